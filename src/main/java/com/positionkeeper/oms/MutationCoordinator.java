package com.positionkeeper.oms;

import com.positionkeeper.config.RetryConfig;
import com.positionkeeper.domain.enums.FailureClass;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ScalingState;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.domain.model.TradeIntent;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.event.LifecycleEventType;
import com.positionkeeper.event.RiskEventType;
import com.positionkeeper.event.RiskLevel;
import com.positionkeeper.exception.BaseException;
import com.positionkeeper.exception.RegistryInvariantException;
import com.positionkeeper.lifecycle.PositionLifecycleStateMachine;
import com.positionkeeper.registry.PositionRegistry;
import com.positionkeeper.risk.RiskApprovalGate;
import com.positionkeeper.risk.RiskValidationResult;
import com.positionkeeper.risk.RiskViolation;
import com.positionkeeper.venue.SymbolConstraintsCache;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns every pending mutation. Runs on the cycle thread only.
 *
 * <p>Each position has a FIFO queue whose head is its active mutation; later proposals wait
 * behind it in proposal order, so at most one mutation per position is ever at the venue.
 * The coordinator:
 * <ul>
 *   <li>validates proposals with the {@link RiskApprovalGate} and assigns their tokens</li>
 *   <li>moves a position into its transitional state and hands an immutable
 *       {@link DispatchRequest} to the worker</li>
 *   <li>applies outcomes: confirmed effects, backoff and retry, terminal failures</li>
 * </ul>
 * A position is in its transitional state (MODIFYING, PARTIAL_CLOSE, CLOSING) only while an
 * attempt is at the venue. A retried failure returns it to OPEN for the backoff, and the next
 * attempt moves it back.
 */
@Component
public class MutationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MutationCoordinator.class);

    private final PositionRegistry positionRegistry;
    private final RiskApprovalGate riskApprovalGate;
    private final IdempotencyTokenGenerator tokenGenerator;
    private final RetryPolicy retryPolicy;
    private final MutationDispatchWorker dispatchWorker;
    private final MutationTokenLedger tokenLedger;
    private final PositionLifecycleStateMachine lifecycleStateMachine;
    private final SymbolConstraintsCache symbolConstraintsCache;
    private final EventPublisherHelper eventPublisherHelper;
    private final RetryConfig retryConfig;
    private final Clock clock;

    private final Map<String, Deque<PendingMutation>> queues = new LinkedHashMap<>();
    private final Map<String, Long> sequences = new HashMap<>();

    public MutationCoordinator(
            PositionRegistry positionRegistry,
            RiskApprovalGate riskApprovalGate,
            IdempotencyTokenGenerator tokenGenerator,
            RetryPolicy retryPolicy,
            MutationDispatchWorker dispatchWorker,
            MutationTokenLedger tokenLedger,
            PositionLifecycleStateMachine lifecycleStateMachine,
            SymbolConstraintsCache symbolConstraintsCache,
            EventPublisherHelper eventPublisherHelper,
            RetryConfig retryConfig,
            Clock clock) {
        this.positionRegistry = positionRegistry;
        this.riskApprovalGate = riskApprovalGate;
        this.tokenGenerator = tokenGenerator;
        this.retryPolicy = retryPolicy;
        this.dispatchWorker = dispatchWorker;
        this.tokenLedger = tokenLedger;
        this.lifecycleStateMachine = lifecycleStateMachine;
        this.symbolConstraintsCache = symbolConstraintsCache;
        this.eventPublisherHelper = eventPublisherHelper;
        this.retryConfig = retryConfig;
        this.clock = clock;
    }

    // ========================
    // PROPOSALS
    // ========================

    /**
     * Validates and queues a mutation. Rejected proposals are logged, published as a
     * {@code MUTATION_REJECTED} risk event and dropped.
     *
     * @return true if the mutation was queued
     */
    public synchronized boolean propose(PendingMutation mutation, Position position) {
        if (position.getState() != null && position.getState().isTerminal()) {
            log.warn(
                    "Ignoring {} for {}: position is {}", mutation.getKind(), position.getPositionId(), position.getState());
            return false;
        }

        RiskValidationResult validation = riskApprovalGate.validate(mutation, position);
        if (validation.isRejected()) {
            List<String> violations = describe(validation);
            log.warn(
                    "{} for {} ({}) rejected by risk gate: {}",
                    mutation.getKind(),
                    position.getPositionId(),
                    mutation.getSource(),
                    violations);
            publishRejected(mutation, position, violations, "proposal");
            return false;
        }

        String positionId = position.getPositionId();
        Instant now = clock.instant();
        mutation.setPositionId(positionId);
        mutation.setSequence(sequences.merge(positionId, 1L, Long::sum));
        if (mutation.getIdempotencyToken() == null) {
            mutation.setIdempotencyToken(tokenGenerator.generate(mutation));
        }
        mutation.setAttempts(0);
        mutation.setInFlight(false);
        mutation.setCreatedAt(now);
        mutation.setNextEligibleAt(now);

        queues.computeIfAbsent(positionId, id -> new ArrayDeque<>()).addLast(mutation);
        log.info(
                "{} queued for {} (source {}, token {}, seq {}): {}",
                mutation.getKind(),
                positionId,
                mutation.getSource(),
                mutation.getIdempotencyToken(),
                mutation.getSequence(),
                mutation.getReason());
        return true;
    }

    private static List<String> describe(RiskValidationResult validation) {
        return validation.getViolations().stream().map(RiskViolation::toString).collect(Collectors.toList());
    }

    private void publishRejected(PendingMutation mutation, Position position, List<String> violations, String stage) {
        Map<String, Object> details = new HashMap<>();
        details.put("positionId", position.getPositionId());
        details.put("kind", mutation.getKind().name());
        details.put("source", mutation.getSource() != null ? mutation.getSource().name() : null);
        details.put("stage", stage);
        details.put("violations", violations);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.MUTATION_REJECTED,
                RiskLevel.WARNING,
                mutation.getKind() + " for " + position.getPositionId() + " rejected: " + violations,
                details);
    }

    public synchronized boolean hasActiveMutation(String positionId) {
        Deque<PendingMutation> queue = queues.get(positionId);
        return queue != null && !queue.isEmpty();
    }

    // ========================
    // DISPATCH
    // ========================

    /**
     * Submits every queue head that is due, not in flight, and whose position is in a state
     * that allows it. Stops early when the worker is full.
     *
     * @return number of requests submitted
     */
    public synchronized int dispatchEligible(Instant now) {
        int submitted = 0;
        for (Map.Entry<String, Deque<PendingMutation>> entry : new ArrayList<>(queues.entrySet())) {
            PendingMutation head = entry.getValue().peekFirst();
            if (head == null || head.isInFlight() || head.getNextEligibleAt().isAfter(now)) {
                continue;
            }
            if (!dispatchWorker.hasCapacity()) {
                log.debug("Dispatch worker full, {} queue heads wait for the next cycle", queues.size());
                break;
            }
            Position position = positionRegistry.get(entry.getKey()).orElse(null);
            if (position == null) {
                cancelAll(entry.getKey(), "position no longer tracked");
                continue;
            }
            if (position.isFrozen() && !head.getKind().isClose()) {
                cancelAll(entry.getKey(), "position frozen");
                continue;
            }
            RiskValidationResult dispatchCheck = riskApprovalGate.validateAtDispatch(head);
            if (dispatchCheck.isRejected()) {
                rejectAtDispatch(head, position, describe(dispatchCheck));
                continue;
            }
            try {
                if (dispatch(head, position)) {
                    submitted++;
                }
            } catch (BaseException e) {
                log.error("Dispatch of {} for {} failed: {}", head.getKind(), position.getPositionId(), e.getMessage());
                freeze(position, "Dispatch failed: " + e.getMessage());
                removeHead(position.getPositionId(), head);
            }
        }
        return submitted;
    }

    /** Drops a queue head that may no longer go to the venue. Later closes keep their place. */
    private void rejectAtDispatch(PendingMutation head, Position position, List<String> violations) {
        String positionId = position.getPositionId();
        log.warn("{} for {} cancelled before dispatch, risk-halted: {}", head.getKind(), positionId, violations);
        publishRejected(head, position, violations, "dispatch");
        if (head.getAttempts() > 0) {
            tokenLedger.markFailed(head.getIdempotencyToken());
        }
        if (head.getKind() == MutationKind.OPEN) {
            lifecycleStateMachine.transition(
                    position, LifecycleState.FAILED, LifecycleEventType.FAILED, "Open cancelled: risk-halted");
            cancelAll(positionId, "risk-halted");
            return;
        }
        removeHead(positionId, head);
        if (isMutating(position.getState())) {
            lifecycleStateMachine.transition(
                    position, LifecycleState.OPEN, LifecycleEventType.MUTATION_FAILED, head.getKind() + " cancelled: risk-halted");
        }
    }

    private boolean dispatch(PendingMutation head, Position position) {
        LifecycleState transitional = transitionalState(head.getKind());
        LifecycleState state = position.getState();
        if (state != transitional && state != LifecycleState.OPEN) {
            log.debug("{} for {} waits: position is {}", head.getKind(), position.getPositionId(), state);
            return false;
        }

        Optional<SymbolConstraints> constraints = symbolConstraintsCache.get(position.getSymbol());
        if (constraints.isEmpty()) {
            log.debug("{} for {} waits: no constraints for {}", head.getKind(), position.getPositionId(), position.getSymbol());
            return false;
        }

        if (state != transitional) {
            lifecycleStateMachine.transition(
                    position, transitional, LifecycleEventType.DISPATCHED, head.getKind() + ": " + head.getReason());
        }

        head.setAttempts(head.getAttempts() + 1);
        DispatchRequest request = buildRequest(head, position, constraints.get());
        if (!dispatchWorker.submit(request)) {
            head.setAttempts(head.getAttempts() - 1);
            return false;
        }
        head.setInFlight(true);
        log.debug("Submitted {}", request);
        return true;
    }

    private static LifecycleState transitionalState(MutationKind kind) {
        return switch (kind) {
            case OPEN -> LifecycleState.OPENING;
            case MODIFY_LEVELS -> LifecycleState.MODIFYING;
            case PARTIAL_CLOSE -> LifecycleState.PARTIAL_CLOSE;
            case FULL_CLOSE -> LifecycleState.CLOSING;
        };
    }

    private DispatchRequest buildRequest(PendingMutation mutation, Position position, SymbolConstraints constraints) {
        BigDecimal sizeStep = constraints.getSizeStep();
        BigDecimal halfStep = sizeStep.signum() > 0 ? sizeStep.divide(BigDecimal.valueOf(2)) : BigDecimal.ZERO;

        DispatchRequest.DispatchRequestBuilder builder = DispatchRequest.builder()
                .idempotencyToken(mutation.getIdempotencyToken())
                .positionId(position.getPositionId())
                .kind(mutation.getKind())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .priceTolerance(retryConfig.getVerificationTolerance())
                .sizeTolerance(retryConfig.getVerificationTolerance().max(halfStep))
                .attempt(mutation.getAttempts())
                .verificationMismatches(mutation.getVerificationMismatches());

        switch (mutation.getKind()) {
            case OPEN -> {
                TradeIntent intent = mutation.getOpenIntent();
                builder.openSize(intent.getSize())
                        .stopLevel(intent.getStopLevel())
                        .targetLevel(intent.getTargetLevel())
                        .expectedSize(intent.getSize());
            }
            case MODIFY_LEVELS -> builder.stopLevel(mutation.getStopLevel())
                    .targetLevel(mutation.getTargetLevel())
                    .expectedSize(position.getSize());
            case PARTIAL_CLOSE -> {
                BigDecimal fraction = mutation.getCloseSize()
                        .divide(position.getSize(), MathContext.DECIMAL64)
                        .min(BigDecimal.ONE);
                builder.closeFraction(fraction)
                        .expectedSize(position.getSize().subtract(mutation.getCloseSize()).max(BigDecimal.ZERO));
            }
            case FULL_CLOSE -> builder.closeFraction(BigDecimal.ONE).expectedSize(BigDecimal.ZERO);
        }
        return builder.build();
    }

    // ========================
    // OUTCOMES
    // ========================

    /** Drains the worker's outcome channel and applies every outcome. */
    public synchronized int drainOutcomes() {
        List<DispatchOutcome> drained = dispatchWorker.drainOutcomes();
        for (DispatchOutcome outcome : drained) {
            applyOutcome(outcome);
        }
        return drained.size();
    }

    public synchronized void applyOutcome(DispatchOutcome outcome) {
        Deque<PendingMutation> queue = queues.get(outcome.getPositionId());
        PendingMutation head = queue != null ? queue.peekFirst() : null;
        if (head == null || !head.getIdempotencyToken().equals(outcome.getIdempotencyToken())) {
            log.debug(
                    "Dropping late outcome for {} (token {}): mutation was cancelled",
                    outcome.getPositionId(),
                    outcome.getIdempotencyToken());
            return;
        }
        head.setInFlight(false);

        Position position = positionRegistry.get(outcome.getPositionId()).orElse(null);
        if (position == null) {
            removeHead(outcome.getPositionId(), head);
            return;
        }

        try {
            switch (outcome.getStatus()) {
                case APPLIED -> {
                    removeHead(position.getPositionId(), head);
                    applyConfirmed(head, position, outcome.getObserved());
                }
                case RETRYABLE_FAILURE -> {
                    if (retryPolicy.hasAttemptsLeft(head.getAttempts())) {
                        scheduleRetry(head, position, outcome);
                    } else {
                        terminalFailure(head, position, outcome.getFailureClass(), outcome.getMessage());
                    }
                }
                case TERMINAL_FAILURE -> terminalFailure(head, position, outcome.getFailureClass(), outcome.getMessage());
            }
        } catch (BaseException e) {
            log.error("Applying outcome for {} failed: {}", position.getPositionId(), e.getMessage());
            removeHead(position.getPositionId(), head);
            revertToStable(position, e.getMessage());
            freeze(position, "Outcome could not be applied: " + e.getMessage());
        }
    }

    private void scheduleRetry(PendingMutation head, Position position, DispatchOutcome outcome) {
        Instant nextEligibleAt = clock.instant().plus(retryPolicy.backoff(head.getAttempts()));
        head.setLastFailure(outcome.getFailureClass());
        head.setLastError(outcome.getMessage());
        head.setNextEligibleAt(nextEligibleAt);
        if (outcome.getFailureClass() == FailureClass.VERIFICATION_MISMATCH) {
            head.setVerificationMismatches(head.getVerificationMismatches() + 1);
        }
        if (isMutating(position.getState())) {
            lifecycleStateMachine.transition(
                    position,
                    LifecycleState.OPEN,
                    LifecycleEventType.RETRY_SCHEDULED,
                    head.getKind() + " attempt " + head.getAttempts() + " failed (" + outcome.getFailureClass() + ")");
        }
        log.warn(
                "{} for {} failed ({}), attempt {}/{}, retrying at {}: {}",
                head.getKind(),
                position.getPositionId(),
                outcome.getFailureClass(),
                head.getAttempts(),
                retryPolicy.getMaxAttempts(),
                nextEligibleAt,
                outcome.getMessage());
    }

    private void applyConfirmed(PendingMutation mutation, Position position, VenuePosition observed) {
        ScalingState scalingState = position.getScalingState();
        switch (mutation.getKind()) {
            case MODIFY_LEVELS -> {
                position.setStopLevel(observed != null ? observed.getStopLevel() : mutation.getStopLevel());
                position.setTargetLevel(observed != null ? observed.getTargetLevel() : mutation.getTargetLevel());
                if (mutation.isSetsBreakeven()) {
                    scalingState.setBreakevenSet(true);
                }
                lifecycleStateMachine.transition(
                        position, LifecycleState.OPEN, LifecycleEventType.MODIFIED, mutation.getReason());
            }
            case PARTIAL_CLOSE -> {
                markEmergencyLock(mutation, scalingState);
                if (observed == null || observed.getSize().signum() <= 0) {
                    recordFullClose(mutation, position);
                    lifecycleStateMachine.transition(
                            position, LifecycleState.CLOSING, LifecycleEventType.PARTIAL_CLOSED, mutation.getReason());
                    lifecycleStateMachine.transition(
                            position, LifecycleState.CLOSED, LifecycleEventType.CLOSED, "Partial close left nothing");
                    cancelAll(position.getPositionId(), "position closed");
                    return;
                }
                scalingState.recordClose(
                        position.getPositionId(), mutation.getCloseFractionOfOriginal(), mutation.getTierIndex());
                position.setSize(observed.getSize());
                refreshFrom(position, observed);
                lifecycleStateMachine.transition(
                        position, LifecycleState.OPEN, LifecycleEventType.PARTIAL_CLOSED, mutation.getReason());
            }
            case FULL_CLOSE -> {
                markEmergencyLock(mutation, scalingState);
                recordFullClose(mutation, position);
                lifecycleStateMachine.transition(
                        position, LifecycleState.CLOSED, LifecycleEventType.CLOSED, mutation.getReason());
                cancelAll(position.getPositionId(), "position closed");
            }
            case OPEN -> confirmOpen(mutation, position, observed);
        }
    }

    private void confirmOpen(PendingMutation mutation, Position position, VenuePosition observed) {
        String provisionalId = position.getPositionId();
        if (observed == null) {
            throw new RegistryInvariantException(
                    provisionalId, "Open confirmed without a venue position");
        }
        String venueId = observed.getPositionId();
        positionRegistry.rekey(provisionalId, venueId);
        Deque<PendingMutation> waiting = queues.remove(provisionalId);
        if (waiting != null && !waiting.isEmpty()) {
            waiting.forEach(next -> next.setPositionId(venueId));
            queues.put(venueId, waiting);
        }
        Long sequence = sequences.remove(provisionalId);
        if (sequence != null) {
            sequences.put(venueId, sequence);
        }

        position.setEntryPrice(observed.getEntryPrice());
        position.setSize(observed.getSize());
        position.setOriginalSize(observed.getSize());
        position.setStopLevel(observed.getStopLevel());
        position.setTargetLevel(observed.getTargetLevel());
        if (observed.getOpenedAt() != null) {
            position.setOpenedAt(observed.getOpenedAt());
        }
        refreshFrom(position, observed);
        lifecycleStateMachine.transition(
                position,
                LifecycleState.OPEN,
                LifecycleEventType.OPENED,
                "Open confirmed (token " + mutation.getIdempotencyToken() + ")");
    }

    private static void recordFullClose(PendingMutation mutation, Position position) {
        ScalingState scalingState = position.getScalingState();
        BigDecimal remaining = scalingState.remainingFraction();
        if (remaining.signum() > 0) {
            scalingState.recordClose(position.getPositionId(), remaining, mutation.getTierIndex());
        }
        position.setSize(BigDecimal.ZERO);
    }

    private static void markEmergencyLock(PendingMutation mutation, ScalingState scalingState) {
        if (mutation.getSource() == MutationSource.EMERGENCY_LOCK) {
            scalingState.setEmergencyLockExecuted(true);
        }
    }

    private static void refreshFrom(Position position, VenuePosition observed) {
        if (observed.getCurrentPrice() != null) {
            position.setCurrentPrice(observed.getCurrentPrice());
        }
        if (observed.getUnrealizedProfit() != null) {
            position.setUnrealizedProfit(observed.getUnrealizedProfit());
        }
    }

    private void terminalFailure(PendingMutation head, Position position, FailureClass failureClass, String message) {
        removeHead(position.getPositionId(), head);
        tokenLedger.markFailed(head.getIdempotencyToken());
        head.setLastFailure(failureClass);
        head.setLastError(message);
        String reason = String.format(
                "%s failed after %d attempt(s) (%s): %s", head.getKind(), head.getAttempts(), failureClass, message);
        log.error("Position {}: {}", position.getPositionId(), reason);

        if (head.getKind() == MutationKind.OPEN) {
            lifecycleStateMachine.transition(position, LifecycleState.FAILED, LifecycleEventType.FAILED, reason);
            cancelAll(position.getPositionId(), "open failed");
            return;
        }

        if (failureClass == FailureClass.VERIFICATION_MISMATCH) {
            if (head.getKind() == MutationKind.MODIFY_LEVELS) {
                lifecycleStateMachine.transition(position, LifecycleState.FAILED, LifecycleEventType.FAILED, reason);
                cancelAll(position.getPositionId(), "position failed");
            } else {
                revertToStable(position, reason);
                freeze(position, "Close not visible at venue: " + message);
            }
            return;
        }

        revertToStable(position, reason);
    }

    /** Returns a position in a transitional state to OPEN and reports the failed mutation. */
    private void revertToStable(Position position, String reason) {
        LifecycleState state = position.getState();
        if (isMutating(state)) {
            lifecycleStateMachine.transition(position, LifecycleState.OPEN, LifecycleEventType.MUTATION_FAILED, reason);
        } else if (state == LifecycleState.OPENING) {
            lifecycleStateMachine.transition(position, LifecycleState.FAILED, LifecycleEventType.FAILED, reason);
        } else if (state != null && !state.isTerminal()) {
            eventPublisherHelper.publishMutationFailed(this, position, reason);
        }
    }

    /** States an OPEN position passes through while a mutation attempt is at the venue. */
    private static boolean isMutating(LifecycleState state) {
        return state == LifecycleState.MODIFYING || state == LifecycleState.PARTIAL_CLOSE || state == LifecycleState.CLOSING;
    }

    // ========================
    // CANCELLATION / FREEZE
    // ========================

    /** Drops the active and every queued mutation of a position. Late outcomes are ignored. */
    public synchronized int cancelAll(String positionId, String reason) {
        if (positionRegistry.get(positionId).isEmpty()) {
            // Archived or never tracked: the id cannot receive new proposals
            sequences.remove(positionId);
        }
        Deque<PendingMutation> queue = queues.remove(positionId);
        if (queue == null || queue.isEmpty()) {
            return 0;
        }
        log.info("Cancelled {} mutation(s) for {}: {}", queue.size(), positionId, reason);
        return queue.size();
    }

    /**
     * Freezes a position for manual review. Waiting mutations are dropped; an in-flight close is
     * left to resolve.
     */
    public synchronized void freeze(Position position, String reason) {
        String positionId = position.getPositionId();
        positionRegistry.freeze(positionId, reason);
        position.setFrozen(true);
        if (position.getFrozenReason() == null) {
            position.setFrozenReason(reason);
        }

        Deque<PendingMutation> queue = queues.get(positionId);
        if (queue != null) {
            queue.removeIf(mutation -> !mutation.isInFlight());
            if (queue.isEmpty()) {
                queues.remove(positionId);
            }
        }

        Map<String, Object> details = new HashMap<>();
        details.put("positionId", positionId);
        details.put("reason", reason);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.POSITION_FROZEN,
                RiskLevel.CRITICAL,
                "Position " + positionId + " frozen: " + reason,
                details);
    }

    private void removeHead(String positionId, PendingMutation head) {
        Deque<PendingMutation> queue = queues.get(positionId);
        if (queue == null) {
            return;
        }
        queue.remove(head);
        if (queue.isEmpty()) {
            queues.remove(positionId);
        }
    }

    // ========================
    // QUERIES
    // ========================

    /**
     * Active mutations that have been dispatched at least once, by position id. Their effect
     * may already be visible at the venue, so reconciliation discounts it.
     */
    public synchronized Map<String, PendingMutation> inFlightMutations() {
        Map<String, PendingMutation> result = new HashMap<>();
        queues.forEach((positionId, queue) -> {
            PendingMutation head = queue.peekFirst();
            if (head != null && head.getAttempts() > 0) {
                result.put(positionId, head.toBuilder().build());
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /** Copies of every queued mutation, heads first. */
    public synchronized List<PendingMutation> pending() {
        List<PendingMutation> result = new ArrayList<>();
        queues.values().forEach(queue -> queue.forEach(mutation -> result.add(mutation.toBuilder().build())));
        return result;
    }

    public synchronized int pendingCount() {
        return queues.values().stream().mapToInt(Deque::size).sum();
    }
}
