package com.positionkeeper.core.engine;

import com.positionkeeper.adoption.AdoptionResult;
import com.positionkeeper.adoption.PositionAdoptionService;
import com.positionkeeper.config.CycleConfig;
import com.positionkeeper.domain.enums.GatewayErrorType;
import com.positionkeeper.domain.enums.RiskMode;
import com.positionkeeper.domain.model.AccountSnapshot;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.event.RiskEventType;
import com.positionkeeper.event.RiskLevel;
import com.positionkeeper.exception.BaseException;
import com.positionkeeper.exception.VenueGatewayException;
import com.positionkeeper.oms.MutationCoordinator;
import com.positionkeeper.reconciliation.PositionReconciliationService;
import com.positionkeeper.reconciliation.ReconciliationRun;
import com.positionkeeper.registry.PositionRegistry;
import com.positionkeeper.risk.AccountRiskState;
import com.positionkeeper.risk.DynamicRiskAdjustmentEngine;
import com.positionkeeper.risk.RiskModeSelector;
import com.positionkeeper.scaling.ProfitScalingEngine;
import com.positionkeeper.venue.VenueGateway;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * The single writer of the position registry. One cycle runs these phases in order:
 * <ol>
 *   <li>drain dispatch outcomes from the worker and apply them</li>
 *   <li>refresh account state, check the daily loss limit, select the risk mode</li>
 *   <li>reconcile against a fresh venue snapshot</li>
 *   <li>adopt new venue positions</li>
 *   <li>evaluate profit scaling</li>
 *   <li>evaluate dynamic protective levels</li>
 *   <li>dispatch eligible mutations, unless the venue is considered unreachable</li>
 * </ol>
 * Scheduled and manual cycles serialize on one lock. After enough consecutive UNREACHABLE
 * snapshot failures only the dispatch phase is suspended; evaluation keeps running on the
 * last known data until a snapshot succeeds.
 */
@Service
public class PositionCycleEngine {

    private static final Logger log = LoggerFactory.getLogger(PositionCycleEngine.class);

    private final CycleConfig cycleConfig;
    private final VenueGateway venueGateway;
    private final PositionReconciliationService reconciliationService;
    private final PositionAdoptionService adoptionService;
    private final ProfitScalingEngine profitScalingEngine;
    private final DynamicRiskAdjustmentEngine dynamicRiskAdjustmentEngine;
    private final MutationCoordinator mutationCoordinator;
    private final PositionRegistry positionRegistry;
    private final AccountRiskState accountRiskState;
    private final RiskModeSelector riskModeSelector;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicBoolean haltNotified = new AtomicBoolean(false);

    private int consecutiveUnreachable;
    private volatile boolean dispatchSuspended;
    private volatile CycleReport lastReport;

    public PositionCycleEngine(
            CycleConfig cycleConfig,
            VenueGateway venueGateway,
            PositionReconciliationService reconciliationService,
            PositionAdoptionService adoptionService,
            ProfitScalingEngine profitScalingEngine,
            DynamicRiskAdjustmentEngine dynamicRiskAdjustmentEngine,
            MutationCoordinator mutationCoordinator,
            PositionRegistry positionRegistry,
            AccountRiskState accountRiskState,
            RiskModeSelector riskModeSelector,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.cycleConfig = cycleConfig;
        this.venueGateway = venueGateway;
        this.reconciliationService = reconciliationService;
        this.adoptionService = adoptionService;
        this.profitScalingEngine = profitScalingEngine;
        this.dynamicRiskAdjustmentEngine = dynamicRiskAdjustmentEngine;
        this.mutationCoordinator = mutationCoordinator;
        this.positionRegistry = positionRegistry;
        this.accountRiskState = accountRiskState;
        this.riskModeSelector = riskModeSelector;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // ENTRY POINTS
    // ========================

    @Scheduled(
            fixedDelayString = "${positionkeeper.cycle.interval-ms:5000}",
            initialDelayString = "${positionkeeper.cycle.initial-delay-ms:5000}")
    public void scheduledCycle() {
        if (!cycleConfig.isEnabled()) {
            return;
        }
        if (!cycleLock.tryLock()) {
            log.debug("Previous cycle still running, skipping scheduled run");
            return;
        }
        try {
            runCycleLocked("SCHEDULED", false);
        } catch (RuntimeException e) {
            log.error("Scheduled cycle failed", e);
        } finally {
            cycleLock.unlock();
        }
    }

    /** Runs one full cycle, waiting for any cycle in progress to finish. */
    public CycleReport runCycle(String trigger, boolean manual) {
        cycleLock.lock();
        try {
            return runCycleLocked(trigger, manual);
        } finally {
            cycleLock.unlock();
        }
    }

    /** Runs {@code action} while holding the cycle lock, as the registry's single writer. */
    public <T> T runExclusive(Supplier<T> action) {
        cycleLock.lock();
        try {
            return action.get();
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isDispatchSuspended() {
        return dispatchSuspended;
    }

    public CycleReport getLastReport() {
        return lastReport;
    }

    // ========================
    // CYCLE
    // ========================

    private CycleReport runCycleLocked(String trigger, boolean manual) {
        long startTime = System.currentTimeMillis();
        Instant startedAt = clock.instant();

        int outcomesApplied = mutationCoordinator.drainOutcomes();

        refreshAccount();
        RiskMode mode = selectRiskMode();

        ReconciliationRun run = reconciliationService.reconcile(trigger, manual);
        trackVenueReachability(run);

        BigDecimal balance = accountRiskState.getBalance().signum() > 0 ? accountRiskState.getBalance() : null;
        AdoptionResult adoption = run.isSkipped() ? AdoptionResult.empty() : adoptionService.adopt(run.getDelta(), balance);

        Instant now = clock.instant();
        List<Position> positions = new ArrayList<>(positionRegistry.active());

        List<PendingMutation> scalingProposals =
                profitScalingEngine.evaluate(positions, balance, mutationCoordinator::hasActiveMutation, now);
        int rejected = proposeAll(scalingProposals);

        List<PendingMutation> riskProposals =
                dynamicRiskAdjustmentEngine.evaluate(positions, mode, mutationCoordinator::hasActiveMutation);
        rejected += proposeAll(riskProposals);

        int dispatched = 0;
        if (dispatchSuspended) {
            log.warn("Dispatch suspended: venue unreachable for {} consecutive snapshots", consecutiveUnreachable);
        } else {
            dispatched = mutationCoordinator.dispatchEligible(clock.instant());
        }

        CycleReport report = CycleReport.builder()
                .trigger(trigger)
                .startedAt(startedAt)
                .durationMs(System.currentTimeMillis() - startTime)
                .outcomesApplied(outcomesApplied)
                .reconciliation(run.getResult())
                .adoption(adoption)
                .scalingProposals(scalingProposals.size())
                .riskProposals(riskProposals.size())
                .rejectedProposals(rejected)
                .dispatched(dispatched)
                .dispatchSuspended(dispatchSuspended)
                .riskMode(mode)
                .build();
        lastReport = report;

        log.debug(
                "Cycle {} done in {}ms: outcomes={}, adopted={}, scaling={}, risk={}, dispatched={}",
                trigger,
                report.getDurationMs(),
                outcomesApplied,
                adoption.adoptedCount(),
                scalingProposals.size(),
                riskProposals.size(),
                dispatched);
        return report;
    }

    private void refreshAccount() {
        try {
            AccountSnapshot account = venueGateway.account();
            accountRiskState.observe(account);
        } catch (VenueGatewayException e) {
            log.warn("Account refresh failed ({}), using last known values: {}", e.getErrorType(), e.getMessage());
        }

        if (accountRiskState.isDailyLimitBreached()) {
            if (!haltNotified.getAndSet(true)) {
                log.error(
                        "Daily loss limit breached: realized {}. Only closes will be approved",
                        accountRiskState.getDailyRealizedPnl());
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                        RiskLevel.CRITICAL,
                        "Daily loss limit breached: realized " + accountRiskState.getDailyRealizedPnl(),
                        Map.of("dailyRealizedPnl", accountRiskState.getDailyRealizedPnl()));
            }
        } else {
            haltNotified.set(false);
        }
    }

    private RiskMode selectRiskMode() {
        RiskMode mode = riskModeSelector.select(accountRiskState.getLosingStreak(), accountRiskState.drawdown());
        RiskMode previous = accountRiskState.updateMode(mode);
        if (previous != mode) {
            log.info(
                    "Risk mode {} -> {} (losing streak {}, drawdown {})",
                    previous,
                    mode,
                    accountRiskState.getLosingStreak(),
                    accountRiskState.drawdown());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.RISK_MODE_CHANGED,
                    RiskLevel.INFO,
                    "Risk mode changed from " + previous + " to " + mode,
                    Map.of("previous", String.valueOf(previous), "current", mode.name()));
        }
        return mode;
    }

    private void trackVenueReachability(ReconciliationRun run) {
        if (!run.isSkipped()) {
            consecutiveUnreachable = 0;
            if (dispatchSuspended) {
                dispatchSuspended = false;
                log.info("Venue reachable again, dispatch resumed");
                eventPublisherHelper.publishRiskEvent(
                        this, RiskEventType.VENUE_RECOVERED, RiskLevel.INFO, "Venue reachable, dispatch resumed");
            }
            return;
        }
        if (run.getSnapshotFailure() != GatewayErrorType.UNREACHABLE) {
            return;
        }
        consecutiveUnreachable++;
        if (consecutiveUnreachable >= cycleConfig.getUnreachableThreshold() && !dispatchSuspended) {
            dispatchSuspended = true;
            log.error("Venue unreachable for {} consecutive snapshots, suspending dispatch", consecutiveUnreachable);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.VENUE_UNREACHABLE,
                    RiskLevel.CRITICAL,
                    "Venue unreachable for " + consecutiveUnreachable + " consecutive snapshots; dispatch suspended",
                    Map.of("consecutiveFailures", consecutiveUnreachable));
        }
    }

    /** Queues proposals in order; returns how many were rejected. */
    private int proposeAll(List<PendingMutation> proposals) {
        int rejected = 0;
        for (PendingMutation proposal : proposals) {
            Position position = positionRegistry.get(proposal.getPositionId()).orElse(null);
            if (position == null) {
                continue;
            }
            try {
                if (!mutationCoordinator.propose(proposal, position)) {
                    rejected++;
                }
            } catch (BaseException e) {
                log.error("Proposal {} for {} failed: {}", proposal.getKind(), position.getPositionId(), e.getMessage());
                mutationCoordinator.freeze(position, "Proposal failed: " + e.getMessage());
                rejected++;
            }
        }
        return rejected;
    }
}
