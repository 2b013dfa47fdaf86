package com.positionkeeper.adoption;

import com.positionkeeper.config.AdoptionConfig;
import com.positionkeeper.domain.enums.AdoptionMode;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.DecimalComparisons;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ReconciliationDelta;
import com.positionkeeper.domain.model.ScalingState;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.exception.RegistryInvariantException;
import com.positionkeeper.oms.MutationCoordinator;
import com.positionkeeper.registry.PositionRegistry;
import com.positionkeeper.risk.ProtectiveLevels;
import com.positionkeeper.venue.SymbolConstraintsCache;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Brings venue positions this system did not open under management.
 *
 * <p><b>Adopt flow</b> for each new id found by reconciliation:
 * <ol>
 *   <li>Check the candidate against {@link AdoptionPolicy}</li>
 *   <li>Compute protective levels: keep the venue stop, else place an emergency stop that
 *       risks {@code emergencyLossFraction × balance}; keep the venue target, else place one
 *       at {@code riskRewardRatio ×} the stop distance</li>
 *   <li>Insert the position as OPEN and not owned (tracking-only in LOG_ONLY mode)</li>
 *   <li>In ACTIVE mode, propose a MODIFY_LEVELS through the coordinator when the levels
 *       differ from the venue's</li>
 * </ol>
 */
@Service
public class PositionAdoptionService {

    private static final Logger log = LoggerFactory.getLogger(PositionAdoptionService.class);

    private final AdoptionConfig config;
    private final AdoptionPolicy adoptionPolicy;
    private final PositionRegistry positionRegistry;
    private final MutationCoordinator mutationCoordinator;
    private final SymbolConstraintsCache symbolConstraintsCache;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public PositionAdoptionService(
            AdoptionConfig config,
            AdoptionPolicy adoptionPolicy,
            PositionRegistry positionRegistry,
            MutationCoordinator mutationCoordinator,
            SymbolConstraintsCache symbolConstraintsCache,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.config = config;
        this.adoptionPolicy = adoptionPolicy;
        this.positionRegistry = positionRegistry;
        this.mutationCoordinator = mutationCoordinator;
        this.symbolConstraintsCache = symbolConstraintsCache;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Runs one adoption pass over the delta's new ids.
     *
     * @param balance account balance used to size emergency stops; null leaves missing stops unset
     */
    public AdoptionResult adopt(ReconciliationDelta delta, BigDecimal balance) {
        if (delta == null || delta.getNewIds().isEmpty()) {
            return AdoptionResult.empty();
        }
        Instant now = clock.instant();
        AdoptionResult result = AdoptionResult.empty();

        for (String positionId : delta.getNewIds()) {
            VenuePosition candidate = delta.getVenuePositions().get(positionId);
            if (candidate == null) {
                continue;
            }
            Optional<String> rejection = adoptionPolicy.rejectionReason(candidate, now);
            if (rejection.isPresent()) {
                log.info("Not adopting {} ({}): {}", positionId, candidate.getSymbol(), rejection.get());
                result.getRejected()
                        .add(AdoptionResult.Rejection.builder()
                                .positionId(positionId)
                                .symbol(candidate.getSymbol())
                                .reason(rejection.get())
                                .build());
                continue;
            }
            try {
                result.getAdopted().add(adoptOne(candidate, balance, now));
            } catch (RegistryInvariantException e) {
                log.error("Adoption of {} failed: {}", positionId, e.getMessage());
                result.getRejected()
                        .add(AdoptionResult.Rejection.builder()
                                .positionId(positionId)
                                .symbol(candidate.getSymbol())
                                .reason(e.getMessage())
                                .build());
            }
        }

        if (!result.getAdopted().isEmpty() || !result.getRejected().isEmpty()) {
            log.info("Adoption pass: adopted={}, rejected={}", result.adoptedCount(), result.rejectedCount());
        }
        return result;
    }

    // ========================
    // ADOPT
    // ========================

    private AdoptionResult.AdoptedPosition adoptOne(VenuePosition candidate, BigDecimal balance, Instant now) {
        boolean logOnly = config.getMode() == AdoptionMode.LOG_ONLY;

        Position position = Position.builder()
                .positionId(candidate.getPositionId())
                .clientTag(candidate.getClientTag())
                .symbol(candidate.getSymbol())
                .side(candidate.getSide())
                .size(candidate.getSize())
                .originalSize(candidate.getSize())
                .entryPrice(candidate.getEntryPrice())
                .stopLevel(candidate.getStopLevel())
                .targetLevel(candidate.getTargetLevel())
                .currentPrice(candidate.getCurrentPrice() != null ? candidate.getCurrentPrice() : candidate.getEntryPrice())
                .unrealizedProfit(candidate.getUnrealizedProfit() != null ? candidate.getUnrealizedProfit() : BigDecimal.ZERO)
                .openedAt(candidate.getOpenedAt() != null ? candidate.getOpenedAt() : now)
                .owned(false)
                .trackingOnly(logOnly)
                .scalingState(new ScalingState())
                .state(LifecycleState.OPEN)
                .lastUpdated(now)
                .build();
        positionRegistry.insert(position);

        AdoptionResult.AdoptedPosition.AdoptedPositionBuilder adopted = AdoptionResult.AdoptedPosition.builder()
                .positionId(position.getPositionId())
                .symbol(position.getSymbol())
                .mode(config.getMode());

        if (logOnly) {
            eventPublisherHelper.publishAdopted(this, position, "Adopted for tracking only");
            log.info(
                    "Adopted {} ({} {} {}) in LOG_ONLY mode",
                    position.getPositionId(),
                    position.getSide(),
                    position.getSize(),
                    position.getSymbol());
            return adopted.stopLevel(position.getStopLevel())
                    .targetLevel(position.getTargetLevel())
                    .levelsQueued(false)
                    .note("tracking only")
                    .build();
        }

        Optional<SymbolConstraints> constraints = symbolConstraintsCache.get(position.getSymbol());
        BigDecimal minDistance = constraints.map(SymbolConstraints::getMinStopDistance).orElse(BigDecimal.ZERO);
        BigDecimal contractSize = constraints.map(SymbolConstraints::getContractSize).orElse(BigDecimal.ONE);

        BigDecimal stop = protectiveStop(position, balance, contractSize, minDistance);
        BigDecimal target = protectiveTarget(position, stop, minDistance);

        eventPublisherHelper.publishAdopted(this, position, "Adopted from venue");

        boolean changed = !DecimalComparisons.equalsNullable(stop, position.getStopLevel())
                || !DecimalComparisons.equalsNullable(target, position.getTargetLevel());
        boolean queued = false;
        String note = "venue levels kept";
        if (changed) {
            PendingMutation mutation = PendingMutation.builder()
                    .positionId(position.getPositionId())
                    .kind(MutationKind.MODIFY_LEVELS)
                    .source(MutationSource.ADOPTION)
                    .stopLevel(stop)
                    .targetLevel(target)
                    .reason("Protective levels for adopted position")
                    .build();
            queued = mutationCoordinator.propose(mutation, position);
            note = queued ? "protective levels queued" : "protective levels rejected by risk gate";
        }

        log.info(
                "Adopted {} ({} {} {} @ {}): stop={}, target={}, {}",
                position.getPositionId(),
                position.getSide(),
                position.getSize(),
                position.getSymbol(),
                position.getEntryPrice(),
                stop,
                target,
                note);

        return adopted.stopLevel(stop).targetLevel(target).levelsQueued(queued).note(note).build();
    }

    /**
     * The venue stop if present, else an emergency stop {@code emergencyLossFraction × balance
     * / (size × contractSize)} away from entry, clamped to the venue minimum distance.
     */
    BigDecimal protectiveStop(Position position, BigDecimal balance, BigDecimal contractSize, BigDecimal minDistance) {
        if (position.getStopLevel() != null) {
            return position.getStopLevel();
        }
        if (balance == null || balance.signum() <= 0 || position.getEntryPrice() == null) {
            return null;
        }
        BigDecimal exposure = position.getSize().multiply(contractSize);
        if (exposure.signum() <= 0) {
            return null;
        }
        BigDecimal distance =
                config.getEmergencyLossFraction().multiply(balance).divide(exposure, MathContext.DECIMAL64);
        PositionSide side = position.getSide();
        BigDecimal stop = ProtectiveLevels.stopAt(side, position.getEntryPrice(), distance);
        return ProtectiveLevels.clampStop(side, stop, position.getCurrentPrice(), minDistance);
    }

    /** The venue target if present, else {@code riskRewardRatio ×} the entry-to-stop distance. */
    BigDecimal protectiveTarget(Position position, BigDecimal stop, BigDecimal minDistance) {
        if (position.getTargetLevel() != null) {
            return position.getTargetLevel();
        }
        if (stop == null || position.getEntryPrice() == null) {
            return null;
        }
        BigDecimal distance = position.getEntryPrice().subtract(stop).abs();
        if (distance.signum() == 0) {
            return null;
        }
        PositionSide side = position.getSide();
        BigDecimal target = ProtectiveLevels.targetAt(
                side, position.getEntryPrice(), config.getRiskRewardRatio().multiply(distance));
        return ProtectiveLevels.clampTarget(side, target, position.getCurrentPrice(), minDistance);
    }
}
