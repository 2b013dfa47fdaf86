package com.positionkeeper.reconciliation;

import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.model.PositionChange;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ReconciliationDelta;
import com.positionkeeper.domain.model.ReconciliationResult;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.event.LifecycleEventType;
import com.positionkeeper.exception.BaseException;
import com.positionkeeper.exception.VenueGatewayException;
import com.positionkeeper.lifecycle.PositionLifecycleStateMachine;
import com.positionkeeper.oms.MutationCoordinator;
import com.positionkeeper.registry.PositionRegistry;
import com.positionkeeper.venue.VenueGateway;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps the registry consistent with the venue, which is the source of truth for
 * existence, size and applied protective levels.
 *
 * <p>Each pass fetches one snapshot, classifies it with {@link ReconciliationEngine} and
 * applies the result:
 * <ul>
 *   <li>OPENING positions found at the venue under their client tag are confirmed open</li>
 *   <li>closed positions move to CLOSED and their pending mutations are cancelled</li>
 *   <li>changed positions take the venue's size and levels</li>
 *   <li>prices and unrealized profit are refreshed on every matched position</li>
 * </ul>
 * New ids are left for adoption.
 *
 * <p>If the snapshot cannot be fetched the pass is skipped: no delta, no registry change.
 * Every pass, skipped or not, publishes a ReconciliationEvent.
 */
@Service
public class PositionReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciliationService.class);

    private final VenueGateway venueGateway;
    private final PositionRegistry positionRegistry;
    private final ReconciliationEngine reconciliationEngine;
    private final PositionLifecycleStateMachine lifecycleStateMachine;
    private final MutationCoordinator mutationCoordinator;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public PositionReconciliationService(
            VenueGateway venueGateway,
            PositionRegistry positionRegistry,
            ReconciliationEngine reconciliationEngine,
            PositionLifecycleStateMachine lifecycleStateMachine,
            MutationCoordinator mutationCoordinator,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.venueGateway = venueGateway;
        this.positionRegistry = positionRegistry;
        this.reconciliationEngine = reconciliationEngine;
        this.lifecycleStateMachine = lifecycleStateMachine;
        this.mutationCoordinator = mutationCoordinator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public ReconciliationRun reconcile(String trigger, boolean manual) {
        long startTime = System.currentTimeMillis();
        Instant now = clock.instant();

        ReconciliationResult result = ReconciliationResult.builder()
                .timestamp(now)
                .trigger(trigger)
                .registryPositionCount(positionRegistry.activeCount())
                .build();

        List<VenuePosition> venueSnapshot;
        try {
            venueSnapshot = venueGateway.snapshot();
        } catch (VenueGatewayException e) {
            log.warn("Reconciliation skipped: trigger={}, venue {} ({})", trigger, e.getErrorType(), e.getMessage());
            result.setSkipped(true);
            result.setSkipReason(e.getErrorType() + ": " + e.getMessage());
            result.setDurationMs(System.currentTimeMillis() - startTime);
            eventPublisherHelper.publishReconciliation(this, result, manual);
            return ReconciliationRun.builder()
                    .result(result)
                    .snapshotFailure(e.getErrorType())
                    .build();
        }

        ReconciliationDelta delta = reconciliationEngine.diff(
                positionRegistry.activeSnapshot(),
                positionRegistry.archivedIds(),
                venueSnapshot,
                mutationCoordinator.inFlightMutations());

        result.setVenuePositionCount(venueSnapshot.size());
        result.setNewCount(delta.getNewIds().size());
        result.setClosedCount(delta.getClosedIds().size());
        result.setChangedCount(delta.getChanged().size());

        applyOpeningMatches(delta);
        applyClosed(delta);
        applyChanged(delta);
        refreshMarketData(delta.getVenuePositions());

        result.setDurationMs(System.currentTimeMillis() - startTime);
        eventPublisherHelper.publishReconciliation(this, result, manual);

        if (result.hasDrift()) {
            log.info(
                    "Reconciliation complete: trigger={}, new={}, closed={}, changed={}, duration={}ms",
                    trigger,
                    result.getNewCount(),
                    result.getClosedCount(),
                    result.getChangedCount(),
                    result.getDurationMs());
        } else {
            log.debug("Reconciliation complete: trigger={}, no drift, duration={}ms", trigger, result.getDurationMs());
        }

        return ReconciliationRun.builder().result(result).delta(delta).build();
    }

    // ========================
    // APPLY
    // ========================

    private void applyOpeningMatches(ReconciliationDelta delta) {
        for (Map.Entry<String, String> match : delta.getOpeningMatches().entrySet()) {
            String venueId = match.getKey();
            String provisionalId = match.getValue();
            Position position = positionRegistry.get(provisionalId).orElse(null);
            if (position == null) {
                continue;
            }
            try {
                positionRegistry.rekey(provisionalId, venueId);
                mutationCoordinator.cancelAll(provisionalId, "open confirmed by venue snapshot");
                VenuePosition venuePosition = delta.getVenuePositions().get(venueId);
                position.setEntryPrice(venuePosition.getEntryPrice());
                position.setSize(venuePosition.getSize());
                position.setOriginalSize(venuePosition.getSize());
                position.setStopLevel(venuePosition.getStopLevel());
                position.setTargetLevel(venuePosition.getTargetLevel());
                if (venuePosition.getOpenedAt() != null) {
                    position.setOpenedAt(venuePosition.getOpenedAt());
                }
                lifecycleStateMachine.transition(
                        position, LifecycleState.OPEN, LifecycleEventType.OPENED, "Open found in venue snapshot");
            } catch (BaseException e) {
                mutationCoordinator.freeze(position, "Could not confirm open: " + e.getMessage());
            }
        }
    }

    private void applyClosed(ReconciliationDelta delta) {
        for (String positionId : delta.getClosedIds()) {
            Position position = positionRegistry.get(positionId).orElse(null);
            if (position == null) {
                continue;
            }
            try {
                lifecycleStateMachine.inferClosed(position, "Absent from venue snapshot");
                mutationCoordinator.cancelAll(positionId, "position closed at venue");
            } catch (BaseException e) {
                mutationCoordinator.freeze(position, "Could not apply inferred close: " + e.getMessage());
            }
        }
    }

    private void applyChanged(ReconciliationDelta delta) {
        for (PositionChange change : delta.getChanged().values()) {
            Position position = positionRegistry.get(change.getPositionId()).orElse(null);
            if (position == null) {
                continue;
            }
            if (change.getCurrentSize().signum() < 0) {
                mutationCoordinator.freeze(position, "Venue reported negative size " + change.getCurrentSize());
                continue;
            }
            log.warn(
                    "Position {} drifted at venue: size {} -> {}, stop {} -> {}, target {} -> {}",
                    change.getPositionId(),
                    change.getPreviousSize(),
                    change.getCurrentSize(),
                    change.getPreviousStop(),
                    change.getCurrentStop(),
                    change.getPreviousTarget(),
                    change.getCurrentTarget());
            position.setSize(change.getCurrentSize());
            position.setStopLevel(change.getCurrentStop());
            position.setTargetLevel(change.getCurrentTarget());
            position.setLastUpdated(clock.instant());
            eventPublisherHelper.publishLifecycle(
                    this, LifecycleEventType.MODIFIED, position.getState(), position, "Venue-side change");
        }
    }

    private void refreshMarketData(Map<String, VenuePosition> venuePositions) {
        for (Position position : positionRegistry.active()) {
            VenuePosition venuePosition = venuePositions.get(position.getPositionId());
            if (venuePosition == null) {
                continue;
            }
            if (venuePosition.getCurrentPrice() != null) {
                position.setCurrentPrice(venuePosition.getCurrentPrice());
            }
            if (venuePosition.getUnrealizedProfit() != null) {
                position.setUnrealizedProfit(venuePosition.getUnrealizedProfit());
            }
        }
    }
}
