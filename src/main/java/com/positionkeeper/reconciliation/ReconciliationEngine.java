package com.positionkeeper.reconciliation;

import com.positionkeeper.config.RetryConfig;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.model.DecimalComparisons;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.PositionChange;
import com.positionkeeper.domain.model.ReconciliationDelta;
import com.positionkeeper.domain.model.VenuePosition;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Classifies a venue snapshot against the registry. Stateless and free of I/O: the result
 * depends only on the arguments.
 *
 * <ul>
 *   <li><b>new</b>: venue ids neither active nor archived in the registry</li>
 *   <li><b>closed</b>: active ids absent from the venue; OPENING positions have no venue id
 *       yet and are never classified closed</li>
 *   <li><b>changed</b>: ids present on both sides whose size or levels differ, ignoring
 *       differences that match the expected effect of a mutation still in flight</li>
 * </ul>
 */
@Component
public class ReconciliationEngine {

    static final BigDecimal SIZE_TOLERANCE = new BigDecimal("0.00000001");

    private final BigDecimal priceTolerance;

    public ReconciliationEngine(RetryConfig retryConfig) {
        this.priceTolerance = retryConfig.getVerificationTolerance();
    }

    public ReconciliationDelta diff(
            Collection<Position> registrySnapshot,
            Set<String> archivedIds,
            List<VenuePosition> venueSnapshot,
            Map<String, PendingMutation> inFlight) {

        Map<String, VenuePosition> venueById = new LinkedHashMap<>();
        for (VenuePosition venuePosition : venueSnapshot) {
            venueById.put(venuePosition.getPositionId(), venuePosition);
        }

        Map<String, Position> activeById = new HashMap<>();
        Map<String, String> openingByClientTag = new HashMap<>();
        for (Position position : registrySnapshot) {
            activeById.put(position.getPositionId(), position);
            if (position.getState() == LifecycleState.OPENING && position.getClientTag() != null) {
                openingByClientTag.put(position.getClientTag(), position.getPositionId());
            }
        }

        Set<String> newIds = new LinkedHashSet<>();
        Map<String, String> openingMatches = new LinkedHashMap<>();
        for (VenuePosition venuePosition : venueById.values()) {
            String venueId = venuePosition.getPositionId();
            if (activeById.containsKey(venueId) || archivedIds.contains(venueId)) {
                continue;
            }
            String provisionalId = venuePosition.getClientTag() != null
                    ? openingByClientTag.get(venuePosition.getClientTag())
                    : null;
            if (provisionalId != null) {
                openingMatches.put(venueId, provisionalId);
            } else {
                newIds.add(venueId);
            }
        }

        Set<String> closedIds = new LinkedHashSet<>();
        Map<String, PositionChange> changed = new LinkedHashMap<>();
        for (Position position : registrySnapshot) {
            if (position.getState() == LifecycleState.OPENING) {
                continue;
            }
            VenuePosition venuePosition = venueById.get(position.getPositionId());
            if (venuePosition == null) {
                closedIds.add(position.getPositionId());
                continue;
            }
            PositionChange change = detectChange(position, venuePosition, inFlight.get(position.getPositionId()));
            if (change != null) {
                changed.put(position.getPositionId(), change);
            }
        }

        return ReconciliationDelta.builder()
                .newIds(Collections.unmodifiableSet(newIds))
                .closedIds(Collections.unmodifiableSet(closedIds))
                .changed(Collections.unmodifiableMap(changed))
                .openingMatches(Collections.unmodifiableMap(openingMatches))
                .venuePositions(Collections.unmodifiableMap(venueById))
                .build();
    }

    private PositionChange detectChange(Position position, VenuePosition venuePosition, PendingMutation inFlight) {
        BigDecimal expectedSize = null;
        BigDecimal expectedStop = null;
        BigDecimal expectedTarget = null;
        boolean levelsInFlight = false;
        if (inFlight != null) {
            if (inFlight.getKind() == MutationKind.PARTIAL_CLOSE || inFlight.getKind() == MutationKind.FULL_CLOSE) {
                expectedSize = position.getSize().subtract(inFlight.getCloseSize()).max(BigDecimal.ZERO);
            } else if (inFlight.getKind() == MutationKind.MODIFY_LEVELS) {
                levelsInFlight = true;
                expectedStop = inFlight.getStopLevel();
                expectedTarget = inFlight.getTargetLevel();
            }
        }

        boolean sizeChanged = !DecimalComparisons.withinTolerance(position.getSize(), venuePosition.getSize(), SIZE_TOLERANCE)
                && (expectedSize == null
                        || !DecimalComparisons.withinTolerance(expectedSize, venuePosition.getSize(), SIZE_TOLERANCE));
        boolean stopChanged = differs(position.getStopLevel(), venuePosition.getStopLevel())
                && (!levelsInFlight || differs(expectedStop, venuePosition.getStopLevel()));
        boolean targetChanged = differs(position.getTargetLevel(), venuePosition.getTargetLevel())
                && (!levelsInFlight || differs(expectedTarget, venuePosition.getTargetLevel()));

        if (!sizeChanged && !stopChanged && !targetChanged) {
            return null;
        }
        return PositionChange.builder()
                .positionId(position.getPositionId())
                .previousSize(position.getSize())
                .currentSize(venuePosition.getSize())
                .previousStop(position.getStopLevel())
                .currentStop(venuePosition.getStopLevel())
                .previousTarget(position.getTargetLevel())
                .currentTarget(venuePosition.getTargetLevel())
                .build();
    }

    private boolean differs(BigDecimal a, BigDecimal b) {
        return !DecimalComparisons.withinTolerance(a, b, priceTolerance);
    }
}
