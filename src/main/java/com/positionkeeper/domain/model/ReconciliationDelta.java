package com.positionkeeper.domain.model;

import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * Per-cycle classification of venue positions against the registry.
 *
 * <p>Ephemeral: produced by the reconciliation engine, consumed in the same cycle by
 * adoption (new) and the lifecycle (closed, changed), never persisted.
 */
@Getter
@Builder
public class ReconciliationDelta {

    @Builder.Default
    private final Set<String> newIds = Set.of();

    @Builder.Default
    private final Set<String> closedIds = Set.of();

    @Builder.Default
    private final Map<String, PositionChange> changed = Map.of();

    /**
     * Venue positions that carry the client tag of an OPENING position: venue id to
     * provisional id. These are this system's own opens whose fill was not observed.
     */
    @Builder.Default
    private final Map<String, String> openingMatches = Map.of();

    /** The venue snapshot indexed by position id. */
    @Builder.Default
    private final Map<String, VenuePosition> venuePositions = Map.of();

    public boolean isEmpty() {
        return newIds.isEmpty() && closedIds.isEmpty() && changed.isEmpty() && openingMatches.isEmpty();
    }
}
