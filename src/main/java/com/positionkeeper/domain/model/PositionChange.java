package com.positionkeeper.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Old/new pair for a position that differs structurally between registry and venue.
 */
@Getter
@Builder
public class PositionChange {

    private final String positionId;

    private final BigDecimal previousSize;
    private final BigDecimal currentSize;

    private final BigDecimal previousStop;
    private final BigDecimal currentStop;

    private final BigDecimal previousTarget;
    private final BigDecimal currentTarget;

    public boolean isSizeChanged() {
        return !DecimalComparisons.equalsNullable(previousSize, currentSize);
    }

    public boolean isLevelsChanged() {
        return !DecimalComparisons.equalsNullable(previousStop, currentStop)
                || !DecimalComparisons.equalsNullable(previousTarget, currentTarget);
    }
}
