package com.positionkeeper.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One profit-taking tier: when profit fraction reaches {@code profitThreshold}, close
 * {@code closeFraction} of the original size, optionally move the stop to entry, and trail
 * the stop at {@code trailFraction} of the entry-to-current distance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingTier {

    private BigDecimal profitThreshold;
    private BigDecimal closeFraction;
    private boolean moveStopToEntry;
    private BigDecimal trailFraction;

    public static ScalingTier of(String profitThreshold, String closeFraction, boolean moveStopToEntry, String trail) {
        return new ScalingTier(
                new BigDecimal(profitThreshold), new BigDecimal(closeFraction), moveStopToEntry, new BigDecimal(trail));
    }
}
