package com.positionkeeper.risk;

import com.positionkeeper.domain.enums.PositionSide;
import java.math.BigDecimal;

/**
 * Side-aware comparisons and clamping for stop and target prices.
 *
 * <p>A stop is "more protective" when it sits closer to, or beyond, the current price in
 * the position's favor: higher for LONG, lower for SHORT.
 */
public final class ProtectiveLevels {

    private ProtectiveLevels() {}

    /** True if {@code candidate} is strictly more protective than {@code existing}; any stop beats none. */
    public static boolean isMoreProtective(PositionSide side, BigDecimal candidate, BigDecimal existing) {
        if (candidate == null) {
            return false;
        }
        if (existing == null) {
            return true;
        }
        return candidate.subtract(existing).multiply(BigDecimal.valueOf(side.sign())).signum() > 0;
    }

    public static BigDecimal mostProtective(PositionSide side, BigDecimal a, BigDecimal b) {
        if (a == null) {
            return b;
        }
        return isMoreProtective(side, b, a) ? b : a;
    }

    /** Stop placed {@code distance} adversely from {@code reference}. */
    public static BigDecimal stopAt(PositionSide side, BigDecimal reference, BigDecimal distance) {
        return reference.subtract(distance.multiply(BigDecimal.valueOf(side.sign())));
    }

    /** Target placed {@code distance} favorably from {@code reference}. */
    public static BigDecimal targetAt(PositionSide side, BigDecimal reference, BigDecimal distance) {
        return reference.add(distance.multiply(BigDecimal.valueOf(side.sign())));
    }

    /** Moves a stop adversely, if needed, so it is at least {@code minDistance} from {@code currentPrice}. */
    public static BigDecimal clampStop(
            PositionSide side, BigDecimal candidate, BigDecimal currentPrice, BigDecimal minDistance) {
        BigDecimal limit = stopAt(side, currentPrice, minDistance);
        return isMoreProtective(side, candidate, limit) ? limit : candidate;
    }

    /** Moves a target further out, if needed, so it is at least {@code minDistance} from {@code currentPrice}. */
    public static BigDecimal clampTarget(
            PositionSide side, BigDecimal candidate, BigDecimal currentPrice, BigDecimal minDistance) {
        BigDecimal limit = targetAt(side, currentPrice, minDistance);
        return candidate.subtract(limit).multiply(BigDecimal.valueOf(side.sign())).signum() < 0 ? limit : candidate;
    }
}
