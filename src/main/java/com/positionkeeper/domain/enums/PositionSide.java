package com.positionkeeper.domain.enums;

/**
 * Direction of a venue position.
 *
 * <p>{@link #sign()} is +1 for LONG and -1 for SHORT, so "favorable" price movement
 * for a position is {@code (current - entry) * sign}. Protective-level arithmetic in
 * the scaling and risk engines is written against this sign instead of branching on side.
 */
public enum PositionSide {
    LONG,
    SHORT;

    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
