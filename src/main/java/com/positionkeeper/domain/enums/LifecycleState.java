package com.positionkeeper.domain.enums;

/**
 * Lifecycle state of a tracked position.
 *
 * <p>OPEN is the only state from which new mutations may start. MODIFYING, PARTIAL_CLOSE
 * and CLOSING mark a mutation in flight at the venue. CLOSED and FAILED are terminal: a
 * position in either state is archived and never mutated again.
 */
public enum LifecycleState {
    OPENING,
    OPEN,
    MODIFYING,
    PARTIAL_CLOSE,
    CLOSING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }

    /** States the scaling engine evaluates. */
    public boolean isScalable() {
        return this == OPEN || this == PARTIAL_CLOSE;
    }
}
