package com.positionkeeper.domain.enums;

/**
 * The closed set of changes the system can request from the venue.
 *
 * <p>Close-type kinds remain permitted while the account is risk-halted; every other kind
 * is rejected by the approval gate in that condition.
 */
public enum MutationKind {
    OPEN,
    MODIFY_LEVELS,
    PARTIAL_CLOSE,
    FULL_CLOSE;

    public boolean isClose() {
        return this == PARTIAL_CLOSE || this == FULL_CLOSE;
    }
}
