package com.positionkeeper.event;

public enum RiskEventType {

    /** The approval gate rejected a proposed mutation. */
    MUTATION_REJECTED,

    /** Daily realized loss has exceeded the configured limit; only closes are approved. */
    DAILY_LOSS_LIMIT_BREACH,

    /** The dynamic risk mode changed. */
    RISK_MODE_CHANGED,

    /** A position was frozen pending manual reconciliation. */
    POSITION_FROZEN,

    /** The venue has been unreachable for enough consecutive cycles to suspend dispatch. */
    VENUE_UNREACHABLE,

    /** A snapshot succeeded after dispatch had been suspended. */
    VENUE_RECOVERED
}
