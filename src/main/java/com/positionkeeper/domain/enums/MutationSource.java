package com.positionkeeper.domain.enums;

/**
 * Which engine proposed a mutation. Carried through to lifecycle events and logs.
 */
public enum MutationSource {
    ADOPTION,
    PROFIT_SCALING,
    EMERGENCY_LOCK,
    DYNAMIC_RISK,
    STRATEGY
}
