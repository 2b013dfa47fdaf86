package com.positionkeeper.domain.enums;

/**
 * State of an idempotency token in the token ledger.
 */
public enum TokenState {
    DISPATCHED,
    APPLIED,
    FAILED
}
