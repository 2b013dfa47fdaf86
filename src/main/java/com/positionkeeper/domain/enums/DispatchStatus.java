package com.positionkeeper.domain.enums;

/**
 * Result of a single dispatch attempt as seen by the coordinator.
 */
public enum DispatchStatus {
    /** Venue effect verified by read-back. */
    APPLIED,

    /** Failed, eligible for another attempt after backoff. */
    RETRYABLE_FAILURE,

    /** Failed, no further attempts. */
    TERMINAL_FAILURE
}
