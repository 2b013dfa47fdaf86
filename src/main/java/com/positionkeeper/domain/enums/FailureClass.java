package com.positionkeeper.domain.enums;

/**
 * Classification of a mutation failure, deciding whether it is retried.
 *
 * <ul>
 *   <li>TRANSIENT: timeout, busy or unreachable venue; retried with backoff</li>
 *   <li>REJECTED_BY_VENUE: explicit venue refusal; terminal, position keeps its stable state</li>
 *   <li>VERIFICATION_MISMATCH: venue said success but read-back disagrees; retried once,
 *       then escalated to non-retryable</li>
 *   <li>POLICY_REJECTION: refused by the approval gate; never dispatched</li>
 *   <li>INVARIANT_VIOLATION: registry invariant broken; position frozen</li>
 * </ul>
 */
public enum FailureClass {
    TRANSIENT,
    REJECTED_BY_VENUE,
    VERIFICATION_MISMATCH,
    POLICY_REJECTION,
    INVARIANT_VIOLATION;

    public static FailureClass fromGatewayError(GatewayErrorType errorType) {
        return switch (errorType) {
            case TIMEOUT, BUSY, UNREACHABLE -> TRANSIENT;
            case REJECTED -> REJECTED_BY_VENUE;
        };
    }
}
