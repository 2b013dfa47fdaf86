package com.positionkeeper.domain.enums;

/**
 * Failure variants reported by a venue gateway call.
 *
 * <p>TIMEOUT means the effect is unknown: the request may or may not have been applied.
 * BUSY is a transient venue-side refusal (requote, trade context busy). REJECTED is an
 * explicit venue refusal (invalid levels, margin, trading disabled) and is never retried.
 * UNREACHABLE means the request never reached the venue.
 */
public enum GatewayErrorType {
    TIMEOUT,
    BUSY,
    REJECTED,
    UNREACHABLE
}
