package com.positionkeeper.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422),
    ILLEGAL_TRANSITION("ILLEGAL_TRANSITION", 409),
    REGISTRY_INVARIANT("REGISTRY_INVARIANT", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    VENUE_ERROR("VENUE_ERROR", 502),
    VENUE_UNAVAILABLE("VENUE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
