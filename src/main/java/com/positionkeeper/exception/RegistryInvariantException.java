package com.positionkeeper.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A registry invariant would be broken: duplicate id, negative size, cumulative closed
 * fraction above 1.0, or a mutation against a terminal position. The affected position is
 * frozen; the rest of the cycle continues.
 */
@Getter
public class RegistryInvariantException extends BaseException {

    private final String positionId;

    public RegistryInvariantException(String positionId, String message) {
        super(ErrorCode.REGISTRY_INVARIANT, message, detailsFor(positionId));
        this.positionId = positionId;
    }

    private static Map<String, Object> detailsFor(String positionId) {
        return positionId != null ? Map.of("positionId", positionId) : Map.of();
    }
}
