package com.positionkeeper.exception;

import com.positionkeeper.domain.enums.GatewayErrorType;
import java.util.Map;
import lombok.Getter;

/**
 * Failure of a venue gateway call. The {@link GatewayErrorType} decides how the dispatcher
 * classifies it: REJECTED is final, the others are retried after verification.
 */
@Getter
public class VenueGatewayException extends BaseException {

    private final GatewayErrorType errorType;

    public VenueGatewayException(GatewayErrorType errorType, String message) {
        super(codeFor(errorType), message, Map.of("errorType", errorType.name()));
        this.errorType = errorType;
    }

    public VenueGatewayException(GatewayErrorType errorType, String message, Throwable cause) {
        super(codeFor(errorType), message, Map.of("errorType", errorType.name()), cause);
        this.errorType = errorType;
    }

    public static VenueGatewayException timeout(String message) {
        return new VenueGatewayException(GatewayErrorType.TIMEOUT, message);
    }

    public static VenueGatewayException timeout(String message, Throwable cause) {
        return new VenueGatewayException(GatewayErrorType.TIMEOUT, message, cause);
    }

    public static VenueGatewayException rejected(String message) {
        return new VenueGatewayException(GatewayErrorType.REJECTED, message);
    }

    public static VenueGatewayException unreachable(String message, Throwable cause) {
        return new VenueGatewayException(GatewayErrorType.UNREACHABLE, message, cause);
    }

    private static ErrorCode codeFor(GatewayErrorType errorType) {
        return errorType == GatewayErrorType.UNREACHABLE ? ErrorCode.VENUE_UNAVAILABLE : ErrorCode.VENUE_ERROR;
    }
}
