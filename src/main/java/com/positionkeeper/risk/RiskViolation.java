package com.positionkeeper.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single limit violation found by the approval gate. Codes are the constants below.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String RISK_HALTED = "RISK_HALTED";
    public static final String STOP_DISTANCE_CEILING_EXCEEDED = "STOP_DISTANCE_CEILING_EXCEEDED";
    public static final String MAX_POSITIONS_PER_SYMBOL = "MAX_POSITIONS_PER_SYMBOL";
    public static final String MAX_TOTAL_POSITIONS = "MAX_TOTAL_POSITIONS";
    public static final String MAX_SIZE_PER_SYMBOL = "MAX_SIZE_PER_SYMBOL";
    public static final String MAX_TOTAL_SIZE = "MAX_TOTAL_SIZE";
    public static final String POSITION_FROZEN = "POSITION_FROZEN";

    private final String code;

    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
