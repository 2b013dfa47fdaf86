package com.positionkeeper.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Global limits enforced by the {@link RiskApprovalGate}.
 *
 * <p>Null values mean the check is disabled.
 */
@Data
@Builder
public class RiskLimits {

    // ==================== Per-mutation ====================

    /** Maximum |entry − stop| ÷ entry for any stop the system places. */
    private BigDecimal hardStopCeilingFraction;

    // ==================== Exposure (opens only) ====================

    private Integer maxPositionsPerSymbol;

    private Integer maxTotalPositions;

    private BigDecimal maxSizePerSymbol;

    private BigDecimal maxTotalSize;

    // ==================== Account ====================

    /** Daily realized loss (positive amount) beyond which only closes are approved. */
    private BigDecimal dailyLossLimit;
}
