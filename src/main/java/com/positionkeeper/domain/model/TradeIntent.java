package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A request from the strategy layer to open a new position.
 */
@Data
@Builder
public class TradeIntent {

    private String symbol;
    private PositionSide side;
    private BigDecimal size;
    private BigDecimal stopLevel;
    private BigDecimal targetLevel;
    private String strategyTag;

    /** Price the strategy saw when it decided; used for the stop-distance ceiling check. */
    private BigDecimal referencePrice;
}
