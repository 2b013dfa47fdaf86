package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Venue confirmation of an open.
 */
@Getter
@Builder
public class Fill {

    private final String positionId;
    private final String clientTag;
    private final String symbol;
    private final PositionSide side;
    private final BigDecimal size;
    private final BigDecimal price;
    private final BigDecimal stopLevel;
    private final BigDecimal targetLevel;
    private final Instant filledAt;
}
