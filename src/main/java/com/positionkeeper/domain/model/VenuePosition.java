package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the venue's position snapshot. The venue is the source of truth for
 * existence, size and applied protective levels.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VenuePosition {

    private String positionId;
    private String symbol;
    private PositionSide side;
    private BigDecimal size;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal stopLevel;
    private BigDecimal targetLevel;
    private BigDecimal unrealizedProfit;

    /** Venue-reported open time. Null when the venue does not provide it. */
    private Instant openedAt;

    /** Client tag (order comment) attached at open time, if any. */
    private String clientTag;

    /** Ownership marker (magic number / owner id) set by whoever opened the position. */
    private String ownerTag;
}
