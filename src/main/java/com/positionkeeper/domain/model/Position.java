package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position tracked by the registry, either opened by this system ({@code owned=true})
 * or adopted from the venue ({@code owned=false}).
 *
 * <p>Size is an unsigned magnitude; direction lives in {@link #side}. {@code originalSize}
 * is the size at open or adoption and is the base for tier close fractions, so cumulative
 * scaling never depends on how much has already been closed.
 *
 * <p>Instances are mutated only by the cycle thread. Anything handed to other threads
 * (events, REST responses, dispatch requests) is a {@link #snapshot()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    /** Venue-assigned id. For OPENING positions, a provisional id equal to the client tag. */
    private String positionId;

    /** System-assigned ownership/idempotency tag. Never reused. */
    private String clientTag;

    private String symbol;
    private PositionSide side;

    private BigDecimal size;
    private BigDecimal originalSize;
    private BigDecimal entryPrice;

    /** Protective stop. Null when the position carries none. */
    private BigDecimal stopLevel;

    /** Profit target. Null when the position carries none. */
    private BigDecimal targetLevel;

    /** Refreshed every reconciliation. */
    private BigDecimal currentPrice;

    /** Refreshed every reconciliation, in account currency. */
    private BigDecimal unrealizedProfit;

    private Instant openedAt;

    /** True when opened by this system, false when adopted. */
    private boolean owned;

    /** Adopted in log-only mode: tracked, never mutated, never scaled. */
    private boolean trackingOnly;

    private String strategyTag;

    @Builder.Default
    private ScalingState scalingState = new ScalingState();

    private LifecycleState state;

    /** Frozen positions accept no further proposals and need manual reconciliation. */
    private boolean frozen;

    private String frozenReason;

    private Instant lastUpdated;

    /** Price movement in the position's favor; negative when the position is losing. */
    public BigDecimal favorableMove() {
        if (currentPrice == null || entryPrice == null) {
            return BigDecimal.ZERO;
        }
        return currentPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(side.sign()));
    }

    public Duration age(Instant now) {
        if (openedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(openedAt, now);
    }

    public boolean isActive() {
        return state != null && !state.isTerminal();
    }

    /** Deep copy safe to publish outside the cycle thread. */
    public Position snapshot() {
        return Position.builder()
                .positionId(positionId)
                .clientTag(clientTag)
                .symbol(symbol)
                .side(side)
                .size(size)
                .originalSize(originalSize)
                .entryPrice(entryPrice)
                .stopLevel(stopLevel)
                .targetLevel(targetLevel)
                .currentPrice(currentPrice)
                .unrealizedProfit(unrealizedProfit)
                .openedAt(openedAt)
                .owned(owned)
                .trackingOnly(trackingOnly)
                .strategyTag(strategyTag)
                .scalingState(scalingState != null ? scalingState.copy() : new ScalingState())
                .state(state)
                .frozen(frozen)
                .frozenReason(frozenReason)
                .lastUpdated(lastUpdated)
                .build();
    }
}
