package com.positionkeeper.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Venue-declared trading constraints for a symbol.
 *
 * <p>{@code minStopDistance} is the minimum distance, in price units, between the current
 * price and any stop or target (the venue's stops level). {@code contractSize} is the
 * per-unit risk basis used to turn price movement into profit fraction.
 */
@Getter
@Builder
public class SymbolConstraints {

    private final String symbol;

    @Builder.Default
    private final BigDecimal minStopDistance = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal minSize = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal sizeStep = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal contractSize = BigDecimal.ONE;

    public static SymbolConstraints unconstrained(String symbol) {
        return SymbolConstraints.builder().symbol(symbol).build();
    }
}
