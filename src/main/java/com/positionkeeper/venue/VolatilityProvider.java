package com.positionkeeper.venue;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Supplies a per-symbol volatility measure (ATR or similar, in price units) computed by the
 * strategy layer. Dynamic risk adjustment skips symbols without a value.
 */
public interface VolatilityProvider {

    Optional<BigDecimal> volatility(String symbol);
}
