package com.positionkeeper.venue;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Default {@link VolatilityProvider} fed by whoever computes volatility upstream through
 * {@link #update}.
 */
@Component
public class InMemoryVolatilityProvider implements VolatilityProvider {

    private final Map<String, BigDecimal> volatilityBySymbol = new ConcurrentHashMap<>();

    public void update(String symbol, BigDecimal volatility) {
        if (volatility == null || volatility.signum() <= 0) {
            volatilityBySymbol.remove(symbol);
        } else {
            volatilityBySymbol.put(symbol, volatility);
        }
    }

    @Override
    public Optional<BigDecimal> volatility(String symbol) {
        return Optional.ofNullable(volatilityBySymbol.get(symbol));
    }
}
