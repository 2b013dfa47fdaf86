package com.positionkeeper.venue;

import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.exception.VenueGatewayException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Caches venue-declared symbol constraints. They change rarely, so one successful fetch per
 * symbol is kept until {@link #evict} is called.
 */
@Component
public class SymbolConstraintsCache {

    private static final Logger log = LoggerFactory.getLogger(SymbolConstraintsCache.class);

    private final VenueGateway venueGateway;
    private final Map<String, SymbolConstraints> cache = new ConcurrentHashMap<>();

    public SymbolConstraintsCache(VenueGateway venueGateway) {
        this.venueGateway = venueGateway;
    }

    /** Empty when the venue cannot be asked right now; callers skip the symbol this cycle. */
    public Optional<SymbolConstraints> get(String symbol) {
        SymbolConstraints cached = cache.get(symbol);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            SymbolConstraints fetched = venueGateway.constraints(symbol);
            cache.put(symbol, fetched);
            return Optional.of(fetched);
        } catch (VenueGatewayException e) {
            log.warn("Constraints for {} unavailable: {} {}", symbol, e.getErrorType(), e.getMessage());
            return Optional.empty();
        }
    }

    public void evict(String symbol) {
        cache.remove(symbol);
    }
}
