package com.positionkeeper.adoption;

import com.positionkeeper.config.AdoptionConfig;
import com.positionkeeper.domain.model.VenuePosition;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Decides whether a venue position unknown to the registry may be adopted. Returns the
 * first rejection reason, or empty when the candidate is accepted.
 */
@Component
public class AdoptionPolicy {

    private final AdoptionConfig config;

    public AdoptionPolicy(AdoptionConfig config) {
        this.config = config;
    }

    public Optional<String> rejectionReason(VenuePosition candidate, Instant now) {
        if (!config.isEnabled()) {
            return Optional.of("adoption disabled");
        }
        String symbol = candidate.getSymbol();
        if (config.getDeniedSymbols().contains(symbol)) {
            return Optional.of("symbol " + symbol + " is denied");
        }
        if (!config.getAllowedSymbols().isEmpty() && !config.getAllowedSymbols().contains(symbol)) {
            return Optional.of("symbol " + symbol + " is not in the allow list");
        }

        Instant openedAt = candidate.getOpenedAt() != null ? candidate.getOpenedAt() : now;
        Duration age = Duration.between(openedAt, now);
        if (age.compareTo(config.getMaxAge()) > 0) {
            return Optional.of("age " + age + " exceeds max " + config.getMaxAge());
        }
        if (age.compareTo(config.getMinAge()) < 0) {
            return Optional.of("age " + age + " below min " + config.getMinAge());
        }

        if (candidate.getSize() == null || candidate.getSize().signum() <= 0) {
            return Optional.of("invalid size " + candidate.getSize());
        }
        if (config.getMinSize() != null && candidate.getSize().compareTo(config.getMinSize()) < 0) {
            return Optional.of("size " + candidate.getSize() + " below min " + config.getMinSize());
        }
        if (config.getMaxSize() != null && candidate.getSize().compareTo(config.getMaxSize()) > 0) {
            return Optional.of("size " + candidate.getSize() + " above max " + config.getMaxSize());
        }

        if (candidate.getOwnerTag() != null && config.getExcludedOwnerTags().contains(candidate.getOwnerTag())) {
            return Optional.of("owner tag " + candidate.getOwnerTag() + " is excluded");
        }
        return Optional.empty();
    }
}
