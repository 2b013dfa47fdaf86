package com.positionkeeper.unit.adoption;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionkeeper.adoption.AdoptionPolicy;
import com.positionkeeper.config.AdoptionConfig;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.VenuePosition;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AdoptionPolicy filters.
 */
class AdoptionPolicyTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private AdoptionConfig config;
    private AdoptionPolicy policy;

    @BeforeEach
    void setUp() {
        config = new AdoptionConfig();
        policy = new AdoptionPolicy(config);
    }

    private static VenuePosition candidate(String symbol, String size, Duration age) {
        return VenuePosition.builder()
                .positionId("2001")
                .symbol(symbol)
                .side(PositionSide.LONG)
                .size(new BigDecimal(size))
                .entryPrice(new BigDecimal("100"))
                .openedAt(NOW.minus(age))
                .build();
    }

    @Test
    @DisplayName("Default config accepts an ordinary candidate")
    void defaultsAccept() {
        assertThat(policy.rejectionReason(candidate("EURUSD", "1", Duration.ofHours(1)), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Disabled adoption rejects everything")
    void disabled() {
        config.setEnabled(false);

        assertThat(policy.rejectionReason(candidate("EURUSD", "1", Duration.ofHours(1)), NOW))
                .contains("adoption disabled");
    }

    @Test
    @DisplayName("Non-empty allow list rejects other symbols")
    void allowList() {
        config.setAllowedSymbols(Set.of("GBPUSD"));

        assertThat(policy.rejectionReason(candidate("EURUSD", "1", Duration.ofHours(1)), NOW)).isPresent();
        assertThat(policy.rejectionReason(candidate("GBPUSD", "1", Duration.ofHours(1)), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Deny list wins over the allow list")
    void denyWins() {
        config.setAllowedSymbols(Set.of("EURUSD"));
        config.setDeniedSymbols(Set.of("EURUSD"));

        assertThat(policy.rejectionReason(candidate("EURUSD", "1", Duration.ofHours(1)), NOW))
                .hasValueSatisfying(reason -> assertThat(reason).contains("denied"));
    }

    @Test
    @DisplayName("Candidates younger than the min age wait")
    void minAge() {
        config.setMinAge(Duration.ofMinutes(5));

        assertThat(policy.rejectionReason(candidate("EURUSD", "1", Duration.ofMinutes(1)), NOW)).isPresent();
        assertThat(policy.rejectionReason(candidate("EURUSD", "1", Duration.ofMinutes(10)), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Size bounds are inclusive")
    void sizeBounds() {
        config.setMinSize(new BigDecimal("0.1"));
        config.setMaxSize(new BigDecimal("5"));

        assertThat(policy.rejectionReason(candidate("EURUSD", "0.05", Duration.ofHours(1)), NOW)).isPresent();
        assertThat(policy.rejectionReason(candidate("EURUSD", "0.1", Duration.ofHours(1)), NOW)).isEmpty();
        assertThat(policy.rejectionReason(candidate("EURUSD", "5", Duration.ofHours(1)), NOW)).isEmpty();
        assertThat(policy.rejectionReason(candidate("EURUSD", "6", Duration.ofHours(1)), NOW)).isPresent();
    }

    @Test
    @DisplayName("Positions of excluded owners are left alone")
    void excludedOwner() {
        config.setExcludedOwnerTags(Set.of("777"));
        VenuePosition foreign = candidate("EURUSD", "1", Duration.ofHours(1));
        foreign.setOwnerTag("777");

        assertThat(policy.rejectionReason(foreign, NOW))
                .hasValueSatisfying(reason -> assertThat(reason).contains("owner tag 777"));
    }

    @Test
    @DisplayName("Missing open time counts as age zero")
    void missingOpenTime() {
        VenuePosition candidate = candidate("EURUSD", "1", Duration.ZERO);
        candidate.setOpenedAt(null);

        assertThat(policy.rejectionReason(candidate, NOW)).isEmpty();
    }
}
