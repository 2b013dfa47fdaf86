package com.positionkeeper.config;

import com.positionkeeper.domain.enums.AdoptionMode;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Adoption policy for positions found at the venue that this system did not open
 * ({@code positionkeeper.adoption}).
 */
@Configuration
@ConfigurationProperties(prefix = "positionkeeper.adoption")
@Getter
@Setter
public class AdoptionConfig {

    private boolean enabled = true;

    private AdoptionMode mode = AdoptionMode.ACTIVE;

    /** Empty means every symbol not denied is allowed. */
    private Set<String> allowedSymbols = new HashSet<>();

    private Set<String> deniedSymbols = new HashSet<>();

    private Duration maxAge = Duration.ofHours(72);

    /** Positions younger than this are left for the next cycle. */
    private Duration minAge = Duration.ZERO;

    /** Null disables the check. */
    private BigDecimal minSize;

    /** Null disables the check. */
    private BigDecimal maxSize;

    /** Owner tags (magic numbers) of other systems whose positions must not be touched. */
    private Set<String> excludedOwnerTags = new HashSet<>();

    /** Emergency stop risks this fraction of balance when the position has no stop. */
    private BigDecimal emergencyLossFraction = new BigDecimal("0.02");

    private BigDecimal riskRewardRatio = new BigDecimal("2.0");
}
