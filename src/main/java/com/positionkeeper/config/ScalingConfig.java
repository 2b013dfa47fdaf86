package com.positionkeeper.config;

import com.positionkeeper.domain.model.ScalingTier;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tiered profit-taking settings ({@code positionkeeper.scaling}).
 *
 * <p>Two tier tables are kept: the standard one and a more eager one for micro accounts
 * (balance below {@code microAccountThreshold}). Thresholds are fractions of the position's
 * notional, so 0.30 means unrealized profit equal to 30% of entry value.
 */
@Configuration
@ConfigurationProperties(prefix = "positionkeeper.scaling")
@Getter
@Setter
public class ScalingConfig {

    private boolean enabled = true;

    /** When false, adopted (non-owned) positions are never scaled. */
    private boolean scaleAdoptedPositions = false;

    private BigDecimal microAccountThreshold = new BigDecimal("100");

    /** Minimum unrealized profit, in account currency, before any tier fires. */
    private BigDecimal minProfitAmount = new BigDecimal("0.10");

    /** Positions older than this are no longer scaled. */
    private Duration maxPositionAge = Duration.ofHours(4);

    private Duration minPositionAge = Duration.ZERO;

    /** Minimum spacing between two evaluations of the same position. */
    private Duration minEvaluationInterval = Duration.ZERO;

    /** Emergency lock trips when unrealized profit exceeds this fraction of balance. */
    private BigDecimal emergencyLockFraction = new BigDecimal("0.10");

    /** Fraction of the favorable move the emergency stop locks in. */
    private BigDecimal emergencyLockInFraction = new BigDecimal("0.50");

    /** Fraction of the remaining size closed by the emergency lock. */
    private BigDecimal emergencyCloseFraction = new BigDecimal("0.50");

    private List<ScalingTier> tiers = new ArrayList<>(List.of(
            ScalingTier.of("0.30", "0.25", true, "0.50"),
            ScalingTier.of("0.60", "0.35", true, "0.60"),
            ScalingTier.of("1.00", "0.50", true, "0.70")));

    private List<ScalingTier> microTiers = new ArrayList<>(List.of(
            ScalingTier.of("0.15", "0.30", true, "0.40"),
            ScalingTier.of("0.30", "0.40", true, "0.50"),
            ScalingTier.of("0.50", "0.50", true, "0.60")));
}
