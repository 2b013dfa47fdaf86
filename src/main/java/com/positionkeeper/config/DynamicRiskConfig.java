package com.positionkeeper.config;

import com.positionkeeper.domain.enums.RiskMode;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Mode selection thresholds and per-mode volatility multipliers
 * ({@code positionkeeper.dynamic-risk}).
 *
 * <p>Drawdown thresholds are fractions of peak equity and must be ascending:
 * {@code ultraAggressiveBelow < aggressiveBelow < balancedBelow}.
 */
@Configuration
@ConfigurationProperties(prefix = "positionkeeper.dynamic-risk")
@Getter
@Setter
public class DynamicRiskConfig {

    private boolean enabled = true;

    private int recoveryLosingStreak = 3;

    private BigDecimal ultraAggressiveBelow = new BigDecimal("0.02");

    private BigDecimal aggressiveBelow = new BigDecimal("0.05");

    private BigDecimal balancedBelow = new BigDecimal("0.10");

    /** Breakeven shift activates once the favorable move reaches this many volatility units. */
    private BigDecimal breakevenTriggerMultiple = new BigDecimal("1.0");

    /** Stop sits this many volatility units beyond entry once breakeven is active. */
    private BigDecimal breakevenBufferFraction = new BigDecimal("0.1");

    private Map<RiskMode, ModeMultipliers> modes = defaultModes();

    public ModeMultipliers multipliersFor(RiskMode mode) {
        ModeMultipliers configured = modes.get(mode);
        return configured != null ? configured : defaultModes().get(mode);
    }

    private static Map<RiskMode, ModeMultipliers> defaultModes() {
        Map<RiskMode, ModeMultipliers> defaults = new EnumMap<>(RiskMode.class);
        defaults.put(RiskMode.RECOVERY, new ModeMultipliers(new BigDecimal("1.0"), new BigDecimal("1.6")));
        defaults.put(RiskMode.CONSERVATIVE, new ModeMultipliers(new BigDecimal("1.4"), new BigDecimal("2.4")));
        defaults.put(RiskMode.BALANCED, new ModeMultipliers(new BigDecimal("2.0"), new BigDecimal("4.0")));
        defaults.put(RiskMode.AGGRESSIVE, new ModeMultipliers(new BigDecimal("3.0"), new BigDecimal("8.0")));
        defaults.put(RiskMode.ULTRA_AGGRESSIVE, new ModeMultipliers(new BigDecimal("3.5"), new BigDecimal("10.0")));
        return defaults;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModeMultipliers {
        private BigDecimal stopMultiplier;
        private BigDecimal targetMultiplier;
    }
}
