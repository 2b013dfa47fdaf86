package com.positionkeeper.risk;

import com.positionkeeper.config.DynamicRiskConfig;
import com.positionkeeper.domain.enums.RiskMode;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Maps account state to a {@link RiskMode}. A losing streak at or above the configured
 * length forces RECOVERY; otherwise the drawdown bands decide, tightest first.
 */
@Component
public class RiskModeSelector {

    private final DynamicRiskConfig config;

    public RiskModeSelector(DynamicRiskConfig config) {
        this.config = config;
    }

    public RiskMode select(int losingStreak, BigDecimal drawdown) {
        if (losingStreak >= config.getRecoveryLosingStreak()) {
            return RiskMode.RECOVERY;
        }
        if (drawdown.compareTo(config.getUltraAggressiveBelow()) < 0) {
            return RiskMode.ULTRA_AGGRESSIVE;
        }
        if (drawdown.compareTo(config.getAggressiveBelow()) < 0) {
            return RiskMode.AGGRESSIVE;
        }
        if (drawdown.compareTo(config.getBalancedBelow()) < 0) {
            return RiskMode.BALANCED;
        }
        return RiskMode.CONSERVATIVE;
    }
}
