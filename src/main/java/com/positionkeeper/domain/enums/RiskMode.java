package com.positionkeeper.domain.enums;

/**
 * Protective-level regime selected from account drawdown.
 *
 * <p>Ordered from most to least defensive by drawdown: CONSERVATIVE applies beyond the
 * highest drawdown breakpoint, ULTRA_AGGRESSIVE near zero drawdown. RECOVERY overrides
 * the drawdown ordering after a losing streak.
 */
public enum RiskMode {
    RECOVERY,
    CONSERVATIVE,
    BALANCED,
    AGGRESSIVE,
    ULTRA_AGGRESSIVE
}
