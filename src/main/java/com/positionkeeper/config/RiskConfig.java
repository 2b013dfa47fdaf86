package com.positionkeeper.config;

import com.positionkeeper.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} bean.
 *
 * <p>Limits default to null (disabled) so the gate runs permissively until configured.
 * Null = check skipped.
 *
 * <p>Properties prefix: {@code positionkeeper.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${positionkeeper.risk.hard-stop-ceiling-fraction:#{null}}") BigDecimal hardStopCeilingFraction,
            @Value("${positionkeeper.risk.max-positions-per-symbol:#{null}}") Integer maxPositionsPerSymbol,
            @Value("${positionkeeper.risk.max-total-positions:#{null}}") Integer maxTotalPositions,
            @Value("${positionkeeper.risk.max-size-per-symbol:#{null}}") BigDecimal maxSizePerSymbol,
            @Value("${positionkeeper.risk.max-total-size:#{null}}") BigDecimal maxTotalSize,
            @Value("${positionkeeper.risk.daily-loss-limit:#{null}}") BigDecimal dailyLossLimit) {
        return RiskLimits.builder()
                .hardStopCeilingFraction(hardStopCeilingFraction)
                .maxPositionsPerSymbol(maxPositionsPerSymbol)
                .maxTotalPositions(maxTotalPositions)
                .maxSizePerSymbol(maxSizePerSymbol)
                .maxTotalSize(maxTotalSize)
                .dailyLossLimit(dailyLossLimit)
                .build();
    }
}
