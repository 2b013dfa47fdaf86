package com.positionkeeper.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retry budget and backoff for venue mutations ({@code positionkeeper.retry}).
 */
@Configuration
@ConfigurationProperties(prefix = "positionkeeper.retry")
@Getter
@Setter
public class RetryConfig {

    /** Maximum number of dispatches of one logical mutation, first attempt included. */
    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofSeconds(1);

    private Duration maxBackoff = Duration.ofSeconds(30);

    private double multiplier = 2.0;

    /** Absolute price tolerance when comparing requested and venue-reported levels. */
    private BigDecimal verificationTolerance = new BigDecimal("0.00001");
}
