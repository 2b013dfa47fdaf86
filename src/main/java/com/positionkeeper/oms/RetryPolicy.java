package com.positionkeeper.oms;

import com.positionkeeper.config.RetryConfig;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Exponential backoff: {@code initial × multiplier^(attempt − 1)}, capped at the configured
 * maximum. A mutation is dispatched at most {@code maxAttempts} times.
 */
@Component
public class RetryPolicy {

    private final RetryConfig retryConfig;
    private final IntervalFunction intervalFunction;

    public RetryPolicy(RetryConfig retryConfig) {
        this.retryConfig = retryConfig;
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(
                retryConfig.getInitialBackoff().toMillis(),
                retryConfig.getMultiplier(),
                retryConfig.getMaxBackoff().toMillis());
    }

    /** Delay before the next dispatch after {@code attempt} dispatches have failed. */
    public Duration backoff(int attempt) {
        return Duration.ofMillis(intervalFunction.apply(Math.max(1, attempt)));
    }

    public boolean hasAttemptsLeft(int attempts) {
        return attempts < retryConfig.getMaxAttempts();
    }

    public int getMaxAttempts() {
        return retryConfig.getMaxAttempts();
    }
}
