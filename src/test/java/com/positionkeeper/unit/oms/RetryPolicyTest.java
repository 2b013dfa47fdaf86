package com.positionkeeper.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionkeeper.config.RetryConfig;
import com.positionkeeper.oms.RetryPolicy;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    private RetryConfig config;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        config = new RetryConfig();
        config.setInitialBackoff(Duration.ofSeconds(1));
        config.setMaxBackoff(Duration.ofSeconds(5));
        config.setMultiplier(2.0);
        config.setMaxAttempts(3);
        policy = new RetryPolicy(config);
    }

    @Test
    @DisplayName("Backoff doubles per failed attempt and is capped at the maximum")
    void exponentialBackoffCapped() {
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoff(4)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.backoff(20)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Attempts are allowed up to the configured maximum, first attempt included")
    void attemptBudget() {
        assertThat(policy.hasAttemptsLeft(1)).isTrue();
        assertThat(policy.hasAttemptsLeft(2)).isTrue();
        assertThat(policy.hasAttemptsLeft(3)).isFalse();
        assertThat(policy.getMaxAttempts()).isEqualTo(3);
    }
}
