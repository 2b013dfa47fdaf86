package com.positionkeeper.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Cycle loop and dispatch channel settings. Properties are read from the
 * {@code positionkeeper.cycle} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "positionkeeper.cycle")
@Getter
@Setter
public class CycleConfig {

    /** Whether the scheduled cycle runs. Manual runs through the API work either way. */
    private boolean enabled = true;

    /** Delay between the end of one cycle and the start of the next. */
    private long intervalMs = 5000;

    /** Upper bound on a single venue call before it is treated as unknown effect. */
    private Duration dispatchTimeout = Duration.ofSeconds(10);

    /** Consecutive UNREACHABLE snapshot failures before the dispatch phase is suspended. */
    private int unreachableThreshold = 3;

    /** Capacity of the bounded channel carrying dispatch outcomes back to the cycle. */
    private int outcomeChannelCapacity = 256;

    /** Capacity of the request queue feeding the dispatch worker. */
    private int dispatchQueueCapacity = 256;
}
