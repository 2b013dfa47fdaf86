package com.positionkeeper.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Summary of one reconciliation run, published with every ReconciliationEvent.
 *
 * <p>A skipped run (venue snapshot unavailable) carries {@code skipped=true} and the reason;
 * the registry was not touched in that case.
 */
@Data
@Builder
public class ReconciliationResult {

    private Instant timestamp;
    private String trigger;

    private int venuePositionCount;
    private int registryPositionCount;

    private int newCount;
    private int closedCount;
    private int changedCount;

    private boolean skipped;
    private String skipReason;

    private long durationMs;

    public boolean hasDrift() {
        return newCount > 0 || closedCount > 0 || changedCount > 0;
    }
}
