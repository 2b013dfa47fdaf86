package com.positionkeeper.event;

import com.positionkeeper.domain.model.ReconciliationResult;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconciliation run, including runs skipped because the venue
 * snapshot could not be fetched.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;
    private final Instant reconciledAt;
    private final boolean manual;

    /**
     * @param source the component publishing this event
     * @param result counts of new, closed and changed positions
     * @param manual true if triggered via API, false if scheduled
     */
    public ReconciliationEvent(Object source, ReconciliationResult result, boolean manual) {
        super(source);
        this.result = result;
        this.reconciledAt = Instant.now();
        this.manual = manual;
    }

    public ReconciliationResult getResult() {
        return result;
    }

    public Instant getReconciledAt() {
        return reconciledAt;
    }

    public boolean isManual() {
        return manual;
    }
}
