package com.positionkeeper.reconciliation;

import com.positionkeeper.domain.enums.GatewayErrorType;
import com.positionkeeper.domain.model.ReconciliationDelta;
import com.positionkeeper.domain.model.ReconciliationResult;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one reconciliation pass handed back to the cycle: the published summary, the
 * delta for adoption, and the snapshot failure when the pass was skipped.
 */
@Getter
@Builder
public class ReconciliationRun {

    private final ReconciliationResult result;

    /** Null when the pass was skipped. */
    private final ReconciliationDelta delta;

    /** Null when the snapshot succeeded. */
    private final GatewayErrorType snapshotFailure;

    public boolean isSkipped() {
        return delta == null;
    }
}
