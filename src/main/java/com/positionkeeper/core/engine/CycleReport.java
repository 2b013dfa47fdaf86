package com.positionkeeper.core.engine;

import com.positionkeeper.adoption.AdoptionResult;
import com.positionkeeper.domain.enums.RiskMode;
import com.positionkeeper.domain.model.ReconciliationResult;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Summary of one management cycle, returned by manual runs and kept as the last report.
 */
@Getter
@Builder
public class CycleReport {

    private final String trigger;
    private final Instant startedAt;
    private final long durationMs;

    private final int outcomesApplied;
    private final ReconciliationResult reconciliation;
    private final AdoptionResult adoption;

    private final int scalingProposals;
    private final int riskProposals;
    private final int rejectedProposals;
    private final int dispatched;

    private final boolean dispatchSuspended;
    private final RiskMode riskMode;
}
