package com.positionkeeper.oms;

import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable hand-off from the cycle thread to the dispatch worker. Carries everything the
 * worker needs to call the venue and verify the result, so the worker never reads a
 * {@link com.positionkeeper.domain.model.Position}.
 */
@Getter
@Builder
@ToString
public class DispatchRequest {

    private final String idempotencyToken;
    private final String positionId;
    private final MutationKind kind;

    private final String symbol;
    private final PositionSide side;

    /** MODIFY_LEVELS and OPEN. */
    private final BigDecimal stopLevel;

    private final BigDecimal targetLevel;

    /** Closes: fraction of the current venue size; 1 for a full close. */
    private final BigDecimal closeFraction;

    /** Size the venue should report once the mutation has taken effect. */
    private final BigDecimal expectedSize;

    /** OPEN only. */
    private final BigDecimal openSize;

    private final BigDecimal priceTolerance;
    private final BigDecimal sizeTolerance;

    /** 1-based dispatch attempt. */
    private final int attempt;

    /** Earlier attempts that were acknowledged but not confirmed by read-back. */
    private final int verificationMismatches;
}
