package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.FailureClass;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A proposed or in-flight change to one position.
 *
 * <p>The idempotency token is assigned once when the proposal is accepted by the
 * coordinator and is reused verbatim on every retry of this same logical mutation.
 * Only the payload fields relevant to {@link #kind} are populated:
 * <ul>
 *   <li>MODIFY_LEVELS: stopLevel and/or targetLevel</li>
 *   <li>PARTIAL_CLOSE / FULL_CLOSE: closeSize (absolute) and closeFractionOfOriginal</li>
 *   <li>OPEN: openIntent</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingMutation {

    private String positionId;
    private MutationKind kind;
    private MutationSource source;
    private String reason;

    private String idempotencyToken;

    /** Per-position proposal sequence, used for token derivation and ordering. */
    private long sequence;

    private int attempts;
    private Instant nextEligibleAt;
    private FailureClass lastFailure;
    private String lastError;
    private int verificationMismatches;

    /** True while a dispatch request for this mutation is with the worker. */
    private boolean inFlight;

    // ---- MODIFY_LEVELS payload ----
    private BigDecimal stopLevel;
    private BigDecimal targetLevel;

    // ---- close payload ----
    private BigDecimal closeSize;
    private BigDecimal closeFractionOfOriginal;

    /** Tier that produced a scaling close; null otherwise. */
    private Integer tierIndex;

    /** Breakeven flag to record in ScalingState once a stop modification is confirmed. */
    private boolean setsBreakeven;

    // ---- OPEN payload ----
    private TradeIntent openIntent;

    private Instant createdAt;
}
