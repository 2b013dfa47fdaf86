package com.positionkeeper.oms;

import com.positionkeeper.domain.enums.DispatchStatus;
import com.positionkeeper.domain.enums.FailureClass;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.model.VenuePosition;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one dispatch attempt, returned to the cycle thread through the outcome channel.
 *
 * <p>{@code observed} is the venue's view of the position after verification. It is null
 * when the position is gone from the venue (full close) or verification could not run.
 */
@Getter
@Builder
@ToString
public class DispatchOutcome {

    private final String idempotencyToken;
    private final String positionId;
    private final MutationKind kind;
    private final DispatchStatus status;
    private final FailureClass failureClass;
    private final String message;
    private final VenuePosition observed;

    public static DispatchOutcome applied(DispatchRequest request, VenuePosition observed, String message) {
        return DispatchOutcome.builder()
                .idempotencyToken(request.getIdempotencyToken())
                .positionId(request.getPositionId())
                .kind(request.getKind())
                .status(DispatchStatus.APPLIED)
                .observed(observed)
                .message(message)
                .build();
    }

    public static DispatchOutcome failed(
            DispatchRequest request, boolean retryable, FailureClass failureClass, String message) {
        return DispatchOutcome.builder()
                .idempotencyToken(request.getIdempotencyToken())
                .positionId(request.getPositionId())
                .kind(request.getKind())
                .status(retryable ? DispatchStatus.RETRYABLE_FAILURE : DispatchStatus.TERMINAL_FAILURE)
                .failureClass(failureClass)
                .message(message)
                .build();
    }

    public boolean isApplied() {
        return status == DispatchStatus.APPLIED;
    }
}
