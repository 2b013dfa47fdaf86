package com.positionkeeper.oms;

import com.positionkeeper.config.CycleConfig;
import com.positionkeeper.domain.enums.FailureClass;
import com.positionkeeper.domain.enums.GatewayErrorType;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.model.DecimalComparisons;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.exception.VenueGatewayException;
import com.positionkeeper.venue.VenueGateway;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Executes one dispatch attempt against the venue and classifies the result.
 *
 * <p>Every venue call runs on the venue-call executor bounded by the dispatch timeout. An
 * expired call has unknown effect. Whatever the call returned, a snapshot read decides:
 * <ul>
 *   <li>intent visible at the venue: APPLIED, even after a timeout</li>
 *   <li>REJECTED: terminal, no read-back needed</li>
 *   <li>TIMEOUT, BUSY, UNREACHABLE with the intent not visible: retryable TRANSIENT</li>
 *   <li>acknowledged but not visible: VERIFICATION_MISMATCH, retryable the first time and
 *       terminal when it repeats</li>
 * </ul>
 * A token the ledger already marks APPLIED skips the venue call and goes straight to
 * verification.
 */
@Service
public class MutationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MutationDispatcher.class);

    private final VenueGateway venueGateway;
    private final MutationTokenLedger tokenLedger;
    private final AsyncTaskExecutor venueCallExecutor;
    private final CycleConfig cycleConfig;

    public MutationDispatcher(
            VenueGateway venueGateway,
            MutationTokenLedger tokenLedger,
            @Qualifier("venueCallExecutor") AsyncTaskExecutor venueCallExecutor,
            CycleConfig cycleConfig) {
        this.venueGateway = venueGateway;
        this.tokenLedger = tokenLedger;
        this.venueCallExecutor = venueCallExecutor;
        this.cycleConfig = cycleConfig;
    }

    public DispatchOutcome dispatch(DispatchRequest request) {
        String token = request.getIdempotencyToken();
        boolean acknowledged = false;
        GatewayErrorType callError = null;
        String callMessage = null;

        if (tokenLedger.isApplied(token)) {
            log.info("Token {} already applied for {}, verifying only", token, request.getPositionId());
            acknowledged = true;
        } else {
            tokenLedger.markDispatched(token);
            try {
                callVenue(request);
                acknowledged = true;
            } catch (VenueGatewayException e) {
                callError = e.getErrorType();
                callMessage = e.getMessage();
            }
        }

        if (callError == GatewayErrorType.REJECTED) {
            log.warn(
                    "{} rejected by venue for {} (token {}): {}",
                    request.getKind(),
                    request.getPositionId(),
                    token,
                    callMessage);
            tokenLedger.markFailed(token);
            return DispatchOutcome.failed(request, false, FailureClass.REJECTED_BY_VENUE, callMessage);
        }

        List<VenuePosition> snapshot;
        try {
            snapshot = withTimeout(venueGateway::snapshot);
        } catch (VenueGatewayException e) {
            String message = "Verification read failed: " + e.getErrorType() + " " + e.getMessage();
            log.warn("{} for {} (token {}): {}", request.getKind(), request.getPositionId(), token, message);
            return DispatchOutcome.failed(request, true, FailureClass.TRANSIENT, message);
        }

        Verification verification = verify(request, snapshot);
        if (verification.confirmed()) {
            tokenLedger.markApplied(token);
            log.info(
                    "{} confirmed for {} (token {}, attempt {}){}",
                    request.getKind(),
                    request.getPositionId(),
                    token,
                    request.getAttempt(),
                    callError != null ? " after " + callError : "");
            return DispatchOutcome.applied(request, verification.observed(), "verified by read-back");
        }

        if (acknowledged) {
            boolean retryable = request.getVerificationMismatches() == 0;
            String message = "Acknowledged but not visible at venue: " + verification.detail();
            log.warn(
                    "{} verification mismatch for {} (token {}, attempt {}, {}): {}",
                    request.getKind(),
                    request.getPositionId(),
                    token,
                    request.getAttempt(),
                    retryable ? "will retry" : "escalating",
                    verification.detail());
            return DispatchOutcome.failed(request, retryable, FailureClass.VERIFICATION_MISMATCH, message);
        }

        log.warn(
                "{} for {} failed with {} (token {}, attempt {}): {}",
                request.getKind(),
                request.getPositionId(),
                callError,
                token,
                request.getAttempt(),
                callMessage);
        return DispatchOutcome.failed(request, true, FailureClass.TRANSIENT, callError + ": " + callMessage);
    }

    // ========================
    // VENUE CALLS
    // ========================

    private void callVenue(DispatchRequest request) {
        String token = request.getIdempotencyToken();
        switch (request.getKind()) {
            case OPEN -> withTimeout(() -> venueGateway.open(
                    request.getSymbol(),
                    request.getSide(),
                    request.getOpenSize(),
                    request.getStopLevel(),
                    request.getTargetLevel(),
                    token));
            case MODIFY_LEVELS -> withTimeout(() -> venueGateway.modify(
                    request.getPositionId(), request.getStopLevel(), request.getTargetLevel(), token));
            case PARTIAL_CLOSE, FULL_CLOSE -> withTimeout(
                    () -> venueGateway.close(request.getPositionId(), request.getCloseFraction(), token));
        }
    }

    private <T> T withTimeout(Callable<T> call) {
        Future<T> future;
        try {
            future = venueCallExecutor.submit(call);
        } catch (TaskRejectedException e) {
            throw new VenueGatewayException(GatewayErrorType.BUSY, "Venue call executor saturated", e);
        }
        try {
            return future.get(cycleConfig.getDispatchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw VenueGatewayException.timeout("No venue response within " + cycleConfig.getDispatchTimeout(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VenueGatewayException venueGatewayException) {
                throw venueGatewayException;
            }
            throw VenueGatewayException.unreachable("Venue call failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw VenueGatewayException.timeout("Interrupted waiting for venue", e);
        }
    }

    // ========================
    // VERIFICATION
    // ========================

    private record Verification(boolean confirmed, VenuePosition observed, String detail) {}

    private Verification verify(DispatchRequest request, List<VenuePosition> snapshot) {
        if (request.getKind() == MutationKind.OPEN) {
            Optional<VenuePosition> opened = snapshot.stream()
                    .filter(position -> request.getIdempotencyToken().equals(position.getClientTag()))
                    .findFirst();
            return opened.map(position -> new Verification(true, position, "open found"))
                    .orElseGet(() -> new Verification(false, null, "no position tagged " + request.getIdempotencyToken()));
        }

        Optional<VenuePosition> found = snapshot.stream()
                .filter(position -> request.getPositionId().equals(position.getPositionId()))
                .findFirst();

        switch (request.getKind()) {
            case FULL_CLOSE:
                return found.isEmpty()
                        ? new Verification(true, null, "position gone")
                        : new Verification(false, found.get(), "still open with size " + found.get().getSize());
            case PARTIAL_CLOSE:
                if (found.isEmpty()) {
                    return new Verification(true, null, "position gone");
                }
                boolean sizeMatches = DecimalComparisons.withinTolerance(
                        found.get().getSize(), request.getExpectedSize(), request.getSizeTolerance());
                return new Verification(
                        sizeMatches,
                        found.get(),
                        "size " + found.get().getSize() + ", expected " + request.getExpectedSize());
            case MODIFY_LEVELS:
                if (found.isEmpty()) {
                    return new Verification(false, null, "position not in snapshot");
                }
                VenuePosition position = found.get();
                boolean levelsMatch = DecimalComparisons.withinTolerance(
                                position.getStopLevel(), request.getStopLevel(), request.getPriceTolerance())
                        && DecimalComparisons.withinTolerance(
                                position.getTargetLevel(), request.getTargetLevel(), request.getPriceTolerance());
                return new Verification(
                        levelsMatch,
                        position,
                        "stop " + position.getStopLevel() + "/" + request.getStopLevel() + ", target "
                                + position.getTargetLevel() + "/" + request.getTargetLevel());
            default:
                return new Verification(false, null, "unsupported kind " + request.getKind());
        }
    }
}
