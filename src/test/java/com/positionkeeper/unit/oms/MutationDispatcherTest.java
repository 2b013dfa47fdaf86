package com.positionkeeper.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.positionkeeper.config.CycleConfig;
import com.positionkeeper.domain.enums.DispatchStatus;
import com.positionkeeper.domain.enums.FailureClass;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.Ack;
import com.positionkeeper.domain.model.Fill;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.exception.VenueGatewayException;
import com.positionkeeper.oms.DispatchOutcome;
import com.positionkeeper.oms.DispatchRequest;
import com.positionkeeper.oms.MutationDispatcher;
import com.positionkeeper.oms.MutationTokenLedger;
import com.positionkeeper.venue.VenueGateway;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

/**
 * Unit tests for MutationDispatcher: every call is verified by read-back, and failures are
 * classified as transient, venue rejection or verification mismatch.
 */
class MutationDispatcherTest {

    private static final String TOKEN = "0123456789abcdef";

    private VenueGateway venueGateway;
    private MutationTokenLedger tokenLedger;
    private CycleConfig cycleConfig;
    private MutationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        venueGateway = mock(VenueGateway.class);
        tokenLedger = mock(MutationTokenLedger.class);
        cycleConfig = new CycleConfig();
        cycleConfig.setDispatchTimeout(Duration.ofSeconds(2));
        dispatcher = new MutationDispatcher(venueGateway, tokenLedger, new SimpleAsyncTaskExecutor(), cycleConfig);
    }

    private DispatchRequest modifyRequest(int verificationMismatches) {
        return DispatchRequest.builder()
                .idempotencyToken(TOKEN)
                .positionId("1001")
                .kind(MutationKind.MODIFY_LEVELS)
                .symbol("EURUSD")
                .side(PositionSide.LONG)
                .stopLevel(new BigDecimal("105"))
                .targetLevel(new BigDecimal("120"))
                .expectedSize(BigDecimal.ONE)
                .priceTolerance(new BigDecimal("0.00001"))
                .sizeTolerance(new BigDecimal("0.00001"))
                .attempt(1)
                .verificationMismatches(verificationMismatches)
                .build();
    }

    private DispatchRequest closeRequest(MutationKind kind, String fraction, String expectedSize) {
        return DispatchRequest.builder()
                .idempotencyToken(TOKEN)
                .positionId("1001")
                .kind(kind)
                .symbol("EURUSD")
                .side(PositionSide.LONG)
                .closeFraction(new BigDecimal(fraction))
                .expectedSize(new BigDecimal(expectedSize))
                .priceTolerance(new BigDecimal("0.00001"))
                .sizeTolerance(new BigDecimal("0.005"))
                .attempt(1)
                .build();
    }

    private static VenuePosition venuePosition(String size, String stop, String target) {
        return VenuePosition.builder()
                .positionId("1001")
                .symbol("EURUSD")
                .side(PositionSide.LONG)
                .size(new BigDecimal(size))
                .stopLevel(stop != null ? new BigDecimal(stop) : null)
                .targetLevel(target != null ? new BigDecimal(target) : null)
                .build();
    }

    @Nested
    @DisplayName("Verified Effects")
    class VerifiedEffects {

        @Test
        @DisplayName("Acknowledged modify visible in the snapshot is APPLIED and marked in the ledger")
        void ackedAndVisibleIsApplied() {
            when(venueGateway.modify(anyString(), any(), any(), anyString())).thenReturn(Ack.of("1001", TOKEN));
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "105", "120")));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(0));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.APPLIED);
            assertThat(outcome.getObserved().getStopLevel()).isEqualByComparingTo("105");
            verify(tokenLedger).markDispatched(TOKEN);
            verify(tokenLedger).markApplied(TOKEN);
        }

        @Test
        @DisplayName("Timeout whose effect is visible in the snapshot is APPLIED")
        void timeoutWithVisibleEffectIsApplied() {
            when(venueGateway.modify(anyString(), any(), any(), anyString()))
                    .thenThrow(VenueGatewayException.timeout("no answer"));
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "105", "120")));

            assertThat(dispatcher.dispatch(modifyRequest(0)).isApplied()).isTrue();
        }

        @Test
        @DisplayName("A token the ledger already marks applied is verified without calling the venue")
        void appliedTokenNotResent() {
            when(tokenLedger.isApplied(TOKEN)).thenReturn(true);
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "105", "120")));

            assertThat(dispatcher.dispatch(modifyRequest(0)).isApplied()).isTrue();
            verify(venueGateway, never()).modify(anyString(), any(), any(), anyString());
        }

        @Test
        @DisplayName("Full close is confirmed by the position's absence")
        void fullCloseConfirmedByAbsence() {
            when(venueGateway.close(eq("1001"), any(), eq(TOKEN))).thenReturn(Ack.of("1001", TOKEN));
            when(venueGateway.snapshot()).thenReturn(List.of());

            DispatchOutcome outcome = dispatcher.dispatch(closeRequest(MutationKind.FULL_CLOSE, "1", "0"));

            assertThat(outcome.isApplied()).isTrue();
            assertThat(outcome.getObserved()).isNull();
        }

        @Test
        @DisplayName("Partial close is confirmed when the residual size matches within tolerance")
        void partialCloseConfirmedBySize() {
            when(venueGateway.close(eq("1001"), any(), eq(TOKEN))).thenReturn(Ack.of("1001", TOKEN));
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("0.75", "95", "120")));

            DispatchOutcome outcome = dispatcher.dispatch(closeRequest(MutationKind.PARTIAL_CLOSE, "0.25", "0.75"));

            assertThat(outcome.isApplied()).isTrue();
            assertThat(outcome.getObserved().getSize()).isEqualByComparingTo("0.75");
        }

        @Test
        @DisplayName("Open is confirmed by a venue position carrying the token as client tag")
        void openConfirmedByClientTag() {
            DispatchRequest request = DispatchRequest.builder()
                    .idempotencyToken(TOKEN)
                    .positionId(TOKEN)
                    .kind(MutationKind.OPEN)
                    .symbol("EURUSD")
                    .side(PositionSide.LONG)
                    .openSize(BigDecimal.ONE)
                    .expectedSize(BigDecimal.ONE)
                    .priceTolerance(new BigDecimal("0.00001"))
                    .sizeTolerance(new BigDecimal("0.00001"))
                    .attempt(1)
                    .build();
            when(venueGateway.open(eq("EURUSD"), eq(PositionSide.LONG), any(), any(), any(), eq(TOKEN)))
                    .thenReturn(Fill.builder().positionId("1001").clientTag(TOKEN).build());
            VenuePosition opened = venuePosition("1", null, null).toBuilder().clientTag(TOKEN).build();
            when(venueGateway.snapshot()).thenReturn(List.of(opened));

            DispatchOutcome outcome = dispatcher.dispatch(request);

            assertThat(outcome.isApplied()).isTrue();
            assertThat(outcome.getObserved().getPositionId()).isEqualTo("1001");
        }
    }

    @Nested
    @DisplayName("Failure Classification")
    class FailureClassification {

        @Test
        @DisplayName("Venue rejection is terminal and skips the read-back")
        void rejectionIsTerminal() {
            when(venueGateway.modify(anyString(), any(), any(), anyString()))
                    .thenThrow(VenueGatewayException.rejected("invalid stops"));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(0));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.TERMINAL_FAILURE);
            assertThat(outcome.getFailureClass()).isEqualTo(FailureClass.REJECTED_BY_VENUE);
            verify(venueGateway, never()).snapshot();
            verify(tokenLedger).markFailed(TOKEN);
        }

        @Test
        @DisplayName("Timeout without visible effect is a retryable transient failure")
        void timeoutWithoutEffectIsTransient() {
            when(venueGateway.modify(anyString(), any(), any(), anyString()))
                    .thenThrow(VenueGatewayException.timeout("no answer"));
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "95", "120")));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(0));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.RETRYABLE_FAILURE);
            assertThat(outcome.getFailureClass()).isEqualTo(FailureClass.TRANSIENT);
        }

        @Test
        @DisplayName("A venue call that overruns the dispatch timeout is treated as unknown effect")
        void slowCallTimesOut() {
            cycleConfig.setDispatchTimeout(Duration.ofMillis(50));
            when(venueGateway.modify(anyString(), any(), any(), anyString())).thenAnswer(invocation -> {
                Thread.sleep(1_000);
                return Ack.of("1001", TOKEN);
            });
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "95", "120")));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(0));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.RETRYABLE_FAILURE);
            assertThat(outcome.getFailureClass()).isEqualTo(FailureClass.TRANSIENT);
            assertThat(outcome.getMessage()).contains("TIMEOUT");
        }

        @Test
        @DisplayName("First acknowledged-but-invisible result is a retryable verification mismatch")
        void firstMismatchRetryable() {
            when(venueGateway.modify(anyString(), any(), any(), anyString())).thenReturn(Ack.of("1001", TOKEN));
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "95", "120")));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(0));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.RETRYABLE_FAILURE);
            assertThat(outcome.getFailureClass()).isEqualTo(FailureClass.VERIFICATION_MISMATCH);
            verify(tokenLedger, never()).markApplied(TOKEN);
        }

        @Test
        @DisplayName("A repeated verification mismatch is escalated to terminal")
        void repeatedMismatchTerminal() {
            when(venueGateway.modify(anyString(), any(), any(), anyString())).thenReturn(Ack.of("1001", TOKEN));
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "95", "120")));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(1));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.TERMINAL_FAILURE);
            assertThat(outcome.getFailureClass()).isEqualTo(FailureClass.VERIFICATION_MISMATCH);
        }

        @Test
        @DisplayName("Failed read-back is a retryable transient failure even after an ack")
        void snapshotFailureTransient() {
            when(venueGateway.modify(anyString(), any(), any(), anyString())).thenReturn(Ack.of("1001", TOKEN));
            when(venueGateway.snapshot())
                    .thenThrow(VenueGatewayException.unreachable("connection refused", null));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(0));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.RETRYABLE_FAILURE);
            assertThat(outcome.getFailureClass()).isEqualTo(FailureClass.TRANSIENT);
        }

        @Test
        @DisplayName("Unexpected runtime errors from the venue become UNREACHABLE transient failures")
        void unexpectedErrorIsUnreachable() {
            when(venueGateway.modify(anyString(), any(), any(), anyString()))
                    .thenThrow(new IllegalStateException("socket closed"));
            when(venueGateway.snapshot()).thenReturn(List.of(venuePosition("1", "95", "120")));

            DispatchOutcome outcome = dispatcher.dispatch(modifyRequest(0));

            assertThat(outcome.getFailureClass()).isEqualTo(FailureClass.TRANSIENT);
            assertThat(outcome.getMessage()).contains("UNREACHABLE");
        }

        @Test
        @DisplayName("A saturated call executor yields a retryable failure")
        @SuppressWarnings("unchecked")
        void saturatedExecutorRetryable() {
            AsyncTaskExecutor executor = mock(AsyncTaskExecutor.class);
            when(executor.submit(any(Callable.class))).thenThrow(new TaskRejectedException("full"));
            MutationDispatcher saturated = new MutationDispatcher(venueGateway, tokenLedger, executor, cycleConfig);

            DispatchOutcome outcome = saturated.dispatch(modifyRequest(0));

            assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.RETRYABLE_FAILURE);
            verify(venueGateway, never()).modify(anyString(), any(), any(), anyString());
        }
    }
}
