package com.positionkeeper.unit.scaling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.positionkeeper.config.ScalingConfig;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ScalingState;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.scaling.ProfitScalingEngine;
import com.positionkeeper.venue.SymbolConstraintsCache;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ProfitScalingEngine covering tier selection, close sizing against lot
 * rules, breakeven and trailing stop proposals, the emergency lock, and eligibility.
 */
class ProfitScalingEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");
    private static final BigDecimal BALANCE = new BigDecimal("10000");

    private ScalingConfig config;
    private SymbolConstraintsCache constraintsCache;
    private ProfitScalingEngine engine;

    @BeforeEach
    void setUp() {
        config = new ScalingConfig();
        constraintsCache = mock(SymbolConstraintsCache.class);
        when(constraintsCache.get(anyString()))
                .thenAnswer(invocation -> Optional.of(SymbolConstraints.unconstrained(invocation.getArgument(0))));
        engine = new ProfitScalingEngine(config, constraintsCache);
    }

    private Position longPosition(String entry, String size, String current, String stop) {
        BigDecimal entryPrice = new BigDecimal(entry);
        BigDecimal positionSize = new BigDecimal(size);
        BigDecimal currentPrice = new BigDecimal(current);
        return Position.builder()
                .positionId("1001")
                .symbol("EURUSD")
                .side(PositionSide.LONG)
                .size(positionSize)
                .originalSize(positionSize)
                .entryPrice(entryPrice)
                .currentPrice(currentPrice)
                .unrealizedProfit(currentPrice.subtract(entryPrice).multiply(positionSize))
                .stopLevel(stop != null ? new BigDecimal(stop) : null)
                .openedAt(NOW.minus(Duration.ofHours(1)))
                .owned(true)
                .state(LifecycleState.OPEN)
                .scalingState(new ScalingState())
                .build();
    }

    private List<PendingMutation> evaluate(Position position) {
        return engine.evaluate(List.of(position), BALANCE, id -> false, NOW);
    }

    @Nested
    @DisplayName("Tier Firing")
    class TierFiring {

        @Test
        @DisplayName("Profit fraction 0.35 fires the first tier: close 25%, stop to entry, then trail")
        void firstTierProposesCloseBreakevenAndTrail() {
            Position position = longPosition("100", "1", "135", "90");

            List<PendingMutation> proposals = evaluate(position);

            assertThat(proposals).hasSize(3);

            PendingMutation close = proposals.get(0);
            assertThat(close.getKind()).isEqualTo(MutationKind.PARTIAL_CLOSE);
            assertThat(close.getSource()).isEqualTo(MutationSource.PROFIT_SCALING);
            assertThat(close.getCloseSize()).isEqualByComparingTo("0.25");
            assertThat(close.getCloseFractionOfOriginal()).isEqualByComparingTo("0.25");
            assertThat(close.getTierIndex()).isEqualTo(0);

            PendingMutation breakeven = proposals.get(1);
            assertThat(breakeven.getKind()).isEqualTo(MutationKind.MODIFY_LEVELS);
            assertThat(breakeven.getStopLevel()).isEqualByComparingTo("100");
            assertThat(breakeven.isSetsBreakeven()).isTrue();

            PendingMutation trail = proposals.get(2);
            assertThat(trail.getKind()).isEqualTo(MutationKind.MODIFY_LEVELS);
            assertThat(trail.getStopLevel()).isEqualByComparingTo("117.5");
            assertThat(trail.isSetsBreakeven()).isFalse();
        }

        @Test
        @DisplayName("Only the highest eligible tier fires in one evaluation")
        void highestEligibleTierFires() {
            Position position = longPosition("100", "1", "165", "90");

            List<PendingMutation> proposals = evaluate(position);

            assertThat(proposals.get(0).getTierIndex()).isEqualTo(1);
            assertThat(proposals.get(0).getCloseSize()).isEqualByComparingTo("0.35");
            assertThat(proposals.stream().filter(p -> p.getKind().isClose())).hasSize(1);
        }

        @Test
        @DisplayName("An executed tier never fires again")
        void executedTierDoesNotRefire() {
            Position position = longPosition("100", "0.75", "135", "117.5");
            position.setOriginalSize(BigDecimal.ONE);
            position.getScalingState().recordClose("1001", new BigDecimal("0.25"), 0);
            position.getScalingState().setBreakevenSet(true);

            assertThat(evaluate(position)).isEmpty();
        }

        @Test
        @DisplayName("Below the first threshold nothing is proposed")
        void belowThresholdProposesNothing() {
            Position position = longPosition("100", "1", "120", "90");

            assertThat(evaluate(position)).isEmpty();
        }

        @Test
        @DisplayName("Close fraction is capped by the remaining fraction of the original size")
        void closeCappedByRemainingFraction() {
            Position position = longPosition("100", "0.2", "200", "150");
            position.setOriginalSize(BigDecimal.ONE);
            position.getScalingState().recordClose("1001", new BigDecimal("0.80"), null);
            // profit fraction = 20 / (100 * 0.2) = 1.0, tier 3 wants 0.50 of original
            position.setUnrealizedProfit(new BigDecimal("20"));

            List<PendingMutation> proposals = evaluate(position);

            assertThat(proposals).hasSize(1);
            assertThat(proposals.get(0).getKind()).isEqualTo(MutationKind.FULL_CLOSE);
            assertThat(proposals.get(0).getCloseSize()).isEqualByComparingTo("0.2");
            assertThat(proposals.get(0).getCloseFractionOfOriginal()).isEqualByComparingTo("0.20");
        }

        @Test
        @DisplayName("Micro accounts use the micro tier table")
        void microAccountUsesMicroTiers() {
            config.setEmergencyLockFraction(BigDecimal.ONE);
            Position position = longPosition("100", "1", "120", "90");

            List<PendingMutation> proposals =
                    engine.evaluate(List.of(position), new BigDecimal("50"), id -> false, NOW);

            assertThat(engine.tiersFor(new BigDecimal("50"))).isSameAs(config.getMicroTiers());
            assertThat(proposals.get(0).getTierIndex()).isEqualTo(0);
            assertThat(proposals.get(0).getCloseSize()).isEqualByComparingTo("0.30");
        }
    }

    @Nested
    @DisplayName("Lot Rules")
    class LotRules {

        @Test
        @DisplayName("Close size rounds down to the size step")
        void closeRoundsDownToStep() {
            when(constraintsCache.get("EURUSD"))
                    .thenReturn(Optional.of(SymbolConstraints.builder()
                            .symbol("EURUSD")
                            .sizeStep(new BigDecimal("0.1"))
                            .minSize(new BigDecimal("0.1"))
                            .build()));
            Position position = longPosition("100", "1", "135", "90");

            PendingMutation close = evaluate(position).get(0);

            assertThat(close.getKind()).isEqualTo(MutationKind.PARTIAL_CLOSE);
            assertThat(close.getCloseSize()).isEqualByComparingTo("0.2");
            assertThat(close.getCloseFractionOfOriginal()).isEqualByComparingTo("0.2");
        }

        @Test
        @DisplayName("Residual below the minimum size turns the close into a full close")
        void residualBelowMinimumBecomesFullClose() {
            when(constraintsCache.get("EURUSD"))
                    .thenReturn(Optional.of(SymbolConstraints.builder()
                            .symbol("EURUSD")
                            .sizeStep(new BigDecimal("0.01"))
                            .minSize(new BigDecimal("0.01"))
                            .build()));
            Position position = longPosition("100", "0.02", "135", "90");

            List<PendingMutation> proposals = evaluate(position);

            // 0.25 x 0.02 = 0.005, raised to the 0.01 minimum, leaves 0.01: still tradable
            assertThat(proposals.get(0).getKind()).isEqualTo(MutationKind.PARTIAL_CLOSE);
            assertThat(proposals.get(0).getCloseSize()).isEqualByComparingTo("0.01");

            Position tiny = longPosition("100", "0.015", "135", "90");
            List<PendingMutation> tinyProposals = evaluate(tiny);
            assertThat(tinyProposals).hasSize(1);
            assertThat(tinyProposals.get(0).getKind()).isEqualTo(MutationKind.FULL_CLOSE);
            assertThat(tinyProposals.get(0).getCloseSize()).isEqualByComparingTo("0.015");
            assertThat(tinyProposals.get(0).getCloseFractionOfOriginal()).isEqualByComparingTo("1");
        }
    }

    @Nested
    @DisplayName("Emergency Lock")
    class EmergencyLock {

        @Test
        @DisplayName("Profit 600 on balance 5000 trips the lock at 10%: close half, lock in half the move")
        void lockClosesHalfAndLocksStop() {
            Position position = longPosition("100", "2", "400", null);
            position.setOpenedAt(NOW.minus(Duration.ofHours(10)));

            List<PendingMutation> proposals =
                    engine.evaluate(List.of(position), new BigDecimal("5000"), id -> false, NOW);

            assertThat(proposals).hasSize(2);
            PendingMutation close = proposals.get(0);
            assertThat(close.getSource()).isEqualTo(MutationSource.EMERGENCY_LOCK);
            assertThat(close.getKind()).isEqualTo(MutationKind.PARTIAL_CLOSE);
            assertThat(close.getCloseSize()).isEqualByComparingTo("1");
            assertThat(close.getCloseFractionOfOriginal()).isEqualByComparingTo("0.5");
            assertThat(close.getTierIndex()).isNull();

            PendingMutation lock = proposals.get(1);
            assertThat(lock.getSource()).isEqualTo(MutationSource.EMERGENCY_LOCK);
            assertThat(lock.getStopLevel()).isEqualByComparingTo("250");
        }

        @Test
        @DisplayName("Lock fires only once per position")
        void lockFiresOnce() {
            Position position = longPosition("100", "1", "700", "400");
            position.getScalingState().setEmergencyLockExecuted(true);
            position.setOpenedAt(NOW.minus(Duration.ofHours(10)));

            List<PendingMutation> proposals =
                    engine.evaluate(List.of(position), new BigDecimal("5000"), id -> false, NOW);

            assertThat(proposals).noneMatch(p -> p.getSource() == MutationSource.EMERGENCY_LOCK);
        }

        @Test
        @DisplayName("Profit at exactly the threshold does not trip the lock")
        void lockNeedsProfitAboveThreshold() {
            Position position = longPosition("100", "1", "600", "550");

            List<PendingMutation> proposals =
                    engine.evaluate(List.of(position), new BigDecimal("5000"), id -> false, NOW);

            assertThat(proposals).noneMatch(p -> p.getSource() == MutationSource.EMERGENCY_LOCK);
        }
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("Positions with an active mutation are skipped")
        void activeMutationSkips() {
            Position position = longPosition("100", "1", "135", "90");

            assertThat(engine.evaluate(List.of(position), BALANCE, id -> true, NOW)).isEmpty();
        }

        @Test
        @DisplayName("Adopted positions are not scaled unless enabled")
        void adoptedPositionsNeedOptIn() {
            Position position = longPosition("100", "1", "135", "90");
            position.setOwned(false);

            assertThat(evaluate(position)).isEmpty();

            config.setScaleAdoptedPositions(true);
            assertThat(evaluate(longAdopted())).isNotEmpty();
        }

        private Position longAdopted() {
            Position position = longPosition("100", "1", "135", "90");
            position.setOwned(false);
            return position;
        }

        @Test
        @DisplayName("Tracking-only and frozen positions are never scaled")
        void trackingOnlyAndFrozenSkipped() {
            Position trackingOnly = longPosition("100", "1", "135", "90");
            trackingOnly.setTrackingOnly(true);
            Position frozen = longPosition("100", "1", "135", "90");
            frozen.setFrozen(true);

            assertThat(engine.evaluate(List.of(trackingOnly, frozen), BALANCE, id -> false, NOW))
                    .isEmpty();
        }

        @Test
        @DisplayName("Positions older than the max age are not scaled by tiers")
        void tooOldForTiers() {
            Position position = longPosition("100", "1", "135", "90");
            position.setOpenedAt(NOW.minus(Duration.ofHours(5)));

            assertThat(evaluate(position)).isEmpty();
        }

        @Test
        @DisplayName("Minimum evaluation interval throttles re-evaluation")
        void evaluationIntervalThrottles() {
            config.setMinEvaluationInterval(Duration.ofMinutes(1));
            Position position = longPosition("100", "1", "120", "90");

            evaluate(position);
            assertThat(position.getScalingState().getLastEvaluatedAt()).isEqualTo(NOW);

            position.setCurrentPrice(new BigDecimal("135"));
            position.setUnrealizedProfit(new BigDecimal("35"));
            assertThat(engine.evaluate(List.of(position), BALANCE, id -> false, NOW.plusSeconds(30)))
                    .isEmpty();
            assertThat(engine.evaluate(List.of(position), BALANCE, id -> false, NOW.plusSeconds(60)))
                    .isNotEmpty();
        }

        @Test
        @DisplayName("Disabled scaling proposes nothing")
        void disabledProposesNothing() {
            config.setEnabled(false);

            assertThat(evaluate(longPosition("100", "1", "135", "90"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Short Positions")
    class ShortPositions {

        @Test
        @DisplayName("Short trail stop sits below entry by the trail fraction of the move")
        void shortTrailIsMirrored() {
            Position position = Position.builder()
                    .positionId("2001")
                    .symbol("EURUSD")
                    .side(PositionSide.SHORT)
                    .size(BigDecimal.ONE)
                    .originalSize(BigDecimal.ONE)
                    .entryPrice(new BigDecimal("100"))
                    .currentPrice(new BigDecimal("65"))
                    .unrealizedProfit(new BigDecimal("35"))
                    .stopLevel(new BigDecimal("110"))
                    .openedAt(NOW.minus(Duration.ofMinutes(5)))
                    .owned(true)
                    .state(LifecycleState.OPEN)
                    .scalingState(new ScalingState())
                    .build();

            List<PendingMutation> proposals = new ArrayList<>(evaluate(position));

            assertThat(proposals).hasSize(3);
            assertThat(proposals.get(1).getStopLevel()).isEqualByComparingTo("100");
            assertThat(proposals.get(2).getStopLevel()).isEqualByComparingTo("82.5");
        }
    }
}
