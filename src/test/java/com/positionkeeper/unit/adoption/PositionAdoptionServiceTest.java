package com.positionkeeper.unit.adoption;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionkeeper.adoption.AdoptionResult;
import com.positionkeeper.domain.enums.AdoptionMode;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ReconciliationDelta;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.event.LifecycleEventType;
import com.positionkeeper.support.KeeperFixture;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PositionAdoptionService: policy filtering, LOG_ONLY tracking, and the
 * emergency stop and target placed on adopted positions in ACTIVE mode.
 */
class PositionAdoptionServiceTest {

    private static final BigDecimal BALANCE = new BigDecimal("10000");

    private KeeperFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new KeeperFixture();
    }

    private VenuePosition candidate(String id, String symbol, PositionSide side, String size, String stop, String target) {
        return VenuePosition.builder()
                .positionId(id)
                .symbol(symbol)
                .side(side)
                .size(new BigDecimal(size))
                .entryPrice(new BigDecimal("100"))
                .currentPrice(new BigDecimal("100"))
                .unrealizedProfit(BigDecimal.ZERO)
                .stopLevel(stop != null ? new BigDecimal(stop) : null)
                .targetLevel(target != null ? new BigDecimal(target) : null)
                .openedAt(fixture.clock.instant().minus(Duration.ofHours(1)))
                .build();
    }

    private static ReconciliationDelta deltaOf(VenuePosition... candidates) {
        ReconciliationDelta.ReconciliationDeltaBuilder builder = ReconciliationDelta.builder();
        Set<String> ids = new LinkedHashSet<>();
        Map<String, VenuePosition> byId = new LinkedHashMap<>();
        for (VenuePosition candidate : candidates) {
            ids.add(candidate.getPositionId());
            byId.put(candidate.getPositionId(), candidate);
        }
        return builder.newIds(ids).venuePositions(byId).build();
    }

    private List<PendingMutation> pendingFor(String positionId) {
        return fixture.coordinator.pending().stream()
                .filter(mutation -> positionId.equals(mutation.getPositionId()))
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Policy")
    class Policy {

        @Test
        @DisplayName("Denied symbol is not adopted")
        void deniedSymbolRejected() {
            fixture.adoptionConfig.setDeniedSymbols(Set.of("XAUUSD"));

            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "XAUUSD", PositionSide.LONG, "1", null, null)), BALANCE);

            assertThat(result.adoptedCount()).isZero();
            assertThat(result.getRejected()).singleElement()
                    .satisfies(rejection -> assertThat(rejection.getReason()).contains("denied"));
            assertThat(fixture.registry.get("2001")).isEmpty();
        }

        @Test
        @DisplayName("Candidates older than the max age are not adopted")
        void tooOldRejected() {
            VenuePosition old = candidate("2001", "EURUSD", PositionSide.LONG, "1", null, null);
            old.setOpenedAt(fixture.clock.instant().minus(Duration.ofHours(73)));

            AdoptionResult result = fixture.adoption.adopt(deltaOf(old), BALANCE);

            assertThat(result.adoptedCount()).isZero();
            assertThat(result.rejectedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Empty delta is a no-op")
        void emptyDelta() {
            AdoptionResult result = fixture.adoption.adopt(ReconciliationDelta.builder().build(), BALANCE);

            assertThat(result.adoptedCount()).isZero();
            assertThat(result.rejectedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("LOG_ONLY mode")
    class LogOnly {

        @Test
        @DisplayName("Adopted positions are tracked only and nothing is queued")
        void trackingOnly() {
            fixture.adoptionConfig.setMode(AdoptionMode.LOG_ONLY);

            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "EURUSD", PositionSide.LONG, "100", null, null)), BALANCE);

            Position adopted = fixture.registry.get("2001").orElseThrow();
            assertThat(adopted.isTrackingOnly()).isTrue();
            assertThat(adopted.isOwned()).isFalse();
            assertThat(adopted.getState()).isEqualTo(LifecycleState.OPEN);
            assertThat(result.getAdopted().get(0).isLevelsQueued()).isFalse();
            assertThat(fixture.coordinator.pendingCount()).isZero();
            assertThat(fixture.events.lifecycle(LifecycleEventType.ADOPTED)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("ACTIVE mode")
    class Active {

        @Test
        @DisplayName("Missing stop and target are placed from the emergency loss budget")
        void emergencyLevelsForLong() {
            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "EURUSD", PositionSide.LONG, "100", null, null)), BALANCE);

            // 0.02 x 10000 / (100 x 1) = 2 price units of risk, target at 2:1
            AdoptionResult.AdoptedPosition adopted = result.getAdopted().get(0);
            assertThat(adopted.getStopLevel()).isEqualByComparingTo("98");
            assertThat(adopted.getTargetLevel()).isEqualByComparingTo("104");
            assertThat(adopted.isLevelsQueued()).isTrue();

            List<PendingMutation> pending = pendingFor("2001");
            assertThat(pending).hasSize(1);
            assertThat(pending.get(0).getKind()).isEqualTo(MutationKind.MODIFY_LEVELS);
            assertThat(pending.get(0).getSource()).isEqualTo(MutationSource.ADOPTION);
            assertThat(pending.get(0).getStopLevel()).isEqualByComparingTo("98");
        }

        @Test
        @DisplayName("Short positions get the stop above and the target below entry")
        void emergencyLevelsForShort() {
            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "EURUSD", PositionSide.SHORT, "100", null, null)), BALANCE);

            assertThat(result.getAdopted().get(0).getStopLevel()).isEqualByComparingTo("102");
            assertThat(result.getAdopted().get(0).getTargetLevel()).isEqualByComparingTo("96");
        }

        @Test
        @DisplayName("Existing venue stop is kept and the target derived from it")
        void venueStopKept() {
            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "EURUSD", PositionSide.LONG, "1", "97", null)), BALANCE);

            assertThat(result.getAdopted().get(0).getStopLevel()).isEqualByComparingTo("97");
            assertThat(result.getAdopted().get(0).getTargetLevel()).isEqualByComparingTo("106");
        }

        @Test
        @DisplayName("Complete venue levels need no modification")
        void completeLevelsKept() {
            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "EURUSD", PositionSide.LONG, "1", "97", "110")), BALANCE);

            assertThat(result.getAdopted().get(0).isLevelsQueued()).isFalse();
            assertThat(result.getAdopted().get(0).getNote()).isEqualTo("venue levels kept");
            assertThat(fixture.coordinator.pendingCount()).isZero();
        }

        @Test
        @DisplayName("Without a balance no emergency stop is placed")
        void noBalanceNoStop() {
            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "EURUSD", PositionSide.LONG, "1", null, null)), null);

            assertThat(result.getAdopted().get(0).getStopLevel()).isNull();
            assertThat(fixture.coordinator.pendingCount()).isZero();
        }

        @Test
        @DisplayName("Emergency stop respects the venue minimum distance")
        void minimumDistanceRespected() {
            fixture.venue.setConstraints(SymbolConstraints.builder()
                    .symbol("EURUSD")
                    .minStopDistance(new BigDecimal("5"))
                    .build());

            AdoptionResult result = fixture.adoption.adopt(
                    deltaOf(candidate("2001", "EURUSD", PositionSide.LONG, "100", null, null)), BALANCE);

            assertThat(result.getAdopted().get(0).getStopLevel()).isEqualByComparingTo("95");
        }
    }
}
