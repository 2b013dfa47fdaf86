package com.positionkeeper.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.TradeIntent;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.event.LifecycleEventType;
import com.positionkeeper.support.KeeperFixture;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * End-to-end flow on the paper venue: open through the open service, confirm the fill,
 * then let profit scaling take a partial close and move the stop to breakeven and the trail.
 * Every venue call goes through the real dispatcher and read-back verification.
 */
class PositionScalingFlowIntegrationTest {

    private KeeperFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new KeeperFixture();
        fixture.venue.setPrice("EURUSD", new BigDecimal("100"));
    }

    private void cycles(int count) {
        for (int i = 0; i < count; i++) {
            fixture.clock.advance(Duration.ofSeconds(5));
            fixture.cycleAndDispatch();
        }
    }

    private Position openLong() {
        return fixture.openService.open(TradeIntent.builder()
                .symbol("EURUSD")
                .side(PositionSide.LONG)
                .size(BigDecimal.ONE)
                .stopLevel(new BigDecimal("95"))
                .targetLevel(new BigDecimal("150"))
                .strategyTag("trend")
                .build());
    }

    @Test
    @DisplayName("Open is registered under its client tag and re-keyed to the venue id once confirmed")
    void openConfirmedAndRekeyed() {
        Position opening = openLong();

        assertThat(opening.getState()).isEqualTo(LifecycleState.OPENING);
        assertThat(opening.getPositionId()).isEqualTo(opening.getClientTag());

        cycles(2);

        Position open = fixture.registry.get("1001").orElseThrow();
        assertThat(open.getState()).isEqualTo(LifecycleState.OPEN);
        assertThat(open.getClientTag()).isEqualTo(opening.getClientTag());
        assertThat(open.getEntryPrice()).isEqualByComparingTo("100");
        assertThat(fixture.registry.get(opening.getPositionId())).isEmpty();
        assertThat(fixture.events.lifecycle(LifecycleEventType.OPENED)).hasSize(1);
        assertThat(fixture.events.lifecycle(LifecycleEventType.ADOPTED)).isEmpty();
    }

    @Test
    @DisplayName("First tier closes a quarter, then stop moves to breakeven and to the trail, in order")
    void firstTierScalesOut() {
        openLong();
        cycles(2);

        fixture.venue.setPrice("EURUSD", new BigDecimal("135"));
        cycles(1);

        Position position = fixture.registry.get("1001").orElseThrow();
        assertThat(position.getState()).isEqualTo(LifecycleState.PARTIAL_CLOSE);
        assertThat(fixture.coordinator.pendingCount()).isEqualTo(3);

        cycles(3);

        VenuePosition atVenue = fixture.venue.position("1001");
        assertThat(atVenue.getSize()).isEqualByComparingTo("0.75");
        assertThat(atVenue.getStopLevel()).isEqualByComparingTo("117.5");
        assertThat(atVenue.getTargetLevel()).isEqualByComparingTo("150");

        assertThat(position.getState()).isEqualTo(LifecycleState.OPEN);
        assertThat(position.getSize()).isEqualByComparingTo("0.75");
        assertThat(position.getOriginalSize()).isEqualByComparingTo("1");
        assertThat(position.getStopLevel()).isEqualByComparingTo("117.5");
        assertThat(position.getScalingState().hasExecuted(0)).isTrue();
        assertThat(position.getScalingState().isBreakevenSet()).isTrue();
        assertThat(position.getScalingState().getClosedFraction()).isEqualByComparingTo("0.25");
        assertThat(fixture.coordinator.pendingCount()).isZero();

        assertThat(fixture.events.lifecycle(LifecycleEventType.PARTIAL_CLOSED)).hasSize(1);
        assertThat(fixture.events.lifecycle(LifecycleEventType.MODIFIED))
                .extracting(event -> event.getPosition().getStopLevel())
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("100"), new BigDecimal("117.5"));
    }

    @Test
    @DisplayName("The same tier does not fire twice while profit stays in its band")
    void tierDoesNotRefire() {
        openLong();
        cycles(2);
        fixture.venue.setPrice("EURUSD", new BigDecimal("135"));
        cycles(4);

        cycles(3);

        assertThat(fixture.venue.position("1001").getSize()).isEqualByComparingTo("0.75");
        assertThat(fixture.events.lifecycle(LifecycleEventType.PARTIAL_CLOSED)).hasSize(1);
    }

    @Test
    @DisplayName("Stop hit at the venue closes the position and archives it")
    void venueCloseInferred() {
        openLong();
        cycles(2);

        fixture.venue.removeExternally("1001");
        cycles(1);

        assertThat(fixture.registry.get("1001")).isEmpty();
        assertThat(fixture.registry.isArchived("1001")).isTrue();
        assertThat(fixture.registry.snapshot("1001").orElseThrow().getState()).isEqualTo(LifecycleState.CLOSED);
    }
}
