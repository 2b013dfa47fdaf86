package com.positionkeeper.lifecycle;

import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.event.LifecycleEventType;
import com.positionkeeper.exception.IllegalLifecycleTransitionException;
import com.positionkeeper.registry.PositionRegistry;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Enforces the allowed lifecycle transitions of a managed position.
 *
 * <p>Transition table:
 * <pre>
 *   OPENING       → OPEN | FAILED | CLOSED
 *   OPEN          → MODIFYING | PARTIAL_CLOSE | CLOSING | CLOSED
 *   MODIFYING     → OPEN | FAILED | CLOSED
 *   PARTIAL_CLOSE → OPEN | CLOSING | CLOSED
 *   CLOSING       → CLOSED | OPEN
 *   CLOSED, FAILED: terminal
 * </pre>
 * Every non-terminal state may go to CLOSED when reconciliation infers the close.
 *
 * <p>Each applied transition publishes a lifecycle event. Positions reaching a terminal
 * state are archived in the same call.
 */
@Component
public class PositionLifecycleStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PositionLifecycleStateMachine.class);

    private static final Map<LifecycleState, Set<LifecycleState>> TRANSITIONS = buildTransitions();

    private final PositionRegistry positionRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public PositionLifecycleStateMachine(
            PositionRegistry positionRegistry, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.positionRegistry = positionRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public static boolean canTransition(LifecycleState from, LifecycleState to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Applies a transition and publishes {@code eventType}.
     *
     * @throws IllegalLifecycleTransitionException if the table does not allow {@code from → to}
     */
    public void transition(Position position, LifecycleState to, LifecycleEventType eventType, String reason) {
        LifecycleState from = position.getState();
        if (!canTransition(from, to)) {
            throw new IllegalLifecycleTransitionException(position.getPositionId(), from, to);
        }
        position.setState(to);
        position.setLastUpdated(clock.instant());
        log.info("Position {} {} -> {} ({})", position.getPositionId(), from, to, reason);

        eventPublisherHelper.publishLifecycle(this, eventType, from, position, reason);

        if (to.isTerminal()) {
            positionRegistry.archive(position.getPositionId());
        }
    }

    /** Reconciliation found the position gone from the venue. */
    public void inferClosed(Position position, String reason) {
        transition(position, LifecycleState.CLOSED, LifecycleEventType.CLOSED, reason);
    }

    private static Map<LifecycleState, Set<LifecycleState>> buildTransitions() {
        Map<LifecycleState, Set<LifecycleState>> table = new EnumMap<>(LifecycleState.class);
        table.put(
                LifecycleState.OPENING,
                EnumSet.of(LifecycleState.OPEN, LifecycleState.FAILED, LifecycleState.CLOSED));
        table.put(
                LifecycleState.OPEN,
                EnumSet.of(
                        LifecycleState.MODIFYING,
                        LifecycleState.PARTIAL_CLOSE,
                        LifecycleState.CLOSING,
                        LifecycleState.CLOSED));
        table.put(
                LifecycleState.MODIFYING,
                EnumSet.of(LifecycleState.OPEN, LifecycleState.FAILED, LifecycleState.CLOSED));
        table.put(
                LifecycleState.PARTIAL_CLOSE,
                EnumSet.of(LifecycleState.OPEN, LifecycleState.CLOSING, LifecycleState.CLOSED));
        table.put(LifecycleState.CLOSING, EnumSet.of(LifecycleState.CLOSED, LifecycleState.OPEN));
        table.put(LifecycleState.CLOSED, EnumSet.noneOf(LifecycleState.class));
        table.put(LifecycleState.FAILED, EnumSet.noneOf(LifecycleState.class));
        return Collections.unmodifiableMap(table);
    }
}
