package com.positionkeeper.event;

import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every lifecycle transition of a managed position, on adoption, and when a
 * mutation fails terminally.
 *
 * <p>The carried {@link Position} is a snapshot taken at publish time, so listeners on other
 * threads never observe registry state that the cycle thread is still mutating.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>CustomMetricsService: counts transitions and failures</li>
 *   <li>Historical storage sinks outside this service</li>
 * </ul>
 */
public class LifecycleEvent extends ApplicationEvent {

    private final String positionId;
    private final LifecycleEventType eventType;
    private final LifecycleState previousState;
    private final Position position;
    private final String reason;

    public LifecycleEvent(
            Object source,
            LifecycleEventType eventType,
            LifecycleState previousState,
            Position position,
            String reason) {
        super(source);
        this.positionId = position.getPositionId();
        this.eventType = eventType;
        this.previousState = previousState;
        this.position = position;
        this.reason = reason;
    }

    public String getPositionId() {
        return positionId;
    }

    public LifecycleEventType getEventType() {
        return eventType;
    }

    /** State before the transition; null for ADOPTED and for events that did not change state. */
    public LifecycleState getPreviousState() {
        return previousState;
    }

    public Position getPosition() {
        return position;
    }

    public String getReason() {
        return reason;
    }
}
