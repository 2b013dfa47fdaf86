package com.positionkeeper.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the approval gate rejects a mutation, when the daily loss limit trips,
 * when the risk mode changes, and when a position is frozen.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, null);
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>MUTATION_REJECTED: {"positionId": "1001", "kind": "MODIFY_LEVELS", "violations": [...]}</li>
     *   <li>RISK_MODE_CHANGED: {"previous": "BALANCED", "current": "RECOVERY"}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
