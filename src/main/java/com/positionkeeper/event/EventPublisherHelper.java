package com.positionkeeper.event;

import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ReconciliationResult;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed facade over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Lifecycle methods snapshot the position before publishing; callers pass the live
 * registry instance.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Lifecycle ----

    public void publishLifecycle(
            Object source, LifecycleEventType eventType, LifecycleState previousState, Position position, String reason) {
        applicationEventPublisher.publishEvent(
                new LifecycleEvent(source, eventType, previousState, position.snapshot(), reason));
    }

    public void publishAdopted(Object source, Position position, String reason) {
        publishLifecycle(source, LifecycleEventType.ADOPTED, null, position, reason);
    }

    public void publishMutationFailed(Object source, Position position, String reason) {
        publishLifecycle(source, LifecycleEventType.MUTATION_FAILED, position.getState(), position, reason);
    }

    // ---- Reconciliation ----

    public void publishReconciliation(Object source, ReconciliationResult result, boolean manual) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(source, result, manual));
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message));
    }

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }
}
