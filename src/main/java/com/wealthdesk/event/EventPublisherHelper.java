package com.wealthdesk.event;

import com.wealthdesk.domain.enums.OrderStatus;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.Order;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the
 * engine's order, holding and risk events.
 *
 * <p>Delivery is synchronous unless a listener is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderCreated(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CREATED));
    }

    public void publishOrderExecuted(Object source, Order order) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.EXECUTED, OrderStatus.PENDING));
    }

    public void publishOrderFailed(Object source, Order order) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.FAILED, OrderStatus.PENDING));
    }

    // ---- Holding ----

    public void publishHoldingChanged(
            Object source, Holding holding, HoldingEventType eventType, int previousQuantity) {
        applicationEventPublisher.publishEvent(new HoldingEvent(source, holding, eventType, previousQuantity));
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }
}
