package com.wealthdesk.event;

import com.wealthdesk.domain.enums.OrderStatus;
import com.wealthdesk.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the order engine on acceptance and by the executor when an order
 * reaches a terminal state.
 *
 * <p>Rejected submissions never produce an OrderEvent; they are reported as a
 * {@link RiskEvent} instead, since no order exists.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Null for CREATED events. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
