package com.wealthdesk.event;

import com.wealthdesk.domain.model.Holding;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a fill changes a holding.
 *
 * <p>For CLOSED events {@code holding} is the last snapshot before removal, so
 * listeners still see the instrument and average cost of the closed position.
 */
public class HoldingEvent extends ApplicationEvent {

    private final Holding holding;
    private final HoldingEventType eventType;
    private final int previousQuantity;

    public HoldingEvent(Object source, Holding holding, HoldingEventType eventType, int previousQuantity) {
        super(source);
        this.holding = holding;
        this.eventType = eventType;
        this.previousQuantity = previousQuantity;
    }

    public Holding getHolding() {
        return holding;
    }

    public HoldingEventType getEventType() {
        return eventType;
    }

    /** Quantity held before the fill; 0 for OPENED. */
    public int getPreviousQuantity() {
        return previousQuantity;
    }
}
