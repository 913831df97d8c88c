package com.wealthdesk.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a submission is rejected by a pre-trade rule.
 *
 * <p>The details map carries rule-specific numbers, for example
 * {@code {"resultingPercentage": 31.2, "limit": 25}} for a concentration breach
 * or {@code {"available": 400, "required": 500}} for insufficient cash.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

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

    public Map<String, Object> getDetails() {
        return details;
    }
}
