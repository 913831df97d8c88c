package com.wealthdesk.event;

public enum HoldingEventType {
    OPENED,
    INCREASED,
    REDUCED,
    CLOSED
}
