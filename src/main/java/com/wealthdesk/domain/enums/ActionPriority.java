package com.wealthdesk.domain.enums;

public enum ActionPriority {
    HIGH,
    MEDIUM,
    LOW
}
