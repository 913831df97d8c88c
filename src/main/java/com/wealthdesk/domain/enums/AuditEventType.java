package com.wealthdesk.domain.enums;

public enum AuditEventType {
    ORDER_CREATED,
    ORDER_EXECUTED,
    ORDER_FAILED,
    RISK_PROFILE_UPDATED,
    MODEL_RECOMMENDATION_CHANGED
}
