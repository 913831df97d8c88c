package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.AuditEventType;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Append-only audit trail entry. Never updated or deleted once written.
 * {@code details} is a free-form payload persisted as JSON.
 */
@Value
@Builder
public class AuditEvent {

    String id;
    AuditEventType type;
    String actor;
    String clientId;
    LocalDateTime timestamp;
    Map<String, Object> details;
}
