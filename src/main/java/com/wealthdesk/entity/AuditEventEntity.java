package com.wealthdesk.entity;

import com.wealthdesk.domain.enums.AuditEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the audit_events table. Rows are inserted, never updated.
 * The details column holds the event payload as a JSON object.
 */
@Entity
@Table(
        name = "audit_events",
        indexes = {@Index(name = "idx_audit_client", columnList = "client_id")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEventEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", length = 50, nullable = false)
    private AuditEventType type;

    @Column(length = 100)
    private String actor;

    @Column(name = "client_id", length = 36)
    private String clientId;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "details_json", columnDefinition = "CLOB")
    private String detailsJson;
}
