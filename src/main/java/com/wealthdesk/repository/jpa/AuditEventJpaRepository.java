package com.wealthdesk.repository.jpa;

import com.wealthdesk.domain.enums.AuditEventType;
import com.wealthdesk.entity.AuditEventEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the append-only audit_events table. */
@Repository
public interface AuditEventJpaRepository extends JpaRepository<AuditEventEntity, String> {

    List<AuditEventEntity> findByClientIdOrderByTimestampDesc(String clientId);

    List<AuditEventEntity> findByType(AuditEventType type);
}
