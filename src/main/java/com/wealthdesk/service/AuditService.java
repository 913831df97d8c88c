package com.wealthdesk.service;

import com.wealthdesk.domain.enums.AuditEventType;
import com.wealthdesk.domain.model.AuditEvent;
import com.wealthdesk.domain.model.Order;
import com.wealthdesk.mapper.AuditEventMapper;
import com.wealthdesk.repository.jpa.AuditEventJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Append-only audit trail for order lifecycle and client profile changes.
 *
 * <p>Events are written synchronously to the audit_events table. There is no update
 * or delete path. Order events always carry the order id, instrument symbol, quantity
 * and side in their details.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditEventJpaRepository auditEventJpaRepository;
    private final AuditEventMapper auditEventMapper = Mappers.getMapper(AuditEventMapper.class);
    private final Clock clock;

    public AuditService(AuditEventJpaRepository auditEventJpaRepository, Clock clock) {
        this.auditEventJpaRepository = auditEventJpaRepository;
        this.clock = clock;
    }

    public AuditEvent record(AuditEventType type, String actor, String clientId, Map<String, Object> details) {
        AuditEvent auditEvent = AuditEvent.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .actor(actor)
                .clientId(clientId)
                .timestamp(LocalDateTime.now(clock))
                .details(details != null ? details : Map.of())
                .build();

        auditEventJpaRepository.save(auditEventMapper.toEntity(auditEvent));
        log.debug("Audit {} recorded for client {}", type, clientId);
        return auditEvent;
    }

    /**
     * Records an order lifecycle event. {@code extra} entries (executed price,
     * failure reason) are appended after the standard order fields.
     */
    public AuditEvent recordOrderEvent(
            AuditEventType type, Order order, String clientId, String instrumentSymbol, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderId", order.getId());
        details.put("portfolioId", order.getPortfolioId());
        details.put("instrument", instrumentSymbol);
        details.put("quantity", order.getQuantity());
        details.put("side", order.getSide().name());
        details.put("orderType", order.getOrderType().name());
        if (extra != null) {
            details.putAll(extra);
        }
        return record(type, order.getCreatedBy(), clientId, details);
    }

    public List<AuditEvent> findByClient(String clientId) {
        return auditEventMapper.toDomainList(auditEventJpaRepository.findByClientIdOrderByTimestampDesc(clientId));
    }

    public List<AuditEvent> findByType(AuditEventType type) {
        return auditEventMapper.toDomainList(auditEventJpaRepository.findByType(type));
    }
}
