package com.wealthdesk.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.wealthdesk.domain.enums.AuditEventType;
import com.wealthdesk.domain.enums.TransactionType;
import com.wealthdesk.entity.AuditEventEntity;
import com.wealthdesk.entity.TransactionEntity;
import com.wealthdesk.repository.jpa.AuditEventJpaRepository;
import com.wealthdesk.repository.jpa.TransactionJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

/**
 * Persistence tests for the transaction ledger and audit trail tables on the
 * embedded H2 database.
 */
@DataJpaTest
@ActiveProfiles("test")
class LedgerPersistenceIntegrationTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 3, 10, 0);

    @Autowired
    private TransactionJpaRepository transactionJpaRepository;

    @Autowired
    private AuditEventJpaRepository auditEventJpaRepository;

    private static TransactionEntity transaction(String id, String orderId, String portfolioId, LocalDateTime at) {
        return TransactionEntity.builder()
                .id(id)
                .orderId(orderId)
                .portfolioId(portfolioId)
                .instrumentId("ins-1")
                .type(TransactionType.BUY)
                .quantity(10)
                .price(new BigDecimal("50.000000"))
                .amount(new BigDecimal("500.000000"))
                .timestamp(at)
                .build();
    }

    private static AuditEventEntity audit(String id, AuditEventType type, String clientId, LocalDateTime at) {
        return AuditEventEntity.builder()
                .id(id)
                .type(type)
                .actor("adv-1")
                .clientId(clientId)
                .timestamp(at)
                .detailsJson("{\"orderId\":\"ord-1\"}")
                .build();
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("Looked up by order id")
        void findByOrderId() {
            transactionJpaRepository.save(transaction("tx-1", "ord-1", "port-1", T0));

            assertThat(transactionJpaRepository.existsByOrderId("ord-1")).isTrue();
            assertThat(transactionJpaRepository.existsByOrderId("ord-2")).isFalse();
            assertThat(transactionJpaRepository.findByOrderId("ord-1"))
                    .get()
                    .satisfies(tx -> {
                        assertThat(tx.getAmount()).isEqualByComparingTo("500");
                        assertThat(tx.getRealizedGain()).isNull();
                    });
        }

        @Test
        @DisplayName("Listed per portfolio, newest first")
        void newestFirst() {
            transactionJpaRepository.save(transaction("tx-1", "ord-1", "port-1", T0));
            transactionJpaRepository.save(transaction("tx-2", "ord-2", "port-1", T0.plusMinutes(5)));
            transactionJpaRepository.save(transaction("tx-3", "ord-3", "port-2", T0.plusMinutes(1)));

            assertThat(transactionJpaRepository.findByPortfolioIdOrderByTimestampDesc("port-1"))
                    .extracting(TransactionEntity::getId)
                    .containsExactly("tx-2", "tx-1");
        }

        @Test
        @DisplayName("A second row for the same order violates the unique order id")
        void oneTransactionPerOrder() {
            transactionJpaRepository.saveAndFlush(transaction("tx-1", "ord-1", "port-1", T0));

            assertThatThrownBy(() ->
                            transactionJpaRepository.saveAndFlush(transaction("tx-2", "ord-1", "port-1", T0)))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }
    }

    @Nested
    @DisplayName("Audit events")
    class AuditEvents {

        @Test
        @DisplayName("Listed per client, newest first, with details kept as JSON")
        void byClient() {
            auditEventJpaRepository.save(audit("evt-1", AuditEventType.ORDER_CREATED, "cli-1", T0));
            auditEventJpaRepository.save(audit("evt-2", AuditEventType.ORDER_EXECUTED, "cli-1", T0.plusSeconds(2)));
            auditEventJpaRepository.save(audit("evt-3", AuditEventType.ORDER_CREATED, "cli-2", T0));

            assertThat(auditEventJpaRepository.findByClientIdOrderByTimestampDesc("cli-1"))
                    .extracting(AuditEventEntity::getId, AuditEventEntity::getDetailsJson)
                    .containsExactly(
                            tuple("evt-2", "{\"orderId\":\"ord-1\"}"),
                            tuple("evt-1", "{\"orderId\":\"ord-1\"}"));
        }

        @Test
        @DisplayName("Filtered by type")
        void byType() {
            auditEventJpaRepository.save(audit("evt-1", AuditEventType.ORDER_CREATED, "cli-1", T0));
            auditEventJpaRepository.save(audit("evt-2", AuditEventType.ORDER_FAILED, "cli-1", T0));

            assertThat(auditEventJpaRepository.findByType(AuditEventType.ORDER_FAILED))
                    .extracting(AuditEventEntity::getId)
                    .containsExactly("evt-2");
        }
    }
}
