package com.wealthdesk.entity;

import com.wealthdesk.domain.enums.TransactionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the ledger_transactions table.
 * One row per executed order; the unique order_id column enforces the 1:1 relation.
 */
@Entity
@Table(
        name = "ledger_transactions",
        indexes = {@Index(name = "idx_ledger_tx_portfolio", columnList = "portfolio_id")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "order_id", length = 36, nullable = false, unique = true)
    private String orderId;

    @Column(name = "portfolio_id", length = 36, nullable = false)
    private String portfolioId;

    @Column(name = "instrument_id", length = 36, nullable = false)
    private String instrumentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "tx_type", columnDefinition = "varchar(10)")
    private TransactionType type;

    private int quantity;

    @Column(precision = 19, scale = 6)
    private BigDecimal price;

    @Column(precision = 19, scale = 6)
    private BigDecimal amount;

    /** Sells only. */
    @Column(name = "realized_gain", precision = 19, scale = 6)
    private BigDecimal realizedGain;

    @Column(name = "executed_at")
    private LocalDateTime timestamp;
}
