package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable ledger record produced exactly once per executed order.
 *
 * <p>{@code realizedGain} is only set for sells: (price - averageCost) x quantity,
 * measured against the holding's average cost at fill time. Holdings never store it.
 */
@Value
@Builder
public class Transaction {

    String id;
    String orderId;
    String portfolioId;
    String instrumentId;
    TransactionType type;
    int quantity;
    BigDecimal price;
    BigDecimal amount;
    BigDecimal realizedGain;
    LocalDateTime timestamp;
}
