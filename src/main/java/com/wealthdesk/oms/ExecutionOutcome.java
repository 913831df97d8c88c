package com.wealthdesk.oms;

import com.wealthdesk.domain.model.Order;
import com.wealthdesk.domain.model.Transaction;
import lombok.Builder;
import lombok.Value;

/**
 * What one call to {@link OrderExecutor#execute} did. {@code skipped} means the order
 * was already terminal (or unknown) and nothing changed.
 */
@Value
@Builder
public class ExecutionOutcome {

    Order order;
    boolean skipped;
    Transaction transaction;
    String clientId;
    String instrumentSymbol;

    public static ExecutionOutcome skipped(Order order) {
        return ExecutionOutcome.builder().order(order).skipped(true).build();
    }

    public boolean isExecuted() {
        return !skipped && transaction != null;
    }

    public boolean isFailed() {
        return !skipped && transaction == null;
    }
}
