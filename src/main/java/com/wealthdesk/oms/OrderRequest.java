package com.wealthdesk.oms;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Input to {@link OrderEngine#submitOrder}. Built by the REST layer or by
 * in-process callers.
 *
 * <p>{@code idempotencyKey} is optional: when a client resubmits with a key that was
 * already accepted, the engine returns the original order id instead of creating
 * a second order.
 */
@Data
@Builder
public class OrderRequest {

    private String portfolioId;
    private String instrumentId;
    private OrderSide side;

    @Builder.Default
    private OrderType orderType = OrderType.MARKET;

    private int quantity;

    /** Required for LIMIT orders, ignored for MARKET orders. */
    private BigDecimal limitPrice;

    /** Advisor or client id recorded as the audit actor. */
    private String createdBy;

    private String idempotencyKey;
}
