package com.wealthdesk.api.dto.request;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.enums.OrderType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/portfolios/{portfolioId}/orders}. Business rules
 * (limit price for LIMIT orders, suitability, cash) are checked by the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    @NotBlank(message = "Instrument id is required")
    private String instrumentId;

    @NotNull(message = "Side is required")
    private OrderSide side;

    /** Defaults to MARKET when omitted. */
    private OrderType orderType;

    @Positive(message = "Quantity must be positive")
    private int quantity;

    private BigDecimal limitPrice;

    private String createdBy;

    @Size(max = 128, message = "Idempotency key must be 128 characters or less")
    private String idempotencyKey;
}
