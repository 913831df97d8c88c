package com.wealthdesk.risk;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.RiskProfile;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the pre-trade rules need, resolved by the order engine before validation.
 * {@code estimatedPrice} is the limit price for LIMIT orders, otherwise the current price.
 */
@Value
@Builder
public class PreTradeContext {

    Portfolio portfolio;
    RiskProfile riskProfile;
    Instrument instrument;
    OrderSide side;
    int quantity;
    BigDecimal estimatedPrice;

    public BigDecimal getEstimatedCost() {
        return estimatedPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
