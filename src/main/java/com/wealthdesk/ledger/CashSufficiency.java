package com.wealthdesk.ledger;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Outcome of a pre-trade cash check. */
@Value
@Builder
public class CashSufficiency {

    boolean sufficient;
    BigDecimal available;
    BigDecimal required;

    public BigDecimal getShortfall() {
        return sufficient ? BigDecimal.ZERO : required.subtract(available);
    }
}
