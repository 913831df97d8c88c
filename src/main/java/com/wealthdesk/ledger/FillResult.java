package com.wealthdesk.ledger;

import com.wealthdesk.domain.model.Holding;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** What one committed fill did to the ledger. */
@Value
@Builder
public class FillResult {

    BigDecimal amount;
    BigDecimal cashAfter;

    /** Null when the fill closed the position. */
    Holding holdingAfter;

    /** Sells only. */
    BigDecimal realizedGain;
}
