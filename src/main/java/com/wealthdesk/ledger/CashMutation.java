package com.wealthdesk.ledger;

import com.wealthdesk.domain.model.Portfolio;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A validated, not yet applied, change to a portfolio's cash balance. */
@Value
@Builder
public class CashMutation {

    Portfolio portfolio;
    BigDecimal previousCash;
    BigDecimal newCash;

    /** Signed change: negative for buys, positive for sells. */
    BigDecimal delta;
}
