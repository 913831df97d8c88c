package com.wealthdesk.risk;

import com.wealthdesk.ledger.HoldingsBook;
import org.springframework.stereotype.Component;

/** Rejects sells larger than the quantity currently held. */
@Component
public class HoldingsChecker {

    private final HoldingsBook holdingsBook;

    public HoldingsChecker(HoldingsBook holdingsBook) {
        this.holdingsBook = holdingsBook;
    }

    public HoldingsCheckResult check(String portfolioId, String instrumentId, int quantity) {
        int held = holdingsBook.getHeldQuantity(portfolioId, instrumentId);
        return HoldingsCheckResult.builder()
                .sufficient(held > 0 && quantity <= held)
                .heldQuantity(held)
                .requestedQuantity(quantity)
                .build();
    }
}
