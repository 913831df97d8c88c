package com.wealthdesk.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * A client's investment account.
 *
 * <p>Cash is written only by {@link com.wealthdesk.ledger.CashLedger} while the
 * portfolio's ledger lock is held, and is never negative after a committed fill.
 * Total value is derived on demand (cash plus holdings at market) and not stored.
 */
@Getter
@Builder
public class Portfolio {

    private final String id;
    private final String clientId;

    @Builder.Default
    private final String baseCurrency = "USD";

    @Setter
    private volatile BigDecimal cash;

    @Setter
    private volatile LocalDateTime lastUpdated;
}
