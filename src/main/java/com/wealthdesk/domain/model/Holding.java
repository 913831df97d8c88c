package com.wealthdesk.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A position in one instrument within one portfolio.
 *
 * <p>Immutable snapshot; the HoldingsBook replaces the snapshot on every fill.
 * Quantity is always positive: a fill that would leave zero or fewer units removes
 * the holding instead.
 */
@Value
@Builder(toBuilder = true)
public class Holding {

    String portfolioId;
    String instrumentId;
    int quantity;
    BigDecimal averageCost;
    LocalDateTime lastUpdated;

    /** Quantity times average cost. */
    public BigDecimal getCostBasis() {
        return averageCost.multiply(BigDecimal.valueOf(quantity));
    }

    public BigDecimal marketValue(BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
