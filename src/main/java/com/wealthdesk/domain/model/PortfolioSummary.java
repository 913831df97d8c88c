package com.wealthdesk.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Point-in-time valuation of a portfolio at current catalog prices. */
@Value
@Builder
public class PortfolioSummary {

    String portfolioId;
    String clientId;
    String baseCurrency;
    BigDecimal cash;
    BigDecimal holdingsValue;
    BigDecimal totalValue;
    BigDecimal costBasis;
    BigDecimal unrealizedGain;
    int holdingCount;
}
