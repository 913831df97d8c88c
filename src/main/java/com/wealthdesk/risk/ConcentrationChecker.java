package com.wealthdesk.risk;

import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.ledger.HoldingsBook;
import com.wealthdesk.service.PortfolioValuationService;
import java.math.BigDecimal;
import java.math.MathContext;
import org.springframework.stereotype.Component;

/**
 * Post-trade position weight check for buys.
 *
 * <pre>
 * resultingValue      = (heldQty + qty) * currentPrice
 * postTradeTotal      = totalValue - estimatedCost + qty * currentPrice
 * resultingPercentage = resultingValue / postTradeTotal * 100
 * </pre>
 *
 * The buy is acceptable when the resulting percentage is at or below the limit.
 */
@Component
public class ConcentrationChecker {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final HoldingsBook holdingsBook;
    private final PortfolioValuationService portfolioValuationService;
    private final RiskLimits riskLimits;

    public ConcentrationChecker(
            HoldingsBook holdingsBook, PortfolioValuationService portfolioValuationService, RiskLimits riskLimits) {
        this.holdingsBook = holdingsBook;
        this.portfolioValuationService = portfolioValuationService;
        this.riskLimits = riskLimits;
    }

    public ConcentrationResult check(Portfolio portfolio, Instrument instrument, int quantity, BigDecimal estimatedCost) {
        BigDecimal price = instrument.getCurrentPrice();
        int heldQuantity = holdingsBook.getHeldQuantity(portfolio.getId(), instrument.getId());

        BigDecimal resultingValue = price.multiply(BigDecimal.valueOf((long) heldQuantity + quantity));
        BigDecimal postTradeTotal = portfolioValuationService
                .totalValue(portfolio)
                .subtract(estimatedCost)
                .add(price.multiply(BigDecimal.valueOf(quantity)));

        BigDecimal resultingPercentage = percentageOf(resultingValue, postTradeTotal);
        BigDecimal limit = riskLimits.getConcentrationLimitPercent();

        return ConcentrationResult.builder()
                .acceptable(resultingPercentage.compareTo(limit) <= 0)
                .resultingPercentage(resultingPercentage)
                .limit(limit)
                .build();
    }

    private static BigDecimal percentageOf(BigDecimal part, BigDecimal total) {
        if (total.signum() <= 0) {
            return part.signum() == 0 ? BigDecimal.ZERO : HUNDRED;
        }
        return part.multiply(HUNDRED).divide(total, MathContext.DECIMAL64);
    }
}
