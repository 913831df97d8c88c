package com.wealthdesk.service;

import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.ledger.HoldingsBook;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Marks portfolios to market at current catalog prices.
 *
 * <p>A holding whose instrument is no longer in the catalog is valued at zero.
 */
@Service
public class PortfolioValuationService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioValuationService.class);

    private final HoldingsBook holdingsBook;
    private final InstrumentCatalog instrumentCatalog;

    public PortfolioValuationService(HoldingsBook holdingsBook, InstrumentCatalog instrumentCatalog) {
        this.holdingsBook = holdingsBook;
        this.instrumentCatalog = instrumentCatalog;
    }

    /** Cash plus the market value of every holding. */
    public BigDecimal totalValue(Portfolio portfolio) {
        return portfolio.getCash().add(holdingsValue(holdingsBook.getHoldings(portfolio.getId())));
    }

    public BigDecimal holdingsValue(List<Holding> holdings) {
        return holdings.stream().map(this::marketValue).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal marketValue(Holding holding) {
        return instrumentCatalog
                .find(holding.getInstrumentId())
                .map(Instrument::getCurrentPrice)
                .map(holding::marketValue)
                .orElseGet(() -> {
                    log.warn(
                            "Holding {} in portfolio {} references an unknown instrument; valued at 0",
                            holding.getInstrumentId(),
                            holding.getPortfolioId());
                    return BigDecimal.ZERO;
                });
    }
}
