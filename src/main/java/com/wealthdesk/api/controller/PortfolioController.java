package com.wealthdesk.api.controller;

import com.wealthdesk.analytics.PortfolioAnalyticsService;
import com.wealthdesk.domain.model.AllocationBreakdown;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.PortfolioDrift;
import com.wealthdesk.domain.model.PortfolioSummary;
import com.wealthdesk.domain.model.Transaction;
import com.wealthdesk.service.PortfolioService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only portfolio views: holdings, transaction history, allocation, drift and valuation.
 *
 * <p>{@code GET /api/portfolios/{portfolioId}/drift} measures against the model for the
 * client's stored risk profile unless {@code riskScore} is given.
 */
@RestController
@RequestMapping("/api/portfolios/{portfolioId}")
public class PortfolioController {

    private final PortfolioService portfolioService;
    private final PortfolioAnalyticsService portfolioAnalyticsService;

    public PortfolioController(
            PortfolioService portfolioService, PortfolioAnalyticsService portfolioAnalyticsService) {
        this.portfolioService = portfolioService;
        this.portfolioAnalyticsService = portfolioAnalyticsService;
    }

    @GetMapping
    public Portfolio getPortfolio(@PathVariable String portfolioId) {
        return portfolioService.getPortfolio(portfolioId);
    }

    @GetMapping("/holdings")
    public List<Holding> getHoldings(@PathVariable String portfolioId) {
        return portfolioService.getHoldings(portfolioId);
    }

    @GetMapping("/transactions")
    public List<Transaction> getTransactions(@PathVariable String portfolioId) {
        return portfolioService.getTransactions(portfolioId);
    }

    @GetMapping("/allocations")
    public List<AllocationBreakdown> getAllocations(@PathVariable String portfolioId) {
        return portfolioAnalyticsService.getAllocations(portfolioId);
    }

    @GetMapping("/drift")
    public PortfolioDrift getDrift(
            @PathVariable String portfolioId, @RequestParam(required = false) Integer riskScore) {
        if (riskScore == null) {
            return portfolioAnalyticsService.getDrift(portfolioId);
        }
        return portfolioAnalyticsService.getDrift(portfolioId, riskScore);
    }

    @GetMapping("/summary")
    public PortfolioSummary getSummary(@PathVariable String portfolioId) {
        return portfolioAnalyticsService.getSummary(portfolioId);
    }
}
