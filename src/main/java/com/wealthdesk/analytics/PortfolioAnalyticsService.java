package com.wealthdesk.analytics;

import com.wealthdesk.domain.model.AllocationBreakdown;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.ModelPortfolio;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.PortfolioDrift;
import com.wealthdesk.domain.model.PortfolioSummary;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.exception.BusinessException;
import com.wealthdesk.exception.ErrorCode;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.repository.memory.ModelPortfolioMemoryRepository;
import com.wealthdesk.repository.memory.RiskProfileMemoryRepository;
import com.wealthdesk.service.PortfolioService;
import com.wealthdesk.service.PortfolioValuationService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * On-demand portfolio analytics: allocation by asset class, drift from the model
 * selected for a risk score, and a market valuation summary.
 *
 * <p>Reads are lock-free and use catalog prices at the time of the call.
 */
@Service
public class PortfolioAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioAnalyticsService.class);

    private final PortfolioService portfolioService;
    private final PortfolioValuationService portfolioValuationService;
    private final AllocationCalculator allocationCalculator;
    private final ModelPortfolioSelector modelPortfolioSelector;
    private final DriftCalculator driftCalculator;
    private final ModelPortfolioMemoryRepository modelPortfolioMemoryRepository;
    private final RiskProfileMemoryRepository riskProfileMemoryRepository;

    public PortfolioAnalyticsService(
            PortfolioService portfolioService,
            PortfolioValuationService portfolioValuationService,
            AllocationCalculator allocationCalculator,
            ModelPortfolioSelector modelPortfolioSelector,
            DriftCalculator driftCalculator,
            ModelPortfolioMemoryRepository modelPortfolioMemoryRepository,
            RiskProfileMemoryRepository riskProfileMemoryRepository) {
        this.portfolioService = portfolioService;
        this.portfolioValuationService = portfolioValuationService;
        this.allocationCalculator = allocationCalculator;
        this.modelPortfolioSelector = modelPortfolioSelector;
        this.driftCalculator = driftCalculator;
        this.modelPortfolioMemoryRepository = modelPortfolioMemoryRepository;
        this.riskProfileMemoryRepository = riskProfileMemoryRepository;
    }

    public List<AllocationBreakdown> getAllocations(String portfolioId) {
        Portfolio portfolio = portfolioService.getPortfolio(portfolioId);
        return allocationCalculator.calculate(portfolio.getCash(), portfolioService.getHoldings(portfolioId));
    }

    /**
     * Drift of the portfolio from the model for {@code riskScore}.
     *
     * @throws BusinessException if the score is outside 0..10
     * @throws ResourceNotFoundException if the portfolio is unknown or no model covers the score
     */
    public PortfolioDrift getDrift(String portfolioId, int riskScore) {
        if (!RiskProfile.isValidScore(riskScore)) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    String.format(
                            "Risk score must be between %d and %d, got %d",
                            RiskProfile.MIN_SCORE, RiskProfile.MAX_SCORE, riskScore),
                    Map.of("riskScore", riskScore));
        }

        List<AllocationBreakdown> allocations = getAllocations(portfolioId);
        ModelPortfolio model = getModelFor(riskScore);

        BigDecimal drift = driftCalculator.calculate(
                AllocationCalculator.toPercentages(allocations), model.getTargetPercentages());
        boolean rebalanceNeeded = driftCalculator.isRebalanceNeeded(drift);

        log.debug(
                "Drift for portfolio {} vs model {} (score {}): {} (rebalance={})",
                portfolioId,
                model.getId(),
                riskScore,
                drift,
                rebalanceNeeded);

        return PortfolioDrift.builder()
                .portfolioId(portfolioId)
                .riskScore(riskScore)
                .modelId(model.getId())
                .modelName(model.getName())
                .driftPercentage(drift)
                .threshold(driftCalculator.getThreshold())
                .rebalanceNeeded(rebalanceNeeded)
                .build();
    }

    /** Drift against the model for the portfolio owner's stored risk profile. */
    public PortfolioDrift getDrift(String portfolioId) {
        Portfolio portfolio = portfolioService.getPortfolio(portfolioId);
        RiskProfile riskProfile = riskProfileMemoryRepository
                .findByClientId(portfolio.getClientId())
                .orElseThrow(() -> new ResourceNotFoundException("RiskProfile", portfolio.getClientId()));
        return getDrift(portfolioId, riskProfile.getScore());
    }

    public ModelPortfolio getModelFor(int riskScore) {
        return modelPortfolioSelector
                .select(riskScore, modelPortfolioMemoryRepository.findAll())
                .orElseThrow(() -> new ResourceNotFoundException("ModelPortfolio", "riskScore=" + riskScore));
    }

    public PortfolioSummary getSummary(String portfolioId) {
        Portfolio portfolio = portfolioService.getPortfolio(portfolioId);
        List<Holding> holdings = portfolioService.getHoldings(portfolioId);

        BigDecimal holdingsValue = portfolioValuationService.holdingsValue(holdings);
        BigDecimal costBasis =
                holdings.stream().map(Holding::getCostBasis).reduce(BigDecimal.ZERO, BigDecimal::add);

        return PortfolioSummary.builder()
                .portfolioId(portfolio.getId())
                .clientId(portfolio.getClientId())
                .baseCurrency(portfolio.getBaseCurrency())
                .cash(portfolio.getCash())
                .holdingsValue(holdingsValue)
                .totalValue(portfolio.getCash().add(holdingsValue))
                .costBasis(costBasis)
                .unrealizedGain(holdingsValue.subtract(costBasis))
                .holdingCount(holdings.size())
                .build();
    }
}
