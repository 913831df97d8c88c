package com.wealthdesk.analytics;

import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.domain.enums.ActionPriority;
import com.wealthdesk.domain.enums.ActionType;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.NextBestAction;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.PortfolioDrift;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.repository.memory.RiskProfileMemoryRepository;
import com.wealthdesk.service.PortfolioService;
import com.wealthdesk.service.PortfolioValuationService;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives next-best-actions for a client.
 *
 * <ul>
 *   <li>Risk profile older than the stale window: REFRESH_RISK_PROFILE, HIGH</li>
 *   <li>Drift above the rebalance threshold: REBALANCE_PORTFOLIO, HIGH above the high-drift
 *       mark, otherwise MEDIUM</li>
 *   <li>Cash above the excess-cash share: INVEST_CASH, MEDIUM above the high-cash mark,
 *       otherwise LOW</li>
 *   <li>Any holding above the concentration share: REDUCE_CONCENTRATION, HIGH</li>
 * </ul>
 *
 * Portfolio rules run for every portfolio the client owns. Nothing is persisted;
 * actions are recomputed on each call.
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final RiskProfileMemoryRepository riskProfileMemoryRepository;
    private final PortfolioService portfolioService;
    private final PortfolioValuationService portfolioValuationService;
    private final PortfolioAnalyticsService portfolioAnalyticsService;
    private final InstrumentCatalog instrumentCatalog;
    private final AnalyticsThresholds thresholds;
    private final Clock clock;

    public RecommendationService(
            RiskProfileMemoryRepository riskProfileMemoryRepository,
            PortfolioService portfolioService,
            PortfolioValuationService portfolioValuationService,
            PortfolioAnalyticsService portfolioAnalyticsService,
            InstrumentCatalog instrumentCatalog,
            AnalyticsThresholds thresholds,
            Clock clock) {
        this.riskProfileMemoryRepository = riskProfileMemoryRepository;
        this.portfolioService = portfolioService;
        this.portfolioValuationService = portfolioValuationService;
        this.portfolioAnalyticsService = portfolioAnalyticsService;
        this.instrumentCatalog = instrumentCatalog;
        this.thresholds = thresholds;
        this.clock = clock;
    }

    public List<NextBestAction> generate(String clientId) {
        RiskProfile riskProfile = riskProfileMemoryRepository
                .findByClientId(clientId)
                .orElseThrow(() -> new ResourceNotFoundException("RiskProfile", clientId));
        LocalDateTime now = LocalDateTime.now(clock);

        List<NextBestAction> actions = new ArrayList<>();
        checkStaleProfile(riskProfile, now, actions);

        for (Portfolio portfolio : portfolioService.getPortfoliosForClient(clientId)) {
            checkDrift(clientId, portfolio, riskProfile, now, actions);

            BigDecimal totalValue = portfolioValuationService.totalValue(portfolio);
            if (totalValue.signum() <= 0) {
                continue;
            }
            checkExcessCash(clientId, portfolio, totalValue, now, actions);
            checkConcentration(clientId, portfolio, totalValue, now, actions);
        }

        log.debug("Generated {} actions for client {}", actions.size(), clientId);
        return actions;
    }

    private void checkStaleProfile(RiskProfile riskProfile, LocalDateTime now, List<NextBestAction> actions) {
        if (riskProfile.getLastUpdated() == null) {
            return;
        }
        if (riskProfile.getLastUpdated().plusDays(thresholds.getRiskProfileStaleDays()).isBefore(now)) {
            long ageDays = ChronoUnit.DAYS.between(riskProfile.getLastUpdated(), now);
            actions.add(NextBestAction.builder()
                    .id("nba-" + riskProfile.getClientId() + "-risk-profile")
                    .clientId(riskProfile.getClientId())
                    .type(ActionType.REFRESH_RISK_PROFILE)
                    .title("Refresh Risk Profile")
                    .description(String.format("Risk profile is %d days old. Consider updating.", ageDays))
                    .priority(ActionPriority.HIGH)
                    .createdAt(now)
                    .metadata(Map.of("ageDays", ageDays))
                    .build());
        }
    }

    private void checkDrift(
            String clientId,
            Portfolio portfolio,
            RiskProfile riskProfile,
            LocalDateTime now,
            List<NextBestAction> actions) {
        PortfolioDrift drift;
        try {
            drift = portfolioAnalyticsService.getDrift(portfolio.getId(), riskProfile.getScore());
        } catch (ResourceNotFoundException e) {
            log.warn("No drift for portfolio {}: {}", portfolio.getId(), e.getMessage());
            return;
        }
        if (!drift.isRebalanceNeeded()) {
            return;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("portfolioId", portfolio.getId());
        metadata.put("drift", drift.getDriftPercentage());
        metadata.put("modelId", drift.getModelId());

        actions.add(NextBestAction.builder()
                .id("nba-" + clientId + "-rebalance-" + portfolio.getId())
                .clientId(clientId)
                .type(ActionType.REBALANCE_PORTFOLIO)
                .title("Rebalance Portfolio")
                .description(String.format(
                        "Portfolio has drifted %s%% from target %s model allocation.",
                        oneDecimal(drift.getDriftPercentage()), drift.getModelName()))
                .priority(
                        drift.getDriftPercentage().compareTo(thresholds.getHighDriftPercent()) > 0
                                ? ActionPriority.HIGH
                                : ActionPriority.MEDIUM)
                .createdAt(now)
                .metadata(metadata)
                .build());
    }

    private void checkExcessCash(
            String clientId,
            Portfolio portfolio,
            BigDecimal totalValue,
            LocalDateTime now,
            List<NextBestAction> actions) {
        BigDecimal cashPercentage = share(portfolio.getCash(), totalValue);
        if (cashPercentage.compareTo(thresholds.getExcessCashPercent()) <= 0) {
            return;
        }

        actions.add(NextBestAction.builder()
                .id("nba-" + clientId + "-invest-cash-" + portfolio.getId())
                .clientId(clientId)
                .type(ActionType.INVEST_CASH)
                .title("Invest Excess Cash")
                .description(String.format(
                        "%s%% of portfolio is in cash. Consider investing according to target allocation.",
                        oneDecimal(cashPercentage)))
                .priority(
                        cashPercentage.compareTo(thresholds.getHighCashPercent()) > 0
                                ? ActionPriority.MEDIUM
                                : ActionPriority.LOW)
                .createdAt(now)
                .metadata(Map.of(
                        "portfolioId", portfolio.getId(),
                        "cashPercentage", cashPercentage,
                        "cashAmount", portfolio.getCash()))
                .build());
    }

    private void checkConcentration(
            String clientId,
            Portfolio portfolio,
            BigDecimal totalValue,
            LocalDateTime now,
            List<NextBestAction> actions) {
        for (Holding holding : portfolioService.getHoldings(portfolio.getId())) {
            Instrument instrument = instrumentCatalog.find(holding.getInstrumentId()).orElse(null);
            if (instrument == null) {
                continue;
            }
            BigDecimal percentage = share(holding.marketValue(instrument.getCurrentPrice()), totalValue);
            if (percentage.compareTo(thresholds.getHoldingConcentrationPercent()) <= 0) {
                continue;
            }

            actions.add(NextBestAction.builder()
                    .id("nba-" + clientId + "-concentration-" + portfolio.getId() + "-" + instrument.getId())
                    .clientId(clientId)
                    .type(ActionType.REDUCE_CONCENTRATION)
                    .title("Reduce Concentration Risk")
                    .description(String.format(
                            "%s represents %s%% of portfolio, exceeding %s%% threshold.",
                            instrument.getSymbol(),
                            oneDecimal(percentage),
                            thresholds.getHoldingConcentrationPercent().toPlainString()))
                    .priority(ActionPriority.HIGH)
                    .createdAt(now)
                    .metadata(Map.of(
                            "portfolioId", portfolio.getId(),
                            "instrumentId", instrument.getId(),
                            "percentage", percentage))
                    .build());
        }
    }

    private static BigDecimal share(BigDecimal part, BigDecimal total) {
        return part.multiply(HUNDRED).divide(total, MathContext.DECIMAL64);
    }

    private static String oneDecimal(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
