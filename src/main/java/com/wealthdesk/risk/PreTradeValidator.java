package com.wealthdesk.risk;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.enums.RejectionCode;
import com.wealthdesk.ledger.CashLedger;
import com.wealthdesk.ledger.CashSufficiency;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the submission rules in a fixed order and stops at the first failure.
 *
 * <p>Order of checks:
 * <ol>
 *   <li>Suitability (every order)</li>
 *   <li>BUY: cash sufficiency, then concentration</li>
 *   <li>SELL: held quantity</li>
 * </ol>
 *
 * <p>A client who fails suitability is therefore never told about cash or
 * concentration. Nothing here mutates state.
 */
@Service
public class PreTradeValidator {

    private static final Logger log = LoggerFactory.getLogger(PreTradeValidator.class);

    private final SuitabilityChecker suitabilityChecker;
    private final CashLedger cashLedger;
    private final ConcentrationChecker concentrationChecker;
    private final HoldingsChecker holdingsChecker;

    public PreTradeValidator(
            SuitabilityChecker suitabilityChecker,
            CashLedger cashLedger,
            ConcentrationChecker concentrationChecker,
            HoldingsChecker holdingsChecker) {
        this.suitabilityChecker = suitabilityChecker;
        this.cashLedger = cashLedger;
        this.concentrationChecker = concentrationChecker;
        this.holdingsChecker = holdingsChecker;
    }

    public RiskValidationResult validate(PreTradeContext context) {
        SuitabilityResult suitability = suitabilityChecker.check(context.getInstrument(), context.getRiskProfile());
        if (!suitability.isSuitable()) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    RejectionCode.SUITABILITY_FAILED,
                    suitability.getReason(),
                    Map.of(
                            "requiredScore", suitability.getRequiredScore(),
                            "clientScore", suitability.getClientScore())));
        }

        RiskValidationResult result =
                context.getSide() == OrderSide.BUY ? validateBuy(context) : validateSell(context);
        if (result.isApproved()) {
            log.debug(
                    "Pre-trade checks passed: {} {} x {} for portfolio {}",
                    context.getSide(),
                    context.getQuantity(),
                    context.getInstrument().getSymbol(),
                    context.getPortfolio().getId());
        }
        return result;
    }

    private RiskValidationResult validateBuy(PreTradeContext context) {
        CashSufficiency cash = cashLedger.checkSufficiency(context.getPortfolio(), context.getEstimatedCost());
        if (!cash.isSufficient()) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    RejectionCode.INSUFFICIENT_CASH,
                    String.format(
                            "Insufficient cash: order needs %s, available %s", cash.getRequired(), cash.getAvailable()),
                    Map.of("required", cash.getRequired(), "available", cash.getAvailable())));
        }

        ConcentrationResult concentration = concentrationChecker.check(
                context.getPortfolio(), context.getInstrument(), context.getQuantity(), context.getEstimatedCost());
        if (!concentration.isAcceptable()) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    RejectionCode.CONCENTRATION_EXCEEDED,
                    String.format(
                            "Position in %s would be %s%% of the portfolio, limit is %s%%",
                            context.getInstrument().getSymbol(),
                            concentration.getResultingPercentage().stripTrailingZeros().toPlainString(),
                            concentration.getLimit().stripTrailingZeros().toPlainString()),
                    Map.of(
                            "resultingPercentage", concentration.getResultingPercentage(),
                            "limit", concentration.getLimit())));
        }

        return RiskValidationResult.approved();
    }

    private RiskValidationResult validateSell(PreTradeContext context) {
        HoldingsCheckResult holdings = holdingsChecker.check(
                context.getPortfolio().getId(), context.getInstrument().getId(), context.getQuantity());
        if (!holdings.isSufficient()) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    RejectionCode.INSUFFICIENT_HOLDINGS,
                    String.format(
                            "Cannot sell %d units of %s, only %d held",
                            holdings.getRequestedQuantity(),
                            context.getInstrument().getSymbol(),
                            holdings.getHeldQuantity()),
                    Map.of("requested", holdings.getRequestedQuantity(), "held", holdings.getHeldQuantity())));
        }
        return RiskValidationResult.approved();
    }
}
