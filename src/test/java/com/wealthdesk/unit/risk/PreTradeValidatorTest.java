package com.wealthdesk.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.wealthdesk.domain.enums.AssetClass;
import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.enums.RejectionCode;
import com.wealthdesk.domain.enums.RiskCategory;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.ledger.CashLedger;
import com.wealthdesk.ledger.CashSufficiency;
import com.wealthdesk.risk.ConcentrationChecker;
import com.wealthdesk.risk.ConcentrationResult;
import com.wealthdesk.risk.HoldingsCheckResult;
import com.wealthdesk.risk.HoldingsChecker;
import com.wealthdesk.risk.PreTradeContext;
import com.wealthdesk.risk.PreTradeValidator;
import com.wealthdesk.risk.RiskValidationResult;
import com.wealthdesk.risk.SuitabilityChecker;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for PreTradeValidator covering rule order and short-circuiting.
 */
@ExtendWith(MockitoExtension.class)
class PreTradeValidatorTest {

    @Mock
    private CashLedger cashLedger;

    @Mock
    private ConcentrationChecker concentrationChecker;

    @Mock
    private HoldingsChecker holdingsChecker;

    private PreTradeValidator preTradeValidator;
    private Portfolio portfolio;
    private Instrument alternative;
    private Instrument equity;

    @BeforeEach
    void setUp() {
        preTradeValidator =
                new PreTradeValidator(new SuitabilityChecker(), cashLedger, concentrationChecker, holdingsChecker);
        portfolio = Portfolio.builder().id("port-1").clientId("cli-1").cash(new BigDecimal("100")).build();
        alternative = Instrument.builder()
                .id("ins-alt")
                .symbol("ALTX")
                .assetClass(AssetClass.ALTERNATIVE)
                .riskRating(7)
                .currentPrice(new BigDecimal("100"))
                .build();
        equity = Instrument.builder()
                .id("ins-eq")
                .symbol("EQX")
                .assetClass(AssetClass.EQUITY)
                .riskRating(5)
                .currentPrice(new BigDecimal("50"))
                .build();
    }

    private PreTradeContext context(Instrument instrument, int score, OrderSide side, int quantity) {
        return PreTradeContext.builder()
                .portfolio(portfolio)
                .riskProfile(RiskProfile.builder()
                        .clientId("cli-1")
                        .score(score)
                        .category(RiskCategory.forScore(score))
                        .build())
                .instrument(instrument)
                .side(side)
                .quantity(quantity)
                .estimatedPrice(instrument.getCurrentPrice())
                .build();
    }

    @Nested
    @DisplayName("Suitability first")
    class SuitabilityFirst {

        @Test
        @DisplayName("Unsuitable buy is rejected before cash or concentration are looked at")
        void unsuitableBuyShortCircuits() {
            RiskValidationResult result = preTradeValidator.validate(context(alternative, 3, OrderSide.BUY, 100));

            assertThat(result.isRejected()).isTrue();
            assertThat(result.getViolation().getCode()).isEqualTo(RejectionCode.SUITABILITY_FAILED);
            verifyNoInteractions(cashLedger, concentrationChecker, holdingsChecker);
        }

        @Test
        @DisplayName("Unsuitable sell is rejected before holdings are looked at")
        void unsuitableSellShortCircuits() {
            RiskValidationResult result = preTradeValidator.validate(context(alternative, 3, OrderSide.SELL, 1));

            assertThat(result.getViolation().getCode()).isEqualTo(RejectionCode.SUITABILITY_FAILED);
            verifyNoInteractions(holdingsChecker);
        }
    }

    @Nested
    @DisplayName("Buys")
    class Buys {

        @Test
        @DisplayName("Insufficient cash stops before the concentration check")
        void insufficientCash() {
            when(cashLedger.checkSufficiency(any(), any())).thenReturn(CashSufficiency.builder()
                    .sufficient(false)
                    .available(new BigDecimal("100"))
                    .required(new BigDecimal("500"))
                    .build());

            RiskValidationResult result = preTradeValidator.validate(context(equity, 6, OrderSide.BUY, 10));

            assertThat(result.getViolation().getCode()).isEqualTo(RejectionCode.INSUFFICIENT_CASH);
            assertThat(result.getViolation().getDetails())
                    .containsEntry("required", new BigDecimal("500"))
                    .containsEntry("available", new BigDecimal("100"));
            verify(concentrationChecker, never()).check(any(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("Concentration breach is reported with the resulting weight")
        void concentrationBreach() {
            when(cashLedger.checkSufficiency(any(), any())).thenReturn(CashSufficiency.builder()
                    .sufficient(true)
                    .available(new BigDecimal("100"))
                    .required(new BigDecimal("50"))
                    .build());
            when(concentrationChecker.check(any(), any(), anyInt(), any())).thenReturn(ConcentrationResult.builder()
                    .acceptable(false)
                    .resultingPercentage(new BigDecimal("50.00"))
                    .limit(new BigDecimal("25"))
                    .build());

            RiskValidationResult result = preTradeValidator.validate(context(equity, 6, OrderSide.BUY, 1));

            assertThat(result.getViolation().getCode()).isEqualTo(RejectionCode.CONCENTRATION_EXCEEDED);
            assertThat(result.getViolation().getMessage())
                    .isEqualTo("Position in EQX would be 50% of the portfolio, limit is 25%");
        }

        @Test
        @DisplayName("Buy passing every rule is approved without touching holdings")
        void approvedBuy() {
            when(cashLedger.checkSufficiency(any(), any())).thenReturn(CashSufficiency.builder()
                    .sufficient(true)
                    .available(new BigDecimal("100"))
                    .required(new BigDecimal("50"))
                    .build());
            when(concentrationChecker.check(any(), any(), anyInt(), any())).thenReturn(ConcentrationResult.builder()
                    .acceptable(true)
                    .resultingPercentage(new BigDecimal("10"))
                    .limit(new BigDecimal("25"))
                    .build());

            assertThat(preTradeValidator.validate(context(equity, 6, OrderSide.BUY, 1)).isApproved())
                    .isTrue();
            verifyNoInteractions(holdingsChecker);
        }
    }

    @Nested
    @DisplayName("Sells")
    class Sells {

        @Test
        @DisplayName("Sells only check held quantity")
        void sellChecksHoldingsOnly() {
            when(holdingsChecker.check(anyString(), anyString(), anyInt())).thenReturn(HoldingsCheckResult.builder()
                    .sufficient(false)
                    .heldQuantity(3)
                    .requestedQuantity(5)
                    .build());

            RiskValidationResult result = preTradeValidator.validate(context(equity, 6, OrderSide.SELL, 5));

            assertThat(result.getViolation().getCode()).isEqualTo(RejectionCode.INSUFFICIENT_HOLDINGS);
            assertThat(result.getViolation().getMessage()).isEqualTo("Cannot sell 5 units of EQX, only 3 held");
            verifyNoInteractions(cashLedger, concentrationChecker);
        }
    }
}
