package com.wealthdesk.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.wealthdesk.domain.enums.AssetClass;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.risk.ConcentrationChecker;
import com.wealthdesk.risk.ConcentrationResult;
import com.wealthdesk.risk.RiskLimits;
import com.wealthdesk.support.EngineFixture;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ConcentrationChecker over real holdings and valuation.
 */
class ConcentrationCheckerTest {

    private EngineFixture fixture;
    private ConcentrationChecker concentrationChecker;
    private Instrument equity;
    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        equity = fixture.addInstrument("ins-eq", "EQX", AssetClass.EQUITY, "100", 5);
        fixture.addInstrument("ins-bond", "BNDX", AssetClass.FIXED_INCOME, "100", 1);
        portfolio = fixture.addClient("cli-1", 6, "port-1", "10000");
        concentrationChecker =
                new ConcentrationChecker(fixture.holdingsBook, fixture.valuationService, RiskLimits.builder().build());
    }

    private ConcentrationResult check(int quantity) {
        return concentrationChecker.check(
                portfolio, equity, quantity, equity.getCurrentPrice().multiply(BigDecimal.valueOf(quantity)));
    }

    @Test
    @DisplayName("Position landing exactly on the limit is accepted")
    void exactlyAtLimit() {
        ConcentrationResult result = check(25);

        assertThat(result.isAcceptable()).isTrue();
        assertThat(result.getResultingPercentage()).isEqualByComparingTo("25");
    }

    @Test
    @DisplayName("Position above the limit is refused")
    void aboveLimit() {
        ConcentrationResult result = check(26);

        assertThat(result.isAcceptable()).isFalse();
        assertThat(result.getResultingPercentage()).isEqualByComparingTo("26");
        assertThat(result.getLimit()).isEqualByComparingTo("25");
    }

    @Test
    @DisplayName("Existing quantity counts toward the resulting position")
    void existingQuantityCounts() {
        fixture.addHolding("port-1", "ins-eq", 20, "90");
        portfolio.setCash(new BigDecimal("8000"));

        // (20 + 6) * 100 / 10000
        ConcentrationResult result = check(6);

        assertThat(result.getResultingPercentage()).isEqualByComparingTo("26");
        assertThat(result.isAcceptable()).isFalse();
    }

    @Test
    @DisplayName("Other holdings widen the denominator")
    void otherHoldingsWidenTotal() {
        fixture.addHolding("port-1", "ins-bond", 100, "100");

        // 40 * 100 / (10000 + 10000)
        ConcentrationResult result = check(40);

        assertThat(result.getResultingPercentage()).isEqualByComparingTo("20");
        assertThat(result.isAcceptable()).isTrue();
    }

    @Test
    @DisplayName("A limit order priced below market is measured at market value")
    void limitBelowMarketUsesMarketForPosition() {
        // cost 20 * 90 = 1800, position 20 * 100 = 2000, total 10000 - 1800 + 2000 = 10200
        ConcentrationResult result =
                concentrationChecker.check(portfolio, equity, 20, new BigDecimal("1800"));

        assertThat(result.getResultingPercentage().doubleValue()).isCloseTo(19.6078, within(0.001));
    }
}
