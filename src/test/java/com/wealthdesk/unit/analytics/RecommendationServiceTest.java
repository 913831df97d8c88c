package com.wealthdesk.unit.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.wealthdesk.domain.enums.ActionPriority;
import com.wealthdesk.domain.enums.ActionType;
import com.wealthdesk.domain.enums.AssetClass;
import com.wealthdesk.domain.enums.RiskCategory;
import com.wealthdesk.domain.model.NextBestAction;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.support.EngineFixture;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RecommendationService. The client scores 6 (Growth, 75/15/5/5) and
 * every instrument is priced at 100 so quantities read as hundreds of dollars.
 */
class RecommendationServiceTest {

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.loadStandardModels();
        fixture.addInstrument("ins-eq1", "EQA", AssetClass.EQUITY, "100", 5);
        fixture.addInstrument("ins-eq2", "EQB", AssetClass.EQUITY, "100", 5);
        fixture.addInstrument("ins-bond", "BND", AssetClass.FIXED_INCOME, "100", 1);
        fixture.addInstrument("ins-alt", "ALT", AssetClass.ALTERNATIVE, "100", 6);
    }

    private List<NextBestAction> generate() {
        return fixture.recommendationService.generate("cli-1");
    }

    @Test
    @DisplayName("A portfolio on target with a fresh profile needs nothing")
    void onTargetNeedsNothing() {
        fixture.addClient("cli-1", 6, "port-1", "500");
        fixture.addHolding("port-1", "ins-eq1", 40, "100");
        fixture.addHolding("port-1", "ins-eq2", 35, "100");
        fixture.addHolding("port-1", "ins-bond", 15, "100");
        fixture.addHolding("port-1", "ins-alt", 5, "100");

        assertThat(generate()).isEmpty();
    }

    @Test
    @DisplayName("Moderate drift and some idle cash give MEDIUM rebalance and LOW invest-cash")
    void moderateDriftAndCash() {
        // cash 12%, equity 63%, fixed income 15%, alternative 10%: drift (12 + 7 + 5) / 2 = 12
        fixture.addClient("cli-1", 6, "port-1", "1200");
        fixture.addHolding("port-1", "ins-eq1", 35, "100");
        fixture.addHolding("port-1", "ins-eq2", 28, "100");
        fixture.addHolding("port-1", "ins-bond", 15, "100");
        fixture.addHolding("port-1", "ins-alt", 10, "100");

        List<NextBestAction> actions = generate();

        assertThat(actions)
                .extracting(NextBestAction::getType, NextBestAction::getPriority)
                .containsExactly(
                        tuple(ActionType.REBALANCE_PORTFOLIO, ActionPriority.MEDIUM),
                        tuple(ActionType.INVEST_CASH, ActionPriority.LOW));
        assertThat(actions.get(0).getDescription())
                .isEqualTo("Portfolio has drifted 12.0% from target Growth model allocation.");
        assertThat(actions.get(0).getMetadata()).containsEntry("modelId", "mp-4");
        assertThat(actions.get(1).getDescription()).startsWith("12.0% of portfolio is in cash.");
    }

    @Test
    @DisplayName("Heavy drift, heavy cash and a dominant holding are all flagged")
    void everythingFlagged() {
        // cash 50%, one equity position 50%
        fixture.addClient("cli-1", 6, "port-1", "5000");
        fixture.addHolding("port-1", "ins-eq1", 50, "80");

        List<NextBestAction> actions = generate();

        assertThat(actions)
                .extracting(NextBestAction::getType)
                .containsExactly(
                        ActionType.REBALANCE_PORTFOLIO, ActionType.INVEST_CASH, ActionType.REDUCE_CONCENTRATION);
        assertThat(actions).extracting(NextBestAction::getPriority)
                .containsExactly(ActionPriority.HIGH, ActionPriority.MEDIUM, ActionPriority.HIGH);
        assertThat(actions.get(2).getDescription())
                .isEqualTo("EQA represents 50.0% of portfolio, exceeding 40% threshold.");
        assertThat(actions.get(2).getMetadata()).containsEntry("instrumentId", "ins-eq1");
    }

    @Nested
    @DisplayName("Risk profile age")
    class ProfileAge {

        private void profileUpdated(LocalDateTime at) {
            fixture.riskProfileRepository.save(RiskProfile.builder()
                    .clientId("cli-1")
                    .score(6)
                    .category(RiskCategory.GROWTH)
                    .lastUpdated(at)
                    .build());
        }

        @Test
        @DisplayName("A profile older than 180 days asks for a refresh")
        void staleProfile() {
            profileUpdated(LocalDateTime.now(fixture.clock).minusDays(200));

            List<NextBestAction> actions = generate();

            assertThat(actions).hasSize(1);
            assertThat(actions.get(0).getType()).isEqualTo(ActionType.REFRESH_RISK_PROFILE);
            assertThat(actions.get(0).getPriority()).isEqualTo(ActionPriority.HIGH);
            assertThat(actions.get(0).getDescription()).isEqualTo("Risk profile is 200 days old. Consider updating.");
        }

        @Test
        @DisplayName("A profile exactly 180 days old is still current")
        void boundaryProfile() {
            profileUpdated(LocalDateTime.now(fixture.clock).minusDays(180));

            assertThat(generate()).isEmpty();
        }

        @Test
        @DisplayName("Half a day past 180 days is stale and reported in whole days")
        void partialDayPastThreshold() {
            profileUpdated(LocalDateTime.now(fixture.clock).minusDays(180).minusHours(12));

            List<NextBestAction> actions = generate();

            assertThat(actions).extracting(NextBestAction::getType).containsExactly(ActionType.REFRESH_RISK_PROFILE);
            assertThat(actions.get(0).getDescription()).isEqualTo("Risk profile is 180 days old. Consider updating.");
        }
    }

    @Test
    @DisplayName("Action ids are stable across calls")
    void idsAreStable() {
        fixture.addClient("cli-1", 6, "port-1", "5000");
        fixture.addHolding("port-1", "ins-eq1", 50, "80");

        assertThat(generate()).extracting(NextBestAction::getId)
                .containsExactlyElementsOf(generate().stream().map(NextBestAction::getId).toList());
    }

    @Test
    @DisplayName("A portfolio worth nothing yields no cash or concentration actions")
    void emptyPortfolio() {
        fixture.addClient("cli-1", 6, "port-1", "0");

        assertThat(generate())
                .extracting(NextBestAction::getType)
                .doesNotContain(ActionType.INVEST_CASH, ActionType.REDUCE_CONCENTRATION);
    }

    @Test
    @DisplayName("Unknown client is reported as not found")
    void unknownClient() {
        assertThatThrownBy(() -> fixture.recommendationService.generate("cli-x"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
