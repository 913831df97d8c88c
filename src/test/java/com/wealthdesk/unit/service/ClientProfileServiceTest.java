package com.wealthdesk.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wealthdesk.domain.enums.AuditEventType;
import com.wealthdesk.domain.enums.RiskCategory;
import com.wealthdesk.domain.model.AuditEvent;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.exception.BusinessException;
import com.wealthdesk.exception.ErrorCode;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.service.ClientProfileService;
import com.wealthdesk.support.EngineFixture;
import java.time.Duration;
import java.time.LocalDateTime;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ClientProfileService: profile updates, the audit trail they
 * leave, and model recommendation changes.
 */
class ClientProfileServiceTest {

    private EngineFixture fixture;
    private ClientProfileService clientProfileService;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.loadStandardModels();
        fixture.addClient("cli-1", 6, "port-1", "1000");
        clientProfileService = new ClientProfileService(
                fixture.riskProfileRepository,
                fixture.modelPortfolioRepository,
                fixture.modelPortfolioSelector,
                fixture.auditService,
                fixture.clock);
    }

    @Nested
    @DisplayName("Updates")
    class Updates {

        @Test
        @DisplayName("Stores the new score, its category and the update time")
        void storesNewProfile() {
            fixture.clock.advance(Duration.ofDays(3));

            RiskProfile updated = clientProfileService.updateRiskProfile("cli-1", 2, "3.0", "adv-1");

            assertThat(updated.getCategory()).isEqualTo(RiskCategory.CONSERVATIVE);
            RiskProfile stored = clientProfileService.getRiskProfile("cli-1");
            assertThat(stored.getScore()).isEqualTo(2);
            assertThat(stored.getQuestionnaireVersion()).isEqualTo("3.0");
            assertThat(stored.getLastUpdated()).isEqualTo(LocalDateTime.now(fixture.clock));
        }

        @Test
        @DisplayName("A score inside the same band audits the update only")
        void sameBandAuditsOnce() {
            clientProfileService.updateRiskProfile("cli-1", 7, "2.1", "cli-1");

            assertThat(fixture.auditService.findByType(AuditEventType.RISK_PROFILE_UPDATED))
                    .singleElement()
                    .satisfies(event -> {
                        assertThat(event.getActor()).isEqualTo("cli-1");
                        assertThat(event.getDetails())
                                .containsEntry("previousScore", 6)
                                .containsEntry("newScore", 7)
                                .containsEntry("category", "GROWTH");
                    });
            assertThat(fixture.auditService.findByType(AuditEventType.MODEL_RECOMMENDATION_CHANGED))
                    .isEmpty();
        }

        @Test
        @DisplayName("Crossing into another band audits the model change")
        void bandChangeAuditsModelChange() {
            clientProfileService.updateRiskProfile("cli-1", 9, "2.1", "adv-7");

            assertThat(fixture.auditService.findByType(AuditEventType.MODEL_RECOMMENDATION_CHANGED))
                    .singleElement()
                    .extracting(AuditEvent::getDetails, InstanceOfAssertFactories.MAP)
                    .containsEntry("previousModelId", "mp-4")
                    .containsEntry("newModelId", "mp-5");
            assertThat(fixture.auditService.findByClient("cli-1")).hasSize(2);
        }

        @Test
        @DisplayName("A first profile counts as a model change from none")
        void firstProfileAuditsModelChange() {
            clientProfileService.updateRiskProfile("cli-new", 5, "2.1", "adv-1");

            assertThat(fixture.auditService.findByType(AuditEventType.MODEL_RECOMMENDATION_CHANGED))
                    .singleElement()
                    .extracting(AuditEvent::getDetails, InstanceOfAssertFactories.MAP)
                    .containsEntry("previousModelId", null)
                    .containsEntry("newModelId", "mp-3");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Scores outside 0..10 are refused without touching the profile")
        void outOfRangeRefused() {
            assertThatThrownBy(() -> clientProfileService.updateRiskProfile("cli-1", 11, "2.1", "adv-1"))
                    .isInstanceOf(BusinessException.class)
                    .hasMessage("Risk score must be between 0 and 10, got 11")
                    .satisfies(ex -> assertThat(((BusinessException) ex).getErrorCode())
                            .isEqualTo(ErrorCode.VALIDATION_ERROR));

            assertThat(clientProfileService.getRiskProfile("cli-1").getScore()).isEqualTo(6);
            assertThat(fixture.auditRows).isEmpty();
        }

        @Test
        @DisplayName("Unknown clients have no profile")
        void unknownClient() {
            assertThatThrownBy(() -> clientProfileService.getRiskProfile("nobody"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("RiskProfile not found with identifier: nobody");
        }
    }
}
