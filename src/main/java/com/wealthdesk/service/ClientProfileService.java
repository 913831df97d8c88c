package com.wealthdesk.service;

import com.wealthdesk.analytics.ModelPortfolioSelector;
import com.wealthdesk.domain.enums.AuditEventType;
import com.wealthdesk.domain.enums.RiskCategory;
import com.wealthdesk.domain.model.ModelPortfolio;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.exception.BusinessException;
import com.wealthdesk.exception.ErrorCode;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.repository.memory.ModelPortfolioMemoryRepository;
import com.wealthdesk.repository.memory.RiskProfileMemoryRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maintains client risk profiles.
 *
 * <p>Every update is audited as RISK_PROFILE_UPDATED. When the new score maps to a
 * different model portfolio than the old one, a MODEL_RECOMMENDATION_CHANGED event is
 * audited as well.
 */
@Service
public class ClientProfileService {

    private static final Logger log = LoggerFactory.getLogger(ClientProfileService.class);

    private final RiskProfileMemoryRepository riskProfileMemoryRepository;
    private final ModelPortfolioMemoryRepository modelPortfolioMemoryRepository;
    private final ModelPortfolioSelector modelPortfolioSelector;
    private final AuditService auditService;
    private final Clock clock;

    public ClientProfileService(
            RiskProfileMemoryRepository riskProfileMemoryRepository,
            ModelPortfolioMemoryRepository modelPortfolioMemoryRepository,
            ModelPortfolioSelector modelPortfolioSelector,
            AuditService auditService,
            Clock clock) {
        this.riskProfileMemoryRepository = riskProfileMemoryRepository;
        this.modelPortfolioMemoryRepository = modelPortfolioMemoryRepository;
        this.modelPortfolioSelector = modelPortfolioSelector;
        this.auditService = auditService;
        this.clock = clock;
    }

    public RiskProfile getRiskProfile(String clientId) {
        return riskProfileMemoryRepository
                .findByClientId(clientId)
                .orElseThrow(() -> new ResourceNotFoundException("RiskProfile", clientId));
    }

    public RiskProfile updateRiskProfile(String clientId, int score, String questionnaireVersion, String actor) {
        if (!RiskProfile.isValidScore(score)) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    String.format(
                            "Risk score must be between %d and %d, got %d",
                            RiskProfile.MIN_SCORE, RiskProfile.MAX_SCORE, score),
                    Map.of("riskScore", score));
        }

        RiskProfile previous = riskProfileMemoryRepository.findByClientId(clientId).orElse(null);
        RiskProfile updated = RiskProfile.builder()
                .clientId(clientId)
                .score(score)
                .category(RiskCategory.forScore(score))
                .lastUpdated(LocalDateTime.now(clock))
                .questionnaireVersion(questionnaireVersion)
                .build();
        riskProfileMemoryRepository.save(updated);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previousScore", previous != null ? previous.getScore() : null);
        details.put("newScore", score);
        details.put("category", updated.getCategory().name());
        details.put("questionnaireVersion", questionnaireVersion);
        auditService.record(AuditEventType.RISK_PROFILE_UPDATED, actor, clientId, details);

        List<ModelPortfolio> models = modelPortfolioMemoryRepository.findAll();
        String previousModel = previous == null
                ? null
                : modelPortfolioSelector.select(previous.getScore(), models).map(ModelPortfolio::getId).orElse(null);
        String newModel = modelPortfolioSelector.select(score, models).map(ModelPortfolio::getId).orElse(null);
        if (!Objects.equals(previousModel, newModel)) {
            Map<String, Object> modelDetails = new LinkedHashMap<>();
            modelDetails.put("previousModelId", previousModel);
            modelDetails.put("newModelId", newModel);
            auditService.record(AuditEventType.MODEL_RECOMMENDATION_CHANGED, actor, clientId, modelDetails);
            log.info("Model recommendation for client {} changed: {} -> {}", clientId, previousModel, newModel);
        }

        log.info("Risk profile updated for client {}: score {} ({})", clientId, score, updated.getCategory());
        return updated;
    }
}
