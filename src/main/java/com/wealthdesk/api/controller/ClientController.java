package com.wealthdesk.api.controller;

import com.wealthdesk.analytics.RecommendationService;
import com.wealthdesk.api.dto.request.RiskProfileUpdateRequest;
import com.wealthdesk.domain.model.AuditEvent;
import com.wealthdesk.domain.model.NextBestAction;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.service.AuditService;
import com.wealthdesk.service.ClientProfileService;
import com.wealthdesk.service.PortfolioService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Client-level endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/clients/{clientId}/risk-profile}</li>
 *   <li>{@code PUT /api/clients/{clientId}/risk-profile} -- record a new questionnaire result</li>
 *   <li>{@code GET /api/clients/{clientId}/portfolios}</li>
 *   <li>{@code GET /api/clients/{clientId}/recommendations} -- next best actions</li>
 *   <li>{@code GET /api/clients/{clientId}/audit-events} -- audit trail, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/clients/{clientId}")
public class ClientController {

    private final ClientProfileService clientProfileService;
    private final PortfolioService portfolioService;
    private final RecommendationService recommendationService;
    private final AuditService auditService;

    public ClientController(
            ClientProfileService clientProfileService,
            PortfolioService portfolioService,
            RecommendationService recommendationService,
            AuditService auditService) {
        this.clientProfileService = clientProfileService;
        this.portfolioService = portfolioService;
        this.recommendationService = recommendationService;
        this.auditService = auditService;
    }

    @GetMapping("/risk-profile")
    public RiskProfile getRiskProfile(@PathVariable String clientId) {
        return clientProfileService.getRiskProfile(clientId);
    }

    @PutMapping("/risk-profile")
    public RiskProfile updateRiskProfile(
            @PathVariable String clientId, @RequestBody @Valid RiskProfileUpdateRequest request) {
        String actor = request.getUpdatedBy() != null ? request.getUpdatedBy() : clientId;
        return clientProfileService.updateRiskProfile(
                clientId, request.getScore(), request.getQuestionnaireVersion(), actor);
    }

    @GetMapping("/portfolios")
    public List<Portfolio> getPortfolios(@PathVariable String clientId) {
        return portfolioService.getPortfoliosForClient(clientId);
    }

    @GetMapping("/recommendations")
    public List<NextBestAction> getRecommendations(@PathVariable String clientId) {
        return recommendationService.generate(clientId);
    }

    @GetMapping("/audit-events")
    public List<AuditEvent> getAuditEvents(@PathVariable String clientId) {
        return auditService.findByClient(clientId);
    }
}
