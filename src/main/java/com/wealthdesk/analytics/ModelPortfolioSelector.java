package com.wealthdesk.analytics;

import com.wealthdesk.domain.model.ModelPortfolio;
import com.wealthdesk.domain.model.RiskProfile;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Maps a risk score to the model portfolio whose band contains it.
 *
 * <p>A valid model set partitions the scores 0..10: every score falls in exactly
 * one band, and each model's targets add up to 100% within {@link #ALLOCATION_TOLERANCE}.
 */
@Component
public class ModelPortfolioSelector {

    public static final BigDecimal ALLOCATION_TOLERANCE = new BigDecimal("0.01");

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public Optional<ModelPortfolio> select(int riskScore, List<ModelPortfolio> models) {
        return models.stream().filter(m -> m.coversScore(riskScore)).findFirst();
    }

    /**
     * Lists every problem with a model set. An empty list means the set is usable.
     */
    public List<String> validateBands(List<ModelPortfolio> models) {
        List<String> problems = new ArrayList<>();

        for (ModelPortfolio model : models) {
            if (model.getMinRiskScore() > model.getMaxRiskScore()) {
                problems.add(String.format(
                        "Model %s has an empty band [%d, %d]",
                        model.getId(), model.getMinRiskScore(), model.getMaxRiskScore()));
            }
            if (model.getMinRiskScore() < RiskProfile.MIN_SCORE || model.getMaxRiskScore() > RiskProfile.MAX_SCORE) {
                problems.add(String.format(
                        "Model %s band [%d, %d] is outside %d..%d",
                        model.getId(),
                        model.getMinRiskScore(),
                        model.getMaxRiskScore(),
                        RiskProfile.MIN_SCORE,
                        RiskProfile.MAX_SCORE));
            }
            BigDecimal total = model.getTotalTargetPercentage();
            if (total.subtract(HUNDRED).abs().compareTo(ALLOCATION_TOLERANCE) > 0) {
                problems.add(String.format("Model %s allocations sum to %s, expected 100", model.getId(), total));
            }
        }

        for (int score = RiskProfile.MIN_SCORE; score <= RiskProfile.MAX_SCORE; score++) {
            int s = score;
            List<ModelPortfolio> covering =
                    models.stream().filter(m -> m.coversScore(s)).toList();
            if (covering.isEmpty()) {
                problems.add("No model covers risk score " + score);
            } else if (covering.size() > 1) {
                problems.add(String.format(
                        "Risk score %d is covered by %s",
                        score,
                        covering.stream().map(ModelPortfolio::getId).collect(Collectors.joining(", "))));
            }
        }

        return problems;
    }
}
