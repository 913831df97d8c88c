package com.wealthdesk.risk;

import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.RiskProfile;
import org.springframework.stereotype.Component;

/**
 * Compares an instrument's risk requirement with a client's risk score.
 *
 * <p>The requirement is the instrument's own rating, or its asset class default
 * when unrated. An instrument with a {@code maxRiskScore} is also unsuitable for
 * clients scoring above it. Applies to buys and sells alike and has no side effects.
 */
@Component
public class SuitabilityChecker {

    public SuitabilityResult check(Instrument instrument, RiskProfile riskProfile) {
        int required = instrument.getRequiredRiskScore();
        int score = riskProfile.getScore();

        if (score < required) {
            return SuitabilityResult.builder()
                    .suitable(false)
                    .reason(String.format(
                            "%s requires a risk score of at least %d, client score is %d",
                            instrument.getSymbol(), required, score))
                    .requiredScore(required)
                    .clientScore(score)
                    .build();
        }

        Integer maxScore = instrument.getMaxRiskScore();
        if (maxScore != null && score > maxScore) {
            return SuitabilityResult.builder()
                    .suitable(false)
                    .reason(String.format(
                            "%s is only suitable up to a risk score of %d, client score is %d",
                            instrument.getSymbol(), maxScore, score))
                    .requiredScore(required)
                    .clientScore(score)
                    .build();
        }

        return SuitabilityResult.builder()
                .suitable(true)
                .requiredScore(required)
                .clientScore(score)
                .build();
    }
}
