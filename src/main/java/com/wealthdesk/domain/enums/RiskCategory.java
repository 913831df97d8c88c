package com.wealthdesk.domain.enums;

/** Questionnaire-derived label for a client's risk score. */
public enum RiskCategory {
    CONSERVATIVE,
    MODERATE,
    BALANCED,
    GROWTH,
    AGGRESSIVE;

    /** Category for a score in 0..10: 0-3, 4, 5, 6-7, 8-10. */
    public static RiskCategory forScore(int score) {
        if (score <= 3) {
            return CONSERVATIVE;
        }
        if (score == 4) {
            return MODERATE;
        }
        if (score == 5) {
            return BALANCED;
        }
        return score <= 7 ? GROWTH : AGGRESSIVE;
    }
}
