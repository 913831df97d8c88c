package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.RiskCategory;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** A client's current risk profile. Score ranges 0 (most conservative) to 10. */
@Value
@Builder
public class RiskProfile {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;

    String clientId;
    int score;
    RiskCategory category;
    LocalDateTime lastUpdated;
    String questionnaireVersion;

    public static boolean isValidScore(int score) {
        return score >= MIN_SCORE && score <= MAX_SCORE;
    }
}
