package com.wealthdesk.risk;

import com.wealthdesk.domain.enums.RejectionCode;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * A single pre-trade rule failure: machine-readable code, human-readable message and
 * the numbers behind the decision.
 */
@Getter
@Builder
public class RiskViolation {

    private final RejectionCode code;
    private final String message;

    @Builder.Default
    private final Map<String, Object> details = Map.of();

    public static RiskViolation of(RejectionCode code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    public static RiskViolation of(RejectionCode code, String message, Map<String, Object> details) {
        return RiskViolation.builder().code(code).message(message).details(details).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
