package com.wealthdesk.risk;

import java.util.Optional;
import lombok.Getter;

/**
 * Result of pre-trade validation: approved, or rejected with the first violation.
 * Checks short-circuit, so at most one violation is ever reported.
 */
@Getter
public class RiskValidationResult {

    private static final RiskValidationResult APPROVED = new RiskValidationResult(null);

    private final RiskViolation violation;

    private RiskValidationResult(RiskViolation violation) {
        this.violation = violation;
    }

    public static RiskValidationResult approved() {
        return APPROVED;
    }

    public static RiskValidationResult rejected(RiskViolation violation) {
        return new RiskValidationResult(violation);
    }

    public boolean isApproved() {
        return violation == null;
    }

    public boolean isRejected() {
        return violation != null;
    }

    public Optional<RiskViolation> getViolationIfAny() {
        return Optional.ofNullable(violation);
    }
}
