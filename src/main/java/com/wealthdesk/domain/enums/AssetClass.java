package com.wealthdesk.domain.enums;

/**
 * Asset class of a tradable instrument and bucket key for allocation and model targets.
 *
 * <p>Declaration order is the display order of allocation breakdowns.
 */
public enum AssetClass {
    EQUITY(5),
    FIXED_INCOME(1),
    CASH(0),
    ALTERNATIVE(7),
    REAL_ESTATE(6);

    private final int defaultMinRiskScore;

    AssetClass(int defaultMinRiskScore) {
        this.defaultMinRiskScore = defaultMinRiskScore;
    }

    /** Minimum client risk score required when an instrument carries no explicit rating. */
    public int getDefaultMinRiskScore() {
        return defaultMinRiskScore;
    }
}
