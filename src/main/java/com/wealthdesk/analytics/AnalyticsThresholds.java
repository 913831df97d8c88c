package com.wealthdesk.analytics;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Thresholds for drift evaluation and next-best-action generation. All percentages
 * are of total portfolio value except the drift values, which are drift percentages.
 */
@Value
@Builder
public class AnalyticsThresholds {

    /** Drift above this triggers a rebalance. */
    @Builder.Default
    BigDecimal driftThresholdPercent = new BigDecimal("8");

    /** Drift above this makes the rebalance action HIGH priority. */
    @Builder.Default
    BigDecimal highDriftPercent = new BigDecimal("15");

    @Builder.Default
    BigDecimal excessCashPercent = new BigDecimal("10");

    /** Cash above this makes the invest-cash action MEDIUM priority instead of LOW. */
    @Builder.Default
    BigDecimal highCashPercent = new BigDecimal("15");

    @Builder.Default
    BigDecimal holdingConcentrationPercent = new BigDecimal("40");

    @Builder.Default
    int riskProfileStaleDays = 180;
}
