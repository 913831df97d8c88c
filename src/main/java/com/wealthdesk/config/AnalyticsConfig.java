package com.wealthdesk.config;

import com.wealthdesk.analytics.AnalyticsThresholds;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides {@link AnalyticsThresholds} from {@code wealthdesk.analytics.*} and
 * {@code wealthdesk.recommendations.*}.
 */
@Configuration
public class AnalyticsConfig {

    @Bean
    public AnalyticsThresholds analyticsThresholds(
            @Value("${wealthdesk.analytics.drift-threshold-percent:8}") BigDecimal driftThresholdPercent,
            @Value("${wealthdesk.recommendations.high-drift-percent:15}") BigDecimal highDriftPercent,
            @Value("${wealthdesk.recommendations.excess-cash-percent:10}") BigDecimal excessCashPercent,
            @Value("${wealthdesk.recommendations.high-cash-percent:15}") BigDecimal highCashPercent,
            @Value("${wealthdesk.recommendations.holding-concentration-percent:40}")
                    BigDecimal holdingConcentrationPercent,
            @Value("${wealthdesk.recommendations.risk-profile-stale-days:180}") int riskProfileStaleDays) {
        return AnalyticsThresholds.builder()
                .driftThresholdPercent(driftThresholdPercent)
                .highDriftPercent(highDriftPercent)
                .excessCashPercent(excessCashPercent)
                .highCashPercent(highCashPercent)
                .holdingConcentrationPercent(holdingConcentrationPercent)
                .riskProfileStaleDays(riskProfileStaleDays)
                .build();
    }
}
