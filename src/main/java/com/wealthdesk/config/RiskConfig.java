package com.wealthdesk.config;

import com.wealthdesk.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.yml.
 *
 * <p>Properties prefix: {@code wealthdesk.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${wealthdesk.risk.concentration-limit-percent:25}") BigDecimal concentrationLimitPercent) {
        if (concentrationLimitPercent.signum() <= 0 || concentrationLimitPercent.compareTo(new BigDecimal("100")) > 0) {
            throw new IllegalStateException(
                    "wealthdesk.risk.concentration-limit-percent must be in (0, 100], got " + concentrationLimitPercent);
        }
        return RiskLimits.builder()
                .concentrationLimitPercent(concentrationLimitPercent)
                .build();
    }
}
