package com.wealthdesk.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Pre-trade limits applied at order submission.
 *
 * <p>Loaded once from {@code wealthdesk.risk.*} by {@link com.wealthdesk.config.RiskConfig}.
 */
@Value
@Builder
public class RiskLimits {

    public static final BigDecimal DEFAULT_CONCENTRATION_LIMIT_PERCENT = new BigDecimal("25");

    /** Maximum post-trade weight of one instrument in a portfolio, in percent. */
    @Builder.Default
    BigDecimal concentrationLimitPercent = DEFAULT_CONCENTRATION_LIMIT_PERCENT;
}
