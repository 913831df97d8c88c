package com.wealthdesk.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConcentrationResult {

    boolean acceptable;
    BigDecimal resultingPercentage;
    BigDecimal limit;
}
