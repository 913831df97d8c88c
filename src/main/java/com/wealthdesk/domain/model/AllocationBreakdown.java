package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.AssetClass;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Market value of one asset class and its share of the portfolio in percent. */
@Value
@Builder
public class AllocationBreakdown {

    AssetClass assetClass;
    BigDecimal value;
    BigDecimal percentage;
}
