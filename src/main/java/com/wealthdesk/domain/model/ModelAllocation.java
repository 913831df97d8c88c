package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.AssetClass;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Target weight of one asset class inside a model portfolio, in percent. */
@Value
@Builder
public class ModelAllocation {

    AssetClass assetClass;
    BigDecimal targetPercentage;
}
