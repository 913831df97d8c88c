package com.wealthdesk.risk;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HoldingsCheckResult {

    boolean sufficient;
    int heldQuantity;
    int requestedQuantity;
}
