package com.wealthdesk.risk;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SuitabilityResult {

    boolean suitable;
    String reason;
    int requiredScore;
    int clientScore;
}
