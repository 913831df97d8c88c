package com.wealthdesk.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Drift of a portfolio's allocation from the model selected for a risk score. */
@Value
@Builder
public class PortfolioDrift {

    String portfolioId;
    int riskScore;
    String modelId;
    String modelName;
    BigDecimal driftPercentage;
    BigDecimal threshold;
    boolean rebalanceNeeded;
}
