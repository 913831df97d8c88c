package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.AssetClass;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A named target allocation designed for clients whose risk score lies in
 * [minRiskScore, maxRiskScore] (inclusive).
 */
@Value
@Builder
public class ModelPortfolio {

    String id;
    String name;
    String description;
    int minRiskScore;
    int maxRiskScore;

    @Singular
    List<ModelAllocation> allocations;

    public boolean coversScore(int riskScore) {
        return riskScore >= minRiskScore && riskScore <= maxRiskScore;
    }

    /** Target percentages keyed by asset class; classes without a target are absent. */
    public Map<AssetClass, BigDecimal> getTargetPercentages() {
        Map<AssetClass, BigDecimal> targets = new EnumMap<>(AssetClass.class);
        for (ModelAllocation allocation : allocations) {
            targets.merge(allocation.getAssetClass(), allocation.getTargetPercentage(), BigDecimal::add);
        }
        return targets;
    }

    public BigDecimal getTotalTargetPercentage() {
        return allocations.stream()
                .map(ModelAllocation::getTargetPercentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
