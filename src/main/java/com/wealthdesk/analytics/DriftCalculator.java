package com.wealthdesk.analytics;

import com.wealthdesk.domain.enums.AssetClass;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Total drift between two allocations, in percentage points:
 * {@code sum over classes of |current - target| / 2}, a class missing on either side
 * counting as 0%.
 *
 * <p>For allocations that each sum to 100 the result lies in [0, 100]. The measure is
 * symmetric and zero for identical allocations.
 */
@Component
public class DriftCalculator {

    private static final BigDecimal TWO = new BigDecimal("2");

    private final AnalyticsThresholds analyticsThresholds;

    public DriftCalculator(AnalyticsThresholds analyticsThresholds) {
        this.analyticsThresholds = analyticsThresholds;
    }

    public BigDecimal calculate(Map<AssetClass, BigDecimal> current, Map<AssetClass, BigDecimal> target) {
        Set<AssetClass> classes = EnumSet.noneOf(AssetClass.class);
        classes.addAll(current.keySet());
        classes.addAll(target.keySet());

        BigDecimal sum = BigDecimal.ZERO;
        for (AssetClass assetClass : classes) {
            BigDecimal c = current.getOrDefault(assetClass, BigDecimal.ZERO);
            BigDecimal t = target.getOrDefault(assetClass, BigDecimal.ZERO);
            sum = sum.add(c.subtract(t).abs());
        }
        return sum.divide(TWO);
    }

    public boolean isRebalanceNeeded(BigDecimal drift) {
        return drift.compareTo(analyticsThresholds.getDriftThresholdPercent()) > 0;
    }

    public BigDecimal getThreshold() {
        return analyticsThresholds.getDriftThresholdPercent();
    }
}
