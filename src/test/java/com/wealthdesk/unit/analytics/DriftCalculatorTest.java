package com.wealthdesk.unit.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.wealthdesk.analytics.AnalyticsThresholds;
import com.wealthdesk.analytics.DriftCalculator;
import com.wealthdesk.domain.enums.AssetClass;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DriftCalculatorTest {

    private final DriftCalculator driftCalculator =
            new DriftCalculator(AnalyticsThresholds.builder().build());

    private static Map<AssetClass, BigDecimal> allocation(String equity, String fixedIncome, String cash, String alt) {
        Map<AssetClass, BigDecimal> map = new EnumMap<>(AssetClass.class);
        map.put(AssetClass.EQUITY, new BigDecimal(equity));
        map.put(AssetClass.FIXED_INCOME, new BigDecimal(fixedIncome));
        map.put(AssetClass.CASH, new BigDecimal(cash));
        map.put(AssetClass.ALTERNATIVE, new BigDecimal(alt));
        return map;
    }

    @Test
    @DisplayName("Identical allocations have zero drift")
    void identicalIsZero() {
        Map<AssetClass, BigDecimal> growth = allocation("75", "15", "5", "5");

        assertThat(driftCalculator.calculate(growth, growth)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Drift is half the sum of absolute differences")
    void halvedSumOfDifferences() {
        // |50-75| + |30-15| + |20-5| + |0-5| = 60
        assertThat(driftCalculator.calculate(allocation("50", "30", "20", "0"), allocation("75", "15", "5", "5")))
                .isEqualByComparingTo("30");
    }

    @Test
    @DisplayName("Drift is symmetric")
    void symmetric() {
        Map<AssetClass, BigDecimal> a = allocation("62.5", "20", "12.5", "5");
        Map<AssetClass, BigDecimal> b = allocation("40", "50", "5", "5");

        assertThat(driftCalculator.calculate(a, b)).isEqualByComparingTo(driftCalculator.calculate(b, a));
    }

    @Test
    @DisplayName("A class missing on one side counts as zero")
    void missingClassCountsAsZero() {
        Map<AssetClass, BigDecimal> allCash = new EnumMap<>(AssetClass.class);
        allCash.put(AssetClass.CASH, new BigDecimal("100"));

        // |0-90| + |0-5| + |100-2| + |0-3| = 196
        assertThat(driftCalculator.calculate(allCash, allocation("90", "5", "2", "3")))
                .isEqualByComparingTo("98");
    }

    @Test
    @DisplayName("Rebalancing is needed only strictly above the threshold")
    void rebalanceThreshold() {
        assertThat(driftCalculator.getThreshold()).isEqualByComparingTo("8");
        assertThat(driftCalculator.isRebalanceNeeded(new BigDecimal("8"))).isFalse();
        assertThat(driftCalculator.isRebalanceNeeded(new BigDecimal("8.01"))).isTrue();
    }
}
