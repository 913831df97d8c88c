package com.wealthdesk.analytics;

import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.domain.enums.AssetClass;
import com.wealthdesk.domain.model.AllocationBreakdown;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.Instrument;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups a portfolio's market value by asset class.
 *
 * <p>Each holding contributes {@code quantity * currentPrice} to its instrument's asset
 * class; uninvested cash is added to the CASH bucket. Percentages are of the sum of
 * all buckets, computed with {@link MathContext#DECIMAL64}, and the result is in
 * asset class declaration order. A portfolio worth nothing has no breakdown at all.
 */
@Component
public class AllocationCalculator {

    private static final Logger log = LoggerFactory.getLogger(AllocationCalculator.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final InstrumentCatalog instrumentCatalog;

    public AllocationCalculator(InstrumentCatalog instrumentCatalog) {
        this.instrumentCatalog = instrumentCatalog;
    }

    public List<AllocationBreakdown> calculate(BigDecimal cash, List<Holding> holdings) {
        Map<AssetClass, BigDecimal> valueByClass = new EnumMap<>(AssetClass.class);

        for (Holding holding : holdings) {
            Instrument instrument = instrumentCatalog.find(holding.getInstrumentId()).orElse(null);
            if (instrument == null) {
                log.warn("Skipping holding with unknown instrument {}", holding.getInstrumentId());
                continue;
            }
            valueByClass.merge(
                    instrument.getAssetClass(), holding.marketValue(instrument.getCurrentPrice()), BigDecimal::add);
        }

        if (cash != null && cash.signum() > 0) {
            valueByClass.merge(AssetClass.CASH, cash, BigDecimal::add);
        }

        BigDecimal total = valueByClass.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() <= 0) {
            return List.of();
        }

        List<AllocationBreakdown> breakdown = new ArrayList<>(valueByClass.size());
        valueByClass.forEach((assetClass, value) -> breakdown.add(AllocationBreakdown.builder()
                .assetClass(assetClass)
                .value(value)
                .percentage(value.multiply(HUNDRED).divide(total, MathContext.DECIMAL64))
                .build()));
        return breakdown;
    }

    /** Percentage per asset class, for drift comparison against model targets. */
    public static Map<AssetClass, BigDecimal> toPercentages(List<AllocationBreakdown> breakdown) {
        Map<AssetClass, BigDecimal> percentages = new EnumMap<>(AssetClass.class);
        for (AllocationBreakdown entry : breakdown) {
            percentages.put(entry.getAssetClass(), entry.getPercentage());
        }
        return percentages;
    }
}
