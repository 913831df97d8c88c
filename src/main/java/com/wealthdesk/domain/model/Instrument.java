package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.AssetClass;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * A tradable instrument in the catalog.
 *
 * <p>All fields are fixed at load time except {@code currentPrice}, which is refreshed
 * by an external price feed and read concurrently by validation and execution.
 *
 * <p>{@code riskRating} is the minimum client risk score required to hold the instrument.
 * When absent the asset class default applies (see {@link AssetClass#getDefaultMinRiskScore()}).
 * {@code maxRiskScore} is an optional upper bound for instruments that are unsuitable
 * for aggressive profiles.
 */
@Getter
@Builder
public class Instrument {

    private final String id;
    private final String symbol;
    private final String name;
    private final AssetClass assetClass;
    private final Integer riskRating;
    private final Integer maxRiskScore;
    private final String description;

    private volatile BigDecimal currentPrice;

    /** Minimum risk score a client needs to buy or sell this instrument. */
    public int getRequiredRiskScore() {
        return riskRating != null ? riskRating : assetClass.getDefaultMinRiskScore();
    }

    public void updatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Instrument price must be >= 0, got " + price);
        }
        this.currentPrice = price;
    }
}
