package com.wealthdesk.seed;

import com.wealthdesk.domain.enums.AssetClass;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/** JSON shape of {@code seed/wealthdesk-seed.json}. */
@Data
@NoArgsConstructor
public class SeedData {

    private List<InstrumentSeed> instruments = new ArrayList<>();
    private List<ModelPortfolioSeed> modelPortfolios = new ArrayList<>();
    private List<ClientSeed> clients = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class InstrumentSeed {
        private String id;
        private String symbol;
        private String name;
        private AssetClass assetClass;
        private BigDecimal currentPrice;
        private Integer riskRating;
        private Integer maxRiskScore;
        private String description;
    }

    @Data
    @NoArgsConstructor
    public static class ModelPortfolioSeed {
        private String id;
        private String name;
        private String description;
        private int minRiskScore;
        private int maxRiskScore;
        private List<AllocationSeed> allocations = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class AllocationSeed {
        private AssetClass assetClass;
        private BigDecimal targetPercentage;
    }

    @Data
    @NoArgsConstructor
    public static class ClientSeed {
        private String clientId;
        private int riskScore;
        private LocalDate riskProfileUpdated;
        private String questionnaireVersion;
        private List<PortfolioSeed> portfolios = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class PortfolioSeed {
        private String id;
        private BigDecimal cash;
        private String baseCurrency = "USD";
        private List<HoldingSeed> holdings = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class HoldingSeed {
        private String instrumentId;
        private int quantity;
        private BigDecimal averageCost;
    }
}
