package com.wealthdesk.seed;

import com.wealthdesk.analytics.ModelPortfolioSelector;
import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.domain.enums.RiskCategory;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.ModelAllocation;
import com.wealthdesk.domain.model.ModelPortfolio;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.mapper.JsonHelper;
import com.wealthdesk.repository.memory.HoldingMemoryRepository;
import com.wealthdesk.repository.memory.ModelPortfolioMemoryRepository;
import com.wealthdesk.repository.memory.PortfolioMemoryRepository;
import com.wealthdesk.repository.memory.RiskProfileMemoryRepository;
import java.io.IOException;
import java.io.InputStream;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Loads the instrument catalog, model portfolios and demo clients at startup.
 *
 * <p>Enabled by {@code wealthdesk.seed.enabled=true}. The model set is checked with
 * {@link ModelPortfolioSelector#validateBands} first and startup fails if the bands
 * overlap, leave a gap, or a model's targets do not add up to 100.
 */
@Component
@ConditionalOnProperty(name = "wealthdesk.seed.enabled", havingValue = "true")
public class SeedDataLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SeedDataLoader.class);

    private final Resource seedResource;
    private final InstrumentCatalog instrumentCatalog;
    private final ModelPortfolioSelector modelPortfolioSelector;
    private final ModelPortfolioMemoryRepository modelPortfolioMemoryRepository;
    private final RiskProfileMemoryRepository riskProfileMemoryRepository;
    private final PortfolioMemoryRepository portfolioMemoryRepository;
    private final HoldingMemoryRepository holdingMemoryRepository;
    private final Clock clock;

    public SeedDataLoader(
            @Value("${wealthdesk.seed.location:classpath:seed/wealthdesk-seed.json}") Resource seedResource,
            InstrumentCatalog instrumentCatalog,
            ModelPortfolioSelector modelPortfolioSelector,
            ModelPortfolioMemoryRepository modelPortfolioMemoryRepository,
            RiskProfileMemoryRepository riskProfileMemoryRepository,
            PortfolioMemoryRepository portfolioMemoryRepository,
            HoldingMemoryRepository holdingMemoryRepository,
            Clock clock) {
        this.seedResource = seedResource;
        this.instrumentCatalog = instrumentCatalog;
        this.modelPortfolioSelector = modelPortfolioSelector;
        this.modelPortfolioMemoryRepository = modelPortfolioMemoryRepository;
        this.riskProfileMemoryRepository = riskProfileMemoryRepository;
        this.portfolioMemoryRepository = portfolioMemoryRepository;
        this.holdingMemoryRepository = holdingMemoryRepository;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        SeedData seedData;
        try (InputStream inputStream = seedResource.getInputStream()) {
            seedData = JsonHelper.read(inputStream, SeedData.class);
        }
        load(seedData);
    }

    void load(SeedData seedData) {
        List<ModelPortfolio> models =
                seedData.getModelPortfolios().stream().map(this::toModel).toList();
        List<String> problems = modelPortfolioSelector.validateBands(models);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid model portfolio set: " + String.join("; ", problems));
        }
        modelPortfolioMemoryRepository.replaceAll(models);

        seedData.getInstruments().forEach(seed -> instrumentCatalog.register(toInstrument(seed)));

        LocalDateTime now = LocalDateTime.now(clock);
        int portfolioCount = 0;
        for (SeedData.ClientSeed client : seedData.getClients()) {
            riskProfileMemoryRepository.save(RiskProfile.builder()
                    .clientId(client.getClientId())
                    .score(client.getRiskScore())
                    .category(RiskCategory.forScore(client.getRiskScore()))
                    .lastUpdated(
                            client.getRiskProfileUpdated() != null
                                    ? client.getRiskProfileUpdated().atStartOfDay()
                                    : now)
                    .questionnaireVersion(client.getQuestionnaireVersion())
                    .build());

            for (SeedData.PortfolioSeed portfolioSeed : client.getPortfolios()) {
                loadPortfolio(client.getClientId(), portfolioSeed, now);
                portfolioCount++;
            }
        }

        log.info(
                "Seed data loaded: {} instruments, {} model portfolios, {} clients, {} portfolios",
                seedData.getInstruments().size(),
                models.size(),
                seedData.getClients().size(),
                portfolioCount);
    }

    private void loadPortfolio(String clientId, SeedData.PortfolioSeed seed, LocalDateTime now) {
        portfolioMemoryRepository.save(Portfolio.builder()
                .id(seed.getId())
                .clientId(clientId)
                .baseCurrency(seed.getBaseCurrency())
                .cash(seed.getCash())
                .lastUpdated(now)
                .build());

        for (SeedData.HoldingSeed holding : seed.getHoldings()) {
            if (instrumentCatalog.find(holding.getInstrumentId()).isEmpty()) {
                throw new IllegalStateException(String.format(
                        "Seed holding in portfolio %s references unknown instrument %s",
                        seed.getId(), holding.getInstrumentId()));
            }
            holdingMemoryRepository.save(Holding.builder()
                    .portfolioId(seed.getId())
                    .instrumentId(holding.getInstrumentId())
                    .quantity(holding.getQuantity())
                    .averageCost(holding.getAverageCost().setScale(6, RoundingMode.HALF_UP))
                    .lastUpdated(now)
                    .build());
        }
    }

    private ModelPortfolio toModel(SeedData.ModelPortfolioSeed seed) {
        ModelPortfolio.ModelPortfolioBuilder builder = ModelPortfolio.builder()
                .id(seed.getId())
                .name(seed.getName())
                .description(seed.getDescription())
                .minRiskScore(seed.getMinRiskScore())
                .maxRiskScore(seed.getMaxRiskScore());
        seed.getAllocations()
                .forEach(a -> builder.allocation(ModelAllocation.builder()
                        .assetClass(a.getAssetClass())
                        .targetPercentage(a.getTargetPercentage())
                        .build()));
        return builder.build();
    }

    private static Instrument toInstrument(SeedData.InstrumentSeed seed) {
        return Instrument.builder()
                .id(seed.getId())
                .symbol(seed.getSymbol())
                .name(seed.getName())
                .assetClass(seed.getAssetClass())
                .currentPrice(seed.getCurrentPrice())
                .riskRating(seed.getRiskRating())
                .maxRiskScore(seed.getMaxRiskScore())
                .description(seed.getDescription())
                .build();
    }
}
