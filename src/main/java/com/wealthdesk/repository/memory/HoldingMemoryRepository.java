package com.wealthdesk.repository.memory;

import com.wealthdesk.domain.model.Holding;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Holdings keyed by portfolio id, then instrument id, so a (portfolio, instrument)
 * pair maps to at most one holding.
 *
 * <p>Writes come only from the HoldingsBook under the portfolio's ledger lock.
 * Reads are lock-free and may observe a holding from just before or just after
 * a concurrent fill, never a half-applied one.
 */
@Repository
public class HoldingMemoryRepository {

    private final Map<String, Map<String, Holding>> holdingsByPortfolio = new ConcurrentHashMap<>();

    public void save(Holding holding) {
        if (holding.getQuantity() <= 0) {
            throw new IllegalArgumentException("Holding quantity must be positive, got " + holding.getQuantity());
        }
        holdingsByPortfolio
                .computeIfAbsent(holding.getPortfolioId(), k -> new ConcurrentHashMap<>())
                .put(holding.getInstrumentId(), holding);
    }

    public Optional<Holding> find(String portfolioId, String instrumentId) {
        Map<String, Holding> holdings = holdingsByPortfolio.get(portfolioId);
        return holdings == null ? Optional.empty() : Optional.ofNullable(holdings.get(instrumentId));
    }

    public List<Holding> findByPortfolioId(String portfolioId) {
        Map<String, Holding> holdings = holdingsByPortfolio.get(portfolioId);
        if (holdings == null) {
            return List.of();
        }
        return holdings.values().stream()
                .sorted(Comparator.comparing(Holding::getInstrumentId))
                .toList();
    }

    public void delete(String portfolioId, String instrumentId) {
        Map<String, Holding> holdings = holdingsByPortfolio.get(portfolioId);
        if (holdings != null) {
            holdings.remove(instrumentId);
        }
    }
}
