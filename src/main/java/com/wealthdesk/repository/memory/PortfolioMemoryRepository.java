package com.wealthdesk.repository.memory;

import com.wealthdesk.domain.model.Portfolio;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class PortfolioMemoryRepository {

    private final Map<String, Portfolio> portfolios = new ConcurrentHashMap<>();

    public void save(Portfolio portfolio) {
        portfolios.put(portfolio.getId(), portfolio);
    }

    public Optional<Portfolio> findById(String id) {
        return Optional.ofNullable(portfolios.get(id));
    }

    public List<Portfolio> findByClientId(String clientId) {
        return portfolios.values().stream()
                .filter(p -> p.getClientId().equals(clientId))
                .toList();
    }
}
