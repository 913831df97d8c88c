package com.wealthdesk.repository.memory;

import com.wealthdesk.domain.model.ModelPortfolio;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

/**
 * The active model portfolio set. Replaced as a whole so readers never see a
 * partially loaded set of risk bands.
 */
@Repository
public class ModelPortfolioMemoryRepository {

    private volatile List<ModelPortfolio> models = new CopyOnWriteArrayList<>();

    public void replaceAll(List<ModelPortfolio> newModels) {
        this.models = new CopyOnWriteArrayList<>(newModels.stream()
                .sorted(Comparator.comparingInt(ModelPortfolio::getMinRiskScore))
                .toList());
    }

    /** Models ordered by the lower bound of their risk band. */
    public List<ModelPortfolio> findAll() {
        return List.copyOf(models);
    }
}
