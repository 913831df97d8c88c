package com.wealthdesk.repository.memory;

import com.wealthdesk.domain.model.Order;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Accepted orders by id. Rejected submissions never reach this repository.
 *
 * <p>Order status is mutated in place on the stored aggregate, so {@link #save}
 * is only needed on creation.
 */
@Repository
public class OrderMemoryRepository {

    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    public void save(Order order) {
        orders.put(order.getId(), order);
    }

    public Optional<Order> findById(String id) {
        return Optional.ofNullable(orders.get(id));
    }

    /** Orders of one portfolio, newest first. */
    public List<Order> findByPortfolioId(String portfolioId) {
        return orders.values().stream()
                .filter(o -> o.getPortfolioId().equals(portfolioId))
                .sorted(Comparator.comparing(Order::getCreatedAt)
                        .reversed()
                        .thenComparing(Order::getId))
                .toList();
    }

    public long countPending() {
        return orders.values().stream().filter(Order::isPending).count();
    }
}
