package com.wealthdesk.repository.jpa;

import com.wealthdesk.entity.TransactionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the ledger_transactions table. */
@Repository
public interface TransactionJpaRepository extends JpaRepository<TransactionEntity, String> {

    Optional<TransactionEntity> findByOrderId(String orderId);

    boolean existsByOrderId(String orderId);

    List<TransactionEntity> findByPortfolioIdOrderByTimestampDesc(String portfolioId);
}
