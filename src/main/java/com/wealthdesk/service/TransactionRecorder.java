package com.wealthdesk.service;

import com.wealthdesk.domain.model.Transaction;
import com.wealthdesk.mapper.TransactionMapper;
import com.wealthdesk.repository.jpa.TransactionJpaRepository;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists the immutable transaction produced by each executed order.
 *
 * <p>At most one transaction exists per order id; a second append for the same
 * order is refused with {@link IllegalStateException}.
 */
@Service
public class TransactionRecorder {

    private static final Logger log = LoggerFactory.getLogger(TransactionRecorder.class);

    private final TransactionJpaRepository transactionJpaRepository;
    private final TransactionMapper transactionMapper = Mappers.getMapper(TransactionMapper.class);

    public TransactionRecorder(TransactionJpaRepository transactionJpaRepository) {
        this.transactionJpaRepository = transactionJpaRepository;
    }

    public Transaction append(Transaction transaction) {
        if (transactionJpaRepository.existsByOrderId(transaction.getOrderId())) {
            throw new IllegalStateException("Transaction already recorded for order " + transaction.getOrderId());
        }
        transactionJpaRepository.save(transactionMapper.toEntity(transaction));
        log.debug(
                "Recorded {} transaction {} for order {}",
                transaction.getType(),
                transaction.getId(),
                transaction.getOrderId());
        return transaction;
    }

    public Optional<Transaction> findByOrderId(String orderId) {
        return transactionJpaRepository.findByOrderId(orderId).map(transactionMapper::toDomain);
    }

    /** Newest first. */
    public List<Transaction> findByPortfolio(String portfolioId) {
        return transactionMapper.toDomainList(
                transactionJpaRepository.findByPortfolioIdOrderByTimestampDesc(portfolioId));
    }
}
