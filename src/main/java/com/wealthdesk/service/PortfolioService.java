package com.wealthdesk.service;

import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.Transaction;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.ledger.HoldingsBook;
import com.wealthdesk.repository.memory.PortfolioMemoryRepository;
import java.util.List;
import org.springframework.stereotype.Service;

/** Read access to portfolios, their holdings and their transaction history. */
@Service
public class PortfolioService {

    private final PortfolioMemoryRepository portfolioMemoryRepository;
    private final HoldingsBook holdingsBook;
    private final TransactionRecorder transactionRecorder;

    public PortfolioService(
            PortfolioMemoryRepository portfolioMemoryRepository,
            HoldingsBook holdingsBook,
            TransactionRecorder transactionRecorder) {
        this.portfolioMemoryRepository = portfolioMemoryRepository;
        this.holdingsBook = holdingsBook;
        this.transactionRecorder = transactionRecorder;
    }

    public Portfolio getPortfolio(String portfolioId) {
        return portfolioMemoryRepository
                .findById(portfolioId)
                .orElseThrow(() -> new ResourceNotFoundException("Portfolio", portfolioId));
    }

    public List<Portfolio> getPortfoliosForClient(String clientId) {
        return portfolioMemoryRepository.findByClientId(clientId);
    }

    public List<Holding> getHoldings(String portfolioId) {
        getPortfolio(portfolioId);
        return holdingsBook.getHoldings(portfolioId);
    }

    public List<Transaction> getTransactions(String portfolioId) {
        getPortfolio(portfolioId);
        return transactionRecorder.findByPortfolio(portfolioId);
    }
}
