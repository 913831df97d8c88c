package com.wealthdesk.oms;

import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.domain.enums.AuditEventType;
import com.wealthdesk.domain.enums.OrderType;
import com.wealthdesk.domain.enums.RejectionCode;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.Order;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.RiskProfile;
import com.wealthdesk.event.EventPublisherHelper;
import com.wealthdesk.event.RiskEventType;
import com.wealthdesk.event.RiskLevel;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.ledger.LedgerService;
import com.wealthdesk.repository.memory.OrderMemoryRepository;
import com.wealthdesk.repository.memory.PortfolioMemoryRepository;
import com.wealthdesk.repository.memory.RiskProfileMemoryRepository;
import com.wealthdesk.risk.PreTradeContext;
import com.wealthdesk.risk.PreTradeValidator;
import com.wealthdesk.risk.RiskValidationResult;
import com.wealthdesk.risk.RiskViolation;
import com.wealthdesk.service.AuditService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for order submission and order history.
 *
 * <p>Submission pipeline (synchronous, first failure wins):
 * <ol>
 *   <li>Idempotency: a key already accepted returns the original order id</li>
 *   <li>Request shape, portfolio and client risk profile</li>
 *   <li>Instrument lookup</li>
 *   <li>{@link PreTradeValidator}: suitability, then cash and concentration for buys or
 *       held quantity for sells</li>
 *   <li>Create the PENDING order and enqueue the fill, then audit ORDER_CREATED and
 *       publish CREATED. A failure in those last two is logged; the order still fills.</li>
 * </ol>
 *
 * <p>Validation and order creation run under the portfolio's ledger lock so the checks
 * see a consistent cash and holdings snapshot. Rejections are returned as values,
 * publish a {@link com.wealthdesk.event.RiskEvent} and leave no order behind.
 */
@Service
public class OrderEngine {

    private static final Logger log = LoggerFactory.getLogger(OrderEngine.class);

    private final OrderMemoryRepository orderMemoryRepository;
    private final PortfolioMemoryRepository portfolioMemoryRepository;
    private final RiskProfileMemoryRepository riskProfileMemoryRepository;
    private final InstrumentCatalog instrumentCatalog;
    private final PreTradeValidator preTradeValidator;
    private final LedgerService ledgerService;
    private final IdempotencyService idempotencyService;
    private final OrderExecutionQueue orderExecutionQueue;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public OrderEngine(
            OrderMemoryRepository orderMemoryRepository,
            PortfolioMemoryRepository portfolioMemoryRepository,
            RiskProfileMemoryRepository riskProfileMemoryRepository,
            InstrumentCatalog instrumentCatalog,
            PreTradeValidator preTradeValidator,
            LedgerService ledgerService,
            IdempotencyService idempotencyService,
            OrderExecutionQueue orderExecutionQueue,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.orderMemoryRepository = orderMemoryRepository;
        this.portfolioMemoryRepository = portfolioMemoryRepository;
        this.riskProfileMemoryRepository = riskProfileMemoryRepository;
        this.instrumentCatalog = instrumentCatalog;
        this.preTradeValidator = preTradeValidator;
        this.ledgerService = ledgerService;
        this.idempotencyService = idempotencyService;
        this.orderExecutionQueue = orderExecutionQueue;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public OrderSubmissionResult submitOrder(OrderRequest request) {
        Optional<String> previous =
                idempotencyService.findAcceptedOrder(request.getPortfolioId(), request.getIdempotencyKey());
        if (previous.isPresent()) {
            log.info(
                    "Duplicate submission for key {} returns order {}", request.getIdempotencyKey(), previous.get());
            return OrderSubmissionResult.duplicateOf(previous.get());
        }

        String shapeError = validateShape(request);
        if (shapeError != null) {
            return reject(request, RiskViolation.of(RejectionCode.INVALID_ORDER, shapeError));
        }

        Portfolio portfolio =
                portfolioMemoryRepository.findById(request.getPortfolioId()).orElse(null);
        if (portfolio == null) {
            return reject(
                    request,
                    RiskViolation.of(
                            RejectionCode.PORTFOLIO_NOT_FOUND, "Portfolio not found: " + request.getPortfolioId()));
        }

        RiskProfile riskProfile =
                riskProfileMemoryRepository.findByClientId(portfolio.getClientId()).orElse(null);
        if (riskProfile == null) {
            return reject(
                    request,
                    RiskViolation.of(
                            RejectionCode.RISK_PROFILE_NOT_FOUND,
                            "No risk profile for client " + portfolio.getClientId()));
        }

        Instrument instrument = instrumentCatalog.find(request.getInstrumentId()).orElse(null);
        if (instrument == null) {
            return reject(
                    request,
                    RiskViolation.of(
                            RejectionCode.INSTRUMENT_NOT_FOUND, "Instrument not found: " + request.getInstrumentId()));
        }

        return ledgerService.withPortfolioLock(
                portfolio.getId(), () -> validateAndCreate(request, portfolio, riskProfile, instrument));
    }

    public List<Order> getOrderHistory(String portfolioId) {
        return orderMemoryRepository.findByPortfolioId(portfolioId);
    }

    public Order getOrder(String orderId) {
        return orderMemoryRepository
                .findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    private OrderSubmissionResult validateAndCreate(
            OrderRequest request, Portfolio portfolio, RiskProfile riskProfile, Instrument instrument) {
        BigDecimal limitPrice = request.getOrderType() == OrderType.LIMIT ? request.getLimitPrice() : null;
        BigDecimal estimatedPrice = limitPrice != null ? limitPrice : instrument.getCurrentPrice();

        RiskValidationResult validation = preTradeValidator.validate(PreTradeContext.builder()
                .portfolio(portfolio)
                .riskProfile(riskProfile)
                .instrument(instrument)
                .side(request.getSide())
                .quantity(request.getQuantity())
                .estimatedPrice(estimatedPrice)
                .build());
        if (validation.isRejected()) {
            return reject(request, validation.getViolation());
        }

        String orderId = UUID.randomUUID().toString();
        String idempotencyKey = request.getIdempotencyKey() != null
                ? request.getIdempotencyKey()
                : UUID.randomUUID().toString();

        Optional<String> claimedBy = idempotencyService.claim(portfolio.getId(), idempotencyKey, orderId);
        if (claimedBy.isPresent()) {
            return OrderSubmissionResult.duplicateOf(claimedBy.get());
        }

        Order order = Order.builder()
                .id(orderId)
                .portfolioId(portfolio.getId())
                .instrumentId(instrument.getId())
                .side(request.getSide())
                .orderType(request.getOrderType())
                .quantity(request.getQuantity())
                .limitPrice(limitPrice)
                .createdBy(request.getCreatedBy() != null ? request.getCreatedBy() : portfolio.getClientId())
                .createdAt(LocalDateTime.now(clock))
                .idempotencyKey(idempotencyKey)
                .build();
        orderMemoryRepository.save(order);
        orderExecutionQueue.enqueue(order.getId());

        try {
            auditService.recordOrderEvent(
                    AuditEventType.ORDER_CREATED, order, portfolio.getClientId(), instrument.getSymbol(), null);
            eventPublisherHelper.publishOrderCreated(this, order);
        } catch (RuntimeException e) {
            log.error("Order {} is queued but its creation was not fully recorded", order.getId(), e);
        }

        log.info(
                "Order accepted: id={}, {} {} {} x {}, portfolio={}",
                order.getId(),
                order.getSide(),
                order.getOrderType(),
                order.getQuantity(),
                instrument.getSymbol(),
                portfolio.getId());

        return OrderSubmissionResult.accepted(order.getId());
    }

    private static String validateShape(OrderRequest request) {
        if (request.getPortfolioId() == null || request.getInstrumentId() == null) {
            return "Portfolio and instrument are required";
        }
        if (request.getSide() == null || request.getOrderType() == null) {
            return "Order side and type are required";
        }
        if (request.getQuantity() <= 0) {
            return "Quantity must be positive, got " + request.getQuantity();
        }
        if (request.getOrderType() == OrderType.LIMIT
                && (request.getLimitPrice() == null || request.getLimitPrice().signum() <= 0)) {
            return "LIMIT orders require a positive limit price";
        }
        return null;
    }

    private OrderSubmissionResult reject(OrderRequest request, RiskViolation violation) {
        log.warn(
                "Order rejected: portfolio={}, instrument={}, side={}, qty={}, {}",
                request.getPortfolioId(),
                request.getInstrumentId(),
                request.getSide(),
                request.getQuantity(),
                violation);

        Map<String, Object> details = new HashMap<>(violation.getDetails());
        details.put("rejectionCode", violation.getCode().name());
        if (request.getPortfolioId() != null) {
            details.put("portfolioId", request.getPortfolioId());
        }
        if (request.getInstrumentId() != null) {
            details.put("instrumentId", request.getInstrumentId());
        }
        eventPublisherHelper.publishRiskEvent(
                this, riskEventTypeFor(violation.getCode()), RiskLevel.WARNING, violation.getMessage(), details);

        return OrderSubmissionResult.rejected(violation.getCode(), violation.getMessage(), violation.getDetails());
    }

    private static RiskEventType riskEventTypeFor(RejectionCode code) {
        return switch (code) {
            case SUITABILITY_FAILED -> RiskEventType.SUITABILITY_BREACH;
            case INSUFFICIENT_CASH -> RiskEventType.INSUFFICIENT_CASH;
            case CONCENTRATION_EXCEEDED -> RiskEventType.CONCENTRATION_BREACH;
            case INSUFFICIENT_HOLDINGS -> RiskEventType.INSUFFICIENT_HOLDINGS;
            default -> RiskEventType.ORDER_REJECTED;
        };
    }
}
