package com.wealthdesk.api.controller;

import com.wealthdesk.api.dto.request.PlaceOrderRequest;
import com.wealthdesk.api.dto.response.ApiErrorResponse;
import com.wealthdesk.domain.enums.OrderType;
import com.wealthdesk.domain.model.Order;
import com.wealthdesk.oms.OrderEngine;
import com.wealthdesk.oms.OrderRequest;
import com.wealthdesk.oms.OrderSubmissionResult;
import com.wealthdesk.service.PortfolioService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for order submission and order history.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/portfolios/{portfolioId}/orders -- validate and accept an order (422 when rejected)</li>
 *   <li>GET /api/portfolios/{portfolioId}/orders -- order history, newest first</li>
 *   <li>GET /api/orders/{orderId} -- a single order with its current status</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderEngine orderEngine;
    private final PortfolioService portfolioService;

    public OrderController(OrderEngine orderEngine, PortfolioService portfolioService) {
        this.orderEngine = orderEngine;
        this.portfolioService = portfolioService;
    }

    /**
     * Submits an order. Accepted and duplicate submissions return 200 with the order id;
     * rejections return 422 with the rejection code as the error code.
     */
    @PostMapping("/portfolios/{portfolioId}/orders")
    public ResponseEntity<?> placeOrder(
            @PathVariable String portfolioId,
            @RequestBody @Valid PlaceOrderRequest body,
            HttpServletRequest httpRequest) {
        OrderRequest orderRequest = OrderRequest.builder()
                .portfolioId(portfolioId)
                .instrumentId(body.getInstrumentId())
                .side(body.getSide())
                .orderType(body.getOrderType() != null ? body.getOrderType() : OrderType.MARKET)
                .quantity(body.getQuantity())
                .limitPrice(body.getLimitPrice())
                .createdBy(body.getCreatedBy())
                .idempotencyKey(body.getIdempotencyKey())
                .build();
        log.debug(
                "Order submission: {} {} {} x{} in {}",
                orderRequest.getSide(),
                orderRequest.getOrderType(),
                orderRequest.getInstrumentId(),
                orderRequest.getQuantity(),
                portfolioId);

        OrderSubmissionResult result = orderEngine.submitOrder(orderRequest);
        if (result.isAccepted()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiErrorResponse.of(
                        result.getRejectionCode().name(),
                        result.getRejectionReason(),
                        result.getDetails(),
                        httpRequest.getRequestURI()));
    }

    @GetMapping("/portfolios/{portfolioId}/orders")
    public List<Order> getOrders(@PathVariable String portfolioId) {
        portfolioService.getPortfolio(portfolioId);
        return orderEngine.getOrderHistory(portfolioId);
    }

    @GetMapping("/orders/{orderId}")
    public Order getOrder(@PathVariable String orderId) {
        return orderEngine.getOrder(orderId);
    }
}
