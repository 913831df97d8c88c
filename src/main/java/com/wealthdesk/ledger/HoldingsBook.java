package com.wealthdesk.ledger;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.event.EventPublisherHelper;
import com.wealthdesk.event.HoldingEventType;
import com.wealthdesk.exception.LedgerException;
import com.wealthdesk.repository.memory.HoldingMemoryRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holdings side of the ledger: one position per (portfolio, instrument).
 *
 * <p>Buys raise quantity and re-weight the average cost:
 * {@code newAvg = (oldQty * oldAvg + qty * price) / newQty}, rounded to
 * {@value #AVERAGE_COST_SCALE} decimals HALF_UP. Sells lower quantity and leave the
 * average cost alone; a sell that reaches zero removes the holding, so no
 * zero-quantity holding is ever stored.
 */
@Component
public class HoldingsBook {

    private static final Logger log = LoggerFactory.getLogger(HoldingsBook.class);

    public static final int AVERAGE_COST_SCALE = 6;

    private final HoldingMemoryRepository holdingMemoryRepository;
    private final EventPublisherHelper eventPublisherHelper;

    public HoldingsBook(HoldingMemoryRepository holdingMemoryRepository, EventPublisherHelper eventPublisherHelper) {
        this.holdingMemoryRepository = holdingMemoryRepository;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public Optional<Holding> find(String portfolioId, String instrumentId) {
        return holdingMemoryRepository.find(portfolioId, instrumentId);
    }

    public List<Holding> getHoldings(String portfolioId) {
        return holdingMemoryRepository.findByPortfolioId(portfolioId);
    }

    public int getHeldQuantity(String portfolioId, String instrumentId) {
        return find(portfolioId, instrumentId).map(Holding::getQuantity).orElse(0);
    }

    /**
     * Computes the holding after a fill without storing it.
     *
     * @throws LedgerException for a sell with no holding, a sell larger than the held
     *     quantity, or a buy that would grow the holding past {@link Integer#MAX_VALUE}
     */
    public HoldingMutation prepare(
            String portfolioId,
            String instrumentId,
            OrderSide side,
            int quantity,
            BigDecimal price,
            LocalDateTime at) {
        Holding existing = find(portfolioId, instrumentId).orElse(null);
        return side == OrderSide.BUY
                ? prepareBuy(portfolioId, instrumentId, existing, quantity, price, at)
                : prepareSell(portfolioId, instrumentId, existing, quantity, price, at);
    }

    public void commit(HoldingMutation mutation) {
        int previousQuantity = mutation.getPrevious() != null ? mutation.getPrevious().getQuantity() : 0;

        if (mutation.isClosing()) {
            holdingMemoryRepository.delete(mutation.getPortfolioId(), mutation.getInstrumentId());
            log.debug("Closed holding {} in portfolio {}", mutation.getInstrumentId(), mutation.getPortfolioId());
            eventPublisherHelper.publishHoldingChanged(
                    this, mutation.getPrevious(), HoldingEventType.CLOSED, previousQuantity);
            return;
        }

        holdingMemoryRepository.save(mutation.getNext());
        log.debug(
                "Holding {} in portfolio {}: qty {} -> {}, avgCost {}",
                mutation.getInstrumentId(),
                mutation.getPortfolioId(),
                previousQuantity,
                mutation.getNext().getQuantity(),
                mutation.getNext().getAverageCost());
        eventPublisherHelper.publishHoldingChanged(this, mutation.getNext(), mutation.getEventType(), previousQuantity);
    }

    /** Puts back the holding a committed mutation replaced or removed. */
    public void revert(HoldingMutation mutation) {
        if (mutation.getPrevious() != null) {
            holdingMemoryRepository.save(mutation.getPrevious());
        } else {
            holdingMemoryRepository.delete(mutation.getPortfolioId(), mutation.getInstrumentId());
        }
        log.warn("Reverted holding {} in portfolio {}", mutation.getInstrumentId(), mutation.getPortfolioId());
    }

    private HoldingMutation prepareBuy(
            String portfolioId,
            String instrumentId,
            Holding existing,
            int quantity,
            BigDecimal price,
            LocalDateTime at) {
        if (existing == null) {
            Holding opened = Holding.builder()
                    .portfolioId(portfolioId)
                    .instrumentId(instrumentId)
                    .quantity(quantity)
                    .averageCost(price.setScale(AVERAGE_COST_SCALE, RoundingMode.HALF_UP))
                    .lastUpdated(at)
                    .build();
            return HoldingMutation.builder()
                    .portfolioId(portfolioId)
                    .instrumentId(instrumentId)
                    .next(opened)
                    .eventType(HoldingEventType.OPENED)
                    .build();
        }

        long grownQuantity = (long) existing.getQuantity() + quantity;
        if (grownQuantity > Integer.MAX_VALUE) {
            throw new LedgerException(
                    String.format(
                            "Cannot buy %d units, holding of %d is at the quantity limit",
                            quantity, existing.getQuantity()),
                    Map.of("requested", quantity, "held", existing.getQuantity()));
        }
        int newQuantity = (int) grownQuantity;
        BigDecimal totalCost = existing.getAverageCost()
                .multiply(BigDecimal.valueOf(existing.getQuantity()))
                .add(price.multiply(BigDecimal.valueOf(quantity)));
        BigDecimal newAverage =
                totalCost.divide(BigDecimal.valueOf(newQuantity), AVERAGE_COST_SCALE, RoundingMode.HALF_UP);

        return HoldingMutation.builder()
                .portfolioId(portfolioId)
                .instrumentId(instrumentId)
                .previous(existing)
                .next(existing.toBuilder()
                        .quantity(newQuantity)
                        .averageCost(newAverage)
                        .lastUpdated(at)
                        .build())
                .eventType(HoldingEventType.INCREASED)
                .build();
    }

    private HoldingMutation prepareSell(
            String portfolioId,
            String instrumentId,
            Holding existing,
            int quantity,
            BigDecimal price,
            LocalDateTime at) {
        if (existing == null) {
            throw new LedgerException(
                    "No holding to sell", Map.of("portfolioId", portfolioId, "instrumentId", instrumentId));
        }
        if (quantity > existing.getQuantity()) {
            throw new LedgerException(
                    String.format("Cannot sell %d units, only %d held", quantity, existing.getQuantity()),
                    Map.of("requested", quantity, "held", existing.getQuantity()));
        }

        BigDecimal realizedGain =
                price.subtract(existing.getAverageCost()).multiply(BigDecimal.valueOf(quantity));
        int newQuantity = existing.getQuantity() - quantity;

        HoldingMutation.HoldingMutationBuilder builder = HoldingMutation.builder()
                .portfolioId(portfolioId)
                .instrumentId(instrumentId)
                .previous(existing)
                .realizedGain(realizedGain);

        if (newQuantity <= 0) {
            return builder.eventType(HoldingEventType.CLOSED).build();
        }
        return builder.next(existing.toBuilder()
                        .quantity(newQuantity)
                        .lastUpdated(at)
                        .build())
                .eventType(HoldingEventType.REDUCED)
                .build();
    }
}
