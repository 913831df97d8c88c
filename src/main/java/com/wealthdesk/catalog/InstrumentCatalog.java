package com.wealthdesk.catalog;

import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.exception.ResourceNotFoundException;
import com.wealthdesk.repository.memory.InstrumentMemoryRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * View of tradable instruments plus the price refresh hook used by the external
 * price feed and a delisting hook.
 *
 * <p>Lookups never block; a price refresh is a single volatile write on the
 * instrument, so a concurrent validation or fill sees either the old or the new price.
 */
@Service
public class InstrumentCatalog {

    private static final Logger log = LoggerFactory.getLogger(InstrumentCatalog.class);

    private final InstrumentMemoryRepository instrumentMemoryRepository;

    public InstrumentCatalog(InstrumentMemoryRepository instrumentMemoryRepository) {
        this.instrumentMemoryRepository = instrumentMemoryRepository;
    }

    public Optional<Instrument> find(String instrumentId) {
        return instrumentMemoryRepository.findById(instrumentId);
    }

    public Instrument get(String instrumentId) {
        return find(instrumentId).orElseThrow(() -> new ResourceNotFoundException("Instrument", instrumentId));
    }

    public Optional<Instrument> findBySymbol(String symbol) {
        return instrumentMemoryRepository.findBySymbol(symbol);
    }

    public List<Instrument> findAll() {
        return instrumentMemoryRepository.findAll();
    }

    public void register(Instrument instrument) {
        instrumentMemoryRepository.save(instrument);
        log.debug("Registered instrument {} ({})", instrument.getSymbol(), instrument.getId());
    }

    /**
     * Applies a new market price. Orders already accepted fill at whatever price is
     * current when they execute, not the price seen at submission.
     */
    public void refreshPrice(String instrumentId, BigDecimal price) {
        Instrument instrument = get(instrumentId);
        BigDecimal previous = instrument.getCurrentPrice();
        instrument.updatePrice(price);
        log.debug("Price refresh {}: {} -> {}", instrument.getSymbol(), previous, price);
    }

    /**
     * Removes an instrument from the catalog. New orders for it are rejected, and
     * orders already queued fail at execution with "Instrument not found".
     */
    public void delist(String instrumentId) {
        Instrument instrument = get(instrumentId);
        instrumentMemoryRepository.delete(instrumentId);
        log.info("Delisted instrument {} ({})", instrument.getSymbol(), instrumentId);
    }
}
