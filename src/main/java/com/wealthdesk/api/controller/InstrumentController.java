package com.wealthdesk.api.controller;

import com.wealthdesk.api.dto.request.PriceUpdateRequest;
import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.domain.model.Instrument;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Instrument catalog listing, manual price refresh and delisting. */
@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {

    private static final Logger log = LoggerFactory.getLogger(InstrumentController.class);

    private final InstrumentCatalog instrumentCatalog;

    public InstrumentController(InstrumentCatalog instrumentCatalog) {
        this.instrumentCatalog = instrumentCatalog;
    }

    @GetMapping
    public List<Instrument> listInstruments() {
        return instrumentCatalog.findAll();
    }

    @GetMapping("/{instrumentId}")
    public Instrument getInstrument(@PathVariable String instrumentId) {
        return instrumentCatalog.get(instrumentId);
    }

    @PutMapping("/{instrumentId}/price")
    public Instrument updatePrice(
            @PathVariable String instrumentId, @RequestBody @Valid PriceUpdateRequest request) {
        log.info("Manual price update for {}: {}", instrumentId, request.getPrice());
        instrumentCatalog.refreshPrice(instrumentId, request.getPrice());
        return instrumentCatalog.get(instrumentId);
    }

    @DeleteMapping("/{instrumentId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delistInstrument(@PathVariable String instrumentId) {
        log.info("Delisting instrument {}", instrumentId);
        instrumentCatalog.delist(instrumentId);
    }
}
