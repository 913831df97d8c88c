package com.wealthdesk.repository.memory;

import com.wealthdesk.domain.model.Instrument;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** In-memory store of the instrument catalog, keyed by instrument id. */
@Repository
public class InstrumentMemoryRepository {

    private final Map<String, Instrument> instruments = new ConcurrentHashMap<>();

    public void save(Instrument instrument) {
        instruments.put(instrument.getId(), instrument);
    }

    public void delete(String id) {
        instruments.remove(id);
    }

    public Optional<Instrument> findById(String id) {
        return Optional.ofNullable(instruments.get(id));
    }

    public Optional<Instrument> findBySymbol(String symbol) {
        return instruments.values().stream()
                .filter(i -> i.getSymbol().equalsIgnoreCase(symbol))
                .findFirst();
    }

    public List<Instrument> findAll() {
        return instruments.values().stream()
                .sorted(Comparator.comparing(Instrument::getSymbol))
                .toList();
    }
}
