package com.wealthdesk.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Remembers client idempotency keys of accepted submissions for a fixed window.
 *
 * <p>Keys are scoped per portfolio, so two portfolios may reuse the same client key.
 * Entries expire {@code wealthdesk.idempotency.window} (default 24h) after the order
 * was accepted; the cache ticker reads the injected {@link Clock}.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private final Cache<String, String> acceptedKeys;

    public IdempotencyService(Clock clock, @Value("${wealthdesk.idempotency.window:PT24H}") Duration window) {
        this.acceptedKeys = Caffeine.newBuilder()
                .expireAfterWrite(window.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /** The order id accepted earlier under this key, if the key is still inside the window. */
    public Optional<String> findAcceptedOrder(String portfolioId, String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(acceptedKeys.getIfPresent(cacheKey(portfolioId, idempotencyKey)));
    }

    /**
     * Claims the key for {@code orderId}. Returns the id of the order that already
     * owns the key if another submission claimed it first, otherwise empty.
     */
    public Optional<String> claim(String portfolioId, String idempotencyKey, String orderId) {
        String existing = acceptedKeys.asMap().putIfAbsent(cacheKey(portfolioId, idempotencyKey), orderId);
        if (existing != null) {
            log.debug("Idempotency key {} already claimed by order {}", idempotencyKey, existing);
        }
        return Optional.ofNullable(existing);
    }

    private static String cacheKey(String portfolioId, String idempotencyKey) {
        return portfolioId + "|" + idempotencyKey;
    }
}
