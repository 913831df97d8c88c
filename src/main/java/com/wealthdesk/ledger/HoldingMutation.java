package com.wealthdesk.ledger;

import com.wealthdesk.domain.model.Holding;
import com.wealthdesk.event.HoldingEventType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A validated, not yet applied, change to one holding.
 *
 * <p>{@code next} is null when the fill closes the position; {@code previous} is null
 * when it opens one. {@code realizedGain} is set for sells only.
 */
@Value
@Builder
public class HoldingMutation {

    String portfolioId;
    String instrumentId;
    Holding previous;
    Holding next;
    HoldingEventType eventType;
    BigDecimal realizedGain;

    public boolean isClosing() {
        return next == null;
    }
}
