package com.wealthdesk.domain.enums;

/**
 * Order execution type.
 * MARKET fills at the instrument's current price; LIMIT fills at its limit price.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
