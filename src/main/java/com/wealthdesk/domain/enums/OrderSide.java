package com.wealthdesk.domain.enums;

/** Buy or sell side of an order. */
public enum OrderSide {
    BUY,
    SELL
}
