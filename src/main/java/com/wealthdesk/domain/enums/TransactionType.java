package com.wealthdesk.domain.enums;

/**
 * Type of a ledger transaction. Fills produce BUY and SELL; DIVIDEND and FEE
 * come from external statement feeds and are never written by the order engine.
 */
public enum TransactionType {
    BUY,
    SELL,
    DIVIDEND,
    FEE;

    public static TransactionType of(OrderSide side) {
        return side == OrderSide.BUY ? BUY : SELL;
    }
}
