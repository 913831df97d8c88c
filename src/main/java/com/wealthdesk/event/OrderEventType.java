package com.wealthdesk.event;

/** The order state change carried by an {@link OrderEvent}. */
public enum OrderEventType {

    /** Accepted at submission and stored PENDING. */
    CREATED,

    /** Filled; cash and holdings have been mutated. */
    EXECUTED,

    /** Accepted but could not be filled; ledger untouched. */
    FAILED
}
