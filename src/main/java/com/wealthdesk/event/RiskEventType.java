package com.wealthdesk.event;

/** Which pre-trade rule produced a {@link RiskEvent}. */
public enum RiskEventType {

    /** Instrument risk requirement is outside the client's risk score. */
    SUITABILITY_BREACH,

    /** Estimated buy cost exceeds available cash. */
    INSUFFICIENT_CASH,

    /** Post-trade position weight would exceed the concentration limit. */
    CONCENTRATION_BREACH,

    /** Sell quantity exceeds the quantity held. */
    INSUFFICIENT_HOLDINGS,

    /** Any other submission rejection (unknown instrument, malformed request). */
    ORDER_REJECTED
}
