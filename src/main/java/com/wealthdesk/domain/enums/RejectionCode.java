package com.wealthdesk.domain.enums;

/**
 * Machine-readable reason an order submission was rejected before any order existed.
 */
public enum RejectionCode {
    INVALID_ORDER,
    PORTFOLIO_NOT_FOUND,
    RISK_PROFILE_NOT_FOUND,
    INSTRUMENT_NOT_FOUND,
    SUITABILITY_FAILED,
    INSUFFICIENT_CASH,
    CONCENTRATION_EXCEEDED,
    INSUFFICIENT_HOLDINGS
}
