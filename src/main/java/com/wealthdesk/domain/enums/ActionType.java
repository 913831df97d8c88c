package com.wealthdesk.domain.enums;

/** Kind of next-best-action recommended for a client. */
public enum ActionType {
    REFRESH_RISK_PROFILE,
    REBALANCE_PORTFOLIO,
    INVEST_CASH,
    REDUCE_CONCENTRATION
}
