package com.rulesim.domain.enums;

/** How portfolio capital is split across assets. */
public enum AllocationStrategy {
    /** 1/N per asset. */
    EQUAL_WEIGHT,
    /** Inverse volatility of per-trade profits. */
    RISK_PARITY,
    /** Proportional to non-negative Sharpe ratio. */
    PERFORMANCE_BASED
}
