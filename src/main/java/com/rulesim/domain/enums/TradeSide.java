package com.rulesim.domain.enums;

/** Long or short side of a simulated trade. */
public enum TradeSide {
    BUY,
    SELL;

    /** Sign applied to the realized outcome: +1 for BUY, -1 for SELL. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
