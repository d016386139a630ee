package com.rulesim.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-trade cost model: spread, commission and slippage, each a fraction of
 * notional (0.0002 = 0.02%).
 *
 * <p>The three components are summed once per trade and charged identically to BUY and
 * SELL, which approximates a symmetric round trip rather than modelling bid and ask.
 * Trade profits are in percent units, so the simulator charges {@link #getTotalPercent()}.
 */
@Value
@Builder
public class TransactionCosts {

    double spread;
    double commission;
    double slippage;

    /** Sum of the three components as a fraction. */
    public double getTotal() {
        return spread + commission + slippage;
    }

    /** Sum of the three components in percent units (0.0004 becomes 0.04). */
    public double getTotalPercent() {
        return getTotal() * 100;
    }

    public static TransactionCosts zero() {
        return new TransactionCosts(0, 0, 0);
    }
}
