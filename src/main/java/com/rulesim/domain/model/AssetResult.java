package com.rulesim.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Backtest outcome of one asset over one test window: the trades, their statistics and the
 * asset's equity curve ({@code 1 + cumulativeReturn / 100} after each trade).
 */
@Value
@Builder
public class AssetResult {

    String asset;
    List<Trade> trades;
    TradeStatistics statistics;
    List<EquityPoint> equityCurve;

    public boolean hasTrades() {
        return !trades.isEmpty();
    }
}
