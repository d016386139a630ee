package com.rulesim.unit.portfolio;

import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.EquityPoint;
import com.rulesim.domain.model.Trade;
import com.rulesim.simulator.TradeStatisticsCalculator;
import com.rulesim.unit.TestData;
import java.time.LocalDateTime;
import java.util.List;

final class PortfolioFixtures {

    private PortfolioFixtures() {}

    /** Asset result with one trade per day from {@code start}. */
    static AssetResult asset(String name, LocalDateTime start, double... netProfits) {
        return asset(name, TestData.trades(start, netProfits));
    }

    static AssetResult asset(String name, List<Trade> trades) {
        return AssetResult.builder()
                .asset(name)
                .trades(trades)
                .statistics(TradeStatisticsCalculator.calculate(trades))
                .equityCurve(trades.stream()
                        .map(t -> new EquityPoint(t.getEntryTimestamp(), 1 + t.getCumulativeReturn() / 100))
                        .toList())
                .build();
    }
}
