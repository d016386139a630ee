package com.rulesim.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Summary metrics over one trade list (one asset, one run or one walk-forward period).
 *
 * <p>Returns and profits are in percent units; win rates are percentages (0-100).
 * {@code maxDrawdown} is the most negative value of cumulative return minus its running
 * maximum, so it is 0 or negative.
 */
@Value
@Builder
public class TradeStatistics {

    int totalTrades;
    int buyTrades;
    int sellTrades;
    int wins;
    int losses;
    double winRate;

    double totalReturn;
    double totalReturnBeforeCost;
    double totalCostPaid;
    double avgProfit;
    double avgProfitBeforeCost;
    double avgWin;
    double avgLoss;
    double maxWin;
    double maxLoss;
    double finalCumulativeReturn;
    double maxDrawdown;
    double sharpeRatio;

    double buyWinRate;
    double buyAvgProfit;
    double buyTotalReturn;
    double sellWinRate;
    double sellAvgProfit;
    double sellTotalReturn;

    public boolean isEmpty() {
        return totalTrades == 0;
    }

    public static TradeStatistics empty() {
        return TradeStatistics.builder().build();
    }
}
