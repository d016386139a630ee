package com.rulesim.simulator;

import com.rulesim.domain.enums.TradeSide;
import com.rulesim.domain.model.Trade;
import com.rulesim.domain.model.TradeStatistics;
import java.util.List;
import java.util.function.Predicate;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Computes {@link TradeStatistics} from a trade list.
 *
 * <p>Sharpe is per trade: mean net profit over its sample standard deviation, annualized
 * with sqrt(252). It is 0 for fewer than two trades or zero variance.
 */
public final class TradeStatisticsCalculator {

    static final double ANNUALIZATION = Math.sqrt(252);

    private TradeStatisticsCalculator() {}

    public static TradeStatistics calculate(List<Trade> trades) {
        if (trades.isEmpty()) {
            return TradeStatistics.empty();
        }

        DescriptiveStatistics net = new DescriptiveStatistics();
        double totalBeforeCost = 0;
        double totalCost = 0;
        double winSum = 0;
        double lossSum = 0;
        int wins = 0;
        for (Trade trade : trades) {
            net.addValue(trade.getNetProfit());
            totalBeforeCost += trade.getGrossProfit();
            totalCost += trade.getTransactionCost();
            if (trade.isWin()) {
                wins++;
                winSum += trade.getNetProfit();
            } else {
                lossSum += trade.getNetProfit();
            }
        }
        int total = trades.size();
        int losses = total - wins;

        List<Trade> buys = filter(trades, t -> t.getSide() == TradeSide.BUY);
        List<Trade> sells = filter(trades, t -> t.getSide() == TradeSide.SELL);

        return TradeStatistics.builder()
                .totalTrades(total)
                .buyTrades(buys.size())
                .sellTrades(sells.size())
                .wins(wins)
                .losses(losses)
                .winRate(winRate(trades))
                .totalReturn(net.getSum())
                .totalReturnBeforeCost(totalBeforeCost)
                .totalCostPaid(totalCost)
                .avgProfit(net.getMean())
                .avgProfitBeforeCost(totalBeforeCost / total)
                .avgWin(wins > 0 ? winSum / wins : 0)
                .avgLoss(losses > 0 ? lossSum / losses : 0)
                .maxWin(net.getMax())
                .maxLoss(net.getMin())
                .finalCumulativeReturn(trades.get(total - 1).getCumulativeReturn())
                .maxDrawdown(maxDrawdown(trades))
                .sharpeRatio(sharpeRatio(net))
                .buyWinRate(winRate(buys))
                .buyAvgProfit(average(buys))
                .buyTotalReturn(sum(buys))
                .sellWinRate(winRate(sells))
                .sellAvgProfit(average(sells))
                .sellTotalReturn(sum(sells))
                .build();
    }

    /**
     * Most negative gap between cumulative return and its running maximum, measured over
     * the trade sequence. 0 when the curve never falls.
     */
    public static double maxDrawdown(List<Trade> trades) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0;
        for (Trade trade : trades) {
            double cumulative = trade.getCumulativeReturn();
            peak = Math.max(peak, cumulative);
            worst = Math.min(worst, cumulative - peak);
        }
        return worst;
    }

    /** Percentage of winning trades, 0 for an empty list. */
    public static double winRate(List<Trade> trades) {
        if (trades.isEmpty()) {
            return 0;
        }
        long wins = trades.stream().filter(Trade::isWin).count();
        return wins * 100.0 / trades.size();
    }

    static double sharpeRatio(DescriptiveStatistics net) {
        if (net.getN() <= 1) {
            return 0;
        }
        double std = net.getStandardDeviation();
        if (std == 0 || Double.isNaN(std)) {
            return 0;
        }
        return net.getMean() / std * ANNUALIZATION;
    }

    private static double sum(List<Trade> trades) {
        return trades.stream().mapToDouble(Trade::getNetProfit).sum();
    }

    private static double average(List<Trade> trades) {
        return trades.stream().mapToDouble(Trade::getNetProfit).average().orElse(0);
    }

    private static List<Trade> filter(List<Trade> trades, Predicate<Trade> predicate) {
        return trades.stream().filter(predicate).toList();
    }
}
