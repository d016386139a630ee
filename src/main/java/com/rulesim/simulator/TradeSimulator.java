package com.rulesim.simulator;

import com.rulesim.domain.model.Signal;
import com.rulesim.domain.model.Trade;
import com.rulesim.domain.vo.TransactionCosts;
import com.rulesim.timeseries.TimeSeries;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Settles signals into one-period trades.
 *
 * <p>A signal at index {@code t} exits at {@code t + 1} and realizes {@code X[t + 1]}, with
 * the sign flipped for SELL. The summed transaction cost is charged once per trade in the
 * same percent units as X. Cumulative return is the running sum of net profit in entry
 * order. Stateless and thread-safe.
 */
@Component
public class TradeSimulator {

    private static final Logger log = LoggerFactory.getLogger(TradeSimulator.class);

    /**
     * @param signals signals to settle, in any order
     * @param series  the series the signal indices refer to
     * @param costs   per-trade cost model
     * @return trades ordered by entry index; empty when there are no signals
     */
    public List<Trade> simulate(List<Signal> signals, TimeSeries series, TransactionCosts costs) {
        if (signals.isEmpty()) {
            return List.of();
        }

        List<Signal> ordered = new ArrayList<>(signals);
        ordered.sort(Comparator.comparingInt(Signal::getIndex));

        double cost = costs.getTotalPercent();
        double cumulative = 0;
        int dropped = 0;
        List<Trade> trades = new ArrayList<>(ordered.size());

        for (Signal signal : ordered) {
            int exit = signal.getIndex() + 1;
            if (exit >= series.size()) {
                dropped++;
                continue;
            }

            double actualX = series.x(exit);
            double gross = signal.getSide().sign() * actualX;
            double net = gross - cost;
            cumulative += net;

            trades.add(Trade.builder()
                    .entryIndex(signal.getIndex())
                    .exitIndex(exit)
                    .entryTimestamp(signal.getTimestamp())
                    .side(signal.getSide())
                    .ruleId(signal.getRuleId())
                    .ruleText(signal.getRule().getRuleText())
                    .direction(signal.getRule().getDirection())
                    .supportCount(signal.getSupportCount())
                    .expectedX(signal.getExpectedX())
                    .actualX(actualX)
                    .grossProfit(gross)
                    .transactionCost(cost)
                    .netProfit(net)
                    .win(net > 0)
                    .cumulativeReturn(cumulative)
                    .build());
        }

        if (dropped > 0) {
            log.warn("Dropped {} signals at the last row of {} (no next-period outcome)", dropped, series.getAsset());
        }
        return trades;
    }
}
