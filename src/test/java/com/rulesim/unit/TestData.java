package com.rulesim.unit;

import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.TradeSide;
import com.rulesim.domain.model.Condition;
import com.rulesim.domain.model.Rule;
import com.rulesim.domain.model.TimeSeriesRow;
import com.rulesim.domain.model.Trade;
import com.rulesim.timeseries.TimeSeries;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for in-memory rules, series and trades shared by the unit tests. */
public final class TestData {

    public static final LocalDateTime T0 = LocalDateTime.of(2021, 1, 4, 0, 0);

    private TestData() {}

    /** Scenario series: A=[0,1,1,0,1,0], B=[0,0,1,1,0,1], X=[0.1,-0.2,0.3,-0.1,0.05,0.2], daily from T0. */
    public static TimeSeries scenarioSeries() {
        Map<String, int[]> attributes = new LinkedHashMap<>();
        attributes.put("A", new int[] {0, 1, 1, 0, 1, 0});
        attributes.put("B", new int[] {0, 0, 1, 1, 0, 1});
        return series("TEST", attributes, new double[] {0.1, -0.2, 0.3, -0.1, 0.05, 0.2});
    }

    /** Daily series starting at {@link #T0}. */
    public static TimeSeries series(String asset, Map<String, int[]> attributes, double[] x) {
        List<LocalDateTime> timestamps = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            timestamps.add(T0.plusDays(i));
        }
        return series(asset, attributes, x, timestamps);
    }

    public static TimeSeries series(
            String asset, Map<String, int[]> attributes, double[] x, List<LocalDateTime> timestamps) {
        List<TimeSeriesRow> rows = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            Map<String, Integer> values = new HashMap<>();
            for (Map.Entry<String, int[]> entry : attributes.entrySet()) {
                values.put(entry.getKey(), entry.getValue()[i]);
            }
            rows.add(TimeSeriesRow.builder()
                    .timestamp(timestamps.get(i))
                    .attributes(values)
                    .x(x[i])
                    .build());
        }
        return new TimeSeries(asset, rows, attributes.keySet());
    }

    /** Series of {@code size} rows where attribute {@code A} is always 1. */
    public static TimeSeries alwaysActive(String asset, double[] x) {
        int[] ones = new int[x.length];
        Arrays.fill(ones, 1);
        return series(asset, Map.of("A", ones), x);
    }

    public static Rule rule(int id, RuleDirection direction, int support, Condition... conditions) {
        Rule.RuleBuilder builder = Rule.builder()
                .id(id)
                .direction(direction)
                .supportCount(support)
                .supportRate(0.1)
                .xMean(direction == RuleDirection.POSITIVE ? 0.2 : -0.2)
                .xSigma(0.5);
        for (Condition condition : conditions) {
            builder.condition(condition);
        }
        return builder.build();
    }

    public static Condition cond(String attribute, int lag) {
        return new Condition(attribute, lag);
    }

    /** Trades with the given net profits, one per day from {@code start}, cumulative filled in. */
    public static List<Trade> trades(LocalDateTime start, double... netProfits) {
        List<Trade> trades = new ArrayList<>();
        double cumulative = 0;
        for (int i = 0; i < netProfits.length; i++) {
            cumulative += netProfits[i];
            trades.add(Trade.builder()
                    .entryIndex(i)
                    .exitIndex(i + 1)
                    .entryTimestamp(start.plusDays(i))
                    .side(TradeSide.BUY)
                    .ruleId(0)
                    .ruleText("A(t-1)")
                    .direction(RuleDirection.POSITIVE)
                    .supportCount(10)
                    .actualX(netProfits[i])
                    .grossProfit(netProfits[i])
                    .transactionCost(0)
                    .netProfit(netProfits[i])
                    .win(netProfits[i] > 0)
                    .cumulativeReturn(cumulative)
                    .build());
        }
        return trades;
    }
}
