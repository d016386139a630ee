package com.rulesim.portfolio;

import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.Trade;
import com.rulesim.domain.vo.CorrelationMatrix;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/**
 * Pearson correlation of per-trade net profits across assets.
 *
 * <p>Each asset's profits are laid onto the shared timeline (summed where an asset trades
 * twice at one timestamp) and missing timestamps are filled with 0. Pairs involving a
 * constant series, or a timeline shorter than two points, are undefined ({@code NaN}).
 */
public final class CorrelationAnalyzer {

    private CorrelationAnalyzer() {}

    public static CorrelationMatrix correlate(Map<String, AssetResult> assets, SortedSet<LocalDateTime> timeline) {
        List<String> names = new ArrayList<>(assets.keySet());
        List<LocalDateTime> times = new ArrayList<>(timeline);
        Map<LocalDateTime, Integer> position = new HashMap<>();
        for (int i = 0; i < times.size(); i++) {
            position.put(times.get(i), i);
        }

        double[][] series = new double[names.size()][times.size()];
        for (int a = 0; a < names.size(); a++) {
            for (Trade trade : assets.get(names.get(a)).getTrades()) {
                Integer i = position.get(trade.getEntryTimestamp());
                if (i != null) {
                    series[a][i] += trade.getNetProfit();
                }
            }
        }

        PearsonsCorrelation pearson = new PearsonsCorrelation();
        double[][] values = new double[names.size()][names.size()];
        for (int i = 0; i < names.size(); i++) {
            values[i][i] = 1.0;
            for (int j = i + 1; j < names.size(); j++) {
                double r = pearson(pearson, series[i], series[j]);
                values[i][j] = r;
                values[j][i] = r;
            }
        }
        return new CorrelationMatrix(names, values);
    }

    private static double pearson(PearsonsCorrelation pearson, double[] x, double[] y) {
        if (x.length < 2 || isConstant(x) || isConstant(y)) {
            return Double.NaN;
        }
        return pearson.correlation(x, y);
    }

    private static boolean isConstant(double[] values) {
        for (double v : values) {
            if (v != values[0]) {
                return false;
            }
        }
        return true;
    }
}
