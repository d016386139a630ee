package com.rulesim.portfolio;

import com.rulesim.domain.model.EquityPoint;
import com.rulesim.domain.model.PortfolioMetrics;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Metrics of a combined equity curve.
 *
 * <p>Total return is measured against initial capital 1.0. Sharpe and volatility use the
 * sample standard deviation of point-to-point equity changes; both are 0 with fewer than
 * two changes, and Sharpe is also 0 when the changes have no variance.
 */
public final class PortfolioMetricsCalculator {

    private static final double ANNUALIZATION = Math.sqrt(252);

    private PortfolioMetricsCalculator() {}

    public static PortfolioMetrics calculate(List<EquityPoint> curve) {
        if (curve.isEmpty()) {
            return PortfolioMetrics.empty();
        }

        double peak = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0;
        DescriptiveStatistics changes = new DescriptiveStatistics();
        double previous = Double.NaN;
        for (EquityPoint point : curve) {
            double equity = point.getEquity();
            peak = Math.max(peak, equity);
            if (peak != 0) {
                maxDrawdown = Math.min(maxDrawdown, (equity - peak) / peak * 100);
            }
            if (!Double.isNaN(previous) && previous != 0) {
                changes.addValue(equity / previous - 1);
            }
            previous = equity;
        }

        double std = changes.getN() > 1 ? changes.getStandardDeviation() : 0;
        double sharpe = std > 0 ? changes.getMean() / std * ANNUALIZATION : 0;

        return PortfolioMetrics.builder()
                .totalReturn((curve.get(curve.size() - 1).getEquity() - 1) * 100)
                .maxDrawdown(maxDrawdown)
                .sharpeRatio(sharpe)
                .volatility(std * 100)
                .timestampCount(curve.size())
                .build();
    }
}
