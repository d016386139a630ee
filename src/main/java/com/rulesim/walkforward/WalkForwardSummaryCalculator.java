package com.rulesim.walkforward;

import com.rulesim.domain.enums.PerformanceRating;
import com.rulesim.domain.enums.WalkForwardVerdict;
import com.rulesim.domain.model.PeriodResult;
import com.rulesim.domain.model.WalkForwardSummary;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Aggregates completed walk-forward periods.
 *
 * <p>Skipped periods are not part of {@code results} and therefore never enter a
 * denominator. Standard deviation is the population form.
 */
public final class WalkForwardSummaryCalculator {

    private WalkForwardSummaryCalculator() {}

    /** @return the summary, or null when no period completed */
    public static WalkForwardSummary summarize(List<PeriodResult> results, int skippedPeriods) {
        if (results.isEmpty()) {
            return null;
        }

        double[] returns = results.stream().mapToDouble(PeriodResult::getTotalReturn).toArray();
        int n = returns.length;
        double total = 0;
        double best = Double.NEGATIVE_INFINITY;
        double worst = Double.POSITIVE_INFINITY;
        int winPeriods = 0;
        for (double r : returns) {
            total += r;
            best = Math.max(best, r);
            worst = Math.min(worst, r);
            if (r > 0) {
                winPeriods++;
            }
        }
        double avgReturn = total / n;
        double std = new StandardDeviation(false).evaluate(returns);
        double consistency = winPeriods * 100.0 / n;

        return WalkForwardSummary.builder()
                .totalPeriods(n)
                .skippedPeriods(skippedPeriods)
                .totalReturn(total)
                .avgReturnPerPeriod(avgReturn)
                .stdReturn(std)
                .winPeriods(winPeriods)
                .losePeriods(n - winPeriods)
                .consistency(consistency)
                .totalTrades(results.stream().mapToInt(PeriodResult::getTotalTrades).sum())
                .avgWinRate(results.stream().mapToDouble(PeriodResult::getWinRate).average().orElse(0))
                .avgMaxDrawdown(results.stream().mapToDouble(PeriodResult::getMaxDrawdown).average().orElse(0))
                .bestPeriodReturn(best)
                .worstPeriodReturn(worst)
                .consistencyRating(rateConsistency(consistency))
                .returnRating(rateReturn(avgReturn))
                .stabilityRating(rateStability(std))
                .verdict(verdict(consistency, avgReturn))
                .build();
    }

    static PerformanceRating rateConsistency(double consistency) {
        if (consistency >= 70) {
            return PerformanceRating.EXCELLENT;
        }
        return consistency >= 50 ? PerformanceRating.GOOD : PerformanceRating.POOR;
    }

    static PerformanceRating rateReturn(double avgReturn) {
        if (avgReturn >= 2) {
            return PerformanceRating.GOOD;
        }
        return avgReturn >= 0 ? PerformanceRating.FAIR : PerformanceRating.POOR;
    }

    static PerformanceRating rateStability(double std) {
        if (std < 5) {
            return PerformanceRating.GOOD;
        }
        return std < 10 ? PerformanceRating.FAIR : PerformanceRating.POOR;
    }

    static WalkForwardVerdict verdict(double consistency, double avgReturn) {
        if (consistency >= 70 && avgReturn >= 2) {
            return WalkForwardVerdict.PASS;
        }
        if (consistency >= 50 || avgReturn >= 0) {
            return WalkForwardVerdict.MARGINAL;
        }
        return WalkForwardVerdict.FAIL;
    }
}
