package com.rulesim.portfolio;

import com.rulesim.domain.enums.AllocationStrategy;
import com.rulesim.domain.enums.PortfolioGrade;
import com.rulesim.domain.enums.SkipReason;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.EquityPoint;
import com.rulesim.domain.model.PortfolioMetrics;
import com.rulesim.domain.model.PortfolioResult;
import com.rulesim.domain.model.SkippedUnit;
import com.rulesim.domain.vo.CorrelationMatrix;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines per-asset backtest results into one portfolio.
 *
 * <p>Assets without trades are excluded from weights, the equity curve and the correlation
 * matrix, and reported as skipped. When no asset is left the result is empty rather than
 * an error.
 */
@Component
public class PortfolioAggregator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioAggregator.class);

    public PortfolioResult aggregate(Map<String, AssetResult> results, AllocationStrategy strategy) {
        return aggregate(results, strategy, List.of());
    }

    /**
     * @param results        per-asset results in request order
     * @param strategy       weighting scheme
     * @param alreadySkipped assets that failed before producing a result, carried into the output
     */
    public PortfolioResult aggregate(
            Map<String, AssetResult> results, AllocationStrategy strategy, List<SkippedUnit> alreadySkipped) {
        List<SkippedUnit> skipped = new ArrayList<>(alreadySkipped);
        Map<String, AssetResult> included = new LinkedHashMap<>();
        results.forEach((asset, result) -> {
            if (result.hasTrades()) {
                included.put(asset, result);
            } else {
                log.warn("Excluding {} from portfolio: no trades", asset);
                skipped.add(new SkippedUnit(asset, SkipReason.NO_TRADES, "asset produced no trades"));
            }
        });

        if (included.isEmpty()) {
            log.warn("Portfolio is empty: none of {} assets produced trades", results.size() + alreadySkipped.size());
            return PortfolioResult.empty(strategy, skipped);
        }

        Map<String, Double> weights = AllocationWeightCalculator.calculate(included, strategy);
        List<EquityPoint> curve = EquityCurveCombiner.combine(included, weights);
        PortfolioMetrics metrics = PortfolioMetricsCalculator.calculate(curve);
        CorrelationMatrix correlation = CorrelationAnalyzer.correlate(included, EquityCurveCombiner.timeline(included));

        double meanAssetReturn = included.values().stream()
                .mapToDouble(r -> r.getStatistics().getTotalReturn())
                .average()
                .orElse(0);
        PortfolioGrade grade = grade(metrics);

        log.info(
                "Portfolio ({}, {} assets, {} skipped): return {}%, max DD {}%, Sharpe {}, grade {}",
                strategy, included.size(), skipped.size(),
                String.format("%.2f", metrics.getTotalReturn()),
                String.format("%.2f", metrics.getMaxDrawdown()),
                String.format("%.2f", metrics.getSharpeRatio()),
                grade);

        return PortfolioResult.builder()
                .strategy(strategy)
                .assetResults(included)
                .weights(weights)
                .equityCurve(curve)
                .metrics(metrics)
                .correlationMatrix(correlation)
                .averageCorrelation(correlation.averagePairwise())
                .diversificationBenefit(metrics.getTotalReturn() - meanAssetReturn)
                .grade(grade)
                .skippedAssets(skipped)
                .build();
    }

    static PortfolioGrade grade(PortfolioMetrics metrics) {
        double ret = metrics.getTotalReturn();
        double sharpe = metrics.getSharpeRatio();
        double drawdown = Math.abs(metrics.getMaxDrawdown());
        if (ret > 50 && sharpe > 1 && drawdown < 20) {
            return PortfolioGrade.EXCELLENT;
        }
        if (ret > 30 && sharpe > 0.5 && drawdown < 30) {
            return PortfolioGrade.GOOD;
        }
        if (ret > 15 && sharpe > 0.3) {
            return PortfolioGrade.MARGINAL;
        }
        return PortfolioGrade.POOR;
    }
}
