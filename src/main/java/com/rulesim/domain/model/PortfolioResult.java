package com.rulesim.domain.model;

import com.rulesim.domain.enums.AllocationStrategy;
import com.rulesim.domain.enums.PortfolioGrade;
import com.rulesim.domain.vo.CorrelationMatrix;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Multi-asset portfolio outcome: the included assets, their weights, the blended equity
 * curve and its metrics, and the cross-asset correlation of per-trade profits.
 *
 * <p>An empty result (no asset produced trades) has no weights, no equity curve and a null
 * grade. Use {@link #isEmpty()} before reading metrics.
 */
@Value
@Builder
public class PortfolioResult {

    AllocationStrategy strategy;

    /** Included assets in request order. */
    Map<String, AssetResult> assetResults;

    Map<String, Double> weights;
    List<EquityPoint> equityCurve;
    PortfolioMetrics metrics;
    CorrelationMatrix correlationMatrix;
    double averageCorrelation;

    /** Portfolio total return minus the mean single-asset total return, in percent. */
    double diversificationBenefit;

    PortfolioGrade grade;
    List<SkippedUnit> skippedAssets;

    public boolean isEmpty() {
        return assetResults.isEmpty();
    }

    public static PortfolioResult empty(AllocationStrategy strategy, List<SkippedUnit> skippedAssets) {
        return PortfolioResult.builder()
                .strategy(strategy)
                .assetResults(Map.of())
                .weights(Map.of())
                .equityCurve(List.of())
                .metrics(PortfolioMetrics.empty())
                .correlationMatrix(CorrelationMatrix.empty())
                .averageCorrelation(Double.NaN)
                .skippedAssets(List.copyOf(skippedAssets))
                .build();
    }
}
