package com.rulesim.portfolio;

import com.rulesim.domain.enums.AllocationStrategy;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.Trade;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes per-asset capital weights that sum to 1.
 *
 * <p>Risk parity weights each asset by the inverse population standard deviation of its
 * per-trade net profit; a zero-variance asset gets weight 0. Performance-based weights are
 * proportional to {@code max(0, sharpe)}. Either falls back to equal weights when every raw
 * weight is 0.
 */
public final class AllocationWeightCalculator {

    private static final Logger log = LoggerFactory.getLogger(AllocationWeightCalculator.class);

    private AllocationWeightCalculator() {}

    /** @return weights keyed by asset, in the iteration order of {@code assets} */
    public static Map<String, Double> calculate(Map<String, AssetResult> assets, AllocationStrategy strategy) {
        Map<String, Double> raw = new LinkedHashMap<>();
        for (Map.Entry<String, AssetResult> entry : assets.entrySet()) {
            raw.put(entry.getKey(), rawWeight(entry.getValue(), strategy));
        }

        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) {
            if (strategy != AllocationStrategy.EQUAL_WEIGHT && !assets.isEmpty()) {
                log.warn("{} weights all zero across {} assets, falling back to equal weight", strategy, assets.size());
            }
            return equalWeights(assets);
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        raw.forEach((asset, weight) -> weights.put(asset, weight / total));
        return weights;
    }

    static Map<String, Double> equalWeights(Map<String, AssetResult> assets) {
        Map<String, Double> weights = new LinkedHashMap<>();
        double weight = 1.0 / assets.size();
        assets.keySet().forEach(asset -> weights.put(asset, weight));
        return weights;
    }

    private static double rawWeight(AssetResult result, AllocationStrategy strategy) {
        return switch (strategy) {
            case EQUAL_WEIGHT -> 1.0;
            case RISK_PARITY -> {
                double[] profits = result.getTrades().stream().mapToDouble(Trade::getNetProfit).toArray();
                double std = new StandardDeviation(false).evaluate(profits);
                yield std > 0 ? 1.0 / std : 0;
            }
            case PERFORMANCE_BASED -> Math.max(0, result.getStatistics().getSharpeRatio());
        };
    }
}
