package com.rulesim.unit.portfolio;

import static com.rulesim.unit.TestData.T0;
import static com.rulesim.unit.portfolio.PortfolioFixtures.asset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.rulesim.domain.enums.AllocationStrategy;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.portfolio.AllocationWeightCalculator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AllocationWeightCalculator")
class AllocationWeightCalculatorTest {

    private static Map<String, AssetResult> assets(AssetResult... results) {
        Map<String, AssetResult> map = new LinkedHashMap<>();
        for (AssetResult r : results) {
            map.put(r.getAsset(), r);
        }
        return map;
    }

    private static double sum(Map<String, Double> weights) {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Test
    @DisplayName("equal weight should give exactly 1/N to each asset")
    void equalWeight() {
        Map<String, Double> weights = AllocationWeightCalculator.calculate(
                assets(asset("A", T0, 1, 2), asset("B", T0, -1, 3), asset("C", T0, 0.5)),
                AllocationStrategy.EQUAL_WEIGHT);

        assertThat(weights).containsOnlyKeys("A", "B", "C");
        assertThat(weights.values()).allSatisfy(w -> assertThat(w).isEqualTo(1.0 / 3));
        assertThat(sum(weights)).isCloseTo(1.0, within(1e-9));
    }

    @Nested
    @DisplayName("Risk parity")
    class RiskParity {

        @Test
        @DisplayName("should weight by inverse volatility and give zero-variance assets nothing")
        void inverseVolatility() {
            // population std: A=1, B=2, C=0
            Map<String, Double> weights = AllocationWeightCalculator.calculate(
                    assets(asset("A", T0, 1, 3), asset("B", T0, 0, 4), asset("C", T0, 1, 1)),
                    AllocationStrategy.RISK_PARITY);

            assertThat(weights.get("A")).isCloseTo(2.0 / 3, within(1e-12));
            assertThat(weights.get("B")).isCloseTo(1.0 / 3, within(1e-12));
            assertThat(weights.get("C")).isZero();
            assertThat(sum(weights)).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("should fall back to equal weight when every asset has zero variance")
        void allZeroVariance() {
            Map<String, Double> weights = AllocationWeightCalculator.calculate(
                    assets(asset("A", T0, 1, 1), asset("B", T0, 2)), AllocationStrategy.RISK_PARITY);

            assertThat(weights.values()).containsOnly(0.5);
        }
    }

    @Nested
    @DisplayName("Performance based")
    class PerformanceBased {

        @Test
        @DisplayName("should weight by positive Sharpe and ignore negative ones")
        void positiveSharpeOnly() {
            AssetResult good = asset("A", T0, 1, 3);
            AssetResult better = asset("B", T0, 2, 3);
            AssetResult bad = asset("C", T0, -1, -3);

            Map<String, Double> weights =
                    AllocationWeightCalculator.calculate(assets(good, better, bad), AllocationStrategy.PERFORMANCE_BASED);

            double sa = good.getStatistics().getSharpeRatio();
            double sb = better.getStatistics().getSharpeRatio();
            assertThat(weights.get("A")).isCloseTo(sa / (sa + sb), within(1e-12));
            assertThat(weights.get("B")).isCloseTo(sb / (sa + sb), within(1e-12));
            assertThat(weights.get("C")).isZero();
        }

        @Test
        @DisplayName("should fall back to equal weight when no Sharpe ratio is positive")
        void fallback() {
            Map<String, Double> weights = AllocationWeightCalculator.calculate(
                    assets(asset("A", T0, -1, -3), asset("B", T0, 1)), AllocationStrategy.PERFORMANCE_BASED);

            assertThat(weights.values()).containsOnly(0.5);
        }
    }
}
