package com.rulesim.unit.portfolio;

import static com.rulesim.unit.TestData.T0;
import static com.rulesim.unit.TestData.trades;
import static com.rulesim.unit.portfolio.PortfolioFixtures.asset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.rulesim.domain.enums.AllocationStrategy;
import com.rulesim.domain.enums.PortfolioGrade;
import com.rulesim.domain.enums.SkipReason;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.EquityPoint;
import com.rulesim.domain.model.PortfolioMetrics;
import com.rulesim.domain.model.PortfolioResult;
import com.rulesim.domain.model.SkippedUnit;
import com.rulesim.domain.vo.CorrelationMatrix;
import com.rulesim.portfolio.CorrelationAnalyzer;
import com.rulesim.portfolio.EquityCurveCombiner;
import com.rulesim.portfolio.PortfolioAggregator;
import com.rulesim.portfolio.PortfolioMetricsCalculator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Portfolio aggregation")
class PortfolioAggregatorTest {

    private final PortfolioAggregator aggregator = new PortfolioAggregator();

    private static Map<String, AssetResult> assets(AssetResult... results) {
        Map<String, AssetResult> map = new LinkedHashMap<>();
        for (AssetResult r : results) {
            map.put(r.getAsset(), r);
        }
        return map;
    }

    @Nested
    @DisplayName("PortfolioAggregator")
    class Aggregator {

        @Test
        @DisplayName("should blend +12% and -4% into 4% under equal weight")
        void scenarioC() {
            PortfolioResult result = aggregator.aggregate(
                    assets(asset("UP", T0, 6, 6), asset("DOWN", T0, -2, -2)), AllocationStrategy.EQUAL_WEIGHT);

            double total = result.getMetrics().getTotalReturn();
            assertThat(total).isCloseTo(4.0, within(1e-9));
            assertThat(total).isGreaterThan(-4.0).isLessThan(12.0);
            assertThat(result.getWeights()).containsEntry("UP", 0.5).containsEntry("DOWN", 0.5);
            // mean single-asset return is (12 - 4) / 2
            assertThat(result.getDiversificationBenefit()).isCloseTo(0.0, within(1e-9));
            assertThat(result.getSkippedAssets()).isEmpty();
        }

        @Test
        @DisplayName("should exclude assets without trades and report them as skipped")
        void excludesEmptyAssets() {
            AssetResult idle = asset("IDLE", List.of());

            PortfolioResult result = aggregator.aggregate(
                    assets(asset("A", T0, 1, 2), idle), AllocationStrategy.EQUAL_WEIGHT);

            assertThat(result.getAssetResults()).containsOnlyKeys("A");
            assertThat(result.getWeights()).containsOnly(Map.entry("A", 1.0));
            assertThat(result.getCorrelationMatrix().getAssets()).containsExactly("A");
            assertThat(result.getSkippedAssets()).singleElement().satisfies(s -> {
                assertThat(s.getUnitId()).isEqualTo("IDLE");
                assertThat(s.getReason()).isEqualTo(SkipReason.NO_TRADES);
            });
        }

        @Test
        @DisplayName("should return an empty result when no asset has trades")
        void emptyPortfolio() {
            List<SkippedUnit> earlier = List.of(new SkippedUnit("GONE", SkipReason.MISSING_INPUT, "no file"));

            PortfolioResult result = aggregator.aggregate(
                    assets(asset("IDLE", List.of())), AllocationStrategy.RISK_PARITY, earlier);

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.getGrade()).isNull();
            assertThat(result.getEquityCurve()).isEmpty();
            assertThat(result.getWeights()).isEmpty();
            assertThat(result.getSkippedAssets()).extracting(SkippedUnit::getUnitId).containsExactly("GONE", "IDLE");
        }

        @Test
        @DisplayName("should grade a strong portfolio above a weak one")
        void grades() {
            PortfolioResult strong = aggregator.aggregate(
                    assets(asset("A", T0, 20, 18, 22, 19)), AllocationStrategy.EQUAL_WEIGHT);
            PortfolioResult weak = aggregator.aggregate(
                    assets(asset("A", T0, 1, -2, 0.5)), AllocationStrategy.EQUAL_WEIGHT);

            assertThat(strong.getGrade()).isEqualTo(PortfolioGrade.EXCELLENT);
            assertThat(weak.getGrade()).isEqualTo(PortfolioGrade.POOR);
        }
    }

    @Nested
    @DisplayName("EquityCurveCombiner")
    class Combiner {

        @Test
        @DisplayName("should forward-fill each asset on the union timeline, starting at 1.0")
        void forwardFill() {
            AssetResult a = asset("A", List.of(
                    trades(T0, 10).get(0),
                    trades(T0.plusDays(2), 0).get(0)));
            AssetResult b = asset("B", T0.plusDays(1), 20);
            Map<String, AssetResult> both = assets(a, b);

            List<EquityPoint> curve = EquityCurveCombiner.combine(both, Map.of("A", 0.5, "B", 0.5));

            assertThat(curve).extracting(EquityPoint::getTimestamp)
                    .containsExactly(T0, T0.plusDays(1), T0.plusDays(2));
            assertThat(curve.get(0).getEquity()).isCloseTo(1.05, within(1e-12));
            assertThat(curve.get(1).getEquity()).isCloseTo(1.15, within(1e-12));
            // A's second trade restarts its cumulative at 0
            assertThat(curve.get(2).getEquity()).isCloseTo(1.10, within(1e-12));
        }
    }

    @Nested
    @DisplayName("PortfolioMetricsCalculator")
    class Metrics {

        @Test
        @DisplayName("should measure return against 1.0 and drawdown against the running peak")
        void returnAndDrawdown() {
            List<EquityPoint> curve = List.of(
                    new EquityPoint(T0, 1.0), new EquityPoint(T0.plusDays(1), 1.1), new EquityPoint(T0.plusDays(2), 0.99));

            PortfolioMetrics metrics = PortfolioMetricsCalculator.calculate(curve);

            assertThat(metrics.getTotalReturn()).isCloseTo(-1.0, within(1e-9));
            assertThat(metrics.getMaxDrawdown()).isCloseTo(-10.0, within(1e-9));
            assertThat(metrics.getSharpeRatio()).isCloseTo(0.0, within(1e-9));
            assertThat(metrics.getVolatility()).isCloseTo(Math.sqrt(0.02) * 100, within(1e-9));
            assertThat(metrics.getTimestampCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should return zero Sharpe and volatility for a single point")
        void singlePoint() {
            PortfolioMetrics metrics = PortfolioMetricsCalculator.calculate(List.of(new EquityPoint(T0, 1.2)));

            assertThat(metrics.getTotalReturn()).isCloseTo(20.0, within(1e-9));
            assertThat(metrics.getSharpeRatio()).isZero();
            assertThat(metrics.getVolatility()).isZero();
        }
    }

    @Nested
    @DisplayName("CorrelationAnalyzer")
    class Correlation {

        @Test
        @DisplayName("should correlate profits on the shared timeline with gaps filled by 0")
        void correlates() {
            Map<String, AssetResult> all = assets(
                    asset("A", T0, 1, 2, 3), asset("B", T0, 2, 4, 6), asset("C", T0, 3, 2, 1), asset("D", T0, 1, 1, 1));

            CorrelationMatrix matrix = CorrelationAnalyzer.correlate(all, EquityCurveCombiner.timeline(all));

            assertThat(matrix.get("A", "A")).isEqualTo(1.0);
            assertThat(matrix.get("A", "B")).isCloseTo(1.0, within(1e-12));
            assertThat(matrix.get("A", "C")).isCloseTo(-1.0, within(1e-12));
            assertThat(matrix.get("B", "A")).isEqualTo(matrix.get("A", "B"));
            assertThat(matrix.get("A", "D")).isNaN();
            // defined pairs: AB=1, AC=-1, BC=-1
            assertThat(matrix.averagePairwise()).isCloseTo(-1.0 / 3, within(1e-12));
        }

        @Test
        @DisplayName("should treat a missing trade as a zero profit")
        void missingAsZero() {
            Map<String, AssetResult> all = assets(asset("A", T0, 1, 2), asset("B", T0.plusDays(1), 5));

            CorrelationMatrix matrix = CorrelationAnalyzer.correlate(all, EquityCurveCombiner.timeline(all));

            // A=[1,2], B=[0,5] on the two-point timeline
            assertThat(matrix.get("A", "B")).isCloseTo(1.0, within(1e-12));
        }
    }
}
