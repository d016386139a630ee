package com.rulesim.unit.simulator;

import static com.rulesim.unit.TestData.alwaysActive;
import static com.rulesim.unit.TestData.cond;
import static com.rulesim.unit.TestData.rule;
import static com.rulesim.unit.TestData.scenarioSeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.TradeSide;
import com.rulesim.domain.model.Rule;
import com.rulesim.domain.model.Signal;
import com.rulesim.domain.model.Trade;
import com.rulesim.domain.vo.ScanWindow;
import com.rulesim.domain.vo.TransactionCosts;
import com.rulesim.signal.SignalGenerator;
import com.rulesim.simulator.TradeSimulator;
import com.rulesim.timeseries.TimeSeries;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TradeSimulator")
class TradeSimulatorTest {

    private static final TransactionCosts COSTS =
            TransactionCosts.builder().spread(0.0002).commission(0.0001).slippage(0.0001).build();

    private final TradeSimulator simulator = new TradeSimulator();

    private static Signal signal(int index, TimeSeries series, Rule rule) {
        return Signal.builder()
                .index(index)
                .timestamp(series.timestamp(index))
                .side(rule.getSide())
                .rule(rule)
                .expectedX(rule.getXMean())
                .build();
    }

    @Nested
    @DisplayName("Settlement")
    class Settlement {

        @Test
        @DisplayName("should net 0.05 - 0.04 = 0.01 for a BUY with the default costs")
        void scenarioB() {
            TimeSeries series = scenarioSeries();
            Rule buy = rule(0, RuleDirection.POSITIVE, 10, cond("A", 1), cond("B", 1));

            List<Signal> signals = new SignalGenerator().generate(List.of(buy), series, ScanWindow.all(), true);
            List<Trade> trades = simulator.simulate(signals, series, COSTS);

            assertThat(trades).hasSize(1);
            Trade trade = trades.get(0);
            assertThat(trade.getEntryIndex()).isEqualTo(3);
            assertThat(trade.getExitIndex()).isEqualTo(4);
            assertThat(trade.getActualX()).isEqualTo(0.05);
            assertThat(trade.getGrossProfit()).isEqualTo(0.05);
            assertThat(trade.getTransactionCost()).isCloseTo(0.04, within(1e-12));
            assertThat(trade.getNetProfit()).isCloseTo(0.01, within(1e-12));
            assertThat(trade.isWin()).isTrue();
            assertThat(trade.getRuleText()).isEqualTo("A(t-1) AND B(t-1)");
        }

        @Test
        @DisplayName("should flip the sign of the outcome for SELL")
        void sellSign() {
            TimeSeries series = scenarioSeries();
            Rule sell = rule(1, RuleDirection.NEGATIVE, 10, cond("A", 0));

            List<Trade> trades = simulator.simulate(List.of(signal(0, series, sell)), series, TransactionCosts.zero());

            assertThat(trades.get(0).getSide()).isEqualTo(TradeSide.SELL);
            assertThat(trades.get(0).getActualX()).isEqualTo(-0.2);
            assertThat(trades.get(0).getGrossProfit()).isEqualTo(0.2);
        }

        @Test
        @DisplayName("should hold exit = entry + 1 and both profit identities for every trade")
        void identities() {
            TimeSeries series = alwaysActive("S", new double[] {0.3, -0.4, 0.2, 0.0, -0.1, 0.6});
            Rule buy = rule(0, RuleDirection.POSITIVE, 10, cond("A", 0));
            Rule sell = rule(1, RuleDirection.NEGATIVE, 10, cond("A", 0));
            List<Signal> signals = new SignalGenerator().generate(List.of(buy, sell), series, ScanWindow.all(), false);

            List<Trade> trades = simulator.simulate(signals, series, COSTS);

            assertThat(trades).hasSize(10);
            double cost = COSTS.getTotal() * 100;
            double previous = 0;
            for (Trade trade : trades) {
                assertThat(trade.getExitIndex()).isEqualTo(trade.getEntryIndex() + 1).isLessThan(series.size());
                double expectedGross = trade.getSide() == TradeSide.BUY ? trade.getActualX() : -trade.getActualX();
                assertThat(trade.getGrossProfit()).isEqualTo(expectedGross);
                assertThat(trade.getNetProfit()).isEqualTo(trade.getGrossProfit() - cost);
                assertThat(trade.getCumulativeReturn() - previous).isCloseTo(trade.getNetProfit(), within(1e-12));
                previous = trade.getCumulativeReturn();
            }
        }
    }

    @Nested
    @DisplayName("Ordering and edge cases")
    class EdgeCases {

        @Test
        @DisplayName("should return an empty list for no signals")
        void noSignals() {
            assertThat(simulator.simulate(List.of(), scenarioSeries(), COSTS)).isEmpty();
        }

        @Test
        @DisplayName("should drop a signal at the last row")
        void dropsLastRow() {
            TimeSeries series = scenarioSeries();
            Rule buy = rule(0, RuleDirection.POSITIVE, 10, cond("A", 0));

            List<Trade> trades =
                    simulator.simulate(List.of(signal(1, series, buy), signal(5, series, buy)), series, COSTS);

            assertThat(trades).extracting(Trade::getEntryIndex).containsExactly(1);
        }

        @Test
        @DisplayName("should accumulate in entry order regardless of input order")
        void sortsByEntry() {
            TimeSeries series = scenarioSeries();
            Rule buy = rule(0, RuleDirection.POSITIVE, 10, cond("A", 0));

            List<Trade> trades = simulator.simulate(
                    List.of(signal(2, series, buy), signal(0, series, buy)), series, TransactionCosts.zero());

            assertThat(trades).extracting(Trade::getEntryIndex).containsExactly(0, 2);
            assertThat(trades.get(0).getCumulativeReturn()).isEqualTo(-0.2);
            assertThat(trades.get(1).getCumulativeReturn()).isCloseTo(-0.3, within(1e-12));
        }

        @Test
        @DisplayName("should count a zero net profit as a loss")
        void zeroIsNotAWin() {
            TimeSeries series = alwaysActive("S", new double[] {0.0, 0.0});
            Rule buy = rule(0, RuleDirection.POSITIVE, 10, cond("A", 0));

            List<Trade> trades = simulator.simulate(List.of(signal(0, series, buy)), series, TransactionCosts.zero());

            assertThat(trades.get(0).isWin()).isFalse();
        }
    }
}
