package com.rulesim.unit.simulator;

import static com.rulesim.unit.TestData.cond;
import static com.rulesim.unit.TestData.rule;
import static com.rulesim.unit.TestData.scenarioSeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

import com.rulesim.config.SimulationConfig;
import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.RuleSet;
import com.rulesim.exception.MissingInputException;
import com.rulesim.observability.BacktestMetrics;
import com.rulesim.rules.RuleRepository;
import com.rulesim.signal.SignalGenerator;
import com.rulesim.simulator.BacktestService;
import com.rulesim.simulator.TradeSimulator;
import com.rulesim.timeseries.TimeSeriesRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class BacktestServiceTest {

    @Mock
    private RuleRepository ruleRepository;

    @Mock
    private TimeSeriesRepository timeSeriesRepository;

    private BacktestMetrics metrics;
    private BacktestService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        metrics = new BacktestMetrics(new SimpleMeterRegistry());
        service = new BacktestService(
                ruleRepository, timeSeriesRepository, new SignalGenerator(), new TradeSimulator(), metrics);
    }

    @Test
    void run_slicesFromTestStartAndBuildsEquityCurve() {
        SimulationConfig config = SimulationConfig.builder()
                .testStartDate(LocalDate.of(2021, 1, 5))
                .build();
        RuleSet ruleSet = new RuleSet(
                "TEST", List.of(rule(0, RuleDirection.POSITIVE, 10, cond("A", 0))), List.of());
        when(ruleRepository.loadAll("TEST", config)).thenReturn(ruleSet);
        when(timeSeriesRepository.load("TEST")).thenReturn(scenarioSeries());

        AssetResult result = service.run("TEST", config);

        // Rows from 2021-01-05 onward: A=[1,1,0,1,0], X=[-0.2,0.3,-0.1,0.05,0.2]
        assertThat(result.getTrades()).extracting(t -> t.getEntryIndex()).containsExactly(0, 1, 3);
        assertThat(result.getStatistics().getTotalTrades()).isEqualTo(3);
        assertThat(result.getEquityCurve()).hasSize(3);
        double lastCumulative = result.getTrades().get(2).getCumulativeReturn();
        assertThat(result.getEquityCurve().get(2).getEquity()).isCloseTo(1 + lastCumulative / 100, within(1e-12));
        assertThat(metrics.getSignalCount()).isEqualTo(3.0);
        assertThat(metrics.getTradeCount()).isEqualTo(3.0);
    }

    @Test
    void run_withoutMatches_returnsEmptyResult() {
        SimulationConfig config = SimulationConfig.builder().testStartDate(LocalDate.of(2021, 1, 1)).build();
        RuleSet ruleSet = new RuleSet(
                "TEST", List.of(rule(0, RuleDirection.POSITIVE, 10, cond("A", 1), cond("B", 2))), List.of());
        when(ruleRepository.loadAll("TEST", config)).thenReturn(ruleSet);
        when(timeSeriesRepository.load("TEST")).thenReturn(scenarioSeries());

        AssetResult result = service.run("TEST", config);

        assertThat(result.hasTrades()).isFalse();
        assertThat(result.getStatistics().isEmpty()).isTrue();
        assertThat(result.getEquityCurve()).isEmpty();
    }

    @Test
    void run_missingInput_propagates() {
        SimulationConfig config = SimulationConfig.defaults();
        when(ruleRepository.loadAll("NOPE", config))
                .thenThrow(new MissingInputException("Rule file", Path.of("output/NOPE/positive/pool/zrp01a.txt")));

        assertThatThrownBy(() -> service.run("NOPE", config)).isInstanceOf(MissingInputException.class);
    }
}
