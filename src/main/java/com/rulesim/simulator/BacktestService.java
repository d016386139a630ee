package com.rulesim.simulator;

import com.rulesim.config.SimulationConfig;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.EquityPoint;
import com.rulesim.domain.model.RuleSet;
import com.rulesim.domain.model.Signal;
import com.rulesim.domain.model.Trade;
import com.rulesim.domain.model.TradeStatistics;
import com.rulesim.domain.vo.ScanWindow;
import com.rulesim.observability.BacktestMetrics;
import com.rulesim.rules.RuleRepository;
import com.rulesim.signal.SignalGenerator;
import com.rulesim.timeseries.TimeSeries;
import com.rulesim.timeseries.TimeSeriesRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-asset backtest: rules and series are loaded, the series is cut at the configured
 * test start date, and the remainder is scanned and settled.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final RuleRepository ruleRepository;
    private final TimeSeriesRepository timeSeriesRepository;
    private final SignalGenerator signalGenerator;
    private final TradeSimulator tradeSimulator;
    private final BacktestMetrics backtestMetrics;

    public BacktestService(
            RuleRepository ruleRepository,
            TimeSeriesRepository timeSeriesRepository,
            SignalGenerator signalGenerator,
            TradeSimulator tradeSimulator,
            BacktestMetrics backtestMetrics) {
        this.ruleRepository = ruleRepository;
        this.timeSeriesRepository = timeSeriesRepository;
        this.signalGenerator = signalGenerator;
        this.tradeSimulator = tradeSimulator;
        this.backtestMetrics = backtestMetrics;
    }

    /**
     * Runs one asset from {@code config.testStartDate} to the end of its data.
     *
     * @throws com.rulesim.exception.MissingInputException if a rule or data file is absent
     * @throws com.rulesim.exception.DataFormatException if an input cannot be parsed
     */
    public AssetResult run(String asset, SimulationConfig config) {
        return backtestMetrics.timeUnit("asset", () -> {
            log.info("Backtest {} from {}", asset, config.getTestStartDate());
            RuleSet ruleSet = ruleRepository.loadAll(asset, config);
            TimeSeries testData = timeSeriesRepository.load(asset).from(config.getTestStartDate());
            return runOn(asset, ruleSet, testData, config);
        });
    }

    /** Scans and settles an already-loaded series end to end. */
    public AssetResult runOn(String asset, RuleSet ruleSet, TimeSeries series, SimulationConfig config) {
        List<Signal> signals = signalGenerator.generate(ruleSet, series, ScanWindow.all(), config.isDeduplicate());
        backtestMetrics.recordSignals(signals.size());

        List<Trade> trades = tradeSimulator.simulate(signals, series, config.getCosts());
        backtestMetrics.recordTrades(trades.size());

        TradeStatistics statistics = TradeStatisticsCalculator.calculate(trades);
        log.info(
                "{}: {} signals, {} trades, return {}%, win rate {}%",
                asset,
                signals.size(),
                trades.size(),
                String.format("%.2f", statistics.getTotalReturn()),
                String.format("%.1f", statistics.getWinRate()));

        return AssetResult.builder()
                .asset(asset)
                .trades(trades)
                .statistics(statistics)
                .equityCurve(equityCurve(trades))
                .build();
    }

    /** Equity after each trade, {@code 1 + cumulativeReturn / 100}, stamped at entry. */
    static List<EquityPoint> equityCurve(List<Trade> trades) {
        return trades.stream()
                .map(t -> new EquityPoint(t.getEntryTimestamp(), 1 + t.getCumulativeReturn() / 100))
                .toList();
    }
}
