package com.rulesim.walkforward;

import com.rulesim.config.SimulationConfig;
import com.rulesim.domain.enums.SkipReason;
import com.rulesim.domain.model.Period;
import com.rulesim.domain.model.PeriodResult;
import com.rulesim.domain.model.RuleSet;
import com.rulesim.domain.model.Signal;
import com.rulesim.domain.model.SkippedUnit;
import com.rulesim.domain.model.Trade;
import com.rulesim.domain.model.TradeStatistics;
import com.rulesim.domain.model.WalkForwardReport;
import com.rulesim.domain.model.WalkForwardSummary;
import com.rulesim.domain.vo.ScanWindow;
import com.rulesim.observability.BacktestMetrics;
import com.rulesim.rules.RuleRepository;
import com.rulesim.signal.SignalGenerator;
import com.rulesim.simulator.TradeSimulator;
import com.rulesim.simulator.TradeStatisticsCalculator;
import com.rulesim.timeseries.TimeSeries;
import com.rulesim.timeseries.TimeSeriesRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs rolling out-of-sample tests of one asset's rule set.
 *
 * <p>The rule set and the full series are loaded once. Every period then slices the series
 * to its test window, scans and settles it, and reports its metrics. The same rule set is
 * used for every period; it is not re-mined per training window. A period that yields no
 * signals or no trades is logged and recorded as skipped, and stays out of the summary.
 */
@Service
public class WalkForwardOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WalkForwardOrchestrator.class);

    private final RuleRepository ruleRepository;
    private final TimeSeriesRepository timeSeriesRepository;
    private final SignalGenerator signalGenerator;
    private final TradeSimulator tradeSimulator;
    private final BacktestMetrics backtestMetrics;

    public WalkForwardOrchestrator(
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
     * @throws com.rulesim.exception.MissingInputException if a rule or data file is absent
     * @throws com.rulesim.exception.DataFormatException if an input cannot be parsed
     */
    public WalkForwardReport run(String asset, SimulationConfig config) {
        RuleSet ruleSet = ruleRepository.loadAll(asset, config);
        TimeSeries series = timeSeriesRepository.load(asset);
        return run(asset, ruleSet, series, config);
    }

    public WalkForwardReport run(String asset, RuleSet ruleSet, TimeSeries series, SimulationConfig config) {
        List<Period> periods = PeriodGenerator.generate(config);
        log.info(
                "Walk-forward {}: {} periods (train {}y, test {}y, {}-{}), {}",
                asset, periods.size(), config.getTrainYears(), config.getTestYears(),
                config.getStartYear(), config.getEndYear(), ruleSet);

        List<PeriodResult> results = new ArrayList<>();
        List<SkippedUnit> skipped = new ArrayList<>();
        for (Period period : periods) {
            String unitId = asset + " " + period.label();
            if (ruleSet.isEmpty()) {
                skip(skipped, unitId, SkipReason.NO_RULES, "rule set is empty");
                continue;
            }
            Optional<PeriodResult> result =
                    backtestMetrics.timeUnit("period", () -> runPeriod(period, ruleSet, series, config, skipped, unitId));
            result.ifPresent(results::add);
        }

        WalkForwardSummary summary = WalkForwardSummaryCalculator.summarize(results, skipped.size());
        if (summary == null) {
            log.warn("Walk-forward {}: no period produced trades ({} skipped)", asset, skipped.size());
        } else {
            log.info(
                    "Walk-forward {}: {} periods completed, {} skipped, total return {}%, verdict {}",
                    asset, summary.getTotalPeriods(), skipped.size(),
                    String.format("%.2f", summary.getTotalReturn()), summary.getVerdict());
        }

        return WalkForwardReport.builder()
                .asset(asset)
                .periods(periods)
                .results(results)
                .skipped(skipped)
                .summary(summary)
                .build();
    }

    private Optional<PeriodResult> runPeriod(
            Period period, RuleSet ruleSet, TimeSeries series, SimulationConfig config,
            List<SkippedUnit> skipped, String unitId) {
        TimeSeries testData = series.between(period.getTestStart(), period.getTestEnd());

        List<Signal> signals = signalGenerator.generate(ruleSet, testData, ScanWindow.all(), config.isDeduplicate());
        if (signals.isEmpty()) {
            skip(skipped, unitId, SkipReason.NO_SIGNALS, testData.size() + " rows scanned");
            return Optional.empty();
        }
        backtestMetrics.recordSignals(signals.size());

        List<Trade> trades = tradeSimulator.simulate(signals, testData, config.getCosts());
        if (trades.isEmpty()) {
            skip(skipped, unitId, SkipReason.NO_TRADES, signals.size() + " signals, none settled");
            return Optional.empty();
        }
        backtestMetrics.recordTrades(trades.size());

        TradeStatistics stats = TradeStatisticsCalculator.calculate(trades);
        log.debug(
                "{}: {} trades, win rate {}%, return {}%, max DD {}%",
                unitId, stats.getTotalTrades(), String.format("%.1f", stats.getWinRate()),
                String.format("%.2f", stats.getTotalReturn()), String.format("%.2f", stats.getMaxDrawdown()));

        return Optional.of(PeriodResult.builder()
                .period(period)
                .totalTrades(stats.getTotalTrades())
                .winRate(stats.getWinRate())
                .totalReturn(stats.getTotalReturn())
                .totalReturnBeforeCost(stats.getTotalReturnBeforeCost())
                .avgProfit(stats.getAvgProfit())
                .maxDrawdown(stats.getMaxDrawdown())
                .buyTrades(stats.getBuyTrades())
                .sellTrades(stats.getSellTrades())
                .buyReturn(stats.getBuyTotalReturn())
                .sellReturn(stats.getSellTotalReturn())
                .trades(trades)
                .build());
    }

    private void skip(List<SkippedUnit> skipped, String unitId, SkipReason reason, String detail) {
        log.warn("Skipping {}: {} ({})", unitId, reason, detail);
        skipped.add(new SkippedUnit(unitId, reason, detail));
        backtestMetrics.recordSkipped("period", reason);
    }
}
