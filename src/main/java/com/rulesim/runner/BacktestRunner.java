package com.rulesim.runner;

import com.rulesim.config.RulesimProperties;
import com.rulesim.config.SimulationConfig;
import com.rulesim.domain.enums.RunMode;
import com.rulesim.domain.enums.SkipReason;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.PortfolioResult;
import com.rulesim.domain.model.WalkForwardReport;
import com.rulesim.exception.BaseException;
import com.rulesim.observability.BacktestMetrics;
import com.rulesim.portfolio.PortfolioSimulationService;
import com.rulesim.reporting.ReportExporter;
import com.rulesim.simulator.BacktestService;
import com.rulesim.walkforward.WalkForwardOrchestrator;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Executes the configured batch run once the context is up.
 *
 * <p>{@code rulesim.runner.mode} selects a single-asset backtest per asset, a walk-forward
 * run per asset, or one portfolio over all assets. Reports go to
 * {@code rulesim.runner.output-directory}. In NONE mode nothing runs, which is what tests
 * and library use rely on.
 *
 * <p>One asset's missing or unreadable input is logged and skipped; the remaining assets
 * still run.
 */
@Component
public class BacktestRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final RulesimProperties rulesimProperties;
    private final BacktestService backtestService;
    private final WalkForwardOrchestrator walkForwardOrchestrator;
    private final PortfolioSimulationService portfolioSimulationService;
    private final ReportExporter reportExporter;
    private final BacktestMetrics backtestMetrics;

    public BacktestRunner(
            RulesimProperties rulesimProperties,
            BacktestService backtestService,
            WalkForwardOrchestrator walkForwardOrchestrator,
            PortfolioSimulationService portfolioSimulationService,
            ReportExporter reportExporter,
            BacktestMetrics backtestMetrics) {
        this.rulesimProperties = rulesimProperties;
        this.backtestService = backtestService;
        this.walkForwardOrchestrator = walkForwardOrchestrator;
        this.portfolioSimulationService = portfolioSimulationService;
        this.reportExporter = reportExporter;
        this.backtestMetrics = backtestMetrics;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunMode mode = rulesimProperties.getRunner().getMode();
        if (mode == RunMode.NONE) {
            log.debug("Runner mode NONE, nothing to execute");
            return;
        }

        List<String> assets = rulesimProperties.getRunner().getAssets();
        if (assets.isEmpty()) {
            log.warn("Runner mode {} configured without assets (rulesim.runner.assets)", mode);
            return;
        }

        SimulationConfig config = rulesimProperties.toSimulationConfig();
        Path outputDirectory = Paths.get(rulesimProperties.getRunner().getOutputDirectory());
        log.info("Starting {} run over {} -> {}", mode, assets, outputDirectory.toAbsolutePath());

        switch (mode) {
            case SINGLE -> assets.forEach(asset -> runSingle(asset, config, outputDirectory));
            case WALK_FORWARD -> assets.forEach(asset -> runWalkForward(asset, config, outputDirectory));
            case PORTFOLIO -> runPortfolio(assets, config, outputDirectory);
            default -> throw new IllegalStateException("Unhandled run mode " + mode);
        }

        log.info(
                "{} run finished: {} signals, {} trades",
                mode, (long) backtestMetrics.getSignalCount(), (long) backtestMetrics.getTradeCount());
    }

    private void runSingle(String asset, SimulationConfig config, Path outputDirectory) {
        try {
            AssetResult result = backtestService.run(asset, config);
            reportExporter.exportBacktest(result, outputDirectory.resolve(asset));
        } catch (BaseException e) {
            skipOrRethrow(asset, e);
        }
    }

    private void runWalkForward(String asset, SimulationConfig config, Path outputDirectory) {
        try {
            WalkForwardReport report = walkForwardOrchestrator.run(asset, config);
            reportExporter.exportWalkForward(report, outputDirectory.resolve(asset));
        } catch (BaseException e) {
            skipOrRethrow(asset, e);
        }
    }

    private void runPortfolio(List<String> assets, SimulationConfig config, Path outputDirectory) {
        PortfolioResult result = portfolioSimulationService.run(assets, config);
        reportExporter.exportPortfolio(result, outputDirectory.resolve("portfolio"));
    }

    private void skipOrRethrow(String asset, BaseException e) {
        if (!e.isRecoverable()) {
            throw e;
        }
        log.warn("Skipping asset {}: {}", asset, e.getMessage());
        backtestMetrics.recordSkipped("asset", SkipReason.of(e.getErrorCode()));
    }
}
