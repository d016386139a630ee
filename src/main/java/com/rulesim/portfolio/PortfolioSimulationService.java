package com.rulesim.portfolio;

import com.rulesim.config.SimulationConfig;
import com.rulesim.domain.enums.SkipReason;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.PortfolioResult;
import com.rulesim.domain.model.SkippedUnit;
import com.rulesim.exception.BaseException;
import com.rulesim.observability.BacktestMetrics;
import com.rulesim.simulator.BacktestService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Backtests each asset independently and aggregates the results into a portfolio.
 *
 * <p>An asset whose inputs are missing or unreadable is skipped and the run continues
 * with the others. Non-recoverable failures propagate.
 */
@Service
public class PortfolioSimulationService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioSimulationService.class);

    private final BacktestService backtestService;
    private final PortfolioAggregator portfolioAggregator;
    private final BacktestMetrics backtestMetrics;

    public PortfolioSimulationService(
            BacktestService backtestService, PortfolioAggregator portfolioAggregator, BacktestMetrics backtestMetrics) {
        this.backtestService = backtestService;
        this.portfolioAggregator = portfolioAggregator;
        this.backtestMetrics = backtestMetrics;
    }

    public PortfolioResult run(List<String> assets, SimulationConfig config) {
        log.info("Portfolio run over {} assets ({})", assets.size(), config.getAllocationStrategy());

        Map<String, AssetResult> results = new LinkedHashMap<>();
        List<SkippedUnit> skipped = new ArrayList<>();
        for (String asset : assets) {
            try {
                AssetResult result = backtestService.run(asset, config);
                if (!result.hasTrades()) {
                    backtestMetrics.recordSkipped("asset", SkipReason.NO_TRADES);
                }
                results.put(asset, result);
            } catch (BaseException e) {
                if (!e.isRecoverable()) {
                    throw e;
                }
                SkipReason reason = SkipReason.of(e.getErrorCode());
                log.warn("Skipping asset {}: {}", asset, e.getMessage());
                skipped.add(new SkippedUnit(asset, reason, e.getMessage()));
                backtestMetrics.recordSkipped("asset", reason);
            }
        }

        return portfolioAggregator.aggregate(results, config.getAllocationStrategy(), skipped);
    }
}
