package com.rulesim.reporting;

import com.opencsv.CSVWriter;
import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.EquityPoint;
import com.rulesim.domain.model.PeriodResult;
import com.rulesim.domain.model.PortfolioResult;
import com.rulesim.domain.model.RulePerformance;
import com.rulesim.domain.model.SkippedUnit;
import com.rulesim.domain.model.Trade;
import com.rulesim.domain.model.TradeStatistics;
import com.rulesim.domain.model.WalkForwardReport;
import com.rulesim.domain.model.WalkForwardSummary;
import com.rulesim.domain.vo.CorrelationMatrix;
import com.rulesim.exception.ReportExportException;
import com.rulesim.simulator.RulePerformanceAnalyzer;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes run results to CSV tables and plain-text summaries.
 *
 * <p>File names are prefixed with the asset (or {@code portfolio}). The output directory is
 * created when missing. Existing files are overwritten.
 */
@Service
public class ReportExporter {

    private static final Logger log = LoggerFactory.getLogger(ReportExporter.class);

    /** @return the files written */
    public List<Path> exportBacktest(AssetResult result, Path directory) {
        String asset = result.getAsset();
        List<Path> written = new ArrayList<>();

        written.add(writeCsv(directory.resolve(asset + "_trades.csv"), tradeRows(result.getTrades())));

        List<String[]> ruleRows = new ArrayList<>();
        ruleRows.add(new String[] {"rule_id", "side", "direction", "trades", "total_return", "avg_profit", "wins", "win_rate"});
        for (RulePerformance rp : RulePerformanceAnalyzer.analyze(result.getTrades())) {
            ruleRows.add(new String[] {
                String.valueOf(rp.getRuleId()), rp.getSide().name(), rp.getDirection().getKey(),
                String.valueOf(rp.getTradeCount()), num(rp.getTotalReturn()), num(rp.getAvgProfit()),
                String.valueOf(rp.getWins()), num(rp.getWinRate())
            });
        }
        written.add(writeCsv(directory.resolve(asset + "_rule_performance.csv"), ruleRows));

        written.add(writeText(directory.resolve(asset + "_summary.txt"), backtestSummary(result)));
        log.info("Exported backtest report for {} to {}", asset, directory);
        return written;
    }

    public List<Path> exportWalkForward(WalkForwardReport report, Path directory) {
        String asset = report.getAsset();
        List<Path> written = new ArrayList<>();

        List<String[]> rows = new ArrayList<>();
        rows.add(new String[] {
            "period", "train_start", "train_end", "test_start", "test_end", "test_year", "trades", "win_rate",
            "total_return", "total_return_before_cost", "avg_profit", "max_drawdown", "buy_trades", "sell_trades",
            "buy_return", "sell_return"
        });
        for (PeriodResult r : report.getResults()) {
            rows.add(new String[] {
                String.valueOf(r.getPeriod().getIndex()), r.getPeriod().getTrainStart().toString(),
                r.getPeriod().getTrainEnd().toString(), r.getPeriod().getTestStart().toString(),
                r.getPeriod().getTestEnd().toString(), String.valueOf(r.getPeriod().getTestYear()),
                String.valueOf(r.getTotalTrades()), num(r.getWinRate()), num(r.getTotalReturn()),
                num(r.getTotalReturnBeforeCost()), num(r.getAvgProfit()), num(r.getMaxDrawdown()),
                String.valueOf(r.getBuyTrades()), String.valueOf(r.getSellTrades()), num(r.getBuyReturn()),
                num(r.getSellReturn())
            });
        }
        written.add(writeCsv(directory.resolve(asset + "_walkforward_periods.csv"), rows));
        written.add(writeText(directory.resolve(asset + "_walkforward_summary.txt"), walkForwardSummary(report)));
        log.info("Exported walk-forward report for {} to {}", asset, directory);
        return written;
    }

    public List<Path> exportPortfolio(PortfolioResult result, Path directory) {
        List<Path> written = new ArrayList<>();

        List<String[]> curve = new ArrayList<>();
        curve.add(new String[] {"timestamp", "equity"});
        for (EquityPoint point : result.getEquityCurve()) {
            curve.add(new String[] {point.getTimestamp().toString(), num(point.getEquity())});
        }
        written.add(writeCsv(directory.resolve("portfolio_equity_curve.csv"), curve));

        List<String[]> assets = new ArrayList<>();
        assets.add(new String[] {"asset", "weight", "trades", "total_return", "win_rate", "max_drawdown", "sharpe"});
        for (Map.Entry<String, AssetResult> entry : result.getAssetResults().entrySet()) {
            TradeStatistics s = entry.getValue().getStatistics();
            assets.add(new String[] {
                entry.getKey(), num(result.getWeights().get(entry.getKey())), String.valueOf(s.getTotalTrades()),
                num(s.getTotalReturn()), num(s.getWinRate()), num(s.getMaxDrawdown()), num(s.getSharpeRatio())
            });
        }
        written.add(writeCsv(directory.resolve("portfolio_asset_metrics.csv"), assets));

        List<String[]> weights = new ArrayList<>();
        weights.add(new String[] {"asset", "weight"});
        result.getWeights().forEach((asset, weight) -> weights.add(new String[] {asset, num(weight)}));
        written.add(writeCsv(directory.resolve("portfolio_weights.csv"), weights));

        written.add(writeCsv(directory.resolve("portfolio_correlation.csv"), correlationRows(result.getCorrelationMatrix())));
        written.add(writeText(directory.resolve("portfolio_summary.txt"), portfolioSummary(result)));
        log.info("Exported portfolio report ({} assets) to {}", result.getAssetResults().size(), directory);
        return written;
    }

    static List<String[]> tradeRows(List<Trade> trades) {
        List<String[]> rows = new ArrayList<>(trades.size() + 1);
        rows.add(new String[] {
            "entry_index", "exit_index", "timestamp", "side", "rule_id", "rule", "support_count", "expected_x",
            "actual_x", "gross_profit", "transaction_cost", "net_profit", "win", "cumulative_return"
        });
        for (Trade t : trades) {
            rows.add(new String[] {
                String.valueOf(t.getEntryIndex()), String.valueOf(t.getExitIndex()),
                String.valueOf(t.getEntryTimestamp()), t.getSide().name(), String.valueOf(t.getRuleId()),
                t.getRuleText(), String.valueOf(t.getSupportCount()), num(t.getExpectedX()), num(t.getActualX()),
                num(t.getGrossProfit()), num(t.getTransactionCost()), num(t.getNetProfit()),
                String.valueOf(t.isWin()), num(t.getCumulativeReturn())
            });
        }
        return rows;
    }

    static List<String[]> correlationRows(CorrelationMatrix matrix) {
        List<String[]> rows = new ArrayList<>();
        List<String> names = matrix.getAssets();
        String[] header = new String[names.size() + 1];
        header[0] = "";
        for (int i = 0; i < names.size(); i++) {
            header[i + 1] = names.get(i);
        }
        rows.add(header);
        for (int i = 0; i < names.size(); i++) {
            String[] row = new String[names.size() + 1];
            row[0] = names.get(i);
            for (int j = 0; j < names.size(); j++) {
                row[j + 1] = num(matrix.get(i, j));
            }
            rows.add(row);
        }
        return rows;
    }

    static String backtestSummary(AssetResult result) {
        TradeStatistics s = result.getStatistics();
        StringBuilder sb = new StringBuilder();
        sb.append("Backtest: ").append(result.getAsset()).append('\n');
        sb.append("Trades: ").append(s.getTotalTrades())
                .append(" (BUY ").append(s.getBuyTrades()).append(", SELL ").append(s.getSellTrades()).append(")\n");
        sb.append(format("Win rate: %.2f%% (%d wins, %d losses)%n", s.getWinRate(), s.getWins(), s.getLosses()));
        sb.append(format("Total return: %.4f%% (before cost %.4f%%, cost %.4f%%)%n",
                s.getTotalReturn(), s.getTotalReturnBeforeCost(), s.getTotalCostPaid()));
        sb.append(format("Average profit: %.4f%% (avg win %.4f%%, avg loss %.4f%%)%n",
                s.getAvgProfit(), s.getAvgWin(), s.getAvgLoss()));
        sb.append(format("Max win / loss: %.4f%% / %.4f%%%n", s.getMaxWin(), s.getMaxLoss()));
        sb.append(format("Max drawdown: %.4f%%%n", s.getMaxDrawdown()));
        sb.append(format("Sharpe ratio: %.4f%n", s.getSharpeRatio()));
        sb.append(format("BUY: win rate %.2f%%, avg %.4f%%, total %.4f%%%n",
                s.getBuyWinRate(), s.getBuyAvgProfit(), s.getBuyTotalReturn()));
        sb.append(format("SELL: win rate %.2f%%, avg %.4f%%, total %.4f%%%n",
                s.getSellWinRate(), s.getSellAvgProfit(), s.getSellTotalReturn()));
        return sb.toString();
    }

    static String walkForwardSummary(WalkForwardReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Walk-forward: ").append(report.getAsset()).append('\n');
        sb.append("Periods generated: ").append(report.getPeriods().size()).append('\n');
        WalkForwardSummary s = report.getSummary();
        if (s == null) {
            sb.append("No period produced trades\n");
        } else {
            sb.append("Periods completed: ").append(s.getTotalPeriods()).append('\n');
            sb.append(format("Total return: %.4f%%%n", s.getTotalReturn()));
            sb.append(format("Average return per period: %.4f%% (std %.4f%%)%n",
                    s.getAvgReturnPerPeriod(), s.getStdReturn()));
            sb.append(format("Consistency: %.1f%% (%d profitable, %d losing)%n",
                    s.getConsistency(), s.getWinPeriods(), s.getLosePeriods()));
            sb.append("Total trades: ").append(s.getTotalTrades()).append('\n');
            sb.append(format("Average win rate: %.2f%%%n", s.getAvgWinRate()));
            sb.append(format("Average max drawdown: %.4f%%%n", s.getAvgMaxDrawdown()));
            sb.append(format("Best / worst period: %.4f%% / %.4f%%%n", s.getBestPeriodReturn(), s.getWorstPeriodReturn()));
            sb.append("Consistency rating: ").append(s.getConsistencyRating()).append('\n');
            sb.append("Return rating: ").append(s.getReturnRating()).append('\n');
            sb.append("Stability rating: ").append(s.getStabilityRating()).append('\n');
            sb.append("Verdict: ").append(s.getVerdict()).append('\n');
        }
        appendSkipped(sb, report.getSkipped());
        return sb.toString();
    }

    static String portfolioSummary(PortfolioResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Portfolio (").append(result.getStrategy()).append(")\n");
        if (result.isEmpty()) {
            sb.append("No asset produced trades\n");
        } else {
            sb.append("Assets: ").append(String.join(", ", result.getAssetResults().keySet())).append('\n');
            result.getWeights().forEach((asset, w) -> sb.append(format("  %s weight %.4f%n", asset, w)));
            sb.append(format("Total return: %.4f%%%n", result.getMetrics().getTotalReturn()));
            sb.append(format("Max drawdown: %.4f%%%n", result.getMetrics().getMaxDrawdown()));
            sb.append(format("Sharpe ratio: %.4f%n", result.getMetrics().getSharpeRatio()));
            sb.append(format("Volatility: %.4f%%%n", result.getMetrics().getVolatility()));
            sb.append("Timestamps: ").append(result.getMetrics().getTimestampCount()).append('\n');
            sb.append(format("Average correlation: %.4f%n", result.getAverageCorrelation()));
            sb.append(format("Diversification benefit: %.4f%%%n", result.getDiversificationBenefit()));
            sb.append("Grade: ").append(result.getGrade()).append('\n');
        }
        appendSkipped(sb, result.getSkippedAssets());
        return sb.toString();
    }

    private static void appendSkipped(StringBuilder sb, List<SkippedUnit> skipped) {
        sb.append("Skipped: ").append(skipped.size()).append('\n');
        for (SkippedUnit unit : skipped) {
            sb.append("  ").append(unit.getUnitId()).append(": ").append(unit.getReason())
                    .append(" (").append(unit.getDetail()).append(")\n");
        }
    }

    private Path writeCsv(Path path, List<String[]> rows) {
        try {
            ensureParent(path);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                    CSVWriter csvWriter = new CSVWriter(writer)) {
                // Quote only fields that need it
                csvWriter.writeAll(rows, false);
            }
            return path;
        } catch (IOException e) {
            throw new ReportExportException(path, e);
        }
    }

    private Path writeText(Path path, String content) {
        try {
            ensureParent(path);
            Files.writeString(path, content, StandardCharsets.UTF_8);
            return path;
        } catch (IOException e) {
            throw new ReportExportException(path, e);
        }
    }

    private static void ensureParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static String num(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    private static String num(Double value) {
        return value == null ? "" : num(value.doubleValue());
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
