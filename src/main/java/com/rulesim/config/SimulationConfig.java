package com.rulesim.config;

import com.rulesim.domain.enums.AllocationStrategy;
import com.rulesim.domain.enums.RuleSortKey;
import com.rulesim.domain.vo.TransactionCosts;
import com.rulesim.exception.InvalidConfigurationException;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings of one backtest run.
 *
 * <p>Built from {@link RulesimProperties} at the start of a run (or directly in tests) and
 * passed by reference into rule loading, signal generation, trade simulation, walk-forward
 * and portfolio aggregation. Components read nothing else.
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {

    @Builder.Default
    int topNRules = 20;

    @Builder.Default
    RuleSortKey sortBy = RuleSortKey.SUPPORT;

    @Builder.Default
    LocalDate testStartDate = LocalDate.of(2021, 1, 1);

    @Builder.Default
    boolean deduplicate = true;

    @Builder.Default
    TransactionCosts costs = TransactionCosts.builder()
            .spread(0.0002)
            .commission(0.0001)
            .slippage(0.0001)
            .build();

    @Builder.Default
    int trainYears = 5;

    @Builder.Default
    int testYears = 1;

    @Builder.Default
    int startYear = 2010;

    @Builder.Default
    int endYear = 2025;

    @Builder.Default
    AllocationStrategy allocationStrategy = AllocationStrategy.EQUAL_WEIGHT;

    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }

    /**
     * Checks cross-field constraints that bean validation cannot express.
     *
     * @throws InvalidConfigurationException if any setting is out of range
     */
    public void validate() {
        if (topNRules < 0) {
            throw new InvalidConfigurationException("top-n-rules must be >= 0", Map.of("topNRules", topNRules));
        }
        if (sortBy == null || testStartDate == null || costs == null || allocationStrategy == null) {
            throw new InvalidConfigurationException("sort-by, test-start-date, costs and allocation-strategy are required");
        }
        if (costs.getSpread() < 0 || costs.getCommission() < 0 || costs.getSlippage() < 0) {
            throw new InvalidConfigurationException("Transaction costs must be non-negative");
        }
        if (trainYears < 1 || testYears < 1) {
            throw new InvalidConfigurationException(
                    "train-years and test-years must be >= 1", Map.of("trainYears", trainYears, "testYears", testYears));
        }
        if (endYear < startYear) {
            throw new InvalidConfigurationException(
                    "end-year must not precede start-year", Map.of("startYear", startYear, "endYear", endYear));
        }
    }
}
