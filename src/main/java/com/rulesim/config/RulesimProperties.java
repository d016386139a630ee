package com.rulesim.config;

import com.rulesim.domain.enums.AllocationStrategy;
import com.rulesim.domain.enums.RuleSortKey;
import com.rulesim.domain.enums.RunMode;
import com.rulesim.domain.vo.TransactionCosts;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for backtest runs under the {@code rulesim} prefix.
 *
 * <p>These are the mutable, Spring-bound settings. Each run snapshots them into an
 * immutable {@link SimulationConfig} via {@link #toSimulationConfig()} and passes that
 * snapshot explicitly to every component, so a run never observes a property change
 * halfway through.
 *
 * <p>Input locations are path patterns where {@code {asset}} and {@code {direction}} are
 * substituted (direction is {@code positive} or {@code negative}).
 */
@Configuration
@ConfigurationProperties(prefix = "rulesim")
@Validated
@Getter
@Setter
public class RulesimProperties {

    /** First date of the out-of-sample window for single-asset and portfolio runs. */
    @NotNull
    private LocalDate testStartDate = LocalDate.of(2021, 1, 1);

    /** Keep at most one signal per timestamp (highest support wins). */
    private boolean deduplicate = true;

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Costs costs = new Costs();

    @Valid
    private WalkForward walkForward = new WalkForward();

    @Valid
    private Portfolio portfolio = new Portfolio();

    @Valid
    private Input input = new Input();

    @Valid
    private Runner runner = new Runner();

    public SimulationConfig toSimulationConfig() {
        SimulationConfig config = SimulationConfig.builder()
                .topNRules(rules.getTopNRules())
                .sortBy(rules.getSortBy())
                .testStartDate(testStartDate)
                .deduplicate(deduplicate)
                .costs(TransactionCosts.builder()
                        .spread(costs.getSpread())
                        .commission(costs.getCommission())
                        .slippage(costs.getSlippage())
                        .build())
                .trainYears(walkForward.getTrainYears())
                .testYears(walkForward.getTestYears())
                .startYear(walkForward.getStartYear())
                .endYear(walkForward.getEndYear())
                .allocationStrategy(portfolio.getAllocationStrategy())
                .build();
        config.validate();
        return config;
    }

    @Getter
    @Setter
    public static class Rules {

        /** Rules kept per direction after sorting. 0 keeps the whole pool. */
        @Min(0)
        private int topNRules = 20;

        @NotNull
        private RuleSortKey sortBy = RuleSortKey.SUPPORT;
    }

    @Getter
    @Setter
    public static class Costs {

        @DecimalMin("0.0")
        private double spread = 0.0002;

        @DecimalMin("0.0")
        private double commission = 0.0001;

        @DecimalMin("0.0")
        private double slippage = 0.0001;
    }

    @Getter
    @Setter
    public static class WalkForward {

        @Min(1)
        private int trainYears = 5;

        @Min(1)
        private int testYears = 1;

        private int startYear = 2010;
        private int endYear = 2025;
    }

    @Getter
    @Setter
    public static class Portfolio {

        @NotNull
        private AllocationStrategy allocationStrategy = AllocationStrategy.EQUAL_WEIGHT;
    }

    @Getter
    @Setter
    public static class Input {

        @NotBlank
        private String ruleFilePattern = "output/{asset}/{direction}/pool/zrp01a.txt";

        @NotBlank
        private String dataFilePattern = "forex_data/gnminer_individual/{asset}.txt";
    }

    @Getter
    @Setter
    public static class Runner {

        @NotNull
        private RunMode mode = RunMode.NONE;

        private List<String> assets = new ArrayList<>();

        @NotBlank
        private String outputDirectory = "results";
    }
}
