package com.rulesim.domain.model;

import com.rulesim.domain.enums.PerformanceRating;
import com.rulesim.domain.enums.WalkForwardVerdict;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate statistics over the completed periods of a walk-forward run.
 *
 * <p>Only periods that produced trades count. {@code stdReturn} is the population standard
 * deviation of per-period returns and {@code consistency} the percentage of profitable
 * periods.
 */
@Value
@Builder
public class WalkForwardSummary {

    int totalPeriods;
    int skippedPeriods;
    double totalReturn;
    double avgReturnPerPeriod;
    double stdReturn;
    int winPeriods;
    int losePeriods;
    double consistency;
    int totalTrades;
    double avgWinRate;
    double avgMaxDrawdown;
    double bestPeriodReturn;
    double worstPeriodReturn;

    PerformanceRating consistencyRating;
    PerformanceRating returnRating;
    PerformanceRating stabilityRating;
    WalkForwardVerdict verdict;
}
