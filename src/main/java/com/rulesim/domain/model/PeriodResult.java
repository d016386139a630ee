package com.rulesim.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Metrics of one completed walk-forward period. Periods with no trades never produce one. */
@Value
@Builder
public class PeriodResult {

    Period period;
    int totalTrades;
    double winRate;
    double totalReturn;
    double totalReturnBeforeCost;
    double avgProfit;
    double maxDrawdown;
    int buyTrades;
    int sellTrades;
    double buyReturn;
    double sellReturn;

    List<Trade> trades;
}
