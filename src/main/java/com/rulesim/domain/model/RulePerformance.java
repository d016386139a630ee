package com.rulesim.domain.model;

import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.TradeSide;
import lombok.Builder;
import lombok.Value;

/** Realized performance of the trades one rule produced. */
@Value
@Builder
public class RulePerformance {

    int ruleId;
    TradeSide side;
    RuleDirection direction;
    int tradeCount;
    double totalReturn;
    double avgProfit;
    int wins;
    double winRate;
}
