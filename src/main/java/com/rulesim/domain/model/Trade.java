package com.rulesim.domain.model;

import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.TradeSide;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A one-period trade settled from a signal.
 *
 * <p>All profit fields are in percent units, the same units as the series' {@code X}
 * column. {@code cumulativeReturn} is the running sum of {@code netProfit} over the trade
 * list this trade belongs to, in entry-index order.
 */
@Value
@Builder
public class Trade {

    int entryIndex;
    int exitIndex;
    LocalDateTime entryTimestamp;
    TradeSide side;

    int ruleId;
    String ruleText;
    RuleDirection direction;
    int supportCount;

    double expectedX;

    /** X of the exit row. */
    double actualX;

    /** {@code actualX} for BUY, {@code -actualX} for SELL. */
    double grossProfit;

    double transactionCost;
    double netProfit;
    boolean win;
    double cumulativeReturn;
}
