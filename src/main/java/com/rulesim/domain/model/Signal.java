package com.rulesim.domain.model;

import com.rulesim.domain.enums.TradeSide;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** A BUY or SELL instruction emitted at one index because all of a rule's conditions held. */
@Value
@Builder
public class Signal {

    int index;
    LocalDateTime timestamp;
    TradeSide side;
    Rule rule;

    /** The rule's mined mean outcome. Diagnostic only, never used for settlement. */
    double expectedX;

    public int getRuleId() {
        return rule.getId();
    }

    public int getSupportCount() {
        return rule.getSupportCount();
    }
}
