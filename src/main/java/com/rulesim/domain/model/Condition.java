package com.rulesim.domain.model;

import lombok.Value;

/**
 * One lagged attribute test of a rule: attribute {@code attribute} must be active (1)
 * {@code lag} periods before the evaluation index.
 */
@Value
public class Condition {

    String attribute;

    /** Periods into the past, never negative. */
    int lag;

    /** Row index this condition reads when evaluated at {@code t}; negative when out of range. */
    public int lookbackIndex(int t) {
        return t - lag;
    }

    /** Renders the condition in the rule miner's {@code <attr>(t-<lag>)} notation. */
    public String toText() {
        return attribute + "(t-" + lag + ")";
    }
}
