package com.rulesim.domain.enums;

/** Overall robustness verdict of a walk-forward run. */
public enum WalkForwardVerdict {
    /** Consistent and profitable across periods. */
    PASS,
    /** Some consistency, needs improvement. */
    MARGINAL,
    /** Neither consistent nor profitable. */
    FAIL
}
