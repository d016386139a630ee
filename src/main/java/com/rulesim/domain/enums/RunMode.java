package com.rulesim.domain.enums;

/** What the batch runner executes on startup. */
public enum RunMode {
    NONE,
    SINGLE,
    WALK_FORWARD,
    PORTFOLIO
}
