package com.rulesim.domain.enums;

/** Qualitative rating of a single walk-forward aggregate (consistency, return or stability). */
public enum PerformanceRating {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR
}
