package com.rulesim.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Risk and return of a combined equity curve.
 *
 * <p>{@code totalReturn} and {@code maxDrawdown} are percentages against initial capital
 * and the running peak respectively. {@code sharpeRatio} is annualized with sqrt(252).
 */
@Value
@Builder
public class PortfolioMetrics {

    double totalReturn;
    double maxDrawdown;
    double sharpeRatio;
    double volatility;
    int timestampCount;

    public static PortfolioMetrics empty() {
        return PortfolioMetrics.builder().build();
    }
}
