package com.rulesim.domain.enums;

/** Risk-adjusted grade of a portfolio result, from total return, Sharpe ratio and drawdown. */
public enum PortfolioGrade {
    EXCELLENT,
    GOOD,
    MARGINAL,
    POOR
}
