package com.rulesim.domain.enums;

import com.rulesim.exception.ErrorCode;

/** Why a batch unit (one asset, or one walk-forward period) was left out of aggregation. */
public enum SkipReason {
    MISSING_INPUT,
    MALFORMED_INPUT,
    NO_RULES,
    NO_SIGNALS,
    NO_TRADES;

    /** Skip reason for a recoverable input failure. */
    public static SkipReason of(ErrorCode errorCode) {
        return errorCode == ErrorCode.MISSING_INPUT ? MISSING_INPUT : MALFORMED_INPUT;
    }
}
