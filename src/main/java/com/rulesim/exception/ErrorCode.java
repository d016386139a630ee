package com.rulesim.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories raised by the engine.
 *
 * <p>{@code recoverable} tells batch callers whether the failing unit (one asset or one
 * walk-forward period) can be skipped while the rest of the run continues.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    MISSING_INPUT("MISSING_INPUT", true),
    MALFORMED_INPUT("MALFORMED_INPUT", true),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", false),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;
    private final boolean recoverable;
}
