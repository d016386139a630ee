package com.rulesim.domain.vo;

import com.rulesim.domain.model.Condition;

/**
 * Outcome of parsing one rule-file condition cell: either a {@link Condition} or the reason
 * the raw token was rejected.
 *
 * @param condition parsed condition, null on error
 * @param rawToken  the cell text as read
 * @param error     why parsing failed, null on success
 */
public record ConditionParseResult(Condition condition, String rawToken, String error) {

    public static ConditionParseResult ok(Condition condition, String rawToken) {
        return new ConditionParseResult(condition, rawToken, null);
    }

    public static ConditionParseResult error(String rawToken, String error) {
        return new ConditionParseResult(null, rawToken, error);
    }

    public boolean isOk() {
        return condition != null;
    }
}
