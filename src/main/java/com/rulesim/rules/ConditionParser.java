package com.rulesim.rules;

import com.rulesim.domain.model.Condition;
import com.rulesim.domain.vo.ConditionParseResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses rule-file condition cells of the form {@code <attribute>(t-<lag>)}, for example
 * {@code NZDJPY_Up(t-1)}.
 *
 * <p>Parsing never throws. A token that does not match the pattern comes back as an error
 * result so the caller can drop that single condition and keep the rest of the rule.
 */
public final class ConditionParser {

    private static final Pattern CONDITION = Pattern.compile("(.+)\\(t-(\\d+)\\)");

    /** Cell values meaning "no condition in this column". */
    private static final String ABSENT = "0";

    private ConditionParser() {}

    /** True when the cell is the miner's empty-slot sentinel or blank. */
    public static boolean isAbsent(String cell) {
        if (cell == null) {
            return true;
        }
        String trimmed = cell.trim();
        return trimmed.isEmpty() || ABSENT.equals(trimmed);
    }

    public static ConditionParseResult parse(String cell) {
        String token = cell == null ? "" : cell.trim();
        Matcher matcher = CONDITION.matcher(token);
        if (!matcher.matches()) {
            return ConditionParseResult.error(token, "does not match <attr>(t-<lag>)");
        }

        String attribute = matcher.group(1).trim();
        if (attribute.isEmpty()) {
            return ConditionParseResult.error(token, "empty attribute name");
        }

        int lag;
        try {
            lag = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return ConditionParseResult.error(token, "lag out of range");
        }
        return ConditionParseResult.ok(new Condition(attribute, lag), token);
    }
}
