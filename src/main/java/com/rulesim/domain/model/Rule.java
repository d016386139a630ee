package com.rulesim.domain.model;

import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.TradeSide;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A mined association rule: a conjunction of lagged binary conditions plus the outcome
 * statistics the miner computed for it.
 *
 * <p>The statistics are carried through unchanged. They rank rules at load time and break
 * ties between simultaneous signals; nothing in the engine recomputes them.
 *
 * <p>{@code id} is the zero-based row ordinal in the rule file, so it stays stable
 * regardless of how the pool is sorted.
 */
@Value
@Builder
public class Rule {

    int id;
    RuleDirection direction;

    @Singular
    List<Condition> conditions;

    double xMean;
    double xSigma;
    int supportCount;
    double supportRate;

    // Optional miner quality scores, 0 when the rule file does not carry them
    double extremeScore;
    double snr;
    double extremeness;
    double signalStrength;

    public TradeSide getSide() {
        return direction.getSide();
    }

    /** Largest lag across the rule's conditions, 0 for an empty rule. */
    public int getMaxLag() {
        return conditions.stream().mapToInt(Condition::getLag).max().orElse(0);
    }

    public String getRuleText() {
        return conditions.stream().map(Condition::toText).collect(Collectors.joining(" AND "));
    }
}
