package com.rulesim.signal;

import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.model.Condition;
import com.rulesim.domain.model.Rule;
import com.rulesim.domain.model.RuleSet;
import com.rulesim.domain.model.Signal;
import com.rulesim.domain.vo.ScanWindow;
import com.rulesim.timeseries.TimeSeries;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scans a time series for indices where a rule's conditions all hold and emits one signal
 * per matching rule.
 *
 * <p>The scan covers {@code [max(window.start, maxLag), min(window.end, size - 1))}. The
 * upper bound leaves room for the next row, which settles the trade. A series shorter than
 * {@code maxLag + 2} rows yields no signals.
 *
 * <p>With deduplication on, at most one signal survives per index: the highest support
 * count wins, then the lowest rule id, then the positive rule. Stateless and thread-safe.
 */
@Component
public class SignalGenerator {

    private static final Logger log = LoggerFactory.getLogger(SignalGenerator.class);

    static final Comparator<Signal> PRIORITY = Comparator.comparingInt(Signal::getSupportCount)
            .reversed()
            .thenComparingInt(Signal::getRuleId)
            .thenComparing(signal -> signal.getRule().getDirection() == RuleDirection.POSITIVE ? 0 : 1);

    public List<Signal> generate(RuleSet ruleSet, TimeSeries series, ScanWindow window, boolean deduplicate) {
        return generate(ruleSet.all(), series, window, deduplicate);
    }

    /**
     * @param rules       rules to evaluate, any mix of directions
     * @param series      the series to scan; indices are positions within it
     * @param window      half-open index range to consider
     * @param deduplicate keep at most one signal per index
     * @return signals in index order; for one index without deduplication, in rule order
     */
    public List<Signal> generate(List<Rule> rules, TimeSeries series, ScanWindow window, boolean deduplicate) {
        if (rules.isEmpty()) {
            return List.of();
        }
        int maxLag = rules.stream().mapToInt(Rule::getMaxLag).max().orElse(0);
        if (series.size() < maxLag + 2) {
            log.debug("{} rows cannot satisfy max lag {}, no signals", series.size(), maxLag);
            return List.of();
        }

        int start = Math.max(window.getStart(), maxLag);
        int end = Math.min(window.getEnd(), series.size() - 1);

        List<Signal> signals = new ArrayList<>();
        for (int t = start; t < end; t++) {
            List<Signal> candidates = new ArrayList<>();
            for (Rule rule : rules) {
                if (matches(rule, series, t)) {
                    candidates.add(Signal.builder()
                            .index(t)
                            .timestamp(series.timestamp(t))
                            .side(rule.getSide())
                            .rule(rule)
                            .expectedX(rule.getXMean())
                            .build());
                }
            }
            if (candidates.isEmpty()) {
                continue;
            }
            if (deduplicate) {
                signals.add(candidates.stream().min(PRIORITY).orElseThrow());
            } else {
                signals.addAll(candidates);
            }
        }

        log.debug("Scanned [{}, {}) with {} rules: {} signals", start, end, rules.size(), signals.size());
        return signals;
    }

    /** Conjunctive match: every condition's attribute must be 1 at {@code t - lag}. */
    static boolean matches(Rule rule, TimeSeries series, int t) {
        if (rule.getConditions().isEmpty()) {
            return false;
        }
        for (Condition condition : rule.getConditions()) {
            if (!series.isActive(condition.getAttribute(), condition.lookbackIndex(t))) {
                return false;
            }
        }
        return true;
    }
}
