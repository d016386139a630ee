package com.rulesim.domain.model;

import com.rulesim.domain.enums.RuleDirection;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Read-only snapshot of one asset's positive and negative rule pools.
 *
 * <p>A run loads the rule set once and hands the same instance to every walk-forward
 * period and every signal scan; nothing mutates it after construction.
 */
public final class RuleSet {

    private final String asset;
    private final List<Rule> positiveRules;
    private final List<Rule> negativeRules;

    public RuleSet(String asset, List<Rule> positiveRules, List<Rule> negativeRules) {
        this.asset = asset;
        this.positiveRules = List.copyOf(positiveRules);
        this.negativeRules = List.copyOf(negativeRules);
    }

    public static RuleSet of(String asset, List<Rule> rules) {
        List<Rule> positive = new ArrayList<>();
        List<Rule> negative = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.getDirection() == RuleDirection.POSITIVE) {
                positive.add(rule);
            } else {
                negative.add(rule);
            }
        }
        return new RuleSet(asset, positive, negative);
    }

    public String getAsset() {
        return asset;
    }

    public List<Rule> getPositiveRules() {
        return positiveRules;
    }

    public List<Rule> getNegativeRules() {
        return negativeRules;
    }

    public List<Rule> getRules(RuleDirection direction) {
        return direction == RuleDirection.POSITIVE ? positiveRules : negativeRules;
    }

    /** Positive rules first, then negative, each in load order. */
    public List<Rule> all() {
        List<Rule> all = new ArrayList<>(positiveRules.size() + negativeRules.size());
        all.addAll(positiveRules);
        all.addAll(negativeRules);
        return all;
    }

    public int size() {
        return positiveRules.size() + negativeRules.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int getMaxLag() {
        return all().stream().mapToInt(Rule::getMaxLag).max().orElse(0);
    }

    public double averageSupport(RuleDirection direction) {
        return average(getRules(direction), r -> r.getSupportCount());
    }

    public double averageMean(RuleDirection direction) {
        return average(getRules(direction), Rule::getXMean);
    }

    private static double average(List<Rule> rules, ToDoubleFunction<Rule> field) {
        return rules.stream().mapToDouble(field).average().orElse(0);
    }

    @Override
    public String toString() {
        return "RuleSet[" + asset + ": " + positiveRules.size() + " BUY + " + negativeRules.size() + " SELL]";
    }
}
