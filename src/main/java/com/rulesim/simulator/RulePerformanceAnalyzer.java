package com.rulesim.simulator;

import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.TradeSide;
import com.rulesim.domain.model.RulePerformance;
import com.rulesim.domain.model.Trade;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Groups trades by the rule that produced them and ranks rules by realized return. */
public final class RulePerformanceAnalyzer {

    private RulePerformanceAnalyzer() {}

    /** Per-rule results, best total return first. */
    public static List<RulePerformance> analyze(List<Trade> trades) {
        Map<RuleKey, List<Trade>> byRule = new LinkedHashMap<>();
        for (Trade trade : trades) {
            byRule.computeIfAbsent(new RuleKey(trade.getRuleId(), trade.getSide(), trade.getDirection()),
                            k -> new ArrayList<>())
                    .add(trade);
        }

        List<RulePerformance> result = new ArrayList<>(byRule.size());
        for (Map.Entry<RuleKey, List<Trade>> entry : byRule.entrySet()) {
            List<Trade> ruleTrades = entry.getValue();
            double total = ruleTrades.stream().mapToDouble(Trade::getNetProfit).sum();
            int wins = (int) ruleTrades.stream().filter(Trade::isWin).count();
            result.add(RulePerformance.builder()
                    .ruleId(entry.getKey().ruleId())
                    .side(entry.getKey().side())
                    .direction(entry.getKey().direction())
                    .tradeCount(ruleTrades.size())
                    .totalReturn(total)
                    .avgProfit(total / ruleTrades.size())
                    .wins(wins)
                    .winRate(wins * 100.0 / ruleTrades.size())
                    .build());
        }
        result.sort(Comparator.comparingDouble(RulePerformance::getTotalReturn).reversed());
        return result;
    }

    private record RuleKey(int ruleId, TradeSide side, RuleDirection direction) {}
}
