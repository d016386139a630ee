package com.rulesim.rules;

import com.rulesim.config.RulesimProperties;
import com.rulesim.config.SimulationConfig;
import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.RuleSortKey;
import com.rulesim.domain.model.Rule;
import com.rulesim.domain.model.RuleSet;
import com.rulesim.exception.MissingInputException;
import com.rulesim.observability.BacktestMetrics;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rule store: loads the mined rule pools of an asset from the file system.
 *
 * <p>Each asset has one pool per direction, located by substituting {@code {asset}} and
 * {@code {direction}} into {@code rulesim.input.rule-file-pattern}. Loaded rules are
 * immutable; a run loads its {@link RuleSet} once and shares it across all periods.
 */
@Service
public class RuleRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleRepository.class);

    private final RulesimProperties rulesimProperties;
    private final BacktestMetrics backtestMetrics;

    public RuleRepository(RulesimProperties rulesimProperties, BacktestMetrics backtestMetrics) {
        this.rulesimProperties = rulesimProperties;
        this.backtestMetrics = backtestMetrics;
    }

    /**
     * Loads one direction's rule pool, ranked by {@code sortBy} and truncated to {@code topN}.
     *
     * @throws MissingInputException if the rule file does not exist
     * @throws com.rulesim.exception.DataFormatException if the file cannot be interpreted
     */
    public List<Rule> load(String asset, RuleDirection direction, int topN, RuleSortKey sortBy) {
        Path path = resolveRuleFile(asset, direction);
        if (!Files.isRegularFile(path)) {
            throw new MissingInputException("Rule file", path);
        }

        RuleFileReader reader = new RuleFileReader();
        List<Rule> rules = reader.read(path, direction, topN, sortBy);

        if (reader.getDroppedConditions() > 0) {
            backtestMetrics.recordDroppedConditions(reader.getDroppedConditions());
            log.warn(
                    "{} {}: dropped {} malformed conditions, discarded {} empty rules",
                    asset, direction.getKey(), reader.getDroppedConditions(), reader.getDiscardedRules());
        }
        log.info("Loaded {} {} rules for {} (top {}, sorted by {})", rules.size(), direction.getKey(), asset, topN, sortBy);
        return rules;
    }

    /** Loads both directions into a read-only rule set using the run's ranking settings. */
    public RuleSet loadAll(String asset, SimulationConfig config) {
        List<Rule> positive = load(asset, RuleDirection.POSITIVE, config.getTopNRules(), config.getSortBy());
        List<Rule> negative = load(asset, RuleDirection.NEGATIVE, config.getTopNRules(), config.getSortBy());
        RuleSet ruleSet = new RuleSet(asset, positive, negative);
        log.info("Rule set ready: {}", ruleSet);
        return ruleSet;
    }

    Path resolveRuleFile(String asset, RuleDirection direction) {
        String pattern = rulesimProperties.getInput().getRuleFilePattern();
        return Paths.get(pattern.replace("{asset}", asset).replace("{direction}", direction.getKey()));
    }
}
