package com.rulesim.domain.enums;

/**
 * Ranking key used when truncating a rule pool to its top-N rules.
 *
 * <p>Each key names the rule-file column it sorts on (descending). {@link #DISCOVERY}
 * keeps the order in which the miner wrote the rules.
 */
public enum RuleSortKey {
    SUPPORT("support_count"),
    EXTREME_SCORE("ExtremeScore"),
    SNR("SNR"),
    EXTREMENESS("Extremeness"),
    DISCOVERY(null);

    private final String column;

    RuleSortKey(String column) {
        this.column = column;
    }

    /** Rule-file column this key sorts on, or null when file order is kept. */
    public String getColumn() {
        return column;
    }
}
