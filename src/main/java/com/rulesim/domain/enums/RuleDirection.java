package com.rulesim.domain.enums;

/**
 * Direction a mined rule was discovered for.
 *
 * <p>Positive rules predict a rise of the next-period return and generate BUY signals;
 * negative rules predict a fall and generate SELL signals. The lowercase {@link #getKey()}
 * is the directory name the rule miner writes each rule pool under.
 */
public enum RuleDirection {
    POSITIVE("positive", TradeSide.BUY),
    NEGATIVE("negative", TradeSide.SELL);

    private final String key;
    private final TradeSide side;

    RuleDirection(String key, TradeSide side) {
        this.key = key;
        this.side = side;
    }

    public String getKey() {
        return key;
    }

    public TradeSide getSide() {
        return side;
    }
}
