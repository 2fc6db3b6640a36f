package com.missionforge.core.tree;

import java.util.Locale;

/**
 * Relational operators a ValueCondition may use, with their Promela spelling.
 */
public enum Comparator {
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    EQ("=="),
    NEQ("!=");

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Resolve the short mnemonic used in mission XML ("lt", "gte", ...).
     *
     * @throws IllegalArgumentException for anything outside the six mnemonics
     */
    public static Comparator fromMnemonic(String mnemonic) {
        if (mnemonic == null) {
            throw new IllegalArgumentException("Comparator mnemonic is missing");
        }
        return Comparator.valueOf(mnemonic.trim().toUpperCase(Locale.ROOT));
    }
}
