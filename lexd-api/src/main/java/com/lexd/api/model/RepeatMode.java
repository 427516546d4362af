package com.lexd.api.model;

/**
 * Repetition modifier of a pattern element, as two independent properties.
 */
public enum RepeatMode {
    NORMAL(false, false, ""),
    QUESTION(true, false, "?"),
    PLUS(false, true, "+"),
    STAR(true, true, "*");

    private final boolean mayBeAbsent;
    private final boolean mayRepeat;
    private final String symbol;

    RepeatMode(boolean mayBeAbsent, boolean mayRepeat, String symbol) {
        this.mayBeAbsent = mayBeAbsent;
        this.mayRepeat = mayRepeat;
        this.symbol = symbol;
    }

    public boolean mayBeAbsent() {
        return mayBeAbsent;
    }

    public boolean mayRepeat() {
        return mayRepeat;
    }

    /** The source-file suffix: "", "?", "+" or "*". */
    public String symbol() {
        return symbol;
    }

    public static RepeatMode of(boolean mayBeAbsent, boolean mayRepeat) {
        if (mayBeAbsent) {
            return mayRepeat ? STAR : QUESTION;
        }
        return mayRepeat ? PLUS : NORMAL;
    }

    /**
     * Parses a modifier suffix; an empty or null string is {@link #NORMAL}.
     */
    public static RepeatMode fromSymbol(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return NORMAL;
        }
        for (RepeatMode mode : values()) {
            if (mode.symbol.equals(symbol) || mode.name().equalsIgnoreCase(symbol)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown repeat mode: " + symbol);
    }
}
