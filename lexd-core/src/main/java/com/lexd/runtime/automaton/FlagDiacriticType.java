package com.lexd.runtime.automaton;

/**
 * The six flag diacritic operations understood by downstream transducer processors.
 *
 * <p>Feature values are encoded as integers: {@code 0} is unset, a positive value
 * {@code v} means "set to v" and a negative value {@code -v} means "set to anything
 * but v" (the result of {@link #NEGATIVE}).
 */
public enum FlagDiacriticType {
    UNIFICATION('U'),
    POSITIVE('P'),
    NEGATIVE('N'),
    REQUIRE('R'),
    DISALLOW('D'),
    CLEAR('C');

    /** Returned by {@link #apply(int, int)} when the flag blocks the path. */
    public static final int REJECT = Integer.MIN_VALUE;

    private final char code;

    FlagDiacriticType(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static FlagDiacriticType fromCode(char code) {
        for (FlagDiacriticType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown flag diacritic type: " + code);
    }

    /**
     * Whether this operation is written without a value ({@code @C.F@}) when the value is 0.
     */
    public boolean allowsEmptyValue() {
        return switch (this) {
            case REQUIRE, DISALLOW, CLEAR -> true;
            case UNIFICATION, POSITIVE, NEGATIVE -> false;
        };
    }

    /**
     * Applies this operation to the current value of a feature.
     *
     * @param current current feature value (0 when unset)
     * @param value   the value carried by the flag (0 for the value-less form)
     * @return the new feature value, or {@link #REJECT}
     */
    public int apply(int current, int value) {
        return switch (this) {
            case UNIFICATION -> {
                if (current == 0 || current == value || (current < 0 && -current != value)) {
                    yield value;
                }
                yield REJECT;
            }
            case POSITIVE -> value;
            case NEGATIVE -> -value;
            case REQUIRE -> {
                if (value == 0) {
                    yield current != 0 ? current : REJECT;
                }
                yield current == value ? current : REJECT;
            }
            case DISALLOW -> {
                if (value == 0) {
                    yield current == 0 ? current : REJECT;
                }
                yield current == value ? REJECT : current;
            }
            case CLEAR -> 0;
        };
    }
}
