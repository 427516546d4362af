package com.lexd.runtime.automaton;

import java.util.Objects;

/**
 * Identity of one flag diacritic: operation, feature name and value.
 *
 * <p>Equal triples denote the same synthetic transition symbol; see
 * {@link Alphabet#flagSymbol(FlagDiacritic)}.
 */
public record FlagDiacritic(FlagDiacriticType type, String feature, int value) {

    public FlagDiacritic {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(feature, "feature");
        if (feature.isEmpty() || feature.indexOf('@') >= 0) {
            throw new IllegalArgumentException("Invalid flag feature name: '" + feature + "'");
        }
        if (value < 0) {
            throw new IllegalArgumentException("Flag value must not be negative: " + value);
        }
        if (value == 0 && !type.allowsEmptyValue()) {
            throw new IllegalArgumentException("Flag type " + type + " requires a value");
        }
    }

    public static FlagDiacritic unify(String feature, int value) {
        return new FlagDiacritic(FlagDiacriticType.UNIFICATION, feature, value);
    }

    public static FlagDiacritic positive(String feature, int value) {
        return new FlagDiacritic(FlagDiacriticType.POSITIVE, feature, value);
    }

    public static FlagDiacritic disallow(String feature, int value) {
        return new FlagDiacritic(FlagDiacriticType.DISALLOW, feature, value);
    }

    public static FlagDiacritic clear(String feature) {
        return new FlagDiacritic(FlagDiacriticType.CLEAR, feature, 0);
    }

    /**
     * Renders the flag in the conventional {@code @T.FEATURE.VALUE@} form.
     */
    public String render() {
        if (value == 0) {
            return "@" + type.code() + "." + feature + "@";
        }
        return "@" + type.code() + "." + feature + "." + value + "@";
    }

    /**
     * Parses a rendered flag, or returns {@code null} if the text is not a flag diacritic.
     */
    public static FlagDiacritic parse(String text) {
        if (text.length() < 5 || text.charAt(0) != '@' || text.charAt(text.length() - 1) != '@'
                || text.charAt(2) != '.') {
            return null;
        }
        FlagDiacriticType type;
        try {
            type = FlagDiacriticType.fromCode(text.charAt(1));
        } catch (IllegalArgumentException e) {
            return null;
        }
        String body = text.substring(3, text.length() - 1);
        if (body.isEmpty()) {
            return null;
        }
        int dot = body.lastIndexOf('.');
        try {
            if (dot > 0 && isNumber(body.substring(dot + 1))) {
                return new FlagDiacritic(type, body.substring(0, dot), Integer.parseInt(body.substring(dot + 1)));
            }
            return new FlagDiacritic(type, body, 0);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isNumber(String text) {
        if (text.isEmpty() || text.length() > 9) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return render();
    }
}
