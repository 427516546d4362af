package com.lexd.runtime.automaton;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbol table shared by every transducer built in one compilation.
 *
 * <p>Maps multi-character symbols and flag diacritics to negative symbol ids, and
 * pairs of (left, right) symbols to the integer transition labels stored in a
 * {@link Transducer}. Label {@code 0} is always the epsilon pair.
 */
public class Alphabet {

    public static final int EPSILON_LABEL = 0;

    private final Object2IntMap<String> multicharIds = new Object2IntOpenHashMap<>();
    private final List<String> multicharNames = new ArrayList<>();

    private final Map<FlagDiacritic, TransitionSymbol> flagSymbols = new HashMap<>();
    private final Int2ObjectMap<FlagDiacritic> flagsById = new Int2ObjectOpenHashMap<>();

    private final Long2IntMap labelIds = new Long2IntOpenHashMap();
    private final IntArrayList labelLeft = new IntArrayList();
    private final IntArrayList labelRight = new IntArrayList();

    public Alphabet() {
        multicharIds.defaultReturnValue(0);
        labelIds.defaultReturnValue(-1);
        label(0, 0);
    }

    /**
     * Returns a copy with the same symbol and label numbering.
     */
    public Alphabet copy() {
        Alphabet copy = new Alphabet();
        for (String name : multicharNames) {
            copy.multichar(name);
        }
        copy.flagSymbols.putAll(flagSymbols);
        copy.flagsById.putAll(flagsById);
        for (int label = 1; label < labelLeft.size(); label++) {
            copy.label(labelLeft.getInt(label), labelRight.getInt(label));
        }
        return copy;
    }

    // ==================== Symbols ====================

    /**
     * Interns a multi-character symbol such as {@code <n>}.
     */
    public TransitionSymbol multichar(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Multi-character symbol must not be empty");
        }
        int id = multicharIds.getInt(name);
        if (id == 0) {
            multicharNames.add(name);
            id = -multicharNames.size();
            multicharIds.put(name, id);
        }
        return new TransitionSymbol(id);
    }

    /**
     * Looks up a multi-character symbol without registering it.
     *
     * @return the symbol, or {@code null} if it was never interned
     */
    public TransitionSymbol lookupMultichar(String name) {
        int id = multicharIds.getInt(name);
        return id == 0 ? null : new TransitionSymbol(id);
    }

    /**
     * Splits text into transition symbols.
     *
     * <p>{@code <...>} sequences become multi-character symbols, a backslash takes the
     * following character literally and everything else is one symbol per code point.
     */
    public List<TransitionSymbol> tokenize(String text) {
        List<TransitionSymbol> symbols = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (cp == '\\' && i + 1 < text.length()) {
                int escaped = text.codePointAt(i + 1);
                symbols.add(TransitionSymbol.ofCodePoint(escaped));
                i += 1 + Character.charCount(escaped);
                continue;
            }
            if (cp == '<') {
                int close = text.indexOf('>', i + 1);
                if (close > i + 1) {
                    symbols.add(multichar(text.substring(i, close + 1)));
                    i = close + 1;
                    continue;
                }
            }
            symbols.add(TransitionSymbol.ofCodePoint(cp));
            i += Character.charCount(cp);
        }
        return symbols;
    }

    /**
     * Like {@link #tokenize(String)} but never registers new symbols.
     *
     * @return the symbols, or {@code null} if the text uses an unknown multi-character symbol
     */
    public List<TransitionSymbol> tokenizeExisting(String text) {
        List<TransitionSymbol> symbols = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (cp == '\\' && i + 1 < text.length()) {
                int escaped = text.codePointAt(i + 1);
                symbols.add(TransitionSymbol.ofCodePoint(escaped));
                i += 1 + Character.charCount(escaped);
                continue;
            }
            if (cp == '<') {
                int close = text.indexOf('>', i + 1);
                if (close > i + 1) {
                    TransitionSymbol symbol = lookupMultichar(text.substring(i, close + 1));
                    if (symbol == null) {
                        return null;
                    }
                    symbols.add(symbol);
                    i = close + 1;
                    continue;
                }
            }
            symbols.add(TransitionSymbol.ofCodePoint(cp));
            i += Character.charCount(cp);
        }
        return symbols;
    }

    // ==================== Flag diacritics ====================

    /**
     * Returns the synthetic symbol for a flag, allocating it on first use.
     * Equal flags always map to the same symbol.
     */
    public TransitionSymbol flagSymbol(FlagDiacritic flag) {
        TransitionSymbol symbol = flagSymbols.get(flag);
        if (symbol == null) {
            symbol = multichar(flag.render());
            flagSymbols.put(flag, symbol);
            flagsById.put(symbol.id(), flag);
        }
        return symbol;
    }

    /**
     * @return the flag encoded by a symbol id, or {@code null} for ordinary symbols
     */
    public FlagDiacritic flagOf(int symbolId) {
        return symbolId < 0 ? flagsById.get(symbolId) : null;
    }

    public boolean isFlag(int symbolId) {
        return symbolId < 0 && flagsById.containsKey(symbolId);
    }

    public int flagCount() {
        return flagSymbols.size();
    }

    // ==================== Pair labels ====================

    public int label(TransitionSymbol left, TransitionSymbol right) {
        return label(left.id(), right.id());
    }

    /**
     * Interns the (left, right) pair and returns its transition label.
     */
    public int label(int leftId, int rightId) {
        long key = ((long) leftId << 32) | (rightId & 0xFFFFFFFFL);
        int label = labelIds.get(key);
        if (label < 0) {
            label = labelLeft.size();
            labelLeft.add(leftId);
            labelRight.add(rightId);
            labelIds.put(key, label);
        }
        return label;
    }

    /**
     * The identity label {@code f:f} used for a flag diacritic.
     */
    public int flagLabel(FlagDiacritic flag) {
        TransitionSymbol symbol = flagSymbol(flag);
        return label(symbol, symbol);
    }

    public int left(int label) {
        return labelLeft.getInt(label);
    }

    public int right(int label) {
        return labelRight.getInt(label);
    }

    public boolean isFlagLabel(int label) {
        return isFlag(left(label));
    }

    public int labelCount() {
        return labelLeft.size();
    }

    // ==================== Rendering ====================

    public String render(int symbolId) {
        if (symbolId == 0) {
            return "";
        }
        if (symbolId > 0) {
            return new String(Character.toChars(symbolId));
        }
        return multicharNames.get(-symbolId - 1);
    }

    public String render(List<TransitionSymbol> symbols) {
        StringBuilder sb = new StringBuilder();
        for (TransitionSymbol symbol : symbols) {
            sb.append(render(symbol.id()));
        }
        return sb.toString();
    }

    /**
     * Renders a label as {@code a:b}, or just {@code a} when both sides agree.
     */
    public String renderLabel(int label) {
        int left = left(label);
        int right = right(label);
        if (left == right) {
            return left == 0 ? "0" : render(left);
        }
        return (left == 0 ? "0" : render(left)) + ":" + (right == 0 ? "0" : render(right));
    }
}
