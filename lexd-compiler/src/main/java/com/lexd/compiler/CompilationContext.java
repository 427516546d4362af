package com.lexd.compiler;

import com.lexd.api.CompilerOptions;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.SymbolHandle;
import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.Transducer;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one compiler instance: fragment caches, freedom results and the
 * alphabet that every fragment's labels refer to.
 *
 * <p>Fragments are never modified once cached; combining them always copies states.
 */
public class CompilationContext {

    /**
     * Cache key of one entry of a bound lexicon reference.
     */
    public record EntryKey(PatternElement element, int entryIndex) {
    }

    /**
     * Cache key of an element whose iterations start by clearing the given rows.
     */
    public record IterationKey(PatternElement element, Set<SymbolHandle> clearedRows) {
    }

    private final LexdGrammar grammar;
    private final CompilerOptions options;
    private final Alphabet alphabet;

    private final Map<PatternElement, Transducer> patternTransducers = new HashMap<>();
    private final Map<PatternElement, Transducer> lexiconTransducers = new HashMap<>();
    private final Map<EntryKey, Transducer> entryTransducers = new HashMap<>();
    private final Map<IterationKey, Transducer> iterationTransducers = new HashMap<>();
    private final Set<PatternElement> inProgress = new HashSet<>();
    private final Map<SymbolHandle, Boolean> lexiconFreedom = new HashMap<>();
    private final Map<SymbolHandle, Set<SymbolHandle>> heldAround = new HashMap<>();
    private final IntArrayList lineStack = new IntArrayList();

    public CompilationContext(LexdGrammar grammar, CompilerOptions options) {
        this.grammar = grammar;
        this.options = options;
        this.alphabet = grammar.alphabet().copy();
    }

    public LexdGrammar grammar() {
        return grammar;
    }

    public CompilerOptions options() {
        return options;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public Map<PatternElement, Transducer> patternTransducers() {
        return patternTransducers;
    }

    public Map<PatternElement, Transducer> lexiconTransducers() {
        return lexiconTransducers;
    }

    public Map<EntryKey, Transducer> entryTransducers() {
        return entryTransducers;
    }

    public Map<IterationKey, Transducer> iterationTransducers() {
        return iterationTransducers;
    }

    // ==================== Cycle guard ====================

    /**
     * Marks an element as being built.
     *
     * @return false if it already was, meaning the element refers to itself
     */
    public boolean enter(PatternElement element) {
        return inProgress.add(element);
    }

    public void leave(PatternElement element) {
        inProgress.remove(element);
    }

    // ==================== Freedom ====================

    public void setFreedom(Map<SymbolHandle, Boolean> freedom) {
        lexiconFreedom.clear();
        lexiconFreedom.putAll(freedom);
    }

    /**
     * A lexicon never seen by the freedom analysis is free.
     */
    public boolean isBound(SymbolHandle lexicon) {
        return Boolean.FALSE.equals(lexiconFreedom.get(lexicon));
    }

    public void setHeldAround(Map<SymbolHandle, Set<SymbolHandle>> held) {
        heldAround.clear();
        heldAround.putAll(held);
    }

    /**
     * Lexicons whose rows are bound outside the given pattern.
     */
    public Set<SymbolHandle> heldAround(SymbolHandle pattern) {
        return heldAround.getOrDefault(pattern, Set.of());
    }

    public int boundLexiconCount() {
        int count = 0;
        for (Boolean free : lexiconFreedom.values()) {
            if (!free) {
                count++;
            }
        }
        return count;
    }

    // ==================== Source lines ====================

    public void pushLine(int line) {
        lineStack.push(line);
    }

    public void popLine() {
        lineStack.popInt();
    }

    /**
     * Line of the innermost body being built, or {@code -1} outside any body.
     */
    public int currentLine() {
        return lineStack.isEmpty() ? -1 : lineStack.topInt();
    }
}
