package com.lexd.compiler.build;

import com.lexd.api.CompilationException;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.LexiconEntry;
import com.lexd.api.model.LexiconSegment;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.SymbolHandle;
import com.lexd.compiler.CompilationContext;
import com.lexd.compiler.CompilationContext.EntryKey;
import com.lexd.compiler.tags.FlagSynthesizer;
import com.lexd.runtime.automaton.Transducer;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Builds the fragment of a single (non-repeated) lexicon reference.
 *
 * <p>The fragment is the union of one path per compatible entry. Entries of bound
 * lexicons start with their row flag and are cached individually; free lexicons
 * get plain paths.
 */
public class LexiconTransducerBuilder {
    private static final Logger logger = Logger.getLogger(LexiconTransducerBuilder.class.getName());

    private final CompilationContext context;
    private final LexdGrammar grammar;
    private final FlagSynthesizer flags;
    private final EntryAligner aligner;

    public LexiconTransducerBuilder(CompilationContext context, FlagSynthesizer flags, EntryAligner aligner) {
        this.context = context;
        this.grammar = context.grammar();
        this.flags = flags;
        this.aligner = aligner;
    }

    /**
     * @throws CompilationException of kind EMPTINESS if no entry satisfies the element's tags
     */
    public Transducer build(PatternElement element) {
        Transducer cached = context.lexiconTransducers().get(element);
        if (cached != null) {
            return cached;
        }

        Set<SymbolHandle> bound = boundLexicons(element);
        Transducer result = new Transducer();
        int matched = 0;
        int count = grammar.entryCount(element);
        for (int i = 0; i < count; i++) {
            LexiconSegment segment = grammar.effectiveSegment(element, i);
            if (!element.compatible(segment)) {
                continue;
            }
            matched++;
            if (bound.isEmpty()) {
                int end = result.insertPath(result.initial(), entryLabels(segment));
                result.setFinal(end);
            } else {
                result.union(entryTransducer(element, i, segment, bound));
            }
        }
        if (matched == 0) {
            throw CompilationException.emptiness(context.currentLine(),
                    "No entry of " + grammar.describe(element) + " matches its tags");
        }

        logger.fine(() -> String.format("Built %s: %d entries, %d states",
                grammar.describe(element), count, result.stateCount()));
        context.lexiconTransducers().put(element, result);
        return result;
    }

    private Transducer entryTransducer(PatternElement element, int index, LexiconSegment segment,
                                       Set<SymbolHandle> bound) {
        EntryKey key = new EntryKey(element, index);
        Transducer cached = context.entryTransducers().get(key);
        if (cached != null) {
            return cached;
        }
        IntList labels = new IntArrayList();
        for (SymbolHandle lexicon : bound) {
            labels.add(flags.rowLabel(lexicon, index));
        }
        labels.addAll(entryLabels(segment));

        Transducer entry = new Transducer();
        entry.setFinal(entry.insertPath(entry.initial(), labels));
        context.entryTransducers().put(key, entry);
        return entry;
    }

    private IntList entryLabels(LexiconSegment segment) {
        IntList labels = new IntArrayList(flags.entryTagLabels(segment.tags()));
        labels.addAll(aligner.labels(segment.left(), segment.right()));
        return labels;
    }

    private Set<SymbolHandle> boundLexicons(PatternElement element) {
        Set<SymbolHandle> bound = new TreeSet<>();
        if (!element.left().isEmpty() && context.isBound(element.left().name())) {
            bound.add(element.left().name());
        }
        if (!element.right().isEmpty() && context.isBound(element.right().name())) {
            bound.add(element.right().name());
        }
        return bound;
    }

    /**
     * Every entry of a lexicon with its columns concatenated, without flags.
     */
    public Transducer buildWholeLexicon(SymbolHandle lexicon) {
        Transducer result = new Transducer();
        for (LexiconEntry entry : grammar.lexicon(lexicon).entries()) {
            IntList labels = new IntArrayList();
            for (LexiconSegment segment : entry.segments()) {
                labels.addAll(aligner.labels(segment.left(), segment.right()));
            }
            result.setFinal(result.insertPath(result.initial(), labels));
        }
        return result;
    }
}
