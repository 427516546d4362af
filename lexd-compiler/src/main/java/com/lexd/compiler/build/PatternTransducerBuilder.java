package com.lexd.compiler.build;

import com.lexd.api.CompilationException;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.Pattern;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.RepeatMode;
import com.lexd.api.model.SymbolHandle;
import com.lexd.compiler.CompilationContext;
import com.lexd.compiler.CompilationContext.IterationKey;
import com.lexd.compiler.analysis.FreedomAnalyzer;
import com.lexd.compiler.tags.FlagSynthesizer;
import com.lexd.compiler.tags.TagDistributor;
import com.lexd.runtime.automaton.Transducer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Builds and caches the fragment of any pattern element.
 *
 * <p>Elements are built bottom-up and memoized by their full key, so each distinct
 * (token, mode, tags) combination is compiled once however often it is referenced.
 * <ul>
 *   <li>A repeated element wraps one copy of its single fragment with bypass and
 *       back edges. Iterations keep the rows bound around them; a bound lexicon
 *       that only the repeated element of a body reaches, and that no enclosing
 *       body holds, is cleared before each iteration so iterations do not
 *       correlate.</li>
 *   <li>A flag-filtered element surrounds its untagged fragment with tag flags.</li>
 *   <li>A lexicon reference is delegated to {@link LexiconTransducerBuilder}.</li>
 *   <li>A pattern reference is the union of its bodies, each the concatenation of
 *       its elements, with static tags pushed into the bodies.</li>
 * </ul>
 */
public class PatternTransducerBuilder {
    private static final Logger logger = Logger.getLogger(PatternTransducerBuilder.class.getName());

    private final CompilationContext context;
    private final LexdGrammar grammar;
    private final LexiconTransducerBuilder lexiconBuilder;
    private final FlagSynthesizer flags;
    private final TagDistributor tagDistributor;
    private final FreedomAnalyzer freedomAnalyzer;

    public PatternTransducerBuilder(CompilationContext context,
                                    LexiconTransducerBuilder lexiconBuilder,
                                    FlagSynthesizer flags,
                                    TagDistributor tagDistributor,
                                    FreedomAnalyzer freedomAnalyzer) {
        this.context = context;
        this.grammar = context.grammar();
        this.lexiconBuilder = lexiconBuilder;
        this.flags = flags;
        this.tagDistributor = tagDistributor;
        this.freedomAnalyzer = freedomAnalyzer;
    }

    public Transducer build(PatternElement element) {
        boolean plainLexicon = element.mode() == RepeatMode.NORMAL
                && !flags.usesFlags(element)
                && grammar.isLexicon(element.name());
        if (plainLexicon) {
            return lexiconBuilder.build(element);
        }

        Transducer cached = context.patternTransducers().get(element);
        if (cached != null) {
            return cached;
        }
        if (!context.enter(element)) {
            throw CompilationException.shape(context.currentLine(),
                    "Pattern " + grammar.name(element.name()) + " refers to itself");
        }
        try {
            Transducer result;
            if (element.mode() != RepeatMode.NORMAL) {
                result = buildRepeated(element);
            } else if (flags.usesFlags(element)) {
                result = flags.wrapWithTags(element, build(element.withoutTags()));
            } else {
                result = buildPatternReference(element);
            }
            context.patternTransducers().put(element, result);
            return result;
        } finally {
            context.leave(element);
        }
    }

    private Transducer buildRepeated(PatternElement element) {
        RepeatMode mode = element.mode();
        return build(element.withMode(RepeatMode.NORMAL)).repeated(mode.mayBeAbsent(), mode.mayRepeat());
    }

    /**
     * Builds an element whose iterations each start by clearing the given rows.
     */
    private Transducer buildIterated(PatternElement element, Set<SymbolHandle> clearedRows) {
        IterationKey key = new IterationKey(element, clearedRows);
        Transducer cached = context.iterationTransducers().get(key);
        if (cached != null) {
            return cached;
        }
        RepeatMode mode = element.mode();
        Transducer once = FlagSynthesizer.prefixed(flags.clearLabels(clearedRows),
                build(element.withMode(RepeatMode.NORMAL)));
        Transducer result = mode == RepeatMode.NORMAL ? once : once.repeated(mode.mayBeAbsent(), mode.mayRepeat());
        context.iterationTransducers().put(key, result);
        return result;
    }

    /**
     * Bound lexicons reached only by one repeated element of the body and not held
     * by any body around the pattern.
     */
    private Set<SymbolHandle> iterationRows(SymbolHandle pattern, Pattern body) {
        Map<SymbolHandle, PatternElement> reachedBy = new HashMap<>();
        Set<SymbolHandle> shared = new HashSet<>();
        for (PatternElement element : body.elements()) {
            for (SymbolHandle lexicon : freedomAnalyzer.reach(element)) {
                if (reachedBy.putIfAbsent(lexicon, element) != null) {
                    shared.add(lexicon);
                }
            }
        }
        Set<SymbolHandle> held = context.heldAround(pattern);
        Set<SymbolHandle> rows = new TreeSet<>();
        reachedBy.forEach((lexicon, element) -> {
            if (element.mode().mayRepeat() && context.isBound(lexicon)
                    && !shared.contains(lexicon) && !held.contains(lexicon)) {
                rows.add(lexicon);
            }
        });
        return rows;
    }

    private Transducer buildPatternReference(PatternElement element) {
        SymbolHandle name = element.name();
        if (!grammar.isPattern(name)) {
            throw CompilationException.reference(context.currentLine(),
                    "Pattern " + grammar.name(name) + " is not defined");
        }
        Transducer result = new Transducer();
        int derivedBodies = 0;
        for (Pattern body : grammar.patternBodies(name)) {
            context.pushLine(body.lineNumber());
            try {
                Set<SymbolHandle> rows = iterationRows(name, body);
                for (List<PatternElement> derived : tagDistributor.distribute(element, body)) {
                    result.union(buildBody(derived, rows));
                    derivedBodies++;
                }
            } finally {
                context.popLine();
            }
        }
        if (derivedBodies == 0) {
            throw CompilationException.emptiness(context.currentLine(),
                    grammar.describe(element) + " cannot match anything");
        }
        int bodies = derivedBodies;
        logger.fine(() -> String.format("Built %s from %d bodies: %d states",
                grammar.describe(element), bodies, result.stateCount()));
        return result;
    }

    /**
     * Concatenates one body. A left sieve lets the body start at its position, a
     * right sieve lets the body end there. Elements reaching one of
     * {@code iterationRows} come from a repeated element and clear those rows first.
     */
    private Transducer buildBody(List<PatternElement> elements, Set<SymbolHandle> iterationRows) {
        Transducer body = new Transducer();
        int state = body.initial();
        for (PatternElement element : elements) {
            if (grammar.isLeftSieve(element)) {
                body.addEpsilon(body.initial(), state);
            } else if (grammar.isRightSieve(element)) {
                body.setFinal(state);
            } else {
                Set<SymbolHandle> cleared = new TreeSet<>(freedomAnalyzer.reach(element));
                cleared.retainAll(iterationRows);
                Transducer fragment = cleared.isEmpty() ? build(element) : buildIterated(element, cleared);
                state = body.insertTransducer(state, fragment);
            }
        }
        body.setFinal(state);
        return body;
    }
}
