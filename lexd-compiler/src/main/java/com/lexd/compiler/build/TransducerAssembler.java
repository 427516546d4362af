package com.lexd.compiler.build;

import com.lexd.api.CompilationException;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.SymbolHandle;
import com.lexd.api.model.Token;
import com.lexd.compiler.CompilationContext;
import com.lexd.runtime.automaton.Transducer;
import com.lexd.runtime.operations.AutomatonOperations;
import com.lexd.runtime.operations.Hyperminimizer;
import org.apache.lucene.util.automaton.TooComplexToDeterminizeException;

import java.util.List;
import java.util.logging.Logger;

/**
 * Puts the fragments together: unions the root patterns and minimizes the result.
 */
public class TransducerAssembler {
    private static final Logger logger = Logger.getLogger(TransducerAssembler.class.getName());

    private final CompilationContext context;
    private final PatternTransducerBuilder patternBuilder;
    private final LexiconTransducerBuilder lexiconBuilder;

    public TransducerAssembler(CompilationContext context, PatternTransducerBuilder patternBuilder,
                               LexiconTransducerBuilder lexiconBuilder) {
        this.context = context;
        this.patternBuilder = patternBuilder;
        this.lexiconBuilder = lexiconBuilder;
    }

    /**
     * Unminimized union of the root patterns.
     */
    public Transducer assemble(List<SymbolHandle> roots) {
        Transducer result = new Transducer();
        for (SymbolHandle root : roots) {
            result.union(patternBuilder.build(PatternElement.of(new Token(root, 1))));
        }
        logger.fine(() -> String.format("Assembled %d root patterns: %d states, %d transitions",
                roots.size(), result.stateCount(), result.transitionCount()));
        return result;
    }

    /**
     * Unminimized union of one lexicon's entries.
     *
     * @throws CompilationException of kind REFERENCE if the name is not a lexicon
     */
    public Transducer assembleLexicon(String lexiconName) {
        SymbolHandle handle = context.grammar().interner().lookup(lexiconName);
        if (!context.grammar().isLexicon(handle)) {
            throw CompilationException.reference(-1, "Lexicon " + lexiconName + " is not defined");
        }
        return lexiconBuilder.buildWholeLexicon(handle);
    }

    /**
     * @throws CompilationException of kind RESOURCE if the work limit is exceeded
     */
    public Transducer minimize(Transducer transducer) {
        try {
            return AutomatonOperations.minimize(transducer, context.options().determinizeWorkLimit());
        } catch (TooComplexToDeterminizeException e) {
            throw resourceError(e);
        }
    }

    /**
     * @throws CompilationException of kind RESOURCE if the work limit is exceeded
     */
    public Transducer hyperminimize(Transducer transducer) {
        try {
            return new Hyperminimizer(context.options().determinizeWorkLimit()).hyperminimize(transducer);
        } catch (TooComplexToDeterminizeException e) {
            throw resourceError(e);
        }
    }

    private CompilationException resourceError(TooComplexToDeterminizeException e) {
        return new CompilationException(CompilationException.Kind.RESOURCE, -1,
                "Determinization exceeded the work limit of " + context.options().determinizeWorkLimit()
                        + "; raise LEXD_DETERMINIZE_WORK_LIMIT", e);
    }
}
