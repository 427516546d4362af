package com.lexd.api;

import com.lexd.api.model.CompilationResult;
import com.lexd.api.model.CompilationStats;
import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.Transducer;

import java.util.Optional;

/**
 * Contract for compiling a lexicon/pattern grammar into a transducer.
 *
 * <p>One instance compiles one grammar. Fragment caches live as long as the instance,
 * so repeated calls reuse work and return equal automata.
 */
public interface ILexdCompiler {

    /**
     * Builds the minimized transducer for the root pattern(s).
     *
     * @throws CompilationException on reference, shape, emptiness or resource errors
     */
    Transducer buildTransducer();

    /**
     * Builds the minimized transducer of one lexicon's entries, ignoring patterns.
     *
     * @throws CompilationException if {@code lexiconName} is not a lexicon
     */
    Transducer buildTransducerSingleLexicon(String lexiconName);

    /**
     * The hyperminimized companion, present after {@link #buildTransducer()} when
     * hyperminimization is enabled.
     */
    Optional<Transducer> hyperminTransducer();

    /**
     * Symbol table needed to read the labels of the built transducers.
     */
    Alphabet alphabet();

    CompilationStats statistics();

    /**
     * Builds everything the options ask for and bundles the result.
     */
    default CompilationResult compile() {
        Transducer transducer = buildTransducer();
        return new CompilationResult(transducer, hyperminTransducer().orElse(null), alphabet(), statistics());
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
