package com.lexd.compiler;

import com.lexd.api.CompilerOptions;
import com.lexd.api.model.LexdGrammar;
import com.lexd.runtime.automaton.Transducer;
import com.lexd.runtime.evaluation.FlagAwareMatcher;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.util.SortedSet;

/**
 * Shared helpers for compiler tests.
 */
public final class CompilerTestSupport {

    public static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");

    private CompilerTestSupport() {
    }

    public static LexdCompiler compiler(LexdGrammar grammar) {
        return compiler(grammar, CompilerOptions.defaults());
    }

    public static LexdCompiler compiler(LexdGrammar grammar, CompilerOptions options) {
        return new LexdCompiler(grammar, options, TRACER);
    }

    /**
     * Compiles the grammar and enumerates its pairs up to {@code maxSymbols} symbols.
     */
    public static SortedSet<String> acceptedPairs(LexdGrammar grammar, CompilerOptions options, int maxSymbols) {
        LexdCompiler compiler = compiler(grammar, options);
        Transducer transducer = compiler.buildTransducer();
        return new FlagAwareMatcher(transducer, compiler.alphabet()).acceptedPairs(maxSymbols);
    }

    public static SortedSet<String> acceptedPairs(LexdGrammar grammar, int maxSymbols) {
        return acceptedPairs(grammar, CompilerOptions.defaults(), maxSymbols);
    }
}
