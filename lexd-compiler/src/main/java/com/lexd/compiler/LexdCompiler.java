/*
 * Copyright (c) 2025 lexd
 * Licensed under the Apache License, Version 2.0
 */
package com.lexd.compiler;

import com.lexd.api.CompilationException;
import com.lexd.api.CompilationListener;
import com.lexd.api.CompilerOptions;
import com.lexd.api.ILexdCompiler;
import com.lexd.api.model.CompilationStats;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.SymbolHandle;
import com.lexd.compiler.analysis.FreedomAnalyzer;
import com.lexd.compiler.analysis.GrammarValidator;
import com.lexd.compiler.build.EntryAligner;
import com.lexd.compiler.build.LexiconTransducerBuilder;
import com.lexd.compiler.build.PatternTransducerBuilder;
import com.lexd.compiler.build.TransducerAssembler;
import com.lexd.compiler.tags.FlagSynthesizer;
import com.lexd.compiler.tags.TagDistributor;
import com.lexd.infra.telemetry.TracingService;
import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.Transducer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles a lexd grammar into a minimal transducer.
 *
 * <p>A full build runs in stages, each traced as its own span and reported to the
 * {@link CompilationListener}:
 * <ol>
 *   <li>VALIDATION: resolve the roots, check references, shapes, cycles and emptiness.</li>
 *   <li>FREEDOM_ANALYSIS: decide which lexicons need row flags.</li>
 *   <li>PATTERN_BUILDING: build the root patterns bottom-up from cached fragments.</li>
 *   <li>MINIMIZATION: determinize and minimize the union of the roots.</li>
 *   <li>HYPERMINIMIZATION: optional lossy companion automaton.</li>
 * </ol>
 *
 * <p>Instances are single-threaded. Caches persist across calls, so building twice
 * reuses every fragment and yields the same automaton.
 */
public class LexdCompiler implements ILexdCompiler {
    private static final Logger logger = Logger.getLogger(LexdCompiler.class.getName());

    private final LexdGrammar grammar;
    private final CompilerOptions options;
    private final Tracer tracer;

    private final CompilationContext context;
    private final FreedomAnalyzer freedomAnalyzer;
    private final TagDistributor tagDistributor;
    private final GrammarValidator validator;
    private final TransducerAssembler assembler;

    private CompilationListener listener;
    private Transducer lastTransducer;
    private Transducer hyperminimized;
    private long lastCompilationNanos;

    public LexdCompiler(LexdGrammar grammar, CompilerOptions options, Tracer tracer) {
        this.grammar = grammar;
        this.options = options;
        this.tracer = tracer;

        this.context = new CompilationContext(grammar, options);
        this.freedomAnalyzer = new FreedomAnalyzer(grammar);
        this.tagDistributor = new TagDistributor(grammar);
        this.validator = new GrammarValidator(grammar, options, tagDistributor, freedomAnalyzer);

        FlagSynthesizer flags = new FlagSynthesizer(grammar, context.alphabet(), options.tagEncoding());
        EntryAligner aligner = new EntryAligner(context.alphabet(), options.shouldAlign(), options.shouldCompress());
        LexiconTransducerBuilder lexiconBuilder = new LexiconTransducerBuilder(context, flags, aligner);
        PatternTransducerBuilder patternBuilder = new PatternTransducerBuilder(
                context, lexiconBuilder, flags, tagDistributor, freedomAnalyzer);
        this.assembler = new TransducerAssembler(context, patternBuilder, lexiconBuilder);
    }

    /**
     * Uses the process-wide tracer from {@link TracingService}.
     */
    public LexdCompiler(LexdGrammar grammar, CompilerOptions options) {
        this(grammar, options, TracingService.getInstance().getTracer());
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public Transducer buildTransducer() {
        Span span = tracer.spanBuilder("build-transducer").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            int totalStages = options.shouldHypermin() ? 5 : 4;
            logger.info("Compiling grammar with " + options);

            List<SymbolHandle> roots = runStage("VALIDATION", 1, totalStages,
                    validator::validate,
                    r -> Map.of("roots", r.size()));

            Map<SymbolHandle, Boolean> freedom = runStage("FREEDOM_ANALYSIS", 2, totalStages,
                    () -> freedomAnalyzer.analyze(roots),
                    f -> Map.of("lexicons", f.size()));
            context.setFreedom(freedom);
            context.setHeldAround(freedomAnalyzer.heldAround(roots));
            span.setAttribute("boundLexicons", context.boundLexiconCount());

            Transducer assembled = runStage("PATTERN_BUILDING", 3, totalStages,
                    () -> assembler.assemble(roots),
                    t -> Map.of("states", t.stateCount(),
                            "patternCacheSize", context.patternTransducers().size(),
                            "lexiconCacheSize", context.lexiconTransducers().size()));

            Transducer minimal = runStage("MINIMIZATION", 4, totalStages,
                    () -> assembler.minimize(assembled),
                    t -> Map.of("states", t.stateCount(), "transitions", t.transitionCount()));

            hyperminimized = null;
            if (options.shouldHypermin()) {
                hyperminimized = runStage("HYPERMINIMIZATION", 5, totalStages,
                        () -> assembler.hyperminimize(minimal),
                        t -> Map.of("states", t.stateCount()));
            }

            lastTransducer = minimal;
            lastCompilationNanos = System.nanoTime() - startTime;
            span.setAttribute("stateCount", minimal.stateCount());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(lastCompilationNanos));
            logStatistics();
            return minimal;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Transducer buildTransducerSingleLexicon(String lexiconName) {
        Span span = tracer.spanBuilder("build-single-lexicon").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("lexicon", lexiconName);
            long startTime = System.nanoTime();

            Transducer assembled = runStage("PATTERN_BUILDING", 1, 2,
                    () -> assembler.assembleLexicon(lexiconName),
                    t -> Map.of("states", t.stateCount()));
            Transducer minimal = runStage("MINIMIZATION", 2, 2,
                    () -> assembler.minimize(assembled),
                    t -> Map.of("states", t.stateCount(), "transitions", t.transitionCount()));

            lastTransducer = minimal;
            hyperminimized = null;
            lastCompilationNanos = System.nanoTime() - startTime;
            return minimal;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Optional<Transducer> hyperminTransducer() {
        return Optional.ofNullable(hyperminimized);
    }

    @Override
    public Alphabet alphabet() {
        return context.alphabet();
    }

    @Override
    public CompilationStats statistics() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("tagEncoding", options.tagEncoding().name());
        metadata.put("aligned", options.shouldAlign());
        metadata.put("labelCount", context.alphabet().labelCount());
        if (hyperminimized != null) {
            metadata.put("hyperminimizedStates", hyperminimized.stateCount());
        }
        return new CompilationStats(
                grammar.lexicons().size(),
                grammar.patterns().size(),
                context.patternTransducers().size(),
                context.lexiconTransducers().size(),
                context.entryTransducers().size(),
                context.boundLexiconCount(),
                context.alphabet().flagCount(),
                lastTransducer != null ? lastTransducer.stateCount() : 0,
                lastTransducer != null ? lastTransducer.transitionCount() : 0,
                lastCompilationNanos,
                metadata
        );
    }

    private <T> T runStage(String stageName, int stageNumber, int totalStages,
                           Supplier<T> stage, Function<T, Map<String, Object>> metrics) {
        Span span = tracer.spanBuilder(stageName.toLowerCase().replace('_', '-')).startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (listener != null) {
                listener.onStageStart(stageName, stageNumber, totalStages);
            }
            long start = System.nanoTime();
            T result = stage.get();
            long duration = System.nanoTime() - start;
            span.setAttribute("durationMs", TimeUnit.NANOSECONDS.toMillis(duration));
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, duration, metrics.apply(result)));
            }
            return result;
        } catch (CompilationException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    private void logStatistics() {
        CompilationStats stats = statistics();
        logger.info(String.format(
                "Compiled %d lexicons and %d patterns in %d ms: %d states, %d transitions, %d flags, "
                        + "%d bound lexicons, caches pattern=%d lexicon=%d entry=%d",
                stats.lexiconCount(), stats.patternCount(),
                TimeUnit.NANOSECONDS.toMillis(stats.compilationTimeNanos()),
                stats.stateCount(), stats.transitionCount(), stats.flagCount(),
                stats.boundLexiconCount(), stats.patternCacheSize(), stats.lexiconCacheSize(),
                stats.entryCacheSize()));
    }
}
