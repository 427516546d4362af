package com.lexd.compiler;

import com.lexd.api.CompilationException;
import com.lexd.api.CompilationListener;
import com.lexd.api.CompilerOptions;
import com.lexd.api.model.CompilationResult;
import com.lexd.api.model.CompilationStats;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.RepeatMode;
import com.lexd.runtime.automaton.Transducer;
import com.lexd.runtime.evaluation.FlagAwareMatcher;
import com.lexd.runtime.operations.AttFormatter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.lexd.compiler.CompilerTestSupport.acceptedPairs;
import static com.lexd.compiler.CompilerTestSupport.compiler;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexdCompilerTest {

    private static LexdGrammar singleEntryGrammar() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("L", 1, builder.segment("a", "b"));
        builder.addRootPattern(2, builder.ref("L"));
        return builder.build();
    }

    private static LexdGrammar nounGrammar() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("Stem", 1, builder.identity("cat", "n"))
                .addEntry("Stem", 2, builder.identity("dog", "n"))
                .addEntry("Number", 3, builder.segment("<sg>", ""))
                .addEntry("Number", 4, builder.segment("<pl>", "s"));
        builder.addPattern("Noun", 5, builder.ref("Stem"), builder.ref("Number"));
        builder.addRootPattern(6, builder.ref("Noun"));
        return builder.build();
    }

    @Test
    @DisplayName("A single (a,b) entry should compile to exactly that pair")
    void testRoundTrip() {
        LexdCompiler compiler = compiler(singleEntryGrammar());
        Transducer transducer = compiler.buildTransducer();
        FlagAwareMatcher matcher = new FlagAwareMatcher(transducer, compiler.alphabet());

        assertThat(matcher.accepts("a", "b")).isTrue();
        assertThat(matcher.accepts("", "")).isFalse();
        assertThat(matcher.accepts("b", "a")).isFalse();
        assertThat(matcher.acceptedPairs(10)).containsExactly("a:b");
        assertThat(transducer.isDeterministic()).isTrue();
    }

    @Test
    @DisplayName("Should map analyses to surface forms through a nested pattern")
    void testNestedPattern() {
        assertThat(acceptedPairs(nounGrammar(), 12))
                .containsExactly("cat<pl>:cats", "cat<sg>:cat", "dog<pl>:dogs", "dog<sg>:dog");
    }

    @Test
    @DisplayName("Compiling the same grammar twice should give identical automata")
    void testDeterminism() {
        LexdGrammar grammar = nounGrammar();
        LexdCompiler first = compiler(grammar);
        LexdCompiler second = compiler(grammar);

        String firstAtt = AttFormatter.format(first.buildTransducer(), first.alphabet());
        String secondAtt = AttFormatter.format(second.buildTransducer(), second.alphabet());

        assertThat(firstAtt).isEqualTo(secondAtt);
    }

    @Test
    @DisplayName("A second build should reuse every cached fragment and give the same automaton")
    void testMemoizationTransparency() {
        LexdCompiler compiler = compiler(nounGrammar());

        String firstAtt = AttFormatter.format(compiler.buildTransducer(), compiler.alphabet());
        CompilationStats afterFirst = compiler.statistics();
        String secondAtt = AttFormatter.format(compiler.buildTransducer(), compiler.alphabet());
        CompilationStats afterSecond = compiler.statistics();

        assertThat(secondAtt).isEqualTo(firstAtt);
        assertThat(afterSecond.patternCacheSize()).isEqualTo(afterFirst.patternCacheSize());
        assertThat(afterSecond.lexiconCacheSize()).isEqualTo(afterFirst.lexiconCacheSize());
    }

    @Test
    @DisplayName("Should report every stage to the listener in order")
    void testListenerStages() {
        LexdCompiler compiler = compiler(nounGrammar(), CompilerOptions.builder().hypermin(true).build());
        List<String> started = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        compiler.setCompilationListener(new CompilationListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
                started.add(stageName + " " + stageNumber + "/" + totalStages);
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
                completed.add(result.stageName());
                assertThat(result.durationNanos()).isNotNegative();
            }

            @Override
            public void onError(String stageName, Exception error) {
                throw new AssertionError("Unexpected error in " + stageName, error);
            }
        });

        compiler.buildTransducer();

        assertThat(started).containsExactly("VALIDATION 1/5", "FREEDOM_ANALYSIS 2/5",
                "PATTERN_BUILDING 3/5", "MINIMIZATION 4/5", "HYPERMINIMIZATION 5/5");
        assertThat(completed).containsExactly("VALIDATION", "FREEDOM_ANALYSIS",
                "PATTERN_BUILDING", "MINIMIZATION", "HYPERMINIMIZATION");
    }

    @Test
    @DisplayName("Should report the failing stage to the listener and rethrow")
    void testListenerError() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addRootPattern(1, builder.ref("Missing"));
        LexdCompiler compiler = compiler(builder.build());
        List<String> failed = new ArrayList<>();
        compiler.setCompilationListener(new CompilationListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
            }

            @Override
            public void onError(String stageName, Exception error) {
                failed.add(stageName);
            }
        });

        assertThatThrownBy(compiler::buildTransducer).isInstanceOf(CompilationException.class);
        assertThat(failed).containsExactly("VALIDATION");
    }

    @Test
    @DisplayName("Statistics should describe the last build")
    void testStatistics() {
        LexdCompiler compiler = compiler(nounGrammar());
        Transducer transducer = compiler.buildTransducer();

        CompilationStats stats = compiler.statistics();

        assertThat(stats.lexiconCount()).isEqualTo(2);
        assertThat(stats.patternCount()).isEqualTo(2);
        assertThat(stats.boundLexiconCount()).isZero();
        assertThat(stats.flagCount()).isZero();
        assertThat(stats.stateCount()).isEqualTo(transducer.stateCount());
        assertThat(stats.transitionCount()).isEqualTo(transducer.transitionCount());
        assertThat(stats.compilationTimeNanos()).isPositive();
        assertThat(stats.metadata()).containsEntry("tagEncoding", "STATIC");
    }

    @Test
    @DisplayName("Hyperminimization should produce a smaller companion automaton")
    void testHypermin() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("A", 1, builder.identity("a"))
                .addEntry("B", 2, builder.identity("b"));
        builder.addRootPattern(3, builder.ref("A", 1, RepeatMode.STAR, List.of(), List.of()))
                .addRootPattern(4, builder.ref("B"));
        LexdCompiler compiler = compiler(builder.build(), CompilerOptions.builder().hypermin(true).build());

        CompilationResult result = compiler.compile();

        assertThat(result.transducer().stateCount()).isEqualTo(3);
        assertThat(result.hyperminimizedTransducer()).isPresent();
        Transducer hyper = result.hyperminimizedTransducer().get();
        assertThat(hyper.stateCount()).isEqualTo(1);
        assertThat(new FlagAwareMatcher(hyper, result.alphabet()).acceptedPairs(6))
                .containsExactly(":", "a:a", "aa:aa", "aaa:aaa");
    }

    @Test
    @DisplayName("Without hyperminimization there should be no companion automaton")
    void testNoHypermin() {
        LexdCompiler compiler = compiler(singleEntryGrammar());
        compiler.buildTransducer();

        assertThat(compiler.hyperminTransducer()).isEmpty();
    }

    @Test
    @DisplayName("Single-lexicon mode should concatenate the columns of each entry")
    void testSingleLexicon() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("L", 1, builder.segment("a", "b"), builder.segment("c", "d"))
                .addEntry("L", 2, builder.identity("e"), builder.identity("f"));
        LexdCompiler compiler = compiler(builder.build());

        Transducer transducer = compiler.buildTransducerSingleLexicon("L");

        assertThat(new FlagAwareMatcher(transducer, compiler.alphabet()).acceptedPairs(10))
                .containsExactly("ac:bd", "ef:ef");
    }

    @Test
    @DisplayName("Single-lexicon mode should reject an unknown lexicon")
    void testSingleLexiconUnknown() {
        LexdCompiler compiler = compiler(singleEntryGrammar());

        assertThatThrownBy(() -> compiler.buildTransducerSingleLexicon("Nope"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Nope")
                .satisfies(e -> assertThat(((CompilationException) e).getKind())
                        .isEqualTo(CompilationException.Kind.REFERENCE));
    }

    @Test
    @DisplayName("Exceeding the determinization work limit should be a resource error")
    void testWorkLimit() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("AB", 1, builder.identity("a"))
                .addEntry("AB", 2, builder.identity("b"))
                .addEntry("A", 3, builder.identity("a"));
        builder.addPattern("Any", 4, builder.ref("AB"));
        builder.addRootPattern(5,
                builder.ref("AB", 1, RepeatMode.STAR, List.of(), List.of()),
                builder.ref("A"),
                builder.ref("Any"), builder.ref("Any"), builder.ref("Any"),
                builder.ref("Any"), builder.ref("Any"), builder.ref("Any"));
        LexdCompiler compiler = compiler(builder.build(),
                CompilerOptions.builder().determinizeWorkLimit(1).build());

        assertThatThrownBy(compiler::buildTransducer)
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("work limit")
                .satisfies(e -> assertThat(((CompilationException) e).getKind())
                        .isEqualTo(CompilationException.Kind.RESOURCE));
    }

    @Test
    @DisplayName("Explicit root patterns should replace the unnamed root")
    void testExplicitRoots() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("A", 1, builder.identity("a"))
                .addEntry("B", 2, builder.identity("b"));
        builder.addPattern("First", 3, builder.ref("A"))
                .addPattern("Second", 4, builder.ref("B"));
        LexdGrammar grammar = builder.build();

        CompilerOptions options = CompilerOptions.builder().rootPatterns(List.of("First", "Second")).build();

        assertThat(acceptedPairs(grammar, options, 4)).containsExactly("a:a", "b:b");
    }
}
