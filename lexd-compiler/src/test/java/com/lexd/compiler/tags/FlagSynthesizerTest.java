package com.lexd.compiler.tags;

import com.lexd.api.CompilerOptions;
import com.lexd.api.CompilerOptions.TagEncoding;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.RepeatMode;
import com.lexd.compiler.LexdCompiler;
import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.FlagDiacritic;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static com.lexd.compiler.CompilerTestSupport.acceptedPairs;
import static com.lexd.compiler.CompilerTestSupport.compiler;
import static org.assertj.core.api.Assertions.assertThat;

class FlagSynthesizerTest {

    private static LexdGrammar.Builder wordGrammar() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("Stem", 1, builder.identity("walk", "v"))
                .addEntry("Stem", 2, builder.identity("dog", "n"))
                .addEntry("Suffix", 3, builder.identity("s", "pl"))
                .addEntry("Suffix", 4, builder.identity("ed", "past"));
        builder.addPattern("Word", 5, builder.ref("Stem"), builder.ref("Suffix"));
        builder.addRootPattern(6, builder.ref("Word", 1, RepeatMode.NORMAL, List.of("n"), List.of()))
                .addRootPattern(7, builder.ref("Word", 1, RepeatMode.NORMAL, List.of("v"), List.of("pl")))
                .addRootPattern(8, builder.ref("Suffix", 1, RepeatMode.NORMAL, List.of(), List.of("past")));
        return builder;
    }

    private static CompilerOptions options(TagEncoding encoding) {
        return CompilerOptions.builder()
                .tagsAsFlags(encoding == TagEncoding.FLAGS)
                .tagsAsMinFlags(encoding == TagEncoding.MINIMAL_FLAGS)
                .build();
    }

    @ParameterizedTest
    @EnumSource(TagEncoding.class)
    @DisplayName("Every tag encoding should accept the same pairs")
    void testEncodingsAgree(TagEncoding encoding) {
        assertThat(acceptedPairs(wordGrammar().build(), options(encoding), 20))
                .containsExactly("doged:doged", "dogs:dogs", "s:s", "walked:walked");
    }

    @Test
    @DisplayName("Static filtering should not create any flag")
    void testStaticHasNoFlags() {
        LexdCompiler compiler = compiler(wordGrammar().build(), options(TagEncoding.STATIC));
        compiler.buildTransducer();

        assertThat(compiler.statistics().flagCount()).isZero();
    }

    @Test
    @DisplayName("Minimal flags should only flag tags filtered on pattern references")
    void testMinimalFlagAlphabet() {
        LexdGrammar grammar = wordGrammar().build();

        FlagSynthesizer full = new FlagSynthesizer(grammar, grammar.alphabet().copy(), TagEncoding.FLAGS);
        FlagSynthesizer minimal = new FlagSynthesizer(grammar, grammar.alphabet().copy(), TagEncoding.MINIMAL_FLAGS);

        assertThat(names(grammar, full)).containsExactly("v", "n", "pl", "past");
        assertThat(names(grammar, minimal)).containsExactly("v", "n", "pl");
    }

    private static List<String> names(LexdGrammar grammar, FlagSynthesizer flags) {
        List<String> names = new ArrayList<>();
        flags.flaggedTags().forEach(tag -> names.add(grammar.name(tag)));
        return names;
    }

    @ParameterizedTest
    @EnumSource(TagEncoding.class)
    @DisplayName("A tag required inside a reference that forbids it should stay forbidden")
    void testNestedOppositeFilters(TagEncoding encoding) {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("A", 1, builder.identity("a", "x"))
                .addEntry("A", 2, builder.identity("b"));
        builder.addPattern("P", 3, builder.ref("A", 1, RepeatMode.NORMAL, List.of("x"), List.of()))
                .addPattern("P", 4, builder.ref("A"));
        builder.addRootPattern(5, builder.ref("P", 1, RepeatMode.NORMAL, List.of(), List.of("x")));

        assertThat(acceptedPairs(builder.build(), options(encoding), 6)).containsExactly("b:b");
    }

    @ParameterizedTest
    @EnumSource(TagEncoding.class)
    @DisplayName("A required tag on a repeated element should need only one iteration to carry it")
    void testRequiredTagOnRepetition(TagEncoding encoding) {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("A", 1, builder.identity("a", "x"))
                .addEntry("A", 2, builder.identity("b"));
        builder.addPattern("P", 3, builder.ref("A", 1, RepeatMode.STAR, List.of(), List.of()));
        builder.addRootPattern(4, builder.ref("P", 1, RepeatMode.NORMAL, List.of("x"), List.of()));

        assertThat(acceptedPairs(builder.build(), options(encoding), 6)).containsExactly(
                "a:a", "aa:aa", "aaa:aaa", "aab:aab", "ab:ab", "aba:aba", "abb:abb",
                "ba:ba", "baa:baa", "bab:bab", "bba:bba");
    }

    @ParameterizedTest
    @EnumSource(TagEncoding.class)
    @DisplayName("Several required tags on a repeated element may come from different iterations")
    void testTagsFromDifferentIterations(TagEncoding encoding) {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("A", 1, builder.identity("a", "x"))
                .addEntry("A", 2, builder.identity("b", "y"));
        builder.addPattern("P", 3, builder.ref("A", 1, RepeatMode.PLUS, List.of(), List.of()));
        builder.addRootPattern(4, builder.ref("P", 1, RepeatMode.NORMAL, List.of("x", "y"), List.of()));

        assertThat(acceptedPairs(builder.build(), options(encoding), 4)).containsExactly("ab:ab", "ba:ba");
    }

    @Test
    @DisplayName("Tag flags should keep requirements and each prohibition apart")
    void testTagFlagRendering() {
        LexdGrammar.Builder builder = wordGrammar();
        LexdGrammar grammar = builder.build();
        Alphabet alphabet = grammar.alphabet().copy();
        FlagSynthesizer flags = new FlagSynthesizer(grammar, alphabet, TagEncoding.FLAGS);
        var element = builder.ref("Word", 1, RepeatMode.NORMAL, List.of("v"), List.of("pl"));
        String v = feature(grammar, "v");
        String pl = feature(grammar, "pl");

        assertThat(render(alphabet, flags.preTagLabels(element)))
                .containsExactly("@P.[" + v + "].1@", "@P.-[" + pl + "]1.1@");
        assertThat(render(alphabet, flags.postTagLabels(element)))
                .containsExactly("@D.[" + v + "].1@", "@C.-[" + pl + "]1@");
        assertThat(render(alphabet, flags.entryTagLabels(builder.tags(List.of("pl", "other")))))
                .containsExactly("@D.-[" + pl + "]1.1@");
        assertThat(render(alphabet, flags.entryTagLabels(builder.tags(List.of("v")))))
                .containsExactly("@C.[" + v + "]@");
    }

    @Test
    @DisplayName("Row flags should encode the entry number and be shared between equal triples")
    void testRowFlags() {
        LexdGrammar.Builder builder = wordGrammar();
        LexdGrammar grammar = builder.build();
        Alphabet alphabet = grammar.alphabet().copy();
        FlagSynthesizer flags = new FlagSynthesizer(grammar, alphabet, TagEncoding.STATIC);
        var stem = grammar.interner().lookup("Stem");

        int label = flags.rowLabel(stem, 0);

        assertThat(flags.rowLabel(stem, 0)).isEqualTo(label);
        assertThat(alphabet.flagOf(alphabet.left(label))).isEqualTo(FlagDiacritic.unify(feature(grammar, "Stem"), 1));
        assertThat(render(alphabet, flags.clearLabels(List.of(stem))))
                .containsExactly("@C." + feature(grammar, "Stem") + "@");
    }

    @Test
    @DisplayName("Lexicons, tags and synthesized names should never share a feature")
    void testFeaturesAreDisjoint() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("[adj]", 1, builder.identity("a", "adj"))
                .addEntry("lexicon#1", 2, builder.identity("b"));
        String anonymous = builder.anonymousLexicon(3, List.of(List.of(builder.identity("c"))));
        LexdGrammar grammar = builder.build();
        FlagSynthesizer flags = new FlagSynthesizer(grammar, grammar.alphabet().copy(), TagEncoding.FLAGS);

        var lexicon = grammar.interner().lookup("[adj]");
        var tag = grammar.interner().lookup("adj");
        assertThat(flags.feature(lexicon)).isNotEqualTo(flags.tagFeature(tag));
        assertThat(flags.feature(grammar.interner().lookup(anonymous)))
                .isNotEqualTo(flags.feature(grammar.interner().lookup("lexicon#1")));
    }

    @Test
    @DisplayName("A bound lexicon whose name contains @ should still compile")
    void testLexiconNameWithAt() {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        builder.addEntry("N@1", 1, builder.identity("a"), builder.identity("x"))
                .addEntry("N@1", 2, builder.identity("b"), builder.identity("y"));
        builder.addRootPattern(3, builder.ref("N@1", 1), builder.ref("N@1", 2));

        assertThat(acceptedPairs(builder.build(), 10)).containsExactly("ax:ax", "by:by");
    }

    private static String feature(LexdGrammar grammar, String name) {
        return name + "#" + grammar.interner().lookup(name).id();
    }

    private static List<String> render(Alphabet alphabet, IntList labels) {
        List<String> rendered = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            rendered.add(alphabet.renderLabel(labels.getInt(i)));
        }
        return rendered;
    }
}
