package com.lexd.compiler.io;

import com.lexd.api.CompilationException;
import com.lexd.api.CompilationException.Kind;
import com.lexd.api.model.Lexicon;
import com.lexd.api.model.LexdGrammar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.lexd.compiler.CompilerTestSupport.acceptedPairs;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarLoaderTest {

    private static final String LEXICONS = """
            "lexicons": [
              {"name": "A", "entries": [[{"left": "a"}]]},
              {"name": "B", "entries": [[{"left": "b"}]]},
              {"name": "L", "entries": [[{"left": "a"}], [{"left": "b"}]]},
              {"name": "R", "entries": [[{"left": "x"}], [{"left": "y"}]]}
            ]""";

    private final GrammarLoader loader = new GrammarLoader();

    private LexdGrammar loadRoot(String elements) throws IOException {
        return loader.loadFromString("{" + LEXICONS + ", \"patterns\": [{\"line\": 5, \"elements\": ["
                + elements + "]}]}");
    }

    @Test
    @DisplayName("Should load a grammar from the classpath and compile it")
    void testLoadFromClasspath() throws IOException {
        LexdGrammar grammar;
        try (InputStream in = getClass().getResourceAsStream("/grammars/nouns.json")) {
            assertThat(in).isNotNull();
            grammar = loader.load(in);
        }

        assertThat(grammar.lexicons()).hasSize(2);
        assertThat(grammar.isPattern(grammar.interner().lookup("Word"))).isTrue();
        assertThat(grammar.isPattern(grammar.rootHandle())).isTrue();
        assertThat(acceptedPairs(grammar, 12))
                .containsExactly("cat<pl>:cats", "cat<sg>:cat", "dog<pl>:dogs", "dog<sg>:dog");
    }

    @Test
    @DisplayName("Should load a grammar from a file")
    void testLoadFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("grammar.json");
        Files.writeString(file, "{" + LEXICONS + ", \"patterns\": [{\"elements\": [{\"name\": \"A\"}]}]}");

        LexdGrammar grammar = loader.load(file);

        assertThat(acceptedPairs(grammar, 5)).containsExactly("a:a");
    }

    @Test
    @DisplayName("Inline lexicons and right sieves should be understood")
    void testInlineLexiconAndSieve() throws IOException {
        LexdGrammar grammar = loadRoot("""
                {"name": "A"}, {"sieve": ">"}, {"lexicon": [[{"left": "b"}], [{"left": "c"}]]}""");

        assertThat(acceptedPairs(grammar, 5)).containsExactly("a:a", "ab:ab", "ac:ac");
    }

    @Test
    @DisplayName("Inline alternatives should honor their repeat mode")
    void testInlineAlternatives() throws IOException {
        LexdGrammar grammar = loadRoot("""
                {"alternatives": [[{"name": "A"}], [{"name": "B"}]], "mode": "?"}""");

        assertThat(acceptedPairs(grammar, 5)).containsExactly(":", "a:a", "b:b");
    }

    @Test
    @DisplayName("A right name should collate two lexicons")
    void testCollation() throws IOException {
        LexdGrammar grammar = loadRoot("""
                {"name": "L", "right_name": "R"}""");

        assertThat(acceptedPairs(grammar, 5)).containsExactly("a:x", "b:y");
    }

    @Test
    @DisplayName("Declared columns should create a lexicon without entries")
    void testDeclaredColumns() throws IOException {
        LexdGrammar grammar = loader.loadFromString("""
                {"lexicons": [{"name": "Empty", "line": 2, "columns": 2}], "unknown": true}""");

        Lexicon empty = grammar.lexicon(grammar.interner().lookup("Empty"));
        assertThat(empty.columnCount()).isEqualTo(2);
        assertThat(empty.size()).isZero();
    }

    @Test
    @DisplayName("An unknown repeat mode should be a shape error on the pattern's line")
    void testUnknownMode() {
        assertThatThrownBy(() -> loadRoot("""
                {"name": "A", "mode": "%"}"""))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Line 5: Unknown repeat mode: %")
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .satisfies(e -> assertThat(((CompilationException) e).getKind()).isEqualTo(Kind.SHAPE));
    }

    @Test
    @DisplayName("Unknown sides, unknown sieves and nameless elements should be shape errors")
    void testMalformedElements() {
        assertThatThrownBy(() -> loadRoot("""
                {"name": "A", "side": "middle"}"""))
                .hasMessageContaining("Unknown side: middle");
        assertThatThrownBy(() -> loadRoot("""
                {"sieve": "^"}"""))
                .hasMessageContaining("Unknown sieve: ^");
        assertThatThrownBy(() -> loadRoot("""
                {"mode": "*"}"""))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("has no name");
    }

    @Test
    @DisplayName("Malformed JSON should surface as an IOException")
    void testMalformedJson() {
        assertThatThrownBy(() -> loader.loadFromString("{\"lexicons\": ["))
                .isInstanceOf(IOException.class);
    }
}
