package com.lexd.api.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolInternerTest {

    private SymbolInterner interner;

    @BeforeEach
    void setUp() {
        interner = new SymbolInterner();
    }

    @Test
    @DisplayName("Interning the same name twice should return the same handle")
    void testIntern() {
        SymbolHandle noun = interner.intern("Noun");
        SymbolHandle verb = interner.intern("Verb");

        assertThat(interner.intern("Noun")).isEqualTo(noun);
        assertThat(noun.id()).isEqualTo(1);
        assertThat(verb.id()).isEqualTo(2);
        assertThat(noun).isLessThan(verb);
        assertThat(interner.resolve(verb)).isEqualTo("Verb");
        assertThat(interner.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Handle 0 should be reserved and unresolvable")
    void testEmptyHandle() {
        assertThat(interner.lookup("missing")).isEqualTo(SymbolHandle.EMPTY);
        assertThat(SymbolHandle.EMPTY.isEmpty()).isTrue();
        assertThatThrownBy(() -> interner.resolve(SymbolHandle.EMPTY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown symbol handle");
        assertThatThrownBy(() -> interner.resolve(new SymbolHandle(42)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Anonymous names should be unique and never clash with user names")
    void testAnonymous() {
        SymbolHandle first = interner.internAnonymous("lexicon");
        SymbolHandle second = interner.internAnonymous("lexicon");

        assertThat(first).isNotEqualTo(second);
        assertThat(interner.resolve(first)).startsWith(" ");
        assertThat(interner.intern("lexicon#1")).isNotEqualTo(first);
    }
}
