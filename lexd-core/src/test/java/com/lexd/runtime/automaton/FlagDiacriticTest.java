package com.lexd.runtime.automaton;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlagDiacriticTest {

    @Test
    @DisplayName("Should render and parse the conventional flag syntax")
    void testRenderAndParse() {
        FlagDiacritic flag = new FlagDiacritic(FlagDiacriticType.POSITIVE, "[adj]", 1);

        assertThat(flag.render()).isEqualTo("@P.[adj].1@");
        assertThat(FlagDiacritic.parse("@P.[adj].1@")).isEqualTo(flag);
        assertThat(FlagDiacritic.clear("Noun").render()).isEqualTo("@C.Noun@");
        assertThat(FlagDiacritic.parse("@C.Noun@")).isEqualTo(FlagDiacritic.clear("Noun"));
        assertThat(FlagDiacritic.parse("@R.my.feature@"))
                .isEqualTo(new FlagDiacritic(FlagDiacriticType.REQUIRE, "my.feature", 0));
    }

    @Test
    @DisplayName("Should reject text that is not a flag")
    void testParseRejects() {
        assertThat(FlagDiacritic.parse("<n>")).isNull();
        assertThat(FlagDiacritic.parse("@X.a.1@")).isNull();
        assertThat(FlagDiacritic.parse("@U.a@")).isNull();
        assertThat(FlagDiacritic.parse("@@")).isNull();
    }

    @Test
    @DisplayName("Value-carrying types should require a value")
    void testValidation() {
        assertThatThrownBy(() -> new FlagDiacritic(FlagDiacriticType.UNIFICATION, "x", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a value");
        assertThatThrownBy(() -> new FlagDiacritic(FlagDiacriticType.CLEAR, "a@b", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "{0}: current={1}, value={2} -> {3}")
    @CsvSource({
            // type, current, value, expected (R = reject)
            "UNIFICATION, 0, 2, 2",
            "UNIFICATION, 2, 2, 2",
            "UNIFICATION, 3, 2, R",
            "UNIFICATION, -3, 2, 2",
            "UNIFICATION, -2, 2, R",
            "POSITIVE, 5, 2, 2",
            "NEGATIVE, 0, 2, -2",
            "REQUIRE, 2, 2, 2",
            "REQUIRE, 1, 2, R",
            "REQUIRE, 0, 0, R",
            "REQUIRE, 4, 0, 4",
            "DISALLOW, 2, 2, R",
            "DISALLOW, 1, 2, 1",
            "DISALLOW, 0, 0, 0",
            "DISALLOW, 3, 0, R",
            "CLEAR, 7, 0, 0"
    })
    @DisplayName("Each flag type should implement its matching semantics")
    void testSemantics(FlagDiacriticType type, int current, int value, String expected) {
        int result = type.apply(current, value);

        if (expected.equals("R")) {
            assertThat(result).isEqualTo(FlagDiacriticType.REJECT);
        } else {
            assertThat(result).isEqualTo(Integer.parseInt(expected));
        }
    }
}
