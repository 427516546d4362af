package com.lexd.runtime.operations;

import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.TransitionSymbol;
import com.lexd.runtime.automaton.Transducer;
import com.lexd.runtime.evaluation.FlagAwareMatcher;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.TooComplexToDeterminizeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutomatonOperationsTest {

    private Alphabet alphabet;

    @BeforeEach
    void setUp() {
        alphabet = new Alphabet();
    }

    private int label(char c) {
        TransitionSymbol s = TransitionSymbol.ofCodePoint(c);
        return alphabet.label(s, s);
    }

    private Transducer words(String... words) {
        Transducer t = new Transducer();
        for (String word : words) {
            int state = t.initial();
            state = t.insertSingleTransduction(Alphabet.EPSILON_LABEL, state);
            for (char c : word.toCharArray()) {
                state = t.insertSingleTransduction(label(c), state);
            }
            t.setFinal(state);
        }
        return t;
    }

    @Test
    @DisplayName("Minimization should preserve the accepted pairs")
    void testMinimizePreservesLanguage() {
        Transducer t = words("cat", "cats", "bat", "bats");

        Transducer minimal = AutomatonOperations.minimize(t, 10_000);

        assertThat(new FlagAwareMatcher(minimal, alphabet).acceptedPairs(20))
                .isEqualTo(new FlagAwareMatcher(t, alphabet).acceptedPairs(20));
        assertThat(minimal.isDeterministic()).isTrue();
        // c|b -> a -> t -> (final) -> s -> (final)
        assertThat(minimal.stateCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Conversion should remove epsilon moves and keep the initial state first")
    void testEpsilonRemoval() {
        Transducer t = words("a");

        Automaton automaton = AutomatonOperations.toAutomaton(t);

        assertThat(automaton.getNumStates()).isEqualTo(t.stateCount());
        assertThat(automaton.getNumTransitions(0)).isEqualTo(1);
        assertThat(AutomatonOperations.isEmpty(t)).isFalse();
    }

    @Test
    @DisplayName("An automaton without final states should be empty after minimization")
    void testEmpty() {
        Transducer t = new Transducer();
        t.insertSingleTransduction(label('a'), t.initial());

        Transducer minimal = AutomatonOperations.minimize(t, 10_000);

        assertThat(AutomatonOperations.isEmpty(t)).isTrue();
        assertThat(minimal.finals()).isEmpty();
        assertThat(minimal.transitionCount()).isZero();
    }

    @Test
    @DisplayName("Determinization beyond the work limit should throw")
    void testWorkLimit() {
        // (a|b)* a (a|b)^12 needs exponentially many DFA states
        Transducer t = new Transducer();
        int loop = t.initial();
        t.addTransition(loop, label('a'), loop);
        t.addTransition(loop, label('b'), loop);
        int state = t.insertSingleTransduction(label('a'), loop);
        for (int i = 0; i < 12; i++) {
            int next = t.newState();
            t.addTransition(state, label('a'), next);
            t.addTransition(state, label('b'), next);
            state = next;
        }
        t.setFinal(state);

        assertThatThrownBy(() -> AutomatonOperations.determinize(t, 100))
                .isInstanceOf(TooComplexToDeterminizeException.class);
    }
}
