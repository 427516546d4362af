package com.lexd.runtime.operations;

import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.Transducer;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.MinimizationOperations;
import org.apache.lucene.util.automaton.Operations;
import org.apache.lucene.util.automaton.Transition;

import java.util.logging.Logger;

/**
 * Bridge between {@link Transducer} and Lucene's automaton package.
 *
 * <p>Pair labels are used directly as Lucene labels, so determinization and
 * minimization treat each (left, right) pair as one input symbol. Epsilon moves
 * are removed on the way in because Lucene automata have no epsilon label.
 */
public final class AutomatonOperations {
    private static final Logger logger = Logger.getLogger(AutomatonOperations.class.getName());

    private AutomatonOperations() {
    }

    /**
     * Converts to a Lucene automaton, removing epsilon moves. State numbering is kept.
     */
    public static Automaton toAutomaton(Transducer transducer) {
        int stateCount = transducer.stateCount();
        Automaton.Builder builder = new Automaton.Builder(stateCount, (int) Math.min(Integer.MAX_VALUE,
                transducer.transitionCount()));
        for (int i = 0; i < stateCount; i++) {
            builder.createState();
        }
        for (int state = 0; state < stateCount; state++) {
            IntSet closure = transducer.epsilonClosure(state);
            boolean accept = false;
            IntIterator it = closure.iterator();
            while (it.hasNext()) {
                int member = it.nextInt();
                if (transducer.isFinal(member)) {
                    accept = true;
                }
                final int source = state;
                transducer.forEachTransition(member, (label, target) -> {
                    if (label != Alphabet.EPSILON_LABEL) {
                        builder.addTransition(source, target, label);
                    }
                });
            }
            builder.setAccept(state, accept);
        }
        return builder.finish();
    }

    /**
     * Converts a Lucene automaton back, expanding label ranges. Lucene state 0 becomes
     * the initial state; an automaton without states yields an empty transducer.
     */
    public static Transducer fromAutomaton(Automaton automaton) {
        Transducer transducer = new Transducer();
        int stateCount = automaton.getNumStates();
        for (int i = 1; i < stateCount; i++) {
            transducer.newState();
        }
        Transition t = new Transition();
        for (int state = 0; state < stateCount; state++) {
            if (automaton.isAccept(state)) {
                transducer.setFinal(state);
            }
            int count = automaton.initTransition(state, t);
            for (int i = 0; i < count; i++) {
                automaton.getNextTransition(t);
                for (int label = t.min; label <= t.max; label++) {
                    transducer.addTransition(state, label, t.dest);
                }
            }
        }
        return transducer;
    }

    /**
     * Determinizes without minimizing.
     *
     * @throws org.apache.lucene.util.automaton.TooComplexToDeterminizeException
     *         if determinization needs more than {@code workLimit} effort
     */
    public static Transducer determinize(Transducer transducer, int workLimit) {
        Automaton automaton = Operations.determinize(toAutomaton(transducer), workLimit);
        return fromAutomaton(Operations.removeDeadStates(automaton));
    }

    /**
     * Produces the minimal deterministic equivalent, without dead states.
     *
     * @throws org.apache.lucene.util.automaton.TooComplexToDeterminizeException
     *         if determinization needs more than {@code workLimit} effort
     */
    public static Transducer minimize(Transducer transducer, int workLimit) {
        long start = System.nanoTime();
        Automaton automaton = toAutomaton(transducer);
        Automaton minimal = Operations.removeDeadStates(MinimizationOperations.minimize(automaton, workLimit));
        Transducer result = fromAutomaton(minimal);
        logger.fine(() -> String.format("Minimized %d states to %d in %d us",
                transducer.stateCount(), result.stateCount(), (System.nanoTime() - start) / 1_000));
        return result;
    }

    /**
     * True when the transducer accepts no path at all.
     */
    public static boolean isEmpty(Transducer transducer) {
        return Operations.isEmpty(toAutomaton(transducer));
    }

    public static int defaultWorkLimit() {
        return Operations.DEFAULT_DETERMINIZE_WORK_LIMIT;
    }
}
