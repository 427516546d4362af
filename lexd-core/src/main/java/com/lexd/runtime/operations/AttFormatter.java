package com.lexd.runtime.operations;

import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.Transducer;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes a transducer in the tab-separated AT&amp;T text format:
 * {@code source target input output} per transition, then one line per final state.
 */
public final class AttFormatter {

    private static final String EPSILON = "@0@";

    private AttFormatter() {
    }

    public static void write(Transducer transducer, Alphabet alphabet, Writer out) throws IOException {
        for (int state = 0; state < transducer.stateCount(); state++) {
            final int source = state;
            try {
                transducer.forEachTransition(state, (label, target) -> {
                    try {
                        out.write(source + "\t" + target + "\t" + symbol(alphabet, alphabet.left(label))
                                + "\t" + symbol(alphabet, alphabet.right(label)) + "\n");
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
        }
        for (int state : transducer.finals()) {
            out.write(state + "\n");
        }
        out.flush();
    }

    public static String format(Transducer transducer, Alphabet alphabet) {
        StringWriter writer = new StringWriter();
        try {
            write(transducer, alphabet, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private static String symbol(Alphabet alphabet, int symbolId) {
        if (symbolId == 0) {
            return EPSILON;
        }
        String text = alphabet.render(symbolId);
        return switch (text) {
            case " " -> "@_SPACE_@";
            case "\t" -> "@_TAB_@";
            default -> text;
        };
    }
}
