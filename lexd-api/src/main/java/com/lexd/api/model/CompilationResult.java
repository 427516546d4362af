package com.lexd.api.model;

import com.lexd.runtime.automaton.Alphabet;
import com.lexd.runtime.automaton.Transducer;

import java.util.Optional;

/**
 * Output of a full compilation.
 *
 * @param transducer     minimized transducer of the root pattern(s)
 * @param hyperminimized lossy companion, or {@code null} when not requested
 * @param alphabet       symbol table for reading the labels of both transducers
 */
public record CompilationResult(
        Transducer transducer,
        Transducer hyperminimized,
        Alphabet alphabet,
        CompilationStats stats
) {
    public Optional<Transducer> hyperminimizedTransducer() {
        return Optional.ofNullable(hyperminimized);
    }
}
