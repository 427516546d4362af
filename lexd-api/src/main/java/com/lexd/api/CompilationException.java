/*
 * Copyright (c) 2025 lexd
 * Licensed under the Apache License, Version 2.0
 */
package com.lexd.api;

/**
 * Exception thrown when a grammar cannot be compiled.
 *
 * <p>Unchecked, like every user-facing compilation failure in this project. Carries
 * the {@link Kind} of problem and the source line it was detected on, or {@code -1}
 * when no single line is responsible.
 */
public class CompilationException extends RuntimeException {

    /**
     * Error taxonomy.
     */
    public enum Kind {
        /** A lexicon, pattern or root name that does not resolve. */
        REFERENCE,
        /** Inconsistent structure: column counts, tag conflicts, cycles, misplaced references. */
        SHAPE,
        /** A pattern element that can never match anything. */
        EMPTINESS,
        /** The automaton grew beyond the configured determinization limit. */
        RESOURCE
    }

    private final Kind kind;
    private final int lineNumber;

    public CompilationException(Kind kind, int lineNumber, String message) {
        super(format(lineNumber, message));
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public CompilationException(Kind kind, int lineNumber, String message, Throwable cause) {
        super(format(lineNumber, message), cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public static CompilationException reference(int lineNumber, String message) {
        return new CompilationException(Kind.REFERENCE, lineNumber, message);
    }

    public static CompilationException shape(int lineNumber, String message) {
        return new CompilationException(Kind.SHAPE, lineNumber, message);
    }

    public static CompilationException emptiness(int lineNumber, String message) {
        return new CompilationException(Kind.EMPTINESS, lineNumber, message);
    }

    public Kind getKind() {
        return kind;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    private static String format(int lineNumber, String message) {
        return lineNumber > 0 ? "Line " + lineNumber + ": " + message : message;
    }
}
