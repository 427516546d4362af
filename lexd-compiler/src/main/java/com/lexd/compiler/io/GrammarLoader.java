package com.lexd.compiler.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexd.api.CompilationException;
import com.lexd.api.definition.GrammarDefinition;
import com.lexd.api.definition.GrammarDefinition.ElementDefinition;
import com.lexd.api.definition.GrammarDefinition.LexiconDefinition;
import com.lexd.api.definition.GrammarDefinition.PatternDefinition;
import com.lexd.api.definition.GrammarDefinition.SegmentDefinition;
import com.lexd.api.model.LexdGrammar;
import com.lexd.api.model.LexiconSegment;
import com.lexd.api.model.PatternElement;
import com.lexd.api.model.RepeatMode;
import com.lexd.api.model.Token;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads a tokenized grammar from JSON.
 *
 * <p>Example:
 * <pre>{@code
 * {
 *   "lexicons": [
 *     {"name": "Noun", "entries": [[{"left": "cat", "tags": ["sg"]}]]},
 *     {"name": "Suffix", "entries": [[{"left": "<pl>", "right": "s"}]]}
 *   ],
 *   "patterns": [
 *     {"elements": [{"name": "Noun"}, {"name": "Suffix", "mode": "?"}]}
 *   ]
 * }
 * }</pre>
 * A pattern without a name is a body of the root pattern.
 */
public class GrammarLoader {
    private static final Logger logger = Logger.getLogger(GrammarLoader.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public LexdGrammar load(Path path) throws IOException {
        logger.info("Loading grammar from " + path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public LexdGrammar load(InputStream in) throws IOException {
        return toGrammar(objectMapper.readValue(in, GrammarDefinition.class));
    }

    public LexdGrammar loadFromString(String json) throws IOException {
        return toGrammar(objectMapper.readValue(json, GrammarDefinition.class));
    }

    /**
     * @throws CompilationException of kind SHAPE for malformed definitions
     */
    public LexdGrammar toGrammar(GrammarDefinition definition) {
        LexdGrammar.Builder builder = LexdGrammar.builder();
        for (LexiconDefinition lexicon : definition.lexicons()) {
            if (lexicon.columns() != null) {
                builder.declareLexicon(lexicon.name(), lexicon.line(), lexicon.columns());
            }
            for (List<SegmentDefinition> entry : lexicon.entries()) {
                builder.addEntry(lexicon.name(), lexicon.line(), segments(builder, entry));
            }
        }
        for (PatternDefinition pattern : definition.patterns()) {
            builder.addPattern(pattern.name(), pattern.line(), elements(builder, pattern.line(), pattern.elements()));
        }
        LexdGrammar grammar = builder.build();
        logger.fine(() -> String.format("Loaded %d lexicons and %d patterns",
                grammar.lexicons().size(), grammar.patterns().size()));
        return grammar;
    }

    private List<LexiconSegment> segments(LexdGrammar.Builder builder, List<SegmentDefinition> entry) {
        List<LexiconSegment> segments = new ArrayList<>(entry.size());
        for (SegmentDefinition segment : entry) {
            segments.add(builder.segment(segment.left(), segment.right(), segment.tags()));
        }
        return segments;
    }

    private List<PatternElement> elements(LexdGrammar.Builder builder, int line, List<ElementDefinition> definitions) {
        List<PatternElement> elements = new ArrayList<>(definitions.size());
        for (ElementDefinition definition : definitions) {
            elements.add(element(builder, line, definition));
        }
        return elements;
    }

    private PatternElement element(LexdGrammar.Builder builder, int line, ElementDefinition definition) {
        if (definition.sieve() != null) {
            return switch (definition.sieve()) {
                case LexdGrammar.LEFT_SIEVE -> builder.leftSieve();
                case LexdGrammar.RIGHT_SIEVE -> builder.rightSieve();
                default -> throw CompilationException.shape(line, "Unknown sieve: " + definition.sieve());
            };
        }

        String name = definition.name();
        if (definition.lexicon() != null) {
            List<List<LexiconSegment>> entries = new ArrayList<>();
            for (List<SegmentDefinition> entry : definition.lexicon()) {
                entries.add(segments(builder, entry));
            }
            name = builder.anonymousLexicon(line, entries);
        } else if (definition.alternatives() != null) {
            List<List<PatternElement>> bodies = new ArrayList<>();
            for (List<ElementDefinition> body : definition.alternatives()) {
                bodies.add(elements(builder, line, body));
            }
            name = builder.anonymousPattern(line, bodies);
        }
        if (name == null) {
            throw CompilationException.shape(line, "Pattern element has no name");
        }

        Token token = builder.token(name, definition.column());
        Token left;
        Token right;
        switch (definition.side()) {
            case "both" -> {
                left = token;
                right = definition.rightName() != null
                        ? builder.token(definition.rightName(), definition.rightColumn())
                        : token;
            }
            case "left" -> {
                left = token;
                right = Token.EMPTY;
            }
            case "right" -> {
                left = Token.EMPTY;
                right = token;
            }
            default -> throw CompilationException.shape(line, "Unknown side: " + definition.side());
        }

        RepeatMode mode;
        try {
            mode = RepeatMode.fromSymbol(definition.mode());
        } catch (IllegalArgumentException e) {
            throw new CompilationException(CompilationException.Kind.SHAPE, line, e.getMessage(), e);
        }
        return new PatternElement(left, right, mode,
                builder.tags(definition.tags()), builder.tags(definition.negatedTags()));
    }
}
