package com.lexd.api.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a tokenized grammar for deserialization.
 * This is a simple Data Transfer Object (DTO) used only for loading.
 */
public record GrammarDefinition(
        @JsonProperty("lexicons") List<LexiconDefinition> lexicons,
        @JsonProperty("patterns") List<PatternDefinition> patterns
) {
    public List<LexiconDefinition> lexicons() {
        return lexicons != null ? lexicons : List.of();
    }

    public List<PatternDefinition> patterns() {
        return patterns != null ? patterns : List.of();
    }

    /**
     * A lexicon block. Several blocks with the same name merge.
     */
    public record LexiconDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("line") Integer line,
            @JsonProperty("columns") Integer columns,
            @JsonProperty("entries") List<List<SegmentDefinition>> entries
    ) {
        public Integer line() {
            return line != null ? line : -1;
        }

        public List<List<SegmentDefinition>> entries() {
            return entries != null ? entries : List.of();
        }
    }

    /**
     * One column of an entry; a missing right side repeats the left side.
     */
    public record SegmentDefinition(
            @JsonProperty("left") String left,
            @JsonProperty("right") String right,
            @JsonProperty("tags") List<String> tags
    ) {
        public String left() {
            return left != null ? left : "";
        }

        public String right() {
            return right != null ? right : left();
        }

        public List<String> tags() {
            return tags != null ? tags : List.of();
        }
    }

    /**
     * One pattern body; a missing name means the root pattern.
     */
    public record PatternDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("line") Integer line,
            @JsonProperty("elements") List<ElementDefinition> elements
    ) {
        public Integer line() {
            return line != null ? line : -1;
        }

        public List<ElementDefinition> elements() {
            return elements != null ? elements : List.of();
        }
    }

    /**
     * One pattern element. Exactly one of {@code name}, {@code sieve}, {@code lexicon}
     * (inline entries) or {@code alternatives} (inline bodies) is expected.
     */
    public record ElementDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("column") Integer column,
            @JsonProperty("side") String side,
            @JsonProperty("right_name") String rightName,
            @JsonProperty("right_column") Integer rightColumn,
            @JsonProperty("mode") String mode,
            @JsonProperty("tags") List<String> tags,
            @JsonProperty("negated_tags") List<String> negatedTags,
            @JsonProperty("sieve") String sieve,
            @JsonProperty("lexicon") List<List<SegmentDefinition>> lexicon,
            @JsonProperty("alternatives") List<List<ElementDefinition>> alternatives
    ) {
        public Integer column() {
            return column != null ? column : 1;
        }

        public Integer rightColumn() {
            return rightColumn != null ? rightColumn : 1;
        }

        public String side() {
            return side != null ? side : "both";
        }

        public List<String> tags() {
            return tags != null ? tags : List.of();
        }

        public List<String> negatedTags() {
            return negatedTags != null ? negatedTags : List.of();
        }
    }
}
