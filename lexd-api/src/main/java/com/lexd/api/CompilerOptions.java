package com.lexd.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Options consulted by the compiler.
 *
 * <p><b>Environment Variable Override:</b> {@link #fromEnvironment()} reads every
 * option from an environment variable, falling back to a system property of the
 * same name:
 * <pre>
 * LEXD_ALIGN=true
 * LEXD_COMPRESS=true
 * LEXD_TAGS_AS_FLAGS=true
 * LEXD_TAGS_AS_MIN_FLAGS=true
 * LEXD_HYPERMIN=true
 * LEXD_ROOT_PATTERNS=Verb,Noun
 * LEXD_DETERMINIZE_WORK_LIMIT=1000000
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * CompilerOptions options = CompilerOptions.builder()
 *     .align(true)
 *     .tagsAsFlags(true)
 *     .build();
 * }</pre>
 */
public final class CompilerOptions {

    private static final Logger logger = Logger.getLogger(CompilerOptions.class.getName());

    private static final String ENV_ALIGN = "LEXD_ALIGN";
    private static final String ENV_COMPRESS = "LEXD_COMPRESS";
    private static final String ENV_TAGS_AS_FLAGS = "LEXD_TAGS_AS_FLAGS";
    private static final String ENV_TAGS_AS_MIN_FLAGS = "LEXD_TAGS_AS_MIN_FLAGS";
    private static final String ENV_HYPERMIN = "LEXD_HYPERMIN";
    private static final String ENV_ROOT_PATTERNS = "LEXD_ROOT_PATTERNS";
    private static final String ENV_DETERMINIZE_WORK_LIMIT = "LEXD_DETERMINIZE_WORK_LIMIT";

    public static final int DEFAULT_DETERMINIZE_WORK_LIMIT = 1_000_000;

    /**
     * How tag filters are realized in the automaton.
     */
    public enum TagEncoding {
        /** Filter entries at compile time; tags on pattern references are pushed down. */
        STATIC,
        /** Every tag filter becomes flag diacritics. */
        FLAGS,
        /** Lexicon references are filtered statically, pattern references use flags. */
        MINIMAL_FLAGS
    }

    private final boolean align;
    private final boolean compress;
    private final boolean tagsAsFlags;
    private final boolean tagsAsMinFlags;
    private final boolean hypermin;
    private final List<String> rootPatterns;
    private final int determinizeWorkLimit;

    private CompilerOptions(Builder builder) {
        this.align = builder.align;
        this.compress = builder.compress;
        this.tagsAsFlags = builder.tagsAsFlags;
        this.tagsAsMinFlags = builder.tagsAsMinFlags;
        this.hypermin = builder.hypermin;
        this.rootPatterns = List.copyOf(builder.rootPatterns);
        this.determinizeWorkLimit = builder.determinizeWorkLimit;
    }

    public static CompilerOptions defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by {@code LEXD_*} environment variables or system properties.
     */
    public static CompilerOptions fromEnvironment() {
        Builder builder = builder();
        getEnvBoolean(ENV_ALIGN).ifPresent(builder::align);
        getEnvBoolean(ENV_COMPRESS).ifPresent(builder::compress);
        getEnvBoolean(ENV_TAGS_AS_FLAGS).ifPresent(builder::tagsAsFlags);
        getEnvBoolean(ENV_TAGS_AS_MIN_FLAGS).ifPresent(builder::tagsAsMinFlags);
        getEnvBoolean(ENV_HYPERMIN).ifPresent(builder::hypermin);
        getEnv(ENV_ROOT_PATTERNS).ifPresent(val -> builder.rootPatterns(
                Arrays.stream(val.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList()));
        getEnv(ENV_DETERMINIZE_WORK_LIMIT).ifPresent(val -> {
            try {
                builder.determinizeWorkLimit(Integer.parseInt(val.trim()));
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid " + ENV_DETERMINIZE_WORK_LIMIT + "=" + val + ", using default");
            }
        });
        return builder.build();
    }

    // ==================== Accessors ====================

    /** Align each segment's sides by minimum edit distance instead of zipping them. */
    public boolean shouldAlign() {
        return align || compress;
    }

    /** Prefer substitutions ({@code a:b}) over insertion/deletion pairs; implies alignment. */
    public boolean shouldCompress() {
        return compress;
    }

    public boolean tagsAsFlags() {
        return tagsAsFlags;
    }

    public boolean tagsAsMinFlags() {
        return tagsAsMinFlags;
    }

    public boolean shouldHypermin() {
        return hypermin;
    }

    /**
     * Explicit root pattern names; empty means the reserved unnamed root pattern.
     */
    public List<String> rootPatterns() {
        return rootPatterns;
    }

    public int determinizeWorkLimit() {
        return determinizeWorkLimit;
    }

    public TagEncoding tagEncoding() {
        if (tagsAsMinFlags) {
            return TagEncoding.MINIMAL_FLAGS;
        }
        return tagsAsFlags ? TagEncoding.FLAGS : TagEncoding.STATIC;
    }

    public Builder toBuilder() {
        return builder()
                .align(align)
                .compress(compress)
                .tagsAsFlags(tagsAsFlags)
                .tagsAsMinFlags(tagsAsMinFlags)
                .hypermin(hypermin)
                .rootPatterns(rootPatterns)
                .determinizeWorkLimit(determinizeWorkLimit);
    }

    @Override
    public String toString() {
        return "CompilerOptions{align=" + align + ", compress=" + compress + ", tagsAsFlags=" + tagsAsFlags
                + ", tagsAsMinFlags=" + tagsAsMinFlags + ", hypermin=" + hypermin
                + ", rootPatterns=" + rootPatterns + ", determinizeWorkLimit=" + determinizeWorkLimit + "}";
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean align = false;
        private boolean compress = false;
        private boolean tagsAsFlags = false;
        private boolean tagsAsMinFlags = false;
        private boolean hypermin = false;
        private List<String> rootPatterns = new ArrayList<>();
        private int determinizeWorkLimit = DEFAULT_DETERMINIZE_WORK_LIMIT;

        private Builder() {
        }

        public Builder align(boolean align) {
            this.align = align;
            return this;
        }

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder tagsAsFlags(boolean tagsAsFlags) {
            this.tagsAsFlags = tagsAsFlags;
            return this;
        }

        public Builder tagsAsMinFlags(boolean tagsAsMinFlags) {
            this.tagsAsMinFlags = tagsAsMinFlags;
            return this;
        }

        public Builder hypermin(boolean hypermin) {
            this.hypermin = hypermin;
            return this;
        }

        public Builder rootPatterns(List<String> rootPatterns) {
            this.rootPatterns = new ArrayList<>(rootPatterns);
            return this;
        }

        public Builder determinizeWorkLimit(int determinizeWorkLimit) {
            if (determinizeWorkLimit <= 0) {
                throw new IllegalArgumentException("determinizeWorkLimit must be positive: " + determinizeWorkLimit);
            }
            this.determinizeWorkLimit = determinizeWorkLimit;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }

    // ==================== Configuration Helpers ====================

    private static Optional<String> getEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return Optional.ofNullable(value).filter(v -> !v.isEmpty());
    }

    private static Optional<Boolean> getEnvBoolean(String key) {
        return getEnv(key).map(v -> Boolean.parseBoolean(v.trim()));
    }
}
