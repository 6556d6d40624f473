package io.markupxform.core.config;

import java.util.Locale;

/**
 * Configuration of the raw-block expander.
 *
 * <p>All fields have defaults. Use {@link #builder()} to construct instances, or {@link
 * ConfigLoader} to read them from YAML.
 *
 * @param maxDepth           how many raw blocks may nest inside one another; tree depth is not limited
 * @param csvSeparator       separator used by {@code #!csv} blocks without arguments
 * @param csvTableClass      CSS classes set on generated CSV tables
 * @param fallbackLexer      lexer name used when a block falls back to plain text
 * @param locale             locale for diagnostic messages
 */
public record ExpanderConfig(
        int maxDepth, String csvSeparator, String csvTableClass, String fallbackLexer, Locale locale) {

    public static final int DEFAULT_MAX_DEPTH = 128;
    public static final String DEFAULT_CSV_SEPARATOR = ";";
    public static final String DEFAULT_CSV_TABLE_CLASS = "moin-csv-table moin-sortable";
    public static final String DEFAULT_FALLBACK_LEXER = "text";

    /** Configuration with every default applied. */
    public static final ExpanderConfig DEFAULTS = builder().build();

    public ExpanderConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (csvSeparator == null || csvSeparator.isEmpty()) {
            throw new IllegalArgumentException("csvSeparator must not be empty");
        }
        if (csvTableClass == null) {
            throw new IllegalArgumentException("csvTableClass must not be null");
        }
        if (fallbackLexer == null || fallbackLexer.isBlank()) {
            throw new IllegalArgumentException("fallbackLexer must not be blank");
        }
        if (locale == null) {
            throw new IllegalArgumentException("locale must not be null");
        }
    }

    /** Creates a new builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ExpanderConfig}. */
    public static final class Builder {

        private int maxDepth = DEFAULT_MAX_DEPTH;
        private String csvSeparator = DEFAULT_CSV_SEPARATOR;
        private String csvTableClass = DEFAULT_CSV_TABLE_CLASS;
        private String fallbackLexer = DEFAULT_FALLBACK_LEXER;
        private Locale locale = Locale.ENGLISH;

        private Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder csvSeparator(String csvSeparator) {
            this.csvSeparator = csvSeparator;
            return this;
        }

        public Builder csvTableClass(String csvTableClass) {
            this.csvTableClass = csvTableClass;
            return this;
        }

        public Builder fallbackLexer(String fallbackLexer) {
            this.fallbackLexer = fallbackLexer;
            return this;
        }

        public Builder locale(Locale locale) {
            this.locale = locale;
            return this;
        }

        public ExpanderConfig build() {
            return new ExpanderConfig(maxDepth, csvSeparator, csvTableClass, fallbackLexer, locale);
        }
    }
}
