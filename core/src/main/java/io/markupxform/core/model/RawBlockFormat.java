package io.markupxform.core.model;

import java.util.List;

/**
 * Closed set of raw-block formats the expander knows how to handle. Every directive resolves to
 * exactly one constant; anything unrecognised resolves to {@link #UNKNOWN}.
 *
 * <p>Matching is exact and case-sensitive against the short name or the mimetype.
 */
public enum RawBlockFormat {
    /** Syntax-highlighted code; arguments name the lexer. */
    HIGHLIGHT("highlight"),

    /** Delimited text rendered as a table; arguments give the separator. */
    CSV("csv", "text/csv"),

    /** Moin wiki markup; arguments become CSS classes. */
    WIKI("wiki", "text/x.moin.wiki"),

    /** Creole markup. */
    CREOLE("creole", "text/x.moin.creole"),

    /** reStructuredText. */
    RST("rst", "text/x-rst"),

    /** DocBook XML. */
    DOCBOOK("docbook", "application/docbook+xml"),

    /** Markdown. */
    MARKDOWN("markdown", "text/x-markdown"),

    /** MediaWiki markup. */
    MEDIAWIKI("mediawiki", "text/x-mediawiki"),

    /** Absent or unrecognised directive; rendered as a diagnostic plus plain text. */
    UNKNOWN();

    private final List<String> names;

    RawBlockFormat(String... names) {
        this.names = List.of(names);
    }

    /** Directive names that select this format, short name first. Empty for {@link #UNKNOWN}. */
    public List<String> names() {
        return names;
    }

    /**
     * Resolves a directive format name.
     *
     * @param name the format name, may be {@code null}
     * @return the matching format, or {@link #UNKNOWN}
     */
    public static RawBlockFormat fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        for (RawBlockFormat format : values()) {
            if (format.names.contains(name)) {
                return format;
            }
        }
        return UNKNOWN;
    }
}
