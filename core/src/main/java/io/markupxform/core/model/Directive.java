package io.markupxform.core.model;

/**
 * A parsed raw-block directive such as {@code #!highlight python}. Both parts may be absent, which
 * routes the block to the unknown-format fallback.
 *
 * @param formatName the format name after alias resolution, or {@code null}
 * @param formatArgs the residual argument string, or {@code null}
 */
public record Directive(String formatName, String formatArgs) {

    /** Directive for a line without the {@code #!} sentinel. */
    public static final Directive ABSENT = new Directive(null, null);

    public boolean hasArgs() {
        return formatArgs != null;
    }

    /** Resolves the format name against the closed set of supported formats. */
    public RawBlockFormat format() {
        return RawBlockFormat.fromName(formatName);
    }
}
