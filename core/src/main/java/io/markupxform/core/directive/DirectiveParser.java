package io.markupxform.core.directive;

import io.markupxform.core.model.Directive;
import io.markupxform.core.model.RawBlockFormat;
import java.util.Set;

/**
 * Parses the first line of a raw block ({@code #!<format>[ <args>]}) into a {@link Directive}.
 *
 * <p>Legacy bare-language directives such as {@code #!python} are rewritten to {@code #!highlight
 * python} before dispatch. A line without the {@code #!} sentinel, or with nothing after it,
 * yields {@link Directive#ABSENT}; this is not an error.
 *
 * <p>Stateless and thread-safe.
 */
public final class DirectiveParser {

    /** Two-character prefix that introduces a directive. */
    public static final String SENTINEL = "#!";

    /** Directive names from before {@code #!highlight} existed; each names a lexer. */
    static final Set<String> LEGACY_HIGHLIGHT_NAMES = Set.of("diff", "cplusplus", "python", "java", "pascal", "irc");

    /**
     * Parses a directive line.
     *
     * @param directiveLine the raw directive line, may carry trailing whitespace
     * @return the parsed directive, never {@code null}
     */
    public Directive parse(String directiveLine) {
        if (directiveLine == null) {
            return Directive.ABSENT;
        }
        String line = directiveLine.stripTrailing();
        if (!line.startsWith(SENTINEL) || line.length() <= SENTINEL.length()) {
            return Directive.ABSENT;
        }
        String remainder = line.substring(SENTINEL.length());
        int space = remainder.indexOf(' ');
        String name = space < 0 ? remainder : remainder.substring(0, space);
        String args = space < 0 ? null : remainder.substring(space + 1);

        if (LEGACY_HIGHLIGHT_NAMES.contains(name)) {
            return new Directive(RawBlockFormat.HIGHLIGHT.names().get(0), name);
        }
        return new Directive(name, args);
    }
}
