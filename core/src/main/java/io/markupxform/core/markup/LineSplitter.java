package io.markupxform.core.markup;

import java.util.Arrays;
import java.util.List;

/** Line-ending normalisation shared by the line-oriented parsers. */
public final class LineSplitter {

    private LineSplitter() {
        // utility class
    }

    /** Converts CRLF and lone CR line endings to LF. */
    public static String normalize(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Normalises line endings and splits on LF. Trailing empty lines are kept, so {@code "a\n"}
     * yields {@code ["a", ""]}.
     */
    public static List<String> split(String text) {
        return Arrays.asList(normalize(text).split("\n", -1));
    }

    /**
     * Removes the longest common leading whitespace from all non-blank lines.
     *
     * @param lines the lines to dedent
     * @return the dedented lines, blank lines reduced to empty strings
     */
    public static List<String> dedent(List<String> lines) {
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isBlank()) {
                indent = Math.min(indent, leadingWhitespace(line));
            }
        }
        int strip = indent == Integer.MAX_VALUE ? 0 : indent;
        return lines.stream()
                .map(line -> line.isBlank() ? "" : line.substring(strip))
                .toList();
    }

    /** Number of leading space or tab characters. */
    public static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
