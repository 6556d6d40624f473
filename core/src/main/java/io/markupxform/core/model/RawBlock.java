package io.markupxform.core.model;

import io.markupxform.core.error.MalformedPlaceholderException;
import java.util.List;
import java.util.Objects;

/**
 * Typed view over the three structural children of a {@link NodeTag#NOWIKI} placeholder.
 *
 * @param markerLength  number of delimiter characters that opened the block (e.g. 3 for {@code
 *                      {{{})
 * @param directiveLine the directive line, right-trimmed (e.g. {@code "#!highlight python"})
 * @param content       the unparsed body between the delimiters
 */
public record RawBlock(int markerLength, String directiveLine, String content) {

    public RawBlock {
        Objects.requireNonNull(directiveLine, "directiveLine must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Reads the structural children of a placeholder node. The node itself is not modified.
     *
     * @param placeholder a node tagged {@link NodeTag#NOWIKI}
     * @return the raw block view
     * @throws MalformedPlaceholderException if the node is not a placeholder or its children are not
     *     marker length, directive line and body text runs
     */
    public static RawBlock from(DocumentNode placeholder) {
        if (!placeholder.isPlaceholder()) {
            throw new MalformedPlaceholderException("Expected a <nowiki> node but got " + placeholder);
        }
        List<NodeContent> children = placeholder.children();
        if (children.size() < 3) {
            throw new MalformedPlaceholderException(
                    "Raw block placeholder must have 3 children (marker, directive, body), got " + children.size());
        }
        String marker = requireText(children.get(0), "marker length");
        String directive = requireText(children.get(1), "directive line");
        String content = requireText(children.get(2), "body");
        int markerLength;
        try {
            markerLength = Integer.parseInt(marker.strip());
        } catch (NumberFormatException e) {
            throw new MalformedPlaceholderException("Raw block marker length is not a number: '" + marker + "'");
        }
        return new RawBlock(markerLength, directive.stripTrailing(), content);
    }

    private static String requireText(NodeContent child, String what) {
        if (child instanceof TextRun run) {
            return run.text();
        }
        throw new MalformedPlaceholderException("Raw block " + what + " must be a text run, got " + child);
    }
}
