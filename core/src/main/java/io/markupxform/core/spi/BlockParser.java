package io.markupxform.core.spi;

import io.markupxform.core.model.DocumentNode;

/**
 * Line-oriented embedded markup parser. Consumes lines from a {@link LineCursor} and returns the
 * parsed block body.
 *
 * <p>Implementations MUST be stateless and thread-safe; all per-call state lives in the cursor.
 */
public interface BlockParser {

    /** Parser identifier, e.g. {@code "wiki"}. */
    String id();

    /**
     * Parses lines until the cursor is exhausted.
     *
     * @param lines     the line cursor, positioned at the first line of the block
     * @param arguments parser arguments taken from the directive
     * @return a {@code body} node holding the parsed content; may contain unexpanded raw blocks
     * @throws io.markupxform.core.error.SubParserException if the input cannot be parsed
     */
    DocumentNode parseBlock(LineCursor lines, ParserArguments arguments);
}
