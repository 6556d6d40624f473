package io.markupxform.core.spi;

import io.markupxform.core.model.DocumentNode;

/**
 * Whole-text embedded markup parser. Receives the complete block body and does its own line
 * splitting.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface DocumentParser {

    /** Parser identifier, e.g. {@code "markdown"}. */
    String id();

    /**
     * Parses a complete document.
     *
     * @param text        the raw text
     * @param contentType content-type tag, e.g. {@code "text/x-markdown;charset=utf-8"}; may be
     *                    {@code null} when the directive carried no arguments
     * @return a {@code page} node holding the parsed document; may contain unexpanded raw blocks
     * @throws io.markupxform.core.error.SubParserException if the input cannot be parsed
     */
    DocumentNode parse(String text, String contentType);
}
