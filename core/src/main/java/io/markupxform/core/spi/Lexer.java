package io.markupxform.core.spi;

import java.util.List;

/**
 * A tokenizer for one programming or markup language, used for syntax highlighting.
 *
 * <p>Implementations MUST be thread-safe. The concatenated text of the returned tokens MUST equal
 * the input text exactly.
 */
public interface Lexer {

    /** Canonical lexer name, e.g. {@code "python"} or {@code "text"}. */
    String name();

    /**
     * Splits the text into styled tokens.
     *
     * @param text the source text, newlines separated by {@code \n}
     * @return the tokens in document order
     */
    List<HighlightToken> tokenize(String text);
}
