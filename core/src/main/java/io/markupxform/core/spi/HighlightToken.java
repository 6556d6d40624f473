package io.markupxform.core.spi;

import java.util.Objects;

/**
 * One lexical token produced by a {@link Lexer}.
 *
 * @param style the style class of the token
 * @param text  the token text, including any newlines it spans
 */
public record HighlightToken(TokenStyle style, String text) {

    public HighlightToken {
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
