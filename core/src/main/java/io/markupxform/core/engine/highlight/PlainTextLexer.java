package io.markupxform.core.engine.highlight;

import io.markupxform.core.spi.HighlightToken;
import io.markupxform.core.spi.Lexer;
import io.markupxform.core.spi.TokenStyle;
import java.util.List;

/** Lexer that emits the whole input as one unstyled token. */
public final class PlainTextLexer implements Lexer {

    public static final String NAME = "text";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<HighlightToken> tokenize(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(new HighlightToken(TokenStyle.TEXT, text));
    }
}
