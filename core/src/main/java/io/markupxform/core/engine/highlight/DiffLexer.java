package io.markupxform.core.engine.highlight;

import io.markupxform.core.spi.HighlightToken;
import io.markupxform.core.spi.Lexer;
import io.markupxform.core.spi.TokenStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for unified and context diffs. Classifies whole lines by their first characters.
 */
public final class DiffLexer implements Lexer {

    public static final String NAME = "diff";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<HighlightToken> tokenize(String text) {
        List<HighlightToken> tokens = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (!line.isEmpty()) {
                tokens.add(new HighlightToken(styleOf(line), line));
            }
            if (i < lines.length - 1) {
                tokens.add(new HighlightToken(TokenStyle.TEXT, "\n"));
            }
        }
        return tokens;
    }

    static TokenStyle styleOf(String line) {
        if (line.startsWith("+++") || line.startsWith("---") || line.startsWith("***")) {
            return TokenStyle.GENERIC_HEADING;
        }
        if (line.startsWith("diff ") || line.startsWith("Index:") || line.startsWith("index ")) {
            return TokenStyle.GENERIC_HEADING;
        }
        if (line.startsWith("@@")) {
            return TokenStyle.GENERIC_SUBHEADING;
        }
        return switch (line.charAt(0)) {
            case '+', '>' -> TokenStyle.GENERIC_INSERTED;
            case '-', '<' -> TokenStyle.GENERIC_DELETED;
            case '!' -> TokenStyle.KEYWORD;
            default -> TokenStyle.TEXT;
        };
    }
}
