package io.markupxform.core.engine.highlight;

import static org.assertj.core.api.Assertions.assertThat;

import io.markupxform.core.spi.HighlightToken;
import io.markupxform.core.spi.TokenStyle;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class IrcLexerTest {

    private final IrcLexer lexer = new IrcLexer();

    @Test
    void timestampNickAndMessage() {
        List<HighlightToken> tokens = lexer.tokenize("[12:01] <alice> hi there");

        assertThat(tokens).containsExactly(
                new HighlightToken(TokenStyle.COMMENT_PREPROC, "[12:01]"),
                new HighlightToken(TokenStyle.TEXT, " "),
                new HighlightToken(TokenStyle.NAME_TAG, "<alice>"),
                new HighlightToken(TokenStyle.TEXT, " hi there"));
    }

    @Test
    void preservesTextAcrossLines() {
        String log = "<bob> one\n* bob waves\n\nplain line";

        String joined = lexer.tokenize(log).stream().map(HighlightToken::text).collect(Collectors.joining());

        assertThat(joined).isEqualTo(log);
    }
}
