package io.markupxform.core.engine.highlight;

import static org.assertj.core.api.Assertions.assertThat;

import io.markupxform.core.spi.HighlightToken;
import io.markupxform.core.spi.TokenStyle;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DiffLexerTest {

    private final DiffLexer lexer = new DiffLexer();

    @Test
    void classifiesLines() {
        String diff = "--- a/f\n+++ b/f\n@@ -1 +1 @@\n-old\n+new\n ctx";

        List<HighlightToken> tokens = lexer.tokenize(diff);

        assertThat(tokens.stream().map(HighlightToken::text).collect(Collectors.joining())).isEqualTo(diff);
        assertThat(tokens)
                .filteredOn(t -> !t.text().equals("\n"))
                .extracting(HighlightToken::style)
                .containsExactly(
                        TokenStyle.GENERIC_HEADING,
                        TokenStyle.GENERIC_HEADING,
                        TokenStyle.GENERIC_SUBHEADING,
                        TokenStyle.GENERIC_DELETED,
                        TokenStyle.GENERIC_INSERTED,
                        TokenStyle.TEXT);
    }

    @Test
    void emptyInputHasNoTokens() {
        assertThat(lexer.tokenize("")).isEmpty();
    }
}
