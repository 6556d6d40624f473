package io.markupxform.core.engine;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.model.RawBlockFormat;
import io.markupxform.core.spi.HighlightToken;
import io.markupxform.core.spi.Lexer;
import io.markupxform.core.spi.LexerRegistry;
import io.markupxform.core.spi.TokenStyle;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders raw text as a syntax-highlighted {@code blockcode} node.
 *
 * <p>The lexer hint is tried as a language name first and as a mimetype second. If neither
 * resolves, a diagnostic is appended to the placeholder and the fallback lexer is used instead, so
 * rendering never fails.
 *
 * <p>Thread-safe and immutable.
 */
public final class HighlightRenderer {

    /** CSS class of the generated {@code blockcode} node. */
    public static final String HIGHLIGHT_CLASS = "highlight";

    private final LexerRegistry lexers;
    private final DiagnosticBuilder diagnostics;
    private final String fallbackLexer;

    public HighlightRenderer(LexerRegistry lexers, DiagnosticBuilder diagnostics, String fallbackLexer) {
        this.lexers = Objects.requireNonNull(lexers, "lexers must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.fallbackLexer = Objects.requireNonNull(fallbackLexer, "fallbackLexer must not be null");
    }

    /**
     * Highlights {@code rawText} with the lexer named by {@code hint} and appends the result to the
     * placeholder.
     *
     * @param placeholder   the emptied placeholder node receiving the output
     * @param hint          language name or mimetype, may be {@code null}
     * @param rawText       the text to highlight
     * @param directiveLine the directive line, quoted in the diagnostic on failure
     * @return the outcome; a fallback when the hint did not resolve
     */
    public DispatchOutcome render(DocumentNode placeholder, String hint, String rawText, String directiveLine) {
        Optional<Lexer> lexer = lexers.byName(hint).or(() -> lexers.byMimetype(hint));
        if (lexer.isPresent()) {
            placeholder.append(highlight(lexer.get(), rawText));
            return DispatchOutcome.expanded(RawBlockFormat.HIGHLIGHT);
        }
        placeholder.append(diagnostics.invalidArguments(directiveLine));
        placeholder.append(highlight(fallback(), rawText));
        return DispatchOutcome.fallback(RawBlockFormat.HIGHLIGHT, "no lexer for '" + hint + "'");
    }

    /** Appends the raw text as a plain, unhighlighted block. */
    public void renderPlain(DocumentNode placeholder, String rawText) {
        placeholder.append(highlight(fallback(), rawText));
    }

    private Lexer fallback() {
        return lexers.byName(fallbackLexer).orElseGet(lexers::plainText);
    }

    /** Tokenizes the text into a {@code blockcode}: styled tokens become spans, the rest text. */
    DocumentNode highlight(Lexer lexer, String rawText) {
        DocumentNode blockcode = new DocumentNode(NodeTag.BLOCKCODE).withClass(HIGHLIGHT_CLASS);
        for (HighlightToken token : lexer.tokenize(rawText)) {
            if (token.text().isEmpty()) {
                continue;
            }
            TokenStyle style = token.style();
            if (style.cssClass() == null) {
                blockcode.appendText(token.text());
            } else {
                blockcode.append(DocumentNode.text(NodeTag.SPAN, token.text()).withClass(style.cssClass()));
            }
        }
        return blockcode;
    }
}
