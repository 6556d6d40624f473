package io.markupxform.core.engine.highlight;

import io.markupxform.core.spi.HighlightToken;
import io.markupxform.core.spi.Lexer;
import io.markupxform.core.spi.TokenStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.swing.text.Segment;
import org.fife.ui.rsyntaxtextarea.Token;
import org.fife.ui.rsyntaxtextarea.TokenMaker;
import org.fife.ui.rsyntaxtextarea.TokenMakerFactory;
import org.fife.ui.rsyntaxtextarea.TokenTypes;

/**
 * {@link Lexer} backed by an RSyntaxTextArea {@link TokenMaker}.
 *
 * <p>Token makers are stateful, so each {@link #tokenize} call obtains a fresh one from the default
 * {@link TokenMakerFactory}. Text is scanned line by line, carrying the last token type of each line
 * into the next so that multi-line comments and strings are recognised.
 */
public final class RSyntaxLexer implements Lexer {

    private final String name;
    private final String syntaxStyle;

    /**
     * @param name        canonical lexer name, e.g. {@code "python"}
     * @param syntaxStyle RSyntaxTextArea style key, one of the {@code SyntaxConstants.SYNTAX_STYLE_*}
     *                    values
     */
    public RSyntaxLexer(String name, String syntaxStyle) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.syntaxStyle = Objects.requireNonNull(syntaxStyle, "syntaxStyle must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<HighlightToken> tokenize(String text) {
        TokenMaker tokenMaker = TokenMakerFactory.getDefaultInstance().getTokenMaker(syntaxStyle);
        List<HighlightToken> tokens = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        int lastType = TokenTypes.NULL;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            char[] chars = line.toCharArray();
            Segment segment = new Segment(chars, 0, chars.length);
            lastType = tokenizeLine(tokenMaker, segment, line, lastType, tokens);
            if (i < lines.length - 1) {
                tokens.add(new HighlightToken(TokenStyle.TEXT, "\n"));
            }
        }
        return tokens;
    }

    /** Appends the tokens of one line and returns the token type to carry into the next line. */
    private static int tokenizeLine(
            TokenMaker tokenMaker, Segment segment, String line, int initialType, List<HighlightToken> out) {
        if (line.isEmpty()) {
            return tokenMaker.getLastTokenTypeOnLine(segment, initialType);
        }
        List<HighlightToken> lineTokens = new ArrayList<>();
        StringBuilder seen = new StringBuilder();
        Token token = tokenMaker.getTokenList(segment, initialType, 0);
        while (token != null && token.getType() != TokenTypes.NULL && token.isPaintable()) {
            String lexeme = token.getLexeme();
            if (lexeme != null && !lexeme.isEmpty()) {
                lineTokens.add(new HighlightToken(styleOf(token.getType()), lexeme));
                seen.append(lexeme);
            }
            token = token.getNextToken();
        }
        if (seen.toString().equals(line)) {
            out.addAll(lineTokens);
        } else {
            // the token maker lost or reordered text; keep the line intact
            out.add(new HighlightToken(TokenStyle.TEXT, line));
        }
        return tokenMaker.getLastTokenTypeOnLine(segment, initialType);
    }

    static TokenStyle styleOf(int tokenType) {
        return switch (tokenType) {
            case TokenTypes.RESERVED_WORD, TokenTypes.RESERVED_WORD_2 -> TokenStyle.KEYWORD;
            case TokenTypes.DATA_TYPE -> TokenStyle.KEYWORD_TYPE;
            case TokenTypes.LITERAL_BOOLEAN -> TokenStyle.KEYWORD_CONSTANT;
            case TokenTypes.FUNCTION -> TokenStyle.NAME_FUNCTION;
            case TokenTypes.VARIABLE -> TokenStyle.NAME_VARIABLE;
            case TokenTypes.ANNOTATION -> TokenStyle.NAME_DECORATOR;
            case TokenTypes.MARKUP_TAG_NAME, TokenTypes.MARKUP_TAG_DELIMITER -> TokenStyle.NAME_TAG;
            case TokenTypes.MARKUP_TAG_ATTRIBUTE -> TokenStyle.NAME_ATTRIBUTE;
            case TokenTypes.LITERAL_STRING_DOUBLE_QUOTE,
                    TokenTypes.LITERAL_BACKQUOTE,
                    TokenTypes.MARKUP_TAG_ATTRIBUTE_VALUE,
                    TokenTypes.MARKUP_CDATA -> TokenStyle.STRING;
            case TokenTypes.LITERAL_CHAR -> TokenStyle.STRING_CHAR;
            case TokenTypes.REGEX -> TokenStyle.STRING_REGEX;
            case TokenTypes.LITERAL_NUMBER_DECIMAL_INT,
                    TokenTypes.LITERAL_NUMBER_FLOAT,
                    TokenTypes.LITERAL_NUMBER_HEXADECIMAL -> TokenStyle.NUMBER;
            case TokenTypes.OPERATOR -> TokenStyle.OPERATOR;
            case TokenTypes.SEPARATOR -> TokenStyle.PUNCTUATION;
            case TokenTypes.COMMENT_EOL, TokenTypes.COMMENT_MULTILINE, TokenTypes.MARKUP_COMMENT -> TokenStyle.COMMENT;
            case TokenTypes.COMMENT_DOCUMENTATION, TokenTypes.COMMENT_KEYWORD, TokenTypes.COMMENT_MARKUP ->
                    TokenStyle.COMMENT_DOC;
            case TokenTypes.PREPROCESSOR, TokenTypes.MARKUP_PROCESSING_INSTRUCTION, TokenTypes.MARKUP_DTD ->
                    TokenStyle.COMMENT_PREPROC;
            case TokenTypes.ERROR_IDENTIFIER,
                    TokenTypes.ERROR_NUMBER_FORMAT,
                    TokenTypes.ERROR_STRING_DOUBLE,
                    TokenTypes.ERROR_CHAR -> TokenStyle.ERROR;
            default -> TokenStyle.TEXT;
        };
    }
}
