package io.markupxform.core.engine.highlight;

import io.markupxform.core.spi.HighlightToken;
import io.markupxform.core.spi.Lexer;
import io.markupxform.core.spi.TokenStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for IRC chat logs: optional timestamp, {@code <nick>} or {@code * nick} action prefix, then
 * the message.
 */
public final class IrcLexer implements Lexer {

    public static final String NAME = "irc";

    private static final Pattern LINE = Pattern.compile(
            "^(\\s*(?:\\[?\\d{1,2}:\\d{2}(?::\\d{2})?\\]?)?\\s*)"
                    + "(<[^>\\s]+>|\\*{1,3}\\s*\\S+|-!-\\s*\\S+|--\\s*\\S+)?"
                    + "(.*)$");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<HighlightToken> tokenize(String text) {
        List<HighlightToken> tokens = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            line(lines[i], tokens);
            if (i < lines.length - 1) {
                tokens.add(new HighlightToken(TokenStyle.TEXT, "\n"));
            }
        }
        return tokens;
    }

    private static void line(String line, List<HighlightToken> tokens) {
        Matcher m = LINE.matcher(line);
        if (!m.matches()) {
            add(tokens, TokenStyle.TEXT, line);
            return;
        }
        String prefix = m.group(1);
        if (prefix.isBlank()) {
            add(tokens, TokenStyle.TEXT, prefix);
        } else {
            int start = prefix.length() - prefix.stripLeading().length();
            add(tokens, TokenStyle.TEXT, prefix.substring(0, start));
            String stamp = prefix.strip();
            add(tokens, TokenStyle.COMMENT_PREPROC, stamp);
            add(tokens, TokenStyle.TEXT, prefix.substring(start + stamp.length()));
        }
        String nick = m.group(2);
        if (nick != null) {
            add(tokens, nick.startsWith("<") ? TokenStyle.NAME_TAG : TokenStyle.GENERIC_OUTPUT, nick);
        }
        add(tokens, TokenStyle.TEXT, m.group(3));
    }

    private static void add(List<HighlightToken> tokens, TokenStyle style, String text) {
        if (!text.isEmpty()) {
            tokens.add(new HighlightToken(style, text));
        }
    }
}
