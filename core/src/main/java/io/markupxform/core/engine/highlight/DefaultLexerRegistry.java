package io.markupxform.core.engine.highlight;

import io.markupxform.core.spi.Lexer;
import io.markupxform.core.spi.LexerRegistry;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.fife.ui.rsyntaxtextarea.SyntaxConstants;

/**
 * Immutable {@link LexerRegistry} holding lexers keyed by lower-cased name and by mimetype.
 *
 * <p>{@link #defaults()} registers RSyntaxTextArea token makers for the mainstream languages, the
 * native {@link DiffLexer} and {@link IrcLexer}, and {@link PlainTextLexer} under {@code text}.
 * Mimetype parameters such as {@code ;charset=utf-8} are ignored during lookup.
 */
public final class DefaultLexerRegistry implements LexerRegistry {

    private final Map<String, Lexer> byName;
    private final Map<String, Lexer> byMimetype;
    private final Lexer plainText;

    private DefaultLexerRegistry(Map<String, Lexer> byName, Map<String, Lexer> byMimetype, Lexer plainText) {
        this.byName = Map.copyOf(byName);
        this.byMimetype = Map.copyOf(byMimetype);
        this.plainText = plainText;
    }

    /** The registry with every built-in lexer. */
    public static DefaultLexerRegistry defaults() {
        Builder builder = builder();
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_PYTHON, "python", "py", "python3", "py3");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_JAVA, "java");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_CPLUSPLUS, "cplusplus", "cpp", "c++", "cxx");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_C, "c", "h");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_CSHARP, "csharp", "c#", "cs");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_DELPHI, "pascal", "delphi", "objectpascal");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_JAVASCRIPT, "javascript", "js");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_TYPESCRIPT, "typescript", "ts");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_JSON, "json");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_XML, "xml");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_HTML, "html", "htm");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_CSS, "css");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_SQL, "sql");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_UNIX_SHELL, "bash", "sh", "shell", "ksh", "zsh");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_WINDOWS_BATCH, "bat", "batch", "cmd");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_RUBY, "ruby", "rb");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_PERL, "perl", "pl");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_PHP, "php");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_GO, "go", "golang");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_GROOVY, "groovy");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_SCALA, "scala");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_KOTLIN, "kotlin", "kt");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_LUA, "lua");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_YAML, "yaml", "yml");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_INI, "ini", "cfg");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_PROPERTIES_FILE, "properties");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_MAKEFILE, "make", "makefile");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_DOCKERFILE, "docker", "dockerfile");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_LATEX, "latex", "tex");
        rsyntax(builder, SyntaxConstants.SYNTAX_STYLE_MARKDOWN, "md");

        builder.lexer(new DiffLexer(), "text/x-diff", "text/x-patch", "diff", "udiff", "patch");
        builder.lexer(new IrcLexer(), "text/x-irclog", "irc", "irclog");

        // mimetype aliases in the text/x-<language> family
        builder.mimetypeAlias("text/x-python", "python")
                .mimetypeAlias("application/x-python", "python")
                .mimetypeAlias("text/x-java", "java")
                .mimetypeAlias("text/x-c++src", "cplusplus")
                .mimetypeAlias("text/x-c++hdr", "cplusplus")
                .mimetypeAlias("text/x-csrc", "c")
                .mimetypeAlias("text/x-chdr", "c")
                .mimetypeAlias("text/x-csharp", "csharp")
                .mimetypeAlias("text/x-pascal", "pascal")
                .mimetypeAlias("application/javascript", "javascript")
                .mimetypeAlias("text/javascript", "javascript")
                .mimetypeAlias("application/json", "json")
                .mimetypeAlias("application/xml", "xml")
                .mimetypeAlias("text/html", "html")
                .mimetypeAlias("text/css", "css")
                .mimetypeAlias("text/x-sql", "sql")
                .mimetypeAlias("application/x-sh", "bash")
                .mimetypeAlias("text/x-sh", "bash")
                .mimetypeAlias("text/x-ruby", "ruby")
                .mimetypeAlias("text/x-perl", "perl")
                .mimetypeAlias("text/x-php", "php")
                .mimetypeAlias("text/x-go", "go")
                .mimetypeAlias("text/x-scala", "scala")
                .mimetypeAlias("text/x-yaml", "yaml")
                .mimetypeAlias("text/x-lua", "lua");
        return builder.build();
    }

    private static void rsyntax(Builder builder, String syntaxStyle, String name, String... aliases) {
        RSyntaxLexer lexer = new RSyntaxLexer(name, syntaxStyle);
        String[] names = new String[aliases.length + 1];
        names[0] = name;
        System.arraycopy(aliases, 0, names, 1, aliases.length);
        builder.lexer(lexer, syntaxStyle, names);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Lexer> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name.strip().toLowerCase(Locale.ROOT)));
    }

    @Override
    public Optional<Lexer> byMimetype(String mimetype) {
        if (mimetype == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byMimetype.get(normalizeMimetype(mimetype)));
    }

    @Override
    public Lexer plainText() {
        return plainText;
    }

    /** Number of registered lexer names, aliases included. */
    public int size() {
        return byName.size();
    }

    static String normalizeMimetype(String mimetype) {
        int semicolon = mimetype.indexOf(';');
        String base = semicolon < 0 ? mimetype : mimetype.substring(0, semicolon);
        return base.strip().toLowerCase(Locale.ROOT);
    }

    /** Builder for {@link DefaultLexerRegistry}. The plain-text lexer is always registered. */
    public static final class Builder {

        private final Map<String, Lexer> byName = new LinkedHashMap<>();
        private final Map<String, Lexer> byMimetype = new LinkedHashMap<>();
        private final Lexer plainText = new PlainTextLexer();

        private Builder() {
            lexer(plainText, "text/plain", PlainTextLexer.NAME, "plain", "none");
        }

        /**
         * Registers a lexer under a mimetype and one or more names.
         *
         * @param mimetype the mimetype, or {@code null} for none
         */
        public Builder lexer(Lexer lexer, String mimetype, String... names) {
            Objects.requireNonNull(lexer, "lexer must not be null");
            if (mimetype != null) {
                byMimetype.put(normalizeMimetype(mimetype), lexer);
            }
            for (String name : names) {
                byName.put(name.toLowerCase(Locale.ROOT), lexer);
            }
            return this;
        }

        /**
         * Maps an extra mimetype to an already registered lexer name.
         *
         * @throws IllegalArgumentException if no lexer is registered under {@code name}
         */
        public Builder mimetypeAlias(String mimetype, String name) {
            Lexer lexer = byName.get(name.toLowerCase(Locale.ROOT));
            if (lexer == null) {
                throw new IllegalArgumentException("No lexer registered under name '" + name + "'");
            }
            byMimetype.put(normalizeMimetype(mimetype), lexer);
            return this;
        }

        public DefaultLexerRegistry build() {
            return new DefaultLexerRegistry(byName, byMimetype, plainText);
        }
    }
}
