package io.markupxform.core.spi;

import java.util.Optional;

/**
 * Resolves lexers by language name or mimetype. Built once at startup and read-only afterwards.
 */
public interface LexerRegistry {

    /**
     * Looks up a lexer by language name or alias (e.g. {@code "python"}, {@code "cplusplus"}).
     *
     * @param name the language name, may be {@code null}
     * @return the lexer, or empty if the name is unknown
     */
    Optional<Lexer> byName(String name);

    /**
     * Looks up a lexer by mimetype (e.g. {@code "text/x-python"}).
     *
     * @param mimetype the mimetype, may be {@code null}
     * @return the lexer, or empty if the mimetype is unknown
     */
    Optional<Lexer> byMimetype(String mimetype);

    /** Returns the plain-text lexer. Never fails. */
    Lexer plainText();
}
