package io.markupxform.core.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments handed to an embedded parser: positional values and {@code key=value} keywords parsed
 * from the directive's residual argument string.
 */
public final class ParserArguments {

    private static final ParserArguments EMPTY = new ParserArguments(null, List.of(), Map.of());

    private final String raw;
    private final List<String> positional;
    private final Map<String, String> keyword;

    private ParserArguments(String raw, List<String> positional, Map<String, String> keyword) {
        this.raw = raw;
        this.positional = Collections.unmodifiableList(positional);
        this.keyword = Collections.unmodifiableMap(keyword);
    }

    /** Arguments for a directive that carried none. */
    public static ParserArguments empty() {
        return EMPTY;
    }

    /**
     * Parses a whitespace-separated argument string. Tokens of the form {@code key=value} become
     * keywords; everything else is positional.
     *
     * @param raw the residual argument string, may be {@code null}
     */
    public static ParserArguments parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return raw == null ? EMPTY : new ParserArguments(raw, List.of(), Map.of());
        }
        List<String> positional = new ArrayList<>();
        Map<String, String> keyword = new LinkedHashMap<>();
        for (String token : raw.strip().split("\\s+")) {
            int eq = token.indexOf('=');
            if (eq > 0) {
                keyword.put(token.substring(0, eq), token.substring(eq + 1));
            } else {
                positional.add(token);
            }
        }
        return new ParserArguments(raw, positional, keyword);
    }

    /** Arguments holding a single keyword and no raw string. */
    public static ParserArguments ofKeyword(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        return new ParserArguments(null, List.of(), Map.of(key, value));
    }

    /** The original argument string, or {@code null}. */
    public String raw() {
        return raw;
    }

    public List<String> positional() {
        return positional;
    }

    public Map<String, String> keyword() {
        return keyword;
    }

    /** Returns the keyword value, or {@code null} if absent. */
    public String keyword(String key) {
        return keyword.get(key);
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keyword.isEmpty();
    }

    @Override
    public String toString() {
        return "ParserArguments[positional=" + positional + ", keyword=" + keyword + "]";
    }
}
