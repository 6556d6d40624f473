package io.markupxform.core.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Localized user-facing messages that end up inside the document tree.
 *
 * <p>Backed by the {@code io.markupxform.core.messages} resource bundle. Immutable and thread-safe.
 */
public final class Messages {

    static final String BUNDLE = "io.markupxform.core.messages";
    static final String INVALID_ARGUMENTS = "invalid.arguments";

    private final ResourceBundle bundle;
    private final Locale locale;

    private Messages(ResourceBundle bundle, Locale locale) {
        this.bundle = bundle;
        this.locale = locale;
    }

    /** Messages in the given locale, falling back to English for missing translations. */
    public static Messages forLocale(Locale locale) {
        Objects.requireNonNull(locale, "locale must not be null");
        ResourceBundle bundle = ResourceBundle.getBundle(
                BUNDLE, locale, ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
        return new Messages(bundle, locale);
    }

    /** English messages. */
    public static Messages english() {
        return forLocale(Locale.ENGLISH);
    }

    public Locale locale() {
        return locale;
    }

    /**
     * Message shown when a raw block is rendered as plain text because its directive could not be
     * used.
     *
     * @param arguments the original directive text, e.g. {@code "#!bogus-format"}
     */
    public String invalidArguments(String arguments) {
        return format(INVALID_ARGUMENTS, arguments);
    }

    private String format(String key, Object... params) {
        return new MessageFormat(bundle.getString(key), locale).format(params);
    }
}
