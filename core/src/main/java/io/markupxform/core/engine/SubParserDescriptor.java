package io.markupxform.core.engine;

import io.markupxform.core.model.RawBlockFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * How an embedded markup format is handed to its parser: which calling convention it uses and what
 * happens to the directive's residual arguments.
 *
 * @param format      the raw-block format
 * @param convention  line cursor or whole text
 * @param mapping     how the residual arguments are passed on
 * @param contentType the content-type tag handed to whole-text parsers with {@link
 *                    ArgumentMapping#FIXED_CONTENT_TYPE}, otherwise {@code null}
 */
public record SubParserDescriptor(
        RawBlockFormat format, CallingConvention convention, ArgumentMapping mapping, String contentType) {

    /** The two parser calling conventions. */
    public enum CallingConvention {
        /** {@link io.markupxform.core.spi.BlockParser} over a {@link io.markupxform.core.spi.LineCursor}. */
        LINE_CURSOR,
        /** {@link io.markupxform.core.spi.DocumentParser} over the full text. */
        WHOLE_TEXT
    }

    /** What happens to the residual directive arguments. */
    public enum ArgumentMapping {
        /** Arguments become the {@code class} keyword, with {@code /} replaced by a space. */
        CSS_CLASS,
        /** Arguments are passed on unchanged. */
        PASSTHROUGH,
        /** Arguments are ignored; a fixed content-type tag is passed instead. */
        FIXED_CONTENT_TYPE
    }

    public SubParserDescriptor {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(convention, "convention must not be null");
        Objects.requireNonNull(mapping, "mapping must not be null");
        if (mapping == ArgumentMapping.FIXED_CONTENT_TYPE && contentType == null) {
            throw new IllegalArgumentException("contentType is required for FIXED_CONTENT_TYPE");
        }
    }

    /**
     * Returns the descriptor of an embedded markup format.
     *
     * @return the descriptor, or empty for formats that are not parsed as markup
     */
    public static Optional<SubParserDescriptor> forFormat(RawBlockFormat format) {
        return Optional.ofNullable(switch (format) {
            case WIKI -> new SubParserDescriptor(format, CallingConvention.LINE_CURSOR, ArgumentMapping.CSS_CLASS, null);
            case CREOLE -> new SubParserDescriptor(format, CallingConvention.LINE_CURSOR, ArgumentMapping.PASSTHROUGH, null);
            case RST -> wholeText(format, "text/x-rst;charset=utf-8");
            case DOCBOOK -> wholeText(format, "application/docbook+xml;charset=utf-8");
            case MARKDOWN -> wholeText(format, "text/x-markdown;charset=utf-8");
            case MEDIAWIKI -> new SubParserDescriptor(format, CallingConvention.WHOLE_TEXT, ArgumentMapping.PASSTHROUGH, null);
            case HIGHLIGHT, CSV, UNKNOWN -> null;
        });
    }

    private static SubParserDescriptor wholeText(RawBlockFormat format, String contentType) {
        return new SubParserDescriptor(format, CallingConvention.WHOLE_TEXT, ArgumentMapping.FIXED_CONTENT_TYPE, contentType);
    }
}
