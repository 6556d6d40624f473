package io.markupxform.core.engine;

import io.markupxform.core.markup.CreoleParser;
import io.markupxform.core.markup.DocBookParser;
import io.markupxform.core.markup.MarkdownParser;
import io.markupxform.core.markup.MediaWikiParser;
import io.markupxform.core.markup.MoinWikiParser;
import io.markupxform.core.markup.RstParser;
import io.markupxform.core.model.RawBlockFormat;
import io.markupxform.core.spi.BlockParser;
import io.markupxform.core.spi.DocumentParser;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of embedded markup parsers keyed by {@link RawBlockFormat}. Each parser is wrapped in
 * the {@link SubParserInvoker} matching its format's {@link SubParserDescriptor}.
 *
 * <p>Thread-safe. Populated once while the expander is assembled and only read afterwards.
 */
public final class SubParserRegistry {

    private final Map<RawBlockFormat, SubParserInvoker> invokers = new ConcurrentHashMap<>();

    /** A registry holding the six built-in parsers. */
    public static SubParserRegistry withDefaults() {
        SubParserRegistry registry = new SubParserRegistry();
        registry.register(RawBlockFormat.WIKI, new MoinWikiParser());
        registry.register(RawBlockFormat.CREOLE, new CreoleParser());
        registry.register(RawBlockFormat.RST, new RstParser());
        registry.register(RawBlockFormat.DOCBOOK, new DocBookParser());
        registry.register(RawBlockFormat.MARKDOWN, new MarkdownParser());
        registry.register(RawBlockFormat.MEDIAWIKI, new MediaWikiParser());
        return registry;
    }

    /**
     * Registers a line-oriented parser, replacing any parser registered for the format.
     *
     * @throws NullPointerException     if parser is null
     * @throws IllegalArgumentException if the format does not use the line-cursor convention
     */
    public void register(RawBlockFormat format, BlockParser parser) {
        if (parser == null) {
            throw new NullPointerException("parser must not be null");
        }
        SubParserDescriptor descriptor = descriptor(format, SubParserDescriptor.CallingConvention.LINE_CURSOR);
        invokers.put(format, new LineCursorInvoker(descriptor, parser));
    }

    /**
     * Registers a whole-text parser, replacing any parser registered for the format.
     *
     * @throws NullPointerException     if parser is null
     * @throws IllegalArgumentException if the format does not use the whole-text convention
     */
    public void register(RawBlockFormat format, DocumentParser parser) {
        if (parser == null) {
            throw new NullPointerException("parser must not be null");
        }
        SubParserDescriptor descriptor = descriptor(format, SubParserDescriptor.CallingConvention.WHOLE_TEXT);
        invokers.put(format, new WholeTextInvoker(descriptor, parser));
    }

    /**
     * Looks up the invoker for a format.
     *
     * @return the invoker, or empty if no parser is registered
     */
    public Optional<SubParserInvoker> invoker(RawBlockFormat format) {
        return Optional.ofNullable(invokers.get(format));
    }

    /**
     * Looks up the invoker for a format, throwing if not found.
     *
     * @throws IllegalArgumentException if no parser is registered for the format
     */
    public SubParserInvoker requireInvoker(RawBlockFormat format) {
        return invoker(format)
                .orElseThrow(() -> new IllegalArgumentException("No parser registered for format: " + format));
    }

    /** Returns the number of registered parsers. */
    public int size() {
        return invokers.size();
    }

    /** Returns {@code true} if a parser is registered for the format. */
    public boolean hasParser(RawBlockFormat format) {
        return invokers.containsKey(format);
    }

    private static SubParserDescriptor descriptor(RawBlockFormat format, SubParserDescriptor.CallingConvention convention) {
        if (format == null) {
            throw new NullPointerException("format must not be null");
        }
        SubParserDescriptor descriptor = SubParserDescriptor.forFormat(format)
                .orElseThrow(() -> new IllegalArgumentException("Format " + format + " is not an embedded markup format"));
        if (descriptor.convention() != convention) {
            throw new IllegalArgumentException(
                    "Format " + format + " uses the " + descriptor.convention() + " convention, not " + convention);
        }
        return descriptor;
    }
}
