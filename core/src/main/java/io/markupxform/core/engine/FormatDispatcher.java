package io.markupxform.core.engine;

import io.markupxform.core.model.Directive;
import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.RawBlock;
import io.markupxform.core.model.RawBlockFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes a raw block to the handler for its format and appends the handler's output to the
 * (already emptied) placeholder.
 *
 * <p>Unknown formats, unresolvable lexers and formats without a registered parser produce a
 * diagnostic followed by the body as plain text. Exceptions from embedded parsers are not caught.
 *
 * <p>Thread-safe and immutable.
 */
public final class FormatDispatcher {

    private final HighlightRenderer highlighter;
    private final CsvTableBuilder tables;
    private final SubParserRegistry parsers;
    private final DiagnosticBuilder diagnostics;
    private final String defaultSeparator;

    public FormatDispatcher(
            HighlightRenderer highlighter,
            CsvTableBuilder tables,
            SubParserRegistry parsers,
            DiagnosticBuilder diagnostics,
            String defaultSeparator) {
        this.highlighter = Objects.requireNonNull(highlighter, "highlighter must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.parsers = Objects.requireNonNull(parsers, "parsers must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.defaultSeparator = Objects.requireNonNull(defaultSeparator, "defaultSeparator must not be null");
    }

    /**
     * Renders one raw block into its placeholder.
     *
     * @param placeholder the placeholder node, with its children already removed
     * @param block       the raw block read from the placeholder
     * @param directive   the parsed directive line
     * @return what was rendered
     */
    public DispatchOutcome dispatch(DocumentNode placeholder, RawBlock block, Directive directive) {
        RawBlockFormat format = directive.format();
        return switch (format) {
            case HIGHLIGHT -> highlighter.render(
                    placeholder, directive.formatArgs(), block.content(), block.directiveLine());
            case CSV -> {
                String separator = directive.hasArgs() && !directive.formatArgs().isEmpty()
                        ? directive.formatArgs()
                        : defaultSeparator;
                placeholder.append(tables.build(block.content(), separator));
                yield DispatchOutcome.expanded(format);
            }
            case WIKI, CREOLE, RST, DOCBOOK, MARKDOWN, MEDIAWIKI -> subParse(placeholder, block, directive, format);
            case UNKNOWN -> fallback(placeholder, block, format, directive.formatName() == null
                    ? "missing #! directive"
                    : "unknown format '" + directive.formatName() + "'");
        };
    }

    private DispatchOutcome subParse(
            DocumentNode placeholder, RawBlock block, Directive directive, RawBlockFormat format) {
        Optional<SubParserInvoker> invoker = parsers.invoker(format);
        if (invoker.isEmpty()) {
            return fallback(placeholder, block, format, "no parser registered for " + format);
        }
        placeholder.append(invoker.get().invoke(block.content(), directive.formatArgs()));
        return DispatchOutcome.expanded(format);
    }

    private DispatchOutcome fallback(DocumentNode placeholder, RawBlock block, RawBlockFormat format, String reason) {
        placeholder.append(diagnostics.invalidArguments(block.directiveLine()));
        highlighter.renderPlain(placeholder, block.content());
        return DispatchOutcome.fallback(format, reason);
    }
}
