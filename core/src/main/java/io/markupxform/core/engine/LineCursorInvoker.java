package io.markupxform.core.engine;

import io.markupxform.core.markup.LineSplitter;
import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.spi.BlockParser;
import io.markupxform.core.spi.LineCursor;
import io.markupxform.core.spi.ParserArguments;
import java.util.Objects;

/** Invokes a {@link BlockParser} over the normalized lines of the body and wraps its result in a page. */
final class LineCursorInvoker implements SubParserInvoker {

    private final SubParserDescriptor descriptor;
    private final BlockParser parser;

    LineCursorInvoker(SubParserDescriptor descriptor, BlockParser parser) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public SubParserDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public DocumentNode invoke(String rawText, String residualArgs) {
        LineCursor lines = new LineCursor(LineSplitter.split(rawText));
        DocumentNode body = parser.parseBlock(lines, arguments(residualArgs));
        return DocumentNode.of(NodeTag.PAGE, body);
    }

    private ParserArguments arguments(String residualArgs) {
        if (residualArgs == null || residualArgs.isEmpty()) {
            return ParserArguments.empty();
        }
        return switch (descriptor.mapping()) {
            case CSS_CLASS -> ParserArguments.ofKeyword(DocumentNode.CLASS, residualArgs.replace('/', ' '));
            case PASSTHROUGH -> ParserArguments.parse(residualArgs);
            case FIXED_CONTENT_TYPE -> ParserArguments.empty();
        };
    }
}
