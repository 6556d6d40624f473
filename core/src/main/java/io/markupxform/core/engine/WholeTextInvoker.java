package io.markupxform.core.engine;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.spi.DocumentParser;
import java.util.Objects;

/** Invokes a {@link DocumentParser} with the full body and a content-type tag. */
final class WholeTextInvoker implements SubParserInvoker {

    private final SubParserDescriptor descriptor;
    private final DocumentParser parser;

    WholeTextInvoker(SubParserDescriptor descriptor, DocumentParser parser) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public SubParserDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public DocumentNode invoke(String rawText, String residualArgs) {
        String contentType = descriptor.mapping() == SubParserDescriptor.ArgumentMapping.FIXED_CONTENT_TYPE
                ? descriptor.contentType()
                : residualArgs;
        return parser.parse(rawText, contentType);
    }
}
