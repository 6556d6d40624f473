package io.markupxform.core.engine;

import io.markupxform.core.i18n.Messages;
import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import java.util.Objects;

/**
 * Builds the inline error block shown when a raw block cannot be rendered as requested: a {@code
 * div} with class {@code error} holding one paragraph with the localized message.
 *
 * <p>Thread-safe and immutable.
 */
public final class DiagnosticBuilder {

    /** CSS class of the diagnostic {@code div}. */
    public static final String ERROR_CLASS = "error";

    private final Messages messages;

    public DiagnosticBuilder(Messages messages) {
        this.messages = Objects.requireNonNull(messages, "messages must not be null");
    }

    /**
     * Builds the "invalid arguments" diagnostic.
     *
     * @param directiveLine the directive line as written, e.g. {@code "#!bogus-format"}
     */
    public DocumentNode invalidArguments(String directiveLine) {
        DocumentNode paragraph = DocumentNode.text(NodeTag.PARAGRAPH, messages.invalidArguments(directiveLine));
        return DocumentNode.of(NodeTag.DIV, paragraph).withClass(ERROR_CLASS);
    }
}
