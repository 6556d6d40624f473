package io.markupxform.core.error;

/**
 * Thrown by an embedded markup parser when it cannot make sense of its input (e.g. malformed DocBook
 * XML). The expander does not catch it; it propagates to the host.
 */
public final class SubParserException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String parserId;

    public SubParserException(String message, String parserId) {
        super(message, null, Phase.EXPANSION);
        this.parserId = parserId;
    }

    public SubParserException(String message, Throwable cause, String parserId) {
        super(message, cause, null, Phase.EXPANSION);
        this.parserId = parserId;
    }

    /** Identifier of the failing parser, e.g. {@code "docbook"}. */
    public String parserId() {
        return parserId;
    }
}
