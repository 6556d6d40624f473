package io.markupxform.core.error;

/**
 * Thrown when a raw-block placeholder does not carry the three structural children (marker length,
 * directive line, body) the upstream tree builder must supply. This is a caller precondition and is
 * never recovered from.
 */
public final class MalformedPlaceholderException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public MalformedPlaceholderException(String message) {
        super(message, null, Phase.EXPANSION);
    }
}
