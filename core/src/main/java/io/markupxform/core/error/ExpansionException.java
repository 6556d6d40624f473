package io.markupxform.core.error;

/**
 * Abstract base for all markup-xform exceptions. Never thrown directly; use the concrete
 * subclasses.
 *
 * <p>Format-resolution problems (unknown format, unresolvable lexer) are never thrown; they are
 * rendered inline as diagnostics. Only precondition violations, sub-parser failures and
 * configuration errors surface as exceptions.
 */
public abstract class ExpansionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONFIGURATION,
        EXPANSION
    }

    private final String directiveLine;
    private final Phase phase;

    protected ExpansionException(String message, String directiveLine, Phase phase) {
        super(message);
        this.directiveLine = directiveLine;
        this.phase = phase;
    }

    protected ExpansionException(String message, Throwable cause, String directiveLine, Phase phase) {
        super(message, cause);
        this.directiveLine = directiveLine;
        this.phase = phase;
    }

    /** The directive line of the raw block being expanded, or {@code null} if not applicable. */
    public String directiveLine() {
        return directiveLine;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
