package io.markupxform.core.error;

/**
 * Thrown when raw blocks nest more expansions deep than the configured maximum, typically because
 * sub-parser output keeps producing further raw blocks. The depth counts placeholders on the path
 * from the root, not tree levels.
 */
public final class ExpansionDepthExceededException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final int depth;
    private final int maxDepth;

    public ExpansionDepthExceededException(int depth, int maxDepth, String directiveLine) {
        super("Raw block nested " + depth + " expansions deep exceeds the maximum expansion depth of " + maxDepth,
                directiveLine,
                Phase.EXPANSION);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
