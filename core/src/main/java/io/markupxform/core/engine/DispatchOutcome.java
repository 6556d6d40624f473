package io.markupxform.core.engine;

import io.markupxform.core.model.RawBlockFormat;
import java.util.Objects;

/**
 * Result of dispatching one raw block.
 *
 * @param format         the format the directive resolved to
 * @param fallbackReason why the block fell back to plain text, or {@code null} if it was rendered as
 *                       requested
 */
public record DispatchOutcome(RawBlockFormat format, String fallbackReason) {

    public DispatchOutcome {
        Objects.requireNonNull(format, "format must not be null");
    }

    public static DispatchOutcome expanded(RawBlockFormat format) {
        return new DispatchOutcome(format, null);
    }

    public static DispatchOutcome fallback(RawBlockFormat format, String reason) {
        return new DispatchOutcome(format, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean isFallback() {
        return fallbackReason != null;
    }
}
