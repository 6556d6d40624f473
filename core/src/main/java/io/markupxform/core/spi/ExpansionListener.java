package io.markupxform.core.spi;

import io.markupxform.core.model.RawBlockFormat;

/**
 * SPI for observability hooks on raw-block expansion.
 *
 * <p>Hosts provide implementations that bridge to their metrics or tracing systems; the core has no
 * telemetry dependencies. Exceptions thrown by listeners are caught and logged by the expander and
 * do NOT affect expansion.
 */
public interface ExpansionListener {

    /**
     * Called after a raw block has been replaced by its expanded content.
     *
     * @param event contains the resolved format, the directive's format name, tree depth and
     *              duration
     */
    void onBlockExpanded(BlockExpandedEvent event);

    /**
     * Called when a raw block falls back to plain text because its directive could not be resolved.
     *
     * @param event contains the directive line and the reason
     */
    void onBlockFallback(BlockFallbackEvent event);

    // --- Event records ---

    /** Event emitted when a raw block has been expanded. */
    record BlockExpandedEvent(RawBlockFormat format, String formatName, int depth, long durationMs) {}

    /** Event emitted when a raw block is rendered as a diagnostic plus plain text. */
    record BlockFallbackEvent(String directiveLine, String reason) {}
}
