package io.markupxform.core.engine;

import io.markupxform.core.model.DocumentNode;

/**
 * Runs one embedded markup parser over a raw block body, hiding its calling convention.
 *
 * <p>Implementations are stateless and thread-safe.
 */
public interface SubParserInvoker {

    /** The descriptor this invoker was built for. */
    SubParserDescriptor descriptor();

    /**
     * Parses the raw text.
     *
     * @param rawText      the block body
     * @param residualArgs the directive arguments after the format name, may be {@code null}
     * @return a {@code page} node; may contain further unexpanded raw blocks
     */
    DocumentNode invoke(String rawText, String residualArgs);
}
