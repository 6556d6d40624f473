package io.markupxform.core.model;

import java.util.Objects;

/**
 * Immutable leaf text run inside a document tree.
 *
 * @param text the text, never null (may be empty)
 */
public record TextRun(String text) implements NodeContent {

    public TextRun {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String textContent() {
        return text;
    }
}
