package io.markupxform.core.model;

/**
 * A child entry of a {@link DocumentNode}: either a nested node or a leaf {@link TextRun}.
 *
 * <p>The hierarchy is sealed so that tree walkers can switch over both variants exhaustively.
 */
public sealed interface NodeContent permits DocumentNode, TextRun {

    /** Returns the concatenated text of this content and all of its descendants. */
    String textContent();
}
