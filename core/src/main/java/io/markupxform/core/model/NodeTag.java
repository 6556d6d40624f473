package io.markupxform.core.model;

/**
 * Element kinds of the abstract document tree. The {@link #localName()} is the stable identifier
 * used in serialized trees.
 */
public enum NodeTag {
    PAGE("page"),
    BODY("body"),
    DIV("div"),
    PARAGRAPH("p"),
    HEADING("h"),
    BLOCKCODE("blockcode"),
    CODE("code"),
    SPAN("span"),
    EMPHASIS("emphasis"),
    STRONG("strong"),
    LINK("a"),
    LINE_BREAK("line-break"),
    SEPARATOR("separator"),
    BLOCKQUOTE("blockquote"),
    ADMONITION("admonition"),
    LIST("list"),
    LIST_ITEM("list-item"),
    LIST_ITEM_BODY("list-item-body"),
    TABLE("table"),
    TABLE_HEADER("table-header"),
    TABLE_BODY("table-body"),
    TABLE_ROW("table-row"),
    TABLE_CELL("table-cell"),

    /** Unexpanded raw block ({@code {{{#!format args ...}}}}) awaiting expansion. */
    NOWIKI("nowiki"),
    /** A raw block after expansion; holds the rendered content. */
    NOWIKI_EXPANDED("nowiki-expanded");

    private final String localName;

    NodeTag(String localName) {
        this.localName = localName;
    }

    /** Returns the serialized name of this tag, e.g. {@code "table-row"}. */
    public String localName() {
        return localName;
    }

    /**
     * Resolves a serialized tag name.
     *
     * @param localName the name as produced by {@link #localName()}
     * @return the matching tag
     * @throws IllegalArgumentException if no tag has that name
     */
    public static NodeTag fromLocalName(String localName) {
        for (NodeTag tag : values()) {
            if (tag.localName.equals(localName)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unknown node tag: '" + localName + "'");
    }

    @Override
    public String toString() {
        return localName;
    }
}
