package io.markupxform.core.spi;

/**
 * Style classes assigned to highlighted tokens. The {@link #cssClass()} values follow the short
 * class names that highlighting stylesheets conventionally use ({@code k} for keywords, {@code c}
 * for comments, ...).
 */
public enum TokenStyle {
    /** Unstyled text; rendered as a plain text run. */
    TEXT(null),
    KEYWORD("k"),
    KEYWORD_TYPE("kt"),
    KEYWORD_CONSTANT("kc"),
    NAME_FUNCTION("nf"),
    NAME_VARIABLE("nv"),
    NAME_DECORATOR("nd"),
    NAME_TAG("nt"),
    NAME_ATTRIBUTE("na"),
    STRING("s"),
    STRING_CHAR("sc"),
    STRING_REGEX("sr"),
    NUMBER("m"),
    OPERATOR("o"),
    PUNCTUATION("p"),
    COMMENT("c"),
    COMMENT_PREPROC("cp"),
    COMMENT_DOC("cs"),
    GENERIC_INSERTED("gi"),
    GENERIC_DELETED("gd"),
    GENERIC_HEADING("gh"),
    GENERIC_SUBHEADING("gu"),
    GENERIC_OUTPUT("go"),
    ERROR("err");

    private final String cssClass;

    TokenStyle(String cssClass) {
        this.cssClass = cssClass;
    }

    /** Returns the CSS class for this style, or {@code null} for {@link #TEXT}. */
    public String cssClass() {
        return cssClass;
    }
}
