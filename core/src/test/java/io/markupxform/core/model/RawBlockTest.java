package io.markupxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markupxform.core.error.MalformedPlaceholderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RawBlockTest {

    @Test
    @DisplayName("Well-formed placeholder → typed view with right-trimmed directive")
    void readsPlaceholder() {
        RawBlock block = RawBlock.from(DocumentNode.placeholder(3, "#!highlight python   ", "print(1)\n"));

        assertThat(block.markerLength()).isEqualTo(3);
        assertThat(block.directiveLine()).isEqualTo("#!highlight python");
        assertThat(block.content()).isEqualTo("print(1)\n");
    }

    @Test
    void doesNotModifyPlaceholder() {
        DocumentNode placeholder = DocumentNode.placeholder(3, "#!csv", "a");

        RawBlock.from(placeholder);

        assertThat(placeholder.children()).hasSize(3);
    }

    @Test
    @DisplayName("Fewer than three children → MalformedPlaceholderException")
    void rejectsMissingChildren() {
        DocumentNode placeholder = DocumentNode.of(NodeTag.NOWIKI, new TextRun("3"), new TextRun("#!csv"));

        assertThatThrownBy(() -> RawBlock.from(placeholder))
                .isInstanceOf(MalformedPlaceholderException.class)
                .hasMessageContaining("got 2");
    }

    @Test
    @DisplayName("Element child where text is expected → MalformedPlaceholderException")
    void rejectsNonTextChild() {
        DocumentNode placeholder = DocumentNode.of(
                NodeTag.NOWIKI, new TextRun("3"), new DocumentNode(NodeTag.SPAN), new TextRun("body"));

        assertThatThrownBy(() -> RawBlock.from(placeholder))
                .isInstanceOf(MalformedPlaceholderException.class)
                .hasMessageContaining("directive line");
    }

    @Test
    void rejectsNonNumericMarker() {
        DocumentNode placeholder =
                DocumentNode.of(NodeTag.NOWIKI, new TextRun("{{{"), new TextRun("#!csv"), new TextRun("a"));

        assertThatThrownBy(() -> RawBlock.from(placeholder)).isInstanceOf(MalformedPlaceholderException.class);
    }

    @Test
    void rejectsOtherTags() {
        assertThatThrownBy(() -> RawBlock.from(new DocumentNode(NodeTag.DIV)))
                .isInstanceOf(MalformedPlaceholderException.class);
    }
}
