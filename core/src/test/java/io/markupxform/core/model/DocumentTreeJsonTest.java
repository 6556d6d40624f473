package io.markupxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DocumentTreeJsonTest {

    @Test
    void writesSortedAttributesAndTextRuns() {
        DocumentNode link = new DocumentNode(NodeTag.LINK).attribute("href", "x").withClass("ext");
        link.appendText("label");

        assertThat(DocumentTreeJson.write(DocumentNode.of(NodeTag.PARAGRAPH, new TextRun("see "), link)))
                .isEqualTo("{\"tag\":\"p\",\"attributes\":{},\"children\":[\"see \","
                        + "{\"tag\":\"a\",\"attributes\":{\"class\":\"ext\",\"href\":\"x\"},\"children\":[\"label\"]}]}");
    }

    @Test
    void readRestoresTheSameTree() {
        DocumentNode tree = DocumentNode.of(
                NodeTag.PAGE, DocumentNode.of(NodeTag.BODY, DocumentNode.placeholder(3, "#!csv ,", "a,b")));
        String json = DocumentTreeJson.write(tree);

        DocumentNode read = DocumentTreeJson.read(json);

        assertThat(read.tag()).isEqualTo(NodeTag.PAGE);
        assertThat(DocumentTreeJson.write(read)).isEqualTo(json);
    }

    @Test
    void unknownTagIsRejected() {
        assertThatThrownBy(() -> DocumentTreeJson.read("{\"tag\":\"marquee\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("marquee");
    }
}
