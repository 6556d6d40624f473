package io.markupxform.core.markup;

import static io.markupxform.core.testkit.TestTrees.findAll;
import static io.markupxform.core.testkit.TestTrees.findFirst;
import static org.assertj.core.api.Assertions.assertThat;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.model.RawBlock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RstParserTest {

    private final RstParser parser = new RstParser();

    private DocumentNode body(String text) {
        DocumentNode page = parser.parse(text, "text/x-rst;charset=utf-8");
        assertThat(page.tag()).isEqualTo(NodeTag.PAGE);
        return page.childNodes().get(0);
    }

    @Test
    @DisplayName("Title levels follow first appearance of each adornment")
    void titleLevels() {
        DocumentNode body = body("=====\nTitle\n=====\n\nSection\n-------\n\nOther\n=====\n");

        assertThat(findAll(body, NodeTag.HEADING))
                .extracting(h -> h.textContent() + ":" + h.attribute(BlockAssembler.LEVEL).orElseThrow())
                .containsExactly("Title:1", "Section:2", "Other:1");
    }

    @Test
    void paragraphsAndInline() {
        DocumentNode body = body("Use ``lit`` with **bold**, *em* and `Moin <https://moinmo.in>`_.\nSecond line.");

        assertThat(body.childNodes()).extracting(DocumentNode::tag).containsExactly(NodeTag.PARAGRAPH);
        assertThat(findFirst(body, NodeTag.CODE).textContent()).isEqualTo("lit");
        assertThat(findFirst(body, NodeTag.STRONG).textContent()).isEqualTo("bold");
        assertThat(findFirst(body, NodeTag.EMPHASIS).textContent()).isEqualTo("em");
        DocumentNode link = findFirst(body, NodeTag.LINK);
        assertThat(link.attribute(InlineParser.HREF)).hasValue("https://moinmo.in");
        assertThat(link.textContent()).isEqualTo("Moin");
    }

    @Test
    void bulletAndEnumeratedLists() {
        DocumentNode body = body("* a\n* b\n\n1. one\n2. two");

        assertThat(findAll(body, NodeTag.LIST))
                .extracting(l -> l.attribute(BlockAssembler.LIST_STYLE).orElseThrow())
                .containsExactly("unordered", "ordered");
        assertThat(findAll(body, NodeTag.LIST_ITEM)).hasSize(4);
    }

    @Test
    @DisplayName("Paragraph ending in :: introduces a literal block")
    void literalBlock() {
        DocumentNode body = body("Example::\n\n    if x:\n        y()\n\nAfter.");

        assertThat(body.childNodes()).extracting(DocumentNode::tag)
                .containsExactly(NodeTag.PARAGRAPH, NodeTag.BLOCKCODE, NodeTag.PARAGRAPH);
        assertThat(body.childNodes().get(0).textContent()).isEqualTo("Example:");
        assertThat(body.childNodes().get(1).textContent()).isEqualTo("if x:\n    y()");
    }

    @Test
    @DisplayName("code-block directive → #!highlight placeholder")
    void codeBlockDirective() {
        DocumentNode body = body(".. code-block:: java\n\n   int x = 1;\n\n.. code::\n\n   plain");

        assertThat(findAll(body, NodeTag.NOWIKI))
                .extracting(n -> RawBlock.from(n).directiveLine())
                .containsExactly("#!highlight java", "#!highlight text");
        assertThat(RawBlock.from(findFirst(body, NodeTag.NOWIKI)).content()).isEqualTo("int x = 1;");
    }

    @Test
    void admonition() {
        DocumentNode body = body(".. note:: Be careful\n   with this.");

        DocumentNode note = findFirst(body, NodeTag.ADMONITION);
        assertThat(note.attribute("type")).hasValue("note");
        assertThat(note.childNodes()).extracting(DocumentNode::tag).containsExactly(NodeTag.PARAGRAPH);
        assertThat(note.textContent()).isEqualTo("Be careful\nwith this.");
    }

    @Test
    void commentsAreDropped() {
        DocumentNode body = body(".. a comment\n   still comment\n\nVisible.");

        assertThat(body.textContent()).isEqualTo("Visible.");
    }
}
