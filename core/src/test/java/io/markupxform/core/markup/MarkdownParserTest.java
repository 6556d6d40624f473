package io.markupxform.core.markup;

import static io.markupxform.core.testkit.TestTrees.findAll;
import static io.markupxform.core.testkit.TestTrees.findFirst;
import static io.markupxform.core.testkit.TestTrees.rows;
import static org.assertj.core.api.Assertions.assertThat;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.model.RawBlock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarkdownParserTest {

    private final MarkdownParser parser = new MarkdownParser();

    private DocumentNode body(String text) {
        DocumentNode page = parser.parse(text, "text/x-markdown;charset=utf-8");
        assertThat(page.tag()).isEqualTo(NodeTag.PAGE);
        return page.childNodes().get(0);
    }

    @Test
    void blocks() {
        DocumentNode body = body("# Title\r\n\r\nSome text.\r\n\r\n- a\r\n- b\r\n\r\n1. one\r\n\r\n> quoted\r\n\r\n---\r\n");

        assertThat(body.childNodes()).extracting(DocumentNode::tag)
                .containsExactly(NodeTag.HEADING, NodeTag.PARAGRAPH, NodeTag.LIST, NodeTag.LIST,
                        NodeTag.BLOCKQUOTE, NodeTag.SEPARATOR);
        assertThat(body.childNodes().get(0).attribute(BlockAssembler.LEVEL)).hasValue("1");
        assertThat(body.childNodes().get(3).attribute(BlockAssembler.LIST_STYLE)).hasValue("ordered");
    }

    @Test
    void inline() {
        DocumentNode body = body("*em* **strong** `code` [label](https://example.org)  \nnext");

        assertThat(findFirst(body, NodeTag.EMPHASIS).textContent()).isEqualTo("em");
        assertThat(findFirst(body, NodeTag.STRONG).textContent()).isEqualTo("strong");
        assertThat(findFirst(body, NodeTag.CODE).textContent()).isEqualTo("code");
        assertThat(findFirst(body, NodeTag.LINK).attribute(InlineParser.HREF)).hasValue("https://example.org");
        assertThat(findAll(body, NodeTag.LINE_BREAK)).hasSize(1);
    }

    @Test
    @DisplayName("```python → #!highlight python placeholder")
    void fencedCodeWithLanguage() {
        DocumentNode body = body("```python\nx = 1\n```");

        RawBlock block = RawBlock.from(findFirst(body, NodeTag.NOWIKI));
        assertThat(block.directiveLine()).isEqualTo("#!highlight python");
        assertThat(block.content()).isEqualTo("x = 1");
    }

    @Test
    @DisplayName("```csv , → #!csv , placeholder")
    void fencedCodeNamingAFormat() {
        DocumentNode body = body("```csv ,\na,b\n```");

        assertThat(RawBlock.from(findFirst(body, NodeTag.NOWIKI)).directiveLine()).isEqualTo("#!csv ,");
    }

    @Test
    void fencedCodeWithoutInfoIsPreformatted() {
        DocumentNode body = body("```\nplain\n```\n\n    indented");

        assertThat(findAll(body, NodeTag.NOWIKI)).isEmpty();
        assertThat(findAll(body, NodeTag.BLOCKCODE)).extracting(DocumentNode::textContent)
                .containsExactly("plain", "indented");
    }

    @Test
    void gfmTable() {
        DocumentNode body = body("| a | b |\n|---|---|\n| 1 | 2 |");

        DocumentNode table = findFirst(body, NodeTag.TABLE);
        assertThat(rows(findFirst(table, NodeTag.TABLE_HEADER))).containsExactly(List.of("a", "b"));
        assertThat(rows(findFirst(table, NodeTag.TABLE_BODY))).containsExactly(List.of("1", "2"));
    }
}
