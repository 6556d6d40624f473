package io.markupxform.core.markup;

import static io.markupxform.core.testkit.TestTrees.findAll;
import static io.markupxform.core.testkit.TestTrees.findFirst;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.model.RawBlock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MediaWikiParserTest {

    private final MediaWikiParser parser = new MediaWikiParser();

    private DocumentNode body(String text) {
        return parser.parse(text, null).childNodes().get(0);
    }

    @Test
    void headingsListsAndRules() {
        DocumentNode body = body("== Intro ==\n* a\n** a.1\n* b\n----\n# first");

        assertThat(body.childNodes()).extracting(DocumentNode::tag)
                .containsExactly(NodeTag.HEADING, NodeTag.LIST, NodeTag.SEPARATOR, NodeTag.LIST);
        assertThat(body.childNodes().get(0).attribute(BlockAssembler.LEVEL)).hasValue("2");
        assertThat(body.childNodes().get(1).childNodes()).hasSize(2);
        assertThat(body.childNodes().get(3).attribute(BlockAssembler.LIST_STYLE)).hasValue("ordered");
    }

    @Test
    void inlineMarkup() {
        DocumentNode body = body("'''b''' ''i'' <code>c</code> [[Main Page|home]] [https://example.org Example]");

        assertThat(findFirst(body, NodeTag.STRONG).textContent()).isEqualTo("b");
        assertThat(findFirst(body, NodeTag.EMPHASIS).textContent()).isEqualTo("i");
        assertThat(findFirst(body, NodeTag.CODE).textContent()).isEqualTo("c");
        assertThat(findAll(body, NodeTag.LINK))
                .extracting(l -> l.attribute(InlineParser.HREF).orElseThrow() + "|" + l.textContent())
                .containsExactly("Main Page|home", "https://example.org|Example");
    }

    @Test
    @DisplayName("<syntaxhighlight lang> and <source lang> → #!highlight placeholders")
    void sourceBlocks() {
        DocumentNode body = body(
                "<syntaxhighlight lang=\"python\">\nx = 1\n</syntaxhighlight>\n<source lang=cpp>int x;</source>");

        assertThat(findAll(body, NodeTag.NOWIKI))
                .extracting(RawBlock::from)
                .extracting(RawBlock::directiveLine, RawBlock::content)
                .containsExactly(
                        tuple("#!highlight python", "x = 1"),
                        tuple("#!highlight cpp", "int x;"));
    }

    @Test
    void sourceWithoutLanguageIsPlainText() {
        DocumentNode body = body("<syntaxhighlight>\nplain\n</syntaxhighlight>");

        assertThat(RawBlock.from(findFirst(body, NodeTag.NOWIKI)).directiveLine()).isEqualTo("#!highlight text");
    }

    @Test
    void preformatted() {
        DocumentNode body = body("<pre>\nraw ''x''\n</pre>\n indented\n more");

        assertThat(findAll(body, NodeTag.BLOCKCODE)).extracting(DocumentNode::textContent)
                .containsExactly("raw ''x''", "indented\nmore");
    }
}
