package io.markupxform.core.markup;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.model.RawBlockFormat;
import io.markupxform.core.spi.DocumentParser;
import java.util.List;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;

/**
 * Markdown parser backed by commonmark-java with the GFM tables extension. The commonmark AST is
 * converted node by node into the document tree.
 *
 * <p>A fenced code block with an info string becomes an unexpanded raw block: {@code ```python}
 * turns into {@code #!highlight python}, while an info string naming a raw-block format ({@code
 * ```csv ,}) turns into that directive ({@code #!csv ,}).
 */
public final class MarkdownParser implements DocumentParser {

    public static final String ID = "markdown";

    private final Parser parser;

    public MarkdownParser() {
        this.parser = Parser.builder().extensions(List.of(TablesExtension.create())).build();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DocumentNode parse(String text, String contentType) {
        Node document = parser.parse(LineSplitter.normalize(text));
        DocumentNode body = new DocumentNode(NodeTag.BODY);
        appendChildren(body, document);
        return DocumentNode.of(NodeTag.PAGE, body);
    }

    private void appendChildren(DocumentNode target, Node parent) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            DocumentNode converted = convert(child, target);
            if (converted != null) {
                target.append(converted);
            }
        }
    }

    /** Converts one commonmark node; returns {@code null} when content was appended to {@code target} directly. */
    private DocumentNode convert(Node node, DocumentNode target) {
        if (node instanceof Text text) {
            target.appendText(text.getLiteral());
            return null;
        }
        if (node instanceof SoftLineBreak) {
            target.appendText("\n");
            return null;
        }
        if (node instanceof HtmlInline html) {
            target.appendText(html.getLiteral());
            return null;
        }
        if (node instanceof Document) {
            appendChildren(target, node);
            return null;
        }
        if (node instanceof Heading heading) {
            return container(new DocumentNode(NodeTag.HEADING)
                    .attribute(BlockAssembler.LEVEL, Integer.toString(heading.getLevel())), node);
        }
        if (node instanceof Paragraph) {
            return container(new DocumentNode(NodeTag.PARAGRAPH), node);
        }
        if (node instanceof Emphasis) {
            return container(new DocumentNode(NodeTag.EMPHASIS), node);
        }
        if (node instanceof StrongEmphasis) {
            return container(new DocumentNode(NodeTag.STRONG), node);
        }
        if (node instanceof Code code) {
            return DocumentNode.text(NodeTag.CODE, code.getLiteral());
        }
        if (node instanceof HardLineBreak) {
            return new DocumentNode(NodeTag.LINE_BREAK);
        }
        if (node instanceof Link link) {
            return container(new DocumentNode(NodeTag.LINK).attribute(InlineParser.HREF, link.getDestination()), node);
        }
        if (node instanceof Image image) {
            return container(
                    new DocumentNode(NodeTag.LINK)
                            .attribute(InlineParser.HREF, image.getDestination())
                            .withClass("image"),
                    node);
        }
        if (node instanceof BulletList) {
            return container(new DocumentNode(NodeTag.LIST).attribute(BlockAssembler.LIST_STYLE, "unordered"), node);
        }
        if (node instanceof OrderedList) {
            return container(new DocumentNode(NodeTag.LIST).attribute(BlockAssembler.LIST_STYLE, "ordered"), node);
        }
        if (node instanceof ListItem) {
            DocumentNode itemBody = container(new DocumentNode(NodeTag.LIST_ITEM_BODY), node);
            return DocumentNode.of(NodeTag.LIST_ITEM, itemBody);
        }
        if (node instanceof BlockQuote) {
            return container(new DocumentNode(NodeTag.BLOCKQUOTE), node);
        }
        if (node instanceof ThematicBreak) {
            return new DocumentNode(NodeTag.SEPARATOR);
        }
        if (node instanceof FencedCodeBlock fenced) {
            return fencedCode(fenced);
        }
        if (node instanceof IndentedCodeBlock indented) {
            return DocumentNode.text(NodeTag.BLOCKCODE, stripFinalNewline(indented.getLiteral()));
        }
        if (node instanceof HtmlBlock html) {
            return DocumentNode.text(NodeTag.BLOCKCODE, stripFinalNewline(html.getLiteral()));
        }
        if (node instanceof TableBlock) {
            return container(new DocumentNode(NodeTag.TABLE), node);
        }
        if (node instanceof TableHead) {
            return container(new DocumentNode(NodeTag.TABLE_HEADER), node);
        }
        if (node instanceof TableBody) {
            return container(new DocumentNode(NodeTag.TABLE_BODY), node);
        }
        if (node instanceof TableRow) {
            return container(new DocumentNode(NodeTag.TABLE_ROW), node);
        }
        if (node instanceof TableCell) {
            return container(new DocumentNode(NodeTag.TABLE_CELL), node);
        }
        // unknown extension nodes contribute their content
        appendChildren(target, node);
        return null;
    }

    private DocumentNode container(DocumentNode node, Node source) {
        appendChildren(node, source);
        return node;
    }

    private static DocumentNode fencedCode(FencedCodeBlock fenced) {
        String literal = stripFinalNewline(fenced.getLiteral());
        String info = fenced.getInfo() == null ? "" : fenced.getInfo().strip();
        if (info.isEmpty()) {
            return DocumentNode.text(NodeTag.BLOCKCODE, literal);
        }
        String name = info.split("\\s+", 2)[0];
        String directive = RawBlockFormat.fromName(name) != RawBlockFormat.UNKNOWN ? "#!" + info : "#!highlight " + info;
        return DocumentNode.placeholder(3, directive, literal);
    }

    private static String stripFinalNewline(String literal) {
        return literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
    }
}
