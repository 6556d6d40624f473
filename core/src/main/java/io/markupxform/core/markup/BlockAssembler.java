package io.markupxform.core.markup;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Accumulates block-level structure for the line-oriented parsers: paragraphs built from
 * consecutive text lines, nested lists, headings and arbitrary block nodes.
 *
 * <p>One instance per parse call.
 */
final class BlockAssembler {

    static final String LEVEL = "outline-level";
    static final String LIST_STYLE = "item-label-generate";

    private final DocumentNode container;
    private final InlineParser inline;
    private final List<String> paragraph = new ArrayList<>();
    private final Deque<DocumentNode> lists = new ArrayDeque<>();

    BlockAssembler(DocumentNode container, InlineParser inline) {
        this.container = container;
        this.inline = inline;
    }

    DocumentNode container() {
        return container;
    }

    /** Adds a line to the current paragraph, closing any open list. */
    void paragraphLine(String line) {
        closeList();
        paragraph.add(line.strip());
    }

    boolean inParagraph() {
        return !paragraph.isEmpty();
    }

    boolean inList() {
        return !lists.isEmpty();
    }

    /** Ends the current paragraph and list, if any. */
    void flush() {
        flushParagraph();
        closeList();
    }

    void heading(int level, String text) {
        flush();
        DocumentNode heading = new DocumentNode(NodeTag.HEADING).attribute(LEVEL, Integer.toString(level));
        heading.appendAll(inline.parse(text.strip()));
        container.append(heading);
    }

    void separator() {
        flush();
        container.append(new DocumentNode(NodeTag.SEPARATOR));
    }

    /** Appends a finished block node after closing the current paragraph and list. */
    void block(DocumentNode node) {
        flush();
        container.append(node);
    }

    /**
     * Adds a list item at the given one-based nesting level, opening or closing nested lists as
     * needed.
     */
    void listItem(int level, boolean ordered, String text) {
        flushParagraph();
        while (lists.size() > level) {
            lists.pop();
        }
        while (lists.size() < level) {
            DocumentNode list = new DocumentNode(NodeTag.LIST).attribute(LIST_STYLE, ordered ? "ordered" : "unordered");
            if (lists.isEmpty()) {
                container.append(list);
            } else {
                lastItemBody(lists.peek()).append(list);
            }
            lists.push(list);
        }
        DocumentNode body = new DocumentNode(NodeTag.LIST_ITEM_BODY);
        body.appendAll(inline.parse(text.strip()));
        lists.peek().append(DocumentNode.of(NodeTag.LIST_ITEM, body));
    }

    private void flushParagraph() {
        if (paragraph.isEmpty()) {
            return;
        }
        DocumentNode p = new DocumentNode(NodeTag.PARAGRAPH);
        p.appendAll(inline.parse(String.join("\n", paragraph)));
        paragraph.clear();
        container.append(p);
    }

    private void closeList() {
        lists.clear();
    }

    private static DocumentNode lastItemBody(DocumentNode list) {
        List<DocumentNode> items = list.childNodes();
        DocumentNode item;
        if (items.isEmpty()) {
            item = DocumentNode.of(NodeTag.LIST_ITEM, new DocumentNode(NodeTag.LIST_ITEM_BODY));
            list.append(item);
        } else {
            item = items.get(items.size() - 1);
        }
        return item.childNodes().get(0);
    }
}
