package io.markupxform.core.markup;

import io.markupxform.core.error.SubParserException;
import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.spi.DocumentParser;
import java.io.IOException;
import java.io.StringReader;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Document parser for DocBook XML, built on the JDK DOM parser with DTD loading and external
 * entities disabled.
 *
 * <p>Elements are mapped by local name, so both DocBook 4 (no namespace) and DocBook 5 documents
 * are accepted. Elements without a mapping are transparent: their content is kept, the element
 * itself is dropped. A {@code programlisting} or {@code screen} with a {@code language} attribute
 * becomes an unexpanded {@code #!highlight} raw block.
 */
public final class DocBookParser implements DocumentParser {

    public static final String ID = "docbook";

    private static final Set<String> SECTIONS =
            Set.of("article", "book", "chapter", "section", "sect1", "sect2", "sect3", "sect4", "sect5", "simplesect");
    private static final Set<String> ADMONITIONS = Set.of("note", "warning", "tip", "caution", "important");
    private static final Set<String> SKIPPED = Set.of("info", "articleinfo", "bookinfo", "indexterm", "remark");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DocumentNode parse(String text, String contentType) {
        org.w3c.dom.Document xml = read(text);
        DocumentNode body = new DocumentNode(NodeTag.BODY);
        convert(xml.getDocumentElement(), body, 0);
        return DocumentNode.of(NodeTag.PAGE, body);
    }

    private static org.w3c.dom.Document read(String text) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(text)));
        } catch (SAXException e) {
            throw new SubParserException("Malformed DocBook XML: " + e.getMessage(), e, ID);
        } catch (ParserConfigurationException | IOException e) {
            throw new SubParserException("Failed to read DocBook XML: " + e.getMessage(), e, ID);
        }
    }

    private void convertChildren(Node parent, DocumentNode target, int sectionDepth) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            convert(child, target, sectionDepth);
        }
    }

    private void convert(Node node, DocumentNode target, int sectionDepth) {
        switch (node.getNodeType()) {
            case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> appendText(node.getNodeValue(), target);
            case Node.ELEMENT_NODE -> convertElement((Element) node, target, sectionDepth);
            default -> {
                // comments and processing instructions are dropped
            }
        }
    }

    private void convertElement(Element element, DocumentNode target, int sectionDepth) {
        String name = element.getLocalName() == null ? element.getTagName() : element.getLocalName();
        if (SKIPPED.contains(name)) {
            return;
        }
        if (SECTIONS.contains(name)) {
            convertChildren(element, target, sectionDepth + 1);
            return;
        }
        switch (name) {
            case "title" -> target.append(container(
                    new DocumentNode(NodeTag.HEADING).attribute(BlockAssembler.LEVEL, Integer.toString(Math.max(1, Math.min(sectionDepth, 6)))),
                    element,
                    sectionDepth));
            case "para", "simpara" -> target.append(container(new DocumentNode(NodeTag.PARAGRAPH), element, sectionDepth));
            case "emphasis" -> {
                String role = element.getAttribute("role");
                NodeTag tag = "bold".equals(role) || "strong".equals(role) ? NodeTag.STRONG : NodeTag.EMPHASIS;
                target.append(container(new DocumentNode(tag), element, sectionDepth));
            }
            case "literal", "code", "command", "filename", "varname", "function" ->
                    target.append(DocumentNode.text(NodeTag.CODE, element.getTextContent()));
            case "programlisting", "screen", "literallayout" -> target.append(listing(element));
            case "itemizedlist" -> target.append(container(
                    new DocumentNode(NodeTag.LIST).attribute(BlockAssembler.LIST_STYLE, "unordered"), element, sectionDepth));
            case "orderedlist" -> target.append(container(
                    new DocumentNode(NodeTag.LIST).attribute(BlockAssembler.LIST_STYLE, "ordered"), element, sectionDepth));
            case "listitem" -> target.append(
                    DocumentNode.of(NodeTag.LIST_ITEM, container(new DocumentNode(NodeTag.LIST_ITEM_BODY), element, sectionDepth)));
            case "link", "ulink" -> target.append(container(
                    new DocumentNode(NodeTag.LINK).attribute(InlineParser.HREF, linkTarget(element)), element, sectionDepth));
            case "blockquote" -> target.append(container(new DocumentNode(NodeTag.BLOCKQUOTE), element, sectionDepth));
            case "table", "informaltable" -> target.append(container(new DocumentNode(NodeTag.TABLE), element, sectionDepth));
            case "thead" -> target.append(container(new DocumentNode(NodeTag.TABLE_HEADER), element, sectionDepth));
            case "tbody" -> target.append(container(new DocumentNode(NodeTag.TABLE_BODY), element, sectionDepth));
            case "row", "tr" -> target.append(container(new DocumentNode(NodeTag.TABLE_ROW), element, sectionDepth));
            case "entry", "td", "th" -> target.append(container(new DocumentNode(NodeTag.TABLE_CELL), element, sectionDepth));
            default -> {
                if (ADMONITIONS.contains(name)) {
                    target.append(container(new DocumentNode(NodeTag.ADMONITION).attribute("type", name), element, sectionDepth));
                } else {
                    convertChildren(element, target, sectionDepth);
                }
            }
        }
    }

    private DocumentNode container(DocumentNode node, Element element, int sectionDepth) {
        convertChildren(element, node, sectionDepth);
        return node;
    }

    private static DocumentNode listing(Element element) {
        String content = element.getTextContent();
        String language = element.getAttribute("language");
        if (!language.isBlank()) {
            return DocumentNode.placeholder(3, "#!highlight " + language.strip(), content);
        }
        return DocumentNode.text(NodeTag.BLOCKCODE, content);
    }

    private static String linkTarget(Element element) {
        String href = element.getAttributeNS("http://www.w3.org/1999/xlink", "href");
        if (href.isEmpty()) {
            href = element.getAttribute("url");
        }
        if (href.isEmpty()) {
            href = element.getAttribute("linkend");
        }
        return href;
    }

    /** Whitespace-only text between block elements is layout, not content. */
    private static void appendText(String text, DocumentNode target) {
        if (text.isBlank() && !acceptsInlineWhitespace(target.tag())) {
            return;
        }
        target.appendText(text);
    }

    private static boolean acceptsInlineWhitespace(NodeTag tag) {
        return switch (tag) {
            case PARAGRAPH, HEADING, EMPHASIS, STRONG, LINK, TABLE_CELL -> true;
            default -> false;
        };
    }
}
