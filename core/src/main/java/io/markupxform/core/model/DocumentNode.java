package io.markupxform.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable node of the abstract document tree: a {@link NodeTag}, an attribute map and an ordered
 * list of children.
 *
 * <p>Every node has at most one parent. Appending a node that is already attached elsewhere, or
 * that would introduce a cycle, is rejected, so trees built through this API are always acyclic.
 *
 * <p>Not thread-safe. A tree is owned by one expansion call at a time.
 */
public final class DocumentNode implements NodeContent {

    /** Attribute key for CSS class names. */
    public static final String CLASS = "class";

    private NodeTag tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<NodeContent> children = new ArrayList<>();
    private DocumentNode parent;

    public DocumentNode(NodeTag tag) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
    }

    /** Creates a node with the given children appended in order. */
    public static DocumentNode of(NodeTag tag, NodeContent... children) {
        DocumentNode node = new DocumentNode(tag);
        for (NodeContent child : children) {
            node.append(child);
        }
        return node;
    }

    /** Creates a node holding a single text run. */
    public static DocumentNode text(NodeTag tag, String text) {
        return new DocumentNode(tag).appendText(text);
    }

    /**
     * Creates an unexpanded raw-block placeholder with its three structural children: the delimiter
     * marker length, the directive line and the raw body.
     */
    public static DocumentNode placeholder(int markerLength, String directiveLine, String content) {
        return of(
                NodeTag.NOWIKI,
                new TextRun(Integer.toString(markerLength)),
                new TextRun(directiveLine),
                new TextRun(content));
    }

    public NodeTag tag() {
        return tag;
    }

    /**
     * Marks an emptied placeholder as expanded. The node keeps its identity, parent and attributes.
     *
     * @throws IllegalStateException if this node is not a placeholder or still has children
     */
    public DocumentNode markExpanded() {
        if (tag != NodeTag.NOWIKI) {
            throw new IllegalStateException("Only a <nowiki> placeholder can be marked expanded, not <" + tag + ">");
        }
        if (!children.isEmpty()) {
            throw new IllegalStateException("A placeholder must be emptied before it is marked expanded");
        }
        tag = NodeTag.NOWIKI_EXPANDED;
        return this;
    }

    /** Returns {@code true} if this node is an unexpanded raw block. */
    public boolean isPlaceholder() {
        return tag == NodeTag.NOWIKI;
    }

    /** Returns a read-only view of the attributes. */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * Sets an attribute, replacing any previous value.
     *
     * @return this node
     */
    public DocumentNode attribute(String key, String value) {
        Objects.requireNonNull(key, "attribute key must not be null");
        Objects.requireNonNull(value, "attribute value must not be null");
        attributes.put(key, value);
        return this;
    }

    /** Shorthand for {@code attribute(CLASS, cssClass)}. */
    public DocumentNode withClass(String cssClass) {
        return attribute(CLASS, cssClass);
    }

    /** Returns the CSS class attribute, or {@code null} if none is set. */
    public String cssClass() {
        return attributes.get(CLASS);
    }

    /** The owning node, or {@code null} for a root or detached node. */
    public DocumentNode parent() {
        return parent;
    }

    /** Returns a read-only view of the children. */
    public List<NodeContent> children() {
        return Collections.unmodifiableList(children);
    }

    /** Returns only the element children, in order. */
    public List<DocumentNode> childNodes() {
        List<DocumentNode> nodes = new ArrayList<>();
        for (NodeContent child : children) {
            if (child instanceof DocumentNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /**
     * Appends a child.
     *
     * @return this node
     * @throws IllegalArgumentException if the child is already owned by another node or is this node
     *     or one of its ancestors
     */
    public DocumentNode append(NodeContent child) {
        Objects.requireNonNull(child, "child must not be null");
        if (child instanceof DocumentNode node) {
            if (node.parent != null) {
                throw new IllegalArgumentException("Node <" + node.tag + "> already has a parent <" + node.parent.tag + ">");
            }
            for (DocumentNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
                if (ancestor == node) {
                    throw new IllegalArgumentException("Appending <" + node.tag + "> would create a cycle");
                }
            }
            node.parent = this;
        }
        children.add(child);
        return this;
    }

    /** Appends every child in order. */
    public DocumentNode appendAll(Collection<? extends NodeContent> newChildren) {
        for (NodeContent child : newChildren) {
            append(child);
        }
        return this;
    }

    /** Appends a text run, merging with a trailing text run if there is one. */
    public DocumentNode appendText(String text) {
        if (!children.isEmpty() && children.get(children.size() - 1) instanceof TextRun last) {
            children.set(children.size() - 1, new TextRun(last.text() + text));
        } else {
            children.add(new TextRun(text));
        }
        return this;
    }

    /**
     * Detaches and returns all children. Detached nodes may be appended elsewhere.
     *
     * @return the former children, in order
     */
    public List<NodeContent> removeAll() {
        List<NodeContent> removed = new ArrayList<>(children);
        for (NodeContent child : removed) {
            if (child instanceof DocumentNode node) {
                node.parent = null;
            }
        }
        children.clear();
        return removed;
    }

    @Override
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        for (NodeContent child : children) {
            sb.append(child.textContent());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "<" + tag + (attributes.isEmpty() ? "" : " " + attributes) + "> (" + children.size() + " children)";
    }
}
