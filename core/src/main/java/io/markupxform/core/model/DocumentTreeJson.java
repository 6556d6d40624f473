package io.markupxform.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic JSON form of a document tree.
 *
 * <p>A node becomes {@code {"tag": ..., "attributes": {...}, "children": [...]}} with attributes
 * sorted by key; a text run becomes a JSON string. Two trees are structurally equal if and only if
 * their serialized forms are equal.
 */
public final class DocumentTreeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DocumentTreeJson() {
        // utility class
    }

    /** Converts a tree into a Jackson {@link JsonNode}. */
    public static JsonNode toJson(DocumentNode root) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("tag", root.tag().localName());
        ObjectNode attrs = json.putObject("attributes");
        new TreeMap<>(root.attributes()).forEach(attrs::put);
        ArrayNode children = json.putArray("children");
        for (NodeContent child : root.children()) {
            if (child instanceof TextRun run) {
                children.add(run.text());
            } else {
                children.add(toJson((DocumentNode) child));
            }
        }
        return json;
    }

    /** Serializes a tree to a compact JSON string. */
    public static String write(DocumentNode root) {
        try {
            return MAPPER.writeValueAsString(toJson(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document tree", e);
        }
    }

    /**
     * Parses a tree from its JSON string form.
     *
     * @throws IllegalArgumentException if the JSON is malformed or uses an unknown tag
     */
    public static DocumentNode read(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse document tree JSON", e);
        }
    }

    /** Builds a tree from a Jackson {@link JsonNode} in the form produced by {@link #toJson}. */
    public static DocumentNode fromJson(JsonNode json) {
        if (!json.isObject() || !json.hasNonNull("tag")) {
            throw new IllegalArgumentException("Document node must be an object with a 'tag' field: " + json);
        }
        DocumentNode node = new DocumentNode(NodeTag.fromLocalName(json.get("tag").asText()));
        Iterator<Map.Entry<String, JsonNode>> attrs = json.path("attributes").fields();
        while (attrs.hasNext()) {
            Map.Entry<String, JsonNode> attr = attrs.next();
            node.attribute(attr.getKey(), attr.getValue().asText());
        }
        for (JsonNode child : json.path("children")) {
            if (child.isTextual()) {
                node.append(new TextRun(child.asText()));
            } else {
                node.append(fromJson(child));
            }
        }
        return node;
    }
}
