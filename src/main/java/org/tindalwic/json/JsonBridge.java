package org.tindalwic.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tindalwic.model.Association;
import org.tindalwic.model.Document;
import org.tindalwic.model.Entries;
import org.tindalwic.model.Entry;
import org.tindalwic.model.Node;
import org.tindalwic.model.Sequence;
import org.tindalwic.model.Text;

import java.util.Iterator;
import java.util.Map;

/**
 * Conversions between Tindalwic trees and JSON or plain Java data.
 * <p>
 * Text maps to a JSON string, Sequence to an array and Association to an object, in
 * order. Comments have no JSON counterpart and are dropped. In the other direction every
 * scalar becomes Text through {@link JsonNode#asText()}, with {@code null} read as the
 * empty string.
 * <p>
 * Plain data means {@code String}, {@code List} and {@code Map} (insertion ordered).
 * Stateless; safe for concurrent use.
 */
public final class JsonBridge {

    private static final ObjectMapper MAPPER;
    static {
        MAPPER = new ObjectMapper();
        MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private JsonBridge() {
    }

    /* -------------------------- Tindalwic to JSON -------------------------- */

    public static ObjectNode toJson(Document document) {
        return object(document.entries());
    }

    public static JsonNode toJson(Node node) {
        switch (node.kind()) {
            case TEXT:
                return FACTORY.textNode(node.asText().getValue());
            case SEQUENCE:
                ArrayNode array = FACTORY.arrayNode();
                for (Node item : node.asSequence()) {
                    array.add(toJson(item));
                }
                return array;
            default:
                return object(node.asAssociation().entries());
        }
    }

    public static String toJsonString(Document document) {
        try {
            return MAPPER.writeValueAsString(toJson(document));
        } catch (JsonProcessingException e) {
            // a tree of strings, arrays and objects always serializes
            throw new IllegalStateException("failed to write JSON", e);
        }
    }

    public static Map<String, Object> toPlain(Document document) {
        return MAPPER.convertValue(toJson(document), new TypeReference<Map<String, Object>>() {
        });
    }

    /* -------------------------- JSON to Tindalwic -------------------------- */

    /**
     * @throws IllegalArgumentException if {@code json} is not an object
     */
    public static Document fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("a document needs a JSON object at the root, got "
                    + (json == null ? "nothing" : json.getNodeType()));
        }
        Document document = new Document();
        fill(document.entries(), json);
        return document;
    }

    public static Document fromJsonString(String json) throws JsonProcessingException {
        return fromJson(MAPPER.readTree(json));
    }

    public static Document fromPlain(Map<String, ?> data) {
        return fromJson(MAPPER.valueToTree(data));
    }

    public static Node toNode(JsonNode json) {
        if (json.isArray()) {
            Sequence sequence = new Sequence();
            for (JsonNode item : json) {
                sequence.add(toNode(item));
            }
            return sequence;
        }
        if (json.isObject()) {
            Association association = new Association();
            fill(association.entries(), json);
            return association;
        }
        return Text.of(json.isNull() ? "" : json.asText());
    }

    /* -------------------------- Internal helpers -------------------------- */

    private static ObjectNode object(Entries entries) {
        ObjectNode object = FACTORY.objectNode();
        for (Entry entry : entries) {
            object.set(entry.getKey(), toJson(entry.getValue()));
        }
        return object;
    }

    private static void fill(Entries entries, JsonNode object) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.add(field.getKey(), toNode(field.getValue()));
        }
    }
}
