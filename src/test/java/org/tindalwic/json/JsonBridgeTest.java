package org.tindalwic.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tindalwic.Tindalwic;
import org.tindalwic.model.Association;
import org.tindalwic.model.Document;
import org.tindalwic.model.Sequence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonBridgeTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Document to JSON drops comments and keeps order")
    void testToJson() throws Exception {
        Document document = Tindalwic.parse(
                "#intro\n" +
                "{book}\n" +
                "\ttitle=Hop On Pop\n" +
                "\t#a classic\n" +
                "\t<author>\n" +
                "\t\tDr.\n" +
                "\t\tSeuss\n" +
                "[weekend]\n" +
                "\tSaturday\n" +
                "\tSunday\n");

        ObjectNode json = JsonBridge.toJson(document);

        assertEquals(MAPPER.readTree(
                "{\"book\":{\"title\":\"Hop On Pop\",\"author\":\"Dr.\\nSeuss\"},\"weekend\":[\"Saturday\",\"Sunday\"]}"),
                json);
        List<String> names = new ArrayList<>();
        json.fieldNames().forEachRemaining(names::add);
        assertEquals(List.of("book", "weekend"), names);
        assertTrue(JsonBridge.toJsonString(document).contains("\"title\" : \"Hop On Pop\""));
    }

    @Test
    @DisplayName("JSON scalars become text")
    void testFromJson() throws Exception {
        Document document = JsonBridge.fromJson(MAPPER.readTree(
                "{\"n\": 42, \"b\": true, \"z\": null, \"s\": \"x\", \"list\": [1, {\"k\": \"v\"}, []]}"));

        assertEquals("42", document.get("n").asText().getValue());
        assertEquals("true", document.get("b").asText().getValue());
        assertEquals("", document.get("z").asText().getValue());
        assertEquals("x", document.get("s").asText().getValue());

        Sequence list = document.get("list").asSequence();
        assertEquals("1", list.get(0).asText().getValue());
        assertEquals("v", list.get(1).asAssociation().get("k").asText().getValue());
        assertTrue(list.get(2).asSequence().isEmpty());

        assertEquals(
                "n=42\nb=true\n<z>\ns=x\n[list]\n\t1\n\t{}\n\t\tk=v\n\t[]\n",
                Tindalwic.encode(document));
    }

    @Test
    @DisplayName("Only a JSON object can be a document")
    void testNonObjectRoot() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> JsonBridge.fromJson(MAPPER.readTree("[1,2]")));
        assertThrows(IllegalArgumentException.class, () -> JsonBridge.fromJson(MAPPER.readTree("\"text\"")));
        assertThrows(IllegalArgumentException.class, () -> JsonBridge.fromJson(null));
    }

    @Test
    @DisplayName("Plain maps and lists both ways")
    void testPlain() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "demo");
        data.put("tags", List.of("a", "b"));
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("depth", "2");
        data.put("nested", nested);

        Document document = JsonBridge.fromPlain(data);
        assertEquals(new Association().with("depth", "2"), document.get("nested"));
        assertEquals(Sequence.of("a", "b"), document.get("tags"));

        assertEquals(data, JsonBridge.toPlain(document));
    }

    @Test
    @DisplayName("JSON text survives a trip through the Tindalwic encoding")
    void testThroughEncoding() throws Exception {
        String json = "{\"empty\":\"\",\"hash\":\"#x\",\"lines\":\"a\\nb\",\"list\":[\"\",\" pad\"]}";
        Document document = JsonBridge.fromJsonString(json);
        Document reparsed = Tindalwic.parse(Tindalwic.encode(document));
        assertEquals(MAPPER.readTree(json), JsonBridge.toJson(reparsed));
    }
}
