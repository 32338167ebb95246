package org.tindalwic.yaml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tindalwic.Tindalwic;
import org.tindalwic.encode.RandomDocuments;
import org.tindalwic.error.EncodingException;
import org.tindalwic.json.JsonBridge;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Document;
import org.tindalwic.model.Sequence;

import static org.junit.jupiter.api.Assertions.*;

class YamlBridgeTest {

    private static final String BOOK =
            "#!/usr/bin/env tool\n" +
            "#intro\n" +
            "{book}\n" +
            "\t#about book\n" +
            "\ttitle=Hop On Pop\n" +
            "\t#trailing\n" +
            "\t\n" +
            "\t//author comment\n" +
            "\t<author>\n" +
            "\t\tDr.\n" +
            "\t\tSeuss\n" +
            "[weekend]\n" +
            "\tSaturday\n" +
            "\tSunday\n" +
            "#closing weekend\n";

    @Test
    @DisplayName("Every comment position is written as a tagged YAML comment")
    void testCommentsKept() throws Exception {
        Document document = Tindalwic.parse(BOOK);

        String yaml = YamlBridge.toYaml(document);

        assertEquals(
                "---\n" +
                "#!/usr/bin/env tool\n" +
                "#i:intro\n" +
                "\"book\":\n" +
                " #i:about book\n" +
                " \"title\": |2-\n" +
                "   Hop On Pop\n" +
                " #a:trailing\n" +
                " #b\n" +
                " #k:author comment\n" +
                " \"author\": |2-\n" +
                "   Dr.\n" +
                "   Seuss\n" +
                "\"weekend\":\n" +
                " - |2-\n" +
                "   Saturday\n" +
                " - |2-\n" +
                "   Sunday\n" +
                "#a:closing weekend\n" +
                "...\n",
                yaml);
        assertEquals(JsonBridge.toJson(document), JsonBridge.toJson(YamlBridge.fromYaml(yaml)));
    }

    @Test
    @DisplayName("Line breaks, empty values, odd keys and control characters read back from YAML")
    void testTextShapes() throws Exception {
        Sequence empty = new Sequence();
        empty.setIntroComment(new Comment("nothing here"));
        Document document = new Document()
                .with("empty", "")
                .with("newline", "a\n")
                .with("only", "\n")
                .with("spaced", " lead\ttab ")
                .with("quote\"key\t", "v")
                .with("bell", "ding\u0007")
                .with("list", empty);

        String yaml = YamlBridge.toYaml(document);

        assertTrue(yaml.contains("\"empty\": |2-\n\"newline\": |2+\n  a\n"));
        assertTrue(yaml.contains("\"quote\\\"key\\t\": |2-\n"));
        assertTrue(yaml.contains("\"bell\": \"ding\\u0007\"\n"));
        assertTrue(yaml.contains("\"list\": []\n #i:nothing here\n"));
        assertEquals(JsonBridge.toJson(document), JsonBridge.toJson(YamlBridge.fromYaml(yaml)));
    }

    @Test
    @DisplayName("Keys too long for a simple YAML key use the explicit form")
    void testLongKey() throws Exception {
        String key = "k".repeat(1500);
        Document document = new Document().with(key, "v");

        String yaml = YamlBridge.toYaml(document);

        assertTrue(yaml.contains("? \"" + key + "\"\n: |2-\n  v\n"));
        assertEquals("v", YamlBridge.fromYaml(yaml).get(key).asText().getValue());
    }

    @Test
    @DisplayName("Comment lines YAML cannot carry are refused")
    void testUnwritableComment() {
        Document document = new Document().with("k", "v");
        document.setIntroComment(new Comment("carriage\rreturn"));

        assertThrows(EncodingException.class, () -> YamlBridge.toYaml(document));
    }

    @Test
    @DisplayName("Random documents translate to YAML with the same data")
    void testRandomTranslate() throws Exception {
        RandomDocuments documents = new RandomDocuments(31337L, true);
        for (int i = 0; i < 200; i++) {
            Document document = documents.next();
            String yaml = YamlBridge.toYaml(document);

            assertEquals(JsonBridge.toJson(document), JsonBridge.toJson(YamlBridge.fromYaml(yaml)),
                    "document #" + i + ":\n" + yaml);
        }
    }

    @Test
    @DisplayName("Plain YAML through Jackson drops comments and reads back")
    void testPlainYaml() throws Exception {
        Document document = Tindalwic.parse(BOOK);

        String yaml = YamlBridge.toPlainYaml(document);

        assertFalse(yaml.contains("intro"));
        assertEquals(JsonBridge.toJson(document), JsonBridge.toJson(YamlBridge.fromYaml(yaml)));
    }

    @Test
    @DisplayName("YAML input needs a mapping at the top")
    void testFromYaml() throws Exception {
        Document document = YamlBridge.fromYaml("name: demo\ncount: 3\nitems:\n  - a\n  - {k: v}\n");

        assertEquals("demo", document.get("name").asText().getValue());
        assertEquals("3", document.get("count").asText().getValue());
        Sequence items = document.get("items").asSequence();
        assertEquals(2, items.size());
        assertEquals("a", items.get(0).asText().getValue());
        assertEquals("v", items.get(1).asAssociation().get("k").asText().getValue());

        assertThrows(IllegalArgumentException.class, () -> YamlBridge.fromYaml("- a\n- b\n"));
    }
}
