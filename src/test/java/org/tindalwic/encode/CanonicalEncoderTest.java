package org.tindalwic.encode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tindalwic.error.EncodingException;
import org.tindalwic.model.Association;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Document;
import org.tindalwic.model.Sequence;
import org.tindalwic.model.Text;
import org.tindalwic.parse.TindalwicParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CanonicalEncoderTest {

    @Mock
    private Appendable sink;

    private static Document reparse(String encoded) {
        return TindalwicParser.parse(encoded.getBytes(StandardCharsets.UTF_8));
    }

    // ==================== Form selection ====================

    @Test
    @DisplayName("Scenario D: empty string uses the bracketed empty form")
    void testEmptyValue() {
        String encoded = CanonicalEncoder.encode(new Document().with("k", ""));
        assertEquals("<k>\n", encoded);
        assertFalse(encoded.contains("="));
        assertEquals("", reparse(encoded).get("k").asText().getValue());
    }

    @Test
    @DisplayName("Values that force the long form")
    void testLongFormValues() {
        Document document = new Document()
                .with("multi", "line one\nline two")
                .with("hash", "#not a comment")
                .with("slash", "/root")
                .with("space", " leading")
                .with("tab", "\tleading")
                .with("short", "plain = fine");

        assertEquals(
                "<multi>\n\tline one\n\tline two\n" +
                "<hash>\n\t#not a comment\n" +
                "<slash>\n\t/root\n" +
                "<space>\n\t leading\n" +
                "<tab>\n\t\tleading\n" +
                "short=plain = fine\n",
                CanonicalEncoder.encode(document));
    }

    @Test
    @DisplayName("Keys that force the long form")
    void testLongFormKeys() {
        Document document = new Document()
                .with("a=b", "v")
                .with("trailing ", "v")
                .with("{brace", "v")
                .with(" lead", "v")
                .with("", "anonymous");

        assertEquals(
                "<a=b>\n\tv\n" +
                "<trailing >\n\tv\n" +
                "<{brace>\n\tv\n" +
                "< lead>\n\tv\n" +
                "=anonymous\n",
                CanonicalEncoder.encode(document));
    }

    @Test
    @DisplayName("Linear array items and nested empty arrays")
    void testSequenceItems() {
        Document document = new Document()
                .with("s", Sequence.of("plain", "", "#x", "a=b"))
                .with("nest", new Sequence(new Sequence(), new Association()));

        assertEquals(
                "[s]\n\tplain\n\t<>\n\t<>\n\t\t#x\n\ta=b\n" +
                "[nest]\n\t[]\n\t{}\n",
                CanonicalEncoder.encode(document));
    }

    @Test
    @DisplayName("Empty document encodes to nothing")
    void testEmptyDocument() {
        assertEquals("", CanonicalEncoder.encode(new Document()));
        assertArrayEquals(new byte[0], CanonicalEncoder.encodeBytes(new Document()));
    }

    // ==================== Comments ====================

    @Test
    @DisplayName("Comments in every position, multi-line ones indented once")
    void testComments() {
        Document document = new Document();
        document.setHashbang(new Comment("/usr/bin/env tool"));
        document.setIntroComment(new Comment("# Title\n\nbody"));

        Association server = new Association().with("host", Text.of("example.com").withTrailingComment("primary"));
        server.setIntroComment(new Comment("server block"));
        server.setClosingComment(new Comment("end server"));
        document.with("server", server);
        document.entries().getEntry("server").withKeyComment("where to connect").setBlankBeforeComment(true);

        assertEquals(
                "#!/usr/bin/env tool\n" +
                "## Title\n" +
                "\t\n" +
                "\tbody\n" +
                "\n" +
                "//where to connect\n" +
                "{server}\n" +
                "\t#server block\n" +
                "\thost=example.com\n" +
                "\t#primary\n" +
                "#end server\n",
                CanonicalEncoder.encode(document));
    }

    @Test
    @DisplayName("Introductory comment starting with '!' needs a hashbang before it")
    void testAmbiguousIntro() {
        Document document = new Document().with("k", "v");
        document.setIntroComment(new Comment("!important"));
        assertThrows(EncodingException.class, () -> CanonicalEncoder.encode(document));

        document.setHashbang(new Comment("/bin/tool"));
        assertEquals("#!/bin/tool\n#!important\nk=v\n", CanonicalEncoder.encode(document));
    }

    // ==================== Round trip ====================

    @Test
    @DisplayName("encode(parse(encode(d))) == encode(d), and the tree comes back equal")
    void testIdempotence() {
        Document document = new Document().with("title", "Hop On Pop");
        document.setIntroComment(new Comment("intro"));
        Sequence days = Sequence.of("Saturday", "", "multi\nline");
        days.setIntroComment(new Comment("days off"));
        days.setClosingComment(new Comment("that's all"));
        document.with("days", days);
        document.with("nested", new Association()
                .with("deeper", new Sequence(new Association().with("k", Text.of("v").withTrailingComment("after v"))))
                .with("=odd key", "#odd value"));
        document.entries().getEntry("nested").withKeyComment("k\ncomment").setBlankBeforeComment(true);

        String first = CanonicalEncoder.encode(document);
        Document parsed = reparse(first);

        assertEquals(document, parsed);
        assertEquals(first, CanonicalEncoder.encode(parsed));
    }

    @Test
    @DisplayName("Non-canonical spelling is normalized once, then stable")
    void testNormalization() {
        Document parsed = reparse("{book}\n\ttitle = Hop On Pop\n\tempty=\n");
        String canonical = CanonicalEncoder.encode(parsed);

        assertEquals("{book}\n\ttitle=Hop On Pop\n\t<empty>\n", canonical);
        assertEquals(canonical, CanonicalEncoder.encode(reparse(canonical)));
    }

    @Test
    @DisplayName("Spaces after '=' are layout; a value that keeps them takes the long form")
    void testSpaceAfterEquals() {
        assertEquals("v", reparse("k= v\n").get("k").asText().getValue());

        Document document = new Document().with("k", " v").with("t", "\tv");
        String encoded = CanonicalEncoder.encode(document);

        assertEquals("<k>\n\t v\n<t>\n\t\tv\n", encoded);
        assertEquals(" v", reparse(encoded).get("k").asText().getValue());
        assertEquals("\tv", reparse(encoded).get("t").asText().getValue());
        assertEquals(encoded, CanonicalEncoder.encode(reparse(encoded)));
    }

    // ==================== Output sinks ====================

    @Test
    @DisplayName("Appendable failures propagate")
    void testSinkFailure() throws IOException {
        when(sink.append(any(CharSequence.class))).thenThrow(new IOException("disk full"));

        IOException e = assertThrows(IOException.class,
                () -> CanonicalEncoder.encode(new Document().with("k", "v"), sink));
        assertEquals("disk full", e.getMessage());
    }

    @Test
    @DisplayName("Streaming and byte output agree with the string output")
    void testSinks() throws IOException {
        Document document = new Document().with("greeting", "grüß dich").with("list", Sequence.of("a"));
        StringBuilder out = new StringBuilder();
        CanonicalEncoder.encode(document, out);

        assertEquals(CanonicalEncoder.encode(document), out.toString());
        assertArrayEquals(out.toString().getBytes(StandardCharsets.UTF_8), CanonicalEncoder.encodeBytes(document));
    }

    @Test
    @DisplayName("Unpaired surrogate cannot be written as UTF-8")
    void testUnpairedSurrogate() {
        Document document = new Document().with("broken", "\uD800");
        assertThrows(EncodingException.class, () -> CanonicalEncoder.encodeBytes(document));
    }
}
