package org.tindalwic.parse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tindalwic.error.IndentationException;
import org.tindalwic.error.RequiresLongFormException;
import org.tindalwic.error.UnterminatedContextException;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    private static ClassifiedLine classify(String text, int depth) {
        return LineClassifier.classify(new SourceLine(2, 0, text), depth);
    }

    @Test
    @DisplayName("Marker bytes decide the kind")
    void testMarkers() {
        assertEquals(LineKind.COMMENT, classify("#note", 0).kind());
        assertEquals(LineKind.KEY_COMMENT, classify("//about", 0).kind());
        assertEquals(LineKind.TEXT_OPEN, classify("<story>", 0).kind());
        assertEquals(LineKind.SEQUENCE_OPEN, classify("[days]", 0).kind());
        assertEquals(LineKind.ASSOCIATION_OPEN, classify("{book}", 0).kind());
        assertEquals(LineKind.KEY_VALUE, classify("a=b", 0).kind());
        assertEquals(LineKind.PLAIN, classify("Saturday", 0).kind());
        assertEquals(LineKind.BLANK, classify("", 0).kind());
    }

    @Test
    @DisplayName("Comment text follows the marker verbatim")
    void testCommentText() {
        assertEquals(" spaced", classify("# spaced", 0).text());
        assertEquals("about", classify("//about", 0).text());
        assertEquals("", classify("#", 0).text());
    }

    @Test
    @DisplayName("Hashbang only on the first line at depth zero")
    void testHashbang() {
        ClassifiedLine first = LineClassifier.classify(new SourceLine(1, 0, "#!/usr/bin/env tool"), 0);
        assertEquals(LineKind.HASHBANG, first.kind());
        assertEquals("/usr/bin/env tool", first.text());

        ClassifiedLine later = classify("#!not a hashbang", 0);
        assertEquals(LineKind.COMMENT, later.kind());
        assertEquals("!not a hashbang", later.text());
    }

    @Test
    @DisplayName("Opener key is the bracketed text")
    void testOpenerKeys() {
        assertEquals("story", classify("\t<story>", 1).key());
        assertEquals("", classify("[]", 0).key());
        assertEquals("a=b", classify("{a=b}", 0).key());
        assertEquals("x>y", classify("<x>y>", 0).key());
    }

    @Test
    @DisplayName("Spaces around the first '=' are trimmed")
    void testKeyValueTrim() {
        ClassifiedLine line = classify("\ttitle = Hop On Pop", 1);
        assertEquals("title", line.key());
        assertEquals("Hop On Pop", line.text());
        assertEquals(9, line.textIndex());
        assertEquals("title = Hop On Pop", line.content());

        ClassifiedLine empty = classify("=", 0);
        assertEquals("", empty.key());
        assertEquals("", empty.text());

        ClassifiedLine second = classify("a=b=c", 0);
        assertEquals("a", second.key());
        assertEquals("b=c", second.text());
    }

    @Test
    @DisplayName("Too many tabs or any space in the indentation")
    void testIndentationErrors() {
        IndentationException deep = assertThrows(IndentationException.class, () -> classify("\t\tx=y", 1));
        assertEquals(2, deep.getLine());
        assertThrows(IndentationException.class, () -> classify(" x=y", 0));
        assertThrows(IndentationException.class, () -> classify("\t x=y", 1));
    }

    @Test
    @DisplayName("Whitespace-only remainder is blank")
    void testWhitespaceOnlyIsBlank() {
        assertEquals(LineKind.BLANK, classify("\t  ", 1).kind());
    }

    @Test
    @DisplayName("Single slash and unterminated openers")
    void testStructuralErrors() {
        assertThrows(RequiresLongFormException.class, () -> classify("/path", 0));
        assertThrows(UnterminatedContextException.class, () -> classify("<story", 0));
        assertThrows(UnterminatedContextException.class, () -> classify("[days", 0));
        assertThrows(UnterminatedContextException.class, () -> classify("{", 0));
        assertThrows(UnterminatedContextException.class, () -> classify("{book]", 0));
    }

    @Test
    @DisplayName("Lines split at LF with byte offsets; a final LF adds no line")
    void testSplit() {
        byte[] bytes = "a=1\nü=2\n".getBytes(StandardCharsets.UTF_8);
        List<SourceLine> lines = SourceLine.split(bytes, 0);

        assertEquals(2, lines.size());
        assertEquals("ü=2", lines.get(1).text());
        assertEquals(4, lines.get(1).offset());
        assertEquals(6, lines.get(1).offsetOf(1));

        assertEquals(3, SourceLine.split("a\n\nb".getBytes(StandardCharsets.UTF_8), 0).size());
        assertTrue(SourceLine.split(new byte[0], 0).isEmpty());
    }
}
