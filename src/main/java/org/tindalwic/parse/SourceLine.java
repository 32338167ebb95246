package org.tindalwic.parse;

import org.tindalwic.error.EncodingException;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * One physical line of input: its 1-based number, the byte offset of its first byte and
 * its decoded text without the terminating {@code '\n'}.
 */
public final class SourceLine {

    private final int number;
    private final long offset;
    private final String text;
    private final int tabs;

    public SourceLine(int number, long offset, String text) {
        this.number = number;
        this.offset = offset;
        this.text = text;
        int count = 0;
        while (count < text.length() && text.charAt(count) == '\t') {
            count++;
        }
        this.tabs = count;
    }

    /**
     * Splits a UTF-8 buffer at {@code '\n'} bytes, starting at {@code start}. A final
     * {@code '\n'} terminates the last line; it does not open an empty one.
     *
     * @throws EncodingException at the first byte that is not valid UTF-8
     */
    public static List<SourceLine> split(byte[] bytes, int start) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        List<SourceLine> lines = new ArrayList<>();
        int number = 1;
        int from = start;
        while (from < bytes.length) {
            int end = from;
            while (end < bytes.length && bytes[end] != '\n') {
                end++;
            }
            lines.add(new SourceLine(number, from, decode(decoder, bytes, from, end, number)));
            number++;
            from = end + 1;
        }
        return lines;
    }

    private static String decode(CharsetDecoder decoder, byte[] bytes, int from, int end, int number) {
        ByteBuffer in = ByteBuffer.wrap(bytes, from, end - from);
        CharBuffer out = CharBuffer.allocate(end - from);
        decoder.reset();
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            throw new EncodingException("invalid UTF-8", number, in.position());
        }
        out.flip();
        return out.toString();
    }

    public int number() {
        return number;
    }

    /** Byte offset of the first byte of this line within the input. */
    public long offset() {
        return offset;
    }

    public String text() {
        return text;
    }

    /** Count of leading tab characters. */
    public int tabs() {
        return tabs;
    }

    /** Byte offset within the input of the character at {@code index} of this line. */
    public long offsetOf(int index) {
        long bytes = 0;
        int limit = Math.min(index, text.length());
        for (int i = 0; i < limit; i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c)) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return offset + bytes;
    }

    @Override
    public String toString() {
        return "#" + number + ": " + text;
    }
}
