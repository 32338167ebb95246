package org.tindalwic.encode;

import org.tindalwic.error.EncodingException;
import org.tindalwic.model.Association;
import org.tindalwic.model.CollectionNode;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Document;
import org.tindalwic.model.Entries;
import org.tindalwic.model.Entry;
import org.tindalwic.model.Node;
import org.tindalwic.model.Sequence;
import org.tindalwic.model.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Renders a {@link Document} in its one canonical textual form.
 * <p>
 * Output is one line per scalar, array opener and comment line, indented with tabs, each
 * terminated by {@code '\n'}. The short form is used exactly when {@link Forms} allows it,
 * so the spelling of the source a tree was parsed from never survives; re-encoding a parsed
 * canonical text reproduces it byte for byte.
 * <p>
 * Stateless; safe for concurrent use on distinct documents.
 */
public final class CanonicalEncoder {

    private static final Logger logger = LoggerFactory.getLogger(CanonicalEncoder.class);

    private CanonicalEncoder() {
    }

    public static String encode(Document document) {
        StringBuilder out = new StringBuilder();
        try {
            encode(document, out);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        logger.debug("Encoded {} top-level entries into {} chars", document.size(), out.length());
        return out.toString();
    }

    /**
     * @throws EncodingException if text cannot be represented in UTF-8
     */
    public static byte[] encodeBytes(Document document) {
        return toUtf8(encode(document));
    }

    /**
     * Strict UTF-8 encoding of {@code text}.
     *
     * @throws EncodingException on an unpaired surrogate
     */
    public static byte[] toUtf8(String text) {
        try {
            ByteBuffer buffer = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
            return Arrays.copyOfRange(buffer.array(), buffer.position(), buffer.limit());
        } catch (CharacterCodingException e) {
            throw new EncodingException("text is not valid Unicode", 0, -1, e);
        }
    }

    /**
     * Streams the encoding into {@code out}; failures of the sink propagate unchanged.
     */
    public static void encode(Document document, Appendable out) throws IOException {
        new Writer(out).document(document);
    }

    // ==================== Internal Classes ====================

    private static final class Writer {

        private final Appendable out;

        Writer(Appendable out) {
            this.out = out;
        }

        void document(Document document) throws IOException {
            Comment hashbang = document.getHashbang();
            Comment intro = document.getIntroComment();
            if (hashbang == null && intro != null && intro.getText().startsWith("!")) {
                throw new EncodingException("document comment starting with '!' would read back as a hashbang");
            }
            comment(0, hashbang);
            comment(0, intro);
            entries(0, document.entries());
        }

        private void entries(int depth, Entries entries) throws IOException {
            for (Entry entry : entries) {
                if (entry.isBlankBeforeComment()) {
                    line(depth, "");
                }
                comment(depth, entry.getKeyComment());
                value(depth, entry.getKey(), entry.getValue());
            }
        }

        /** {@code key} is {@code null} for linear array items. */
        private void value(int depth, String key, Node node) throws IOException {
            switch (node.kind()) {
                case TEXT:
                    text(depth, key, node.asText());
                    break;
                case SEQUENCE:
                    Sequence sequence = node.asSequence();
                    line(depth, "[" + nullToEmpty(key) + "]");
                    comment(depth + 1, sequence.getIntroComment());
                    for (Node item : sequence) {
                        value(depth + 1, null, item);
                    }
                    closing(depth, sequence);
                    break;
                case ASSOCIATION:
                    Association association = node.asAssociation();
                    line(depth, "{" + nullToEmpty(key) + "}");
                    comment(depth + 1, association.getIntroComment());
                    entries(depth + 1, association.entries());
                    closing(depth, association);
                    break;
                default:
                    throw new IllegalStateException("unknown node kind " + node.kind());
            }
        }

        private void text(int depth, String key, Text text) throws IOException {
            String value = text.getValue();
            boolean shortForm = !Forms.valueNeedsLongForm(value) && (key == null || !Forms.keyNeedsLongForm(key));
            if (shortForm) {
                line(depth, key == null ? value : key + "=" + value);
            } else {
                line(depth, "<" + nullToEmpty(key) + ">");
                for (String content : text.lines()) {
                    line(depth + 1, content);
                }
            }
            comment(depth, text.getTrailingComment());
        }

        private void closing(int depth, CollectionNode collection) throws IOException {
            comment(depth, collection.getClosingComment());
        }

        private void comment(int depth, Comment comment) throws IOException {
            if (comment == null) {
                return;
            }
            List<String> lines = comment.lines();
            line(depth, comment.getPosition().marker() + lines.get(0));
            for (int i = 1; i < lines.size(); i++) {
                line(depth + 1, lines.get(i));
            }
        }

        private void line(int depth, String content) throws IOException {
            for (int i = 0; i < depth; i++) {
                out.append('\t');
            }
            out.append(content).append('\n');
        }

        private static String nullToEmpty(String key) {
            return key == null ? "" : key;
        }
    }
}
