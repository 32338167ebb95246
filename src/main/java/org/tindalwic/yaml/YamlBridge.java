package org.tindalwic.yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.tindalwic.error.EncodingException;
import org.tindalwic.json.JsonBridge;
import org.tindalwic.model.Association;
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
import java.util.List;

/**
 * YAML output for Tindalwic trees, and YAML input through the JSON data model.
 * <p>
 * {@link #toYaml(Document)} keeps every comment. Each comment line becomes a YAML
 * {@code #} comment tagged with where it was bound:
 * <ul>
 *   <li>{@code #!} hashbang</li>
 *   <li>{@code #i:} introducing a collection or the document</li>
 *   <li>{@code #a:} after a value (trailing or closing)</li>
 *   <li>{@code #k:} before a key</li>
 *   <li>{@code #b} the blank line before a key comment</li>
 * </ul>
 * Keys are always double quoted and text is written as literal block scalars with an
 * explicit indentation indicator, so no content is ever taken for YAML syntax. The output
 * favours simplicity over looks; a YAML round trip through a comment-preserving tool can
 * tidy it up.
 * <p>
 * {@link #toPlainYaml(Document)} and {@link #fromYaml(String)} go through Jackson and
 * {@link JsonBridge}, so they drop comments. Stateless; safe for concurrent use.
 */
public final class YamlBridge {

    private static final Logger logger = LoggerFactory.getLogger(YamlBridge.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .build());

    private YamlBridge() {
    }

    // ==================== Comment-preserving output ====================

    /**
     * @throws EncodingException if a comment line holds a character YAML comments cannot carry
     */
    public static String toYaml(Document document) {
        StringBuilder out = new StringBuilder();
        try {
            toYaml(document, out);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        logger.debug("Wrote {} top-level entries as {} chars of YAML", document.size(), out.length());
        return out.toString();
    }

    public static void toYaml(Document document, Appendable out) throws IOException {
        new Writer(out).document(document);
    }

    // ==================== Through the JSON data model ====================

    public static String toPlainYaml(Document document) {
        try {
            return YAML_MAPPER.writeValueAsString(JsonBridge.toJson(document));
        } catch (JsonProcessingException e) {
            // a tree of strings, arrays and objects always serializes
            throw new IllegalStateException("failed to write YAML", e);
        }
    }

    /**
     * Reads a YAML mapping into a comment-free document; scalars become text.
     *
     * @throws JsonProcessingException  if the input is not YAML
     * @throws IllegalArgumentException if the top level is not a mapping
     */
    public static Document fromYaml(String yaml) throws JsonProcessingException {
        return JsonBridge.fromJson(YAML_MAPPER.readTree(yaml));
    }

    // ==================== Internal Classes ====================

    private static final class Writer {

        private static final String STEP = " ";
        private static final String BLOCK = "  ";
        // YAML caps implicit keys at 1024 characters
        private static final int SIMPLE_KEY_LIMIT = 1000;

        private final Appendable out;

        Writer(Appendable out) {
            this.out = out;
        }

        void document(Document document) throws IOException {
            out.append("---\n");
            comment("", "!", document.getHashbang());
            comment("", "i:", document.getIntroComment());
            if (document.isEmpty()) {
                line("", "{}");
            } else {
                entries("", document.entries());
            }
            out.append("...\n");
        }

        private void entries(String indent, Entries entries) throws IOException {
            for (Entry entry : entries) {
                if (entry.isBlankBeforeComment()) {
                    line(indent, "#b");
                }
                comment(indent, "k:", entry.getKeyComment());
                value(indent, key(indent, entry.getKey()), entry.getValue());
            }
        }

        private String key(String indent, String key) throws IOException {
            String quoted = quote(key);
            if (quoted.length() <= SIMPLE_KEY_LIMIT) {
                return quoted + ":";
            }
            line(indent, "? " + quoted);
            return ":";
        }

        /** {@code lead} is a quoted key and colon, or the dash of a sequence item. */
        private void value(String indent, String lead, Node node) throws IOException {
            switch (node.kind()) {
                case TEXT:
                    Text text = node.asText();
                    text(indent, lead, text);
                    comment(indent, "a:", text.getTrailingComment());
                    break;
                case SEQUENCE:
                    Sequence sequence = node.asSequence();
                    line(indent, sequence.isEmpty() ? lead + " []" : lead);
                    comment(indent + STEP, "i:", sequence.getIntroComment());
                    for (Node item : sequence) {
                        value(indent + STEP, "-", item);
                    }
                    comment(indent, "a:", sequence.getClosingComment());
                    break;
                case ASSOCIATION:
                    Association association = node.asAssociation();
                    line(indent, association.isEmpty() ? lead + " {}" : lead);
                    comment(indent + STEP, "i:", association.getIntroComment());
                    entries(indent + STEP, association.entries());
                    comment(indent, "a:", association.getClosingComment());
                    break;
                default:
                    throw new IllegalStateException("unknown node kind " + node.kind());
            }
        }

        private void text(String indent, String lead, Text text) throws IOException {
            List<String> lines = text.lines();
            for (String content : lines) {
                if (!printable(content)) {
                    line(indent, lead + " " + quote(text.getValue()));
                    return;
                }
            }
            // keep chomping restores a final line break, strip chomping drops the last one
            if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
                line(indent, lead + " |2+");
                lines = lines.subList(0, lines.size() - 1);
            } else {
                line(indent, lead + " |2-");
            }
            for (String content : lines) {
                line(indent + BLOCK, content);
            }
        }

        private void comment(String indent, String tag, Comment comment) throws IOException {
            if (comment == null) {
                return;
            }
            for (String content : comment.lines()) {
                if (!printable(content)) {
                    throw new EncodingException("comment line cannot be written as a YAML comment: "
                            + quote(content));
                }
                line(indent, "#" + tag + content);
            }
        }

        private void line(String indent, String content) throws IOException {
            out.append(indent).append(content).append('\n');
        }
    }

    /** YAML double-quoted scalar. */
    static String quote(String text) {
        StringBuilder quoted = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '\\':
                    quoted.append("\\\\");
                    break;
                case '"':
                    quoted.append("\\\"");
                    break;
                case '\t':
                    quoted.append("\\t");
                    break;
                case '\n':
                    quoted.append("\\n");
                    break;
                default:
                    if (printable(cp)) {
                        quoted.appendCodePoint(cp);
                    } else {
                        quoted.append(String.format("\\u%04X", cp));
                    }
            }
        }
        return quoted.append('"').toString();
    }

    /** Whether every character may appear as-is inside one YAML line. */
    static boolean printable(String line) {
        for (int i = 0; i < line.length(); ) {
            int cp = line.codePointAt(i);
            if (cp != '\t' && !printable(cp)) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }

    // YAML 1.1 line breaks (NEL, LS, PS) and the byte order mark are left out
    private static boolean printable(int cp) {
        return (cp >= 0x20 && cp <= 0x7E)
                || (cp >= 0xA0 && cp <= 0xD7FF && cp != 0x2028 && cp != 0x2029)
                || (cp >= 0xE000 && cp <= 0xFFFD && cp != 0xFEFF)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }
}
