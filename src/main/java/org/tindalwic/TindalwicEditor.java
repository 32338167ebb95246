package org.tindalwic;

import org.tindalwic.encode.CanonicalEncoder;
import org.tindalwic.error.PathException;
import org.tindalwic.model.CollectionNode;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Document;
import org.tindalwic.model.Entries;
import org.tindalwic.model.Node;
import org.tindalwic.model.Sequence;
import org.tindalwic.model.Text;
import org.tindalwic.parse.TindalwicParser;
import org.tindalwic.path.NodePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Path-addressed edits of an encoded document, for callers who hold bytes rather than a tree.
 * <p>
 * Every call parses the input, applies one change to the tree and returns the canonical
 * encoding. Comments anywhere else in the document come back unchanged. When
 * {@code expectedOld} is given and does not match the current text, the input array is
 * returned as is. Paths use {@link NodePath#parse pointer syntax}.
 * Thread-safe: no state is kept between calls.
 */
public final class TindalwicEditor {

    private static final Logger logger = LoggerFactory.getLogger(TindalwicEditor.class);

    private TindalwicEditor() {
    }

    // ==================== Byte Array API ====================

    public static byte[] setValue(byte[] bytes, String path, String newValue) {
        return setValue(bytes, path, null, newValue);
    }

    /**
     * Replaces the text at {@code path}. A missing last key of an association is created,
     * as is the item just past the end of a sequence, unless {@code expectedOld} is given.
     *
     * @throws PathException if the path leads through a missing node or ends at an array
     */
    public static byte[] setValue(byte[] bytes, String path, String expectedOld, String newValue) {
        if (newValue == null) {
            throw new IllegalArgumentException("newValue must not be null");
        }
        Document document = TindalwicParser.parse(bytes);
        NodePath nodePath = NodePath.parse(path);
        Node current = nodePath.isRoot() ? null : nodePath.find(document);

        if (current == null) {
            if (expectedOld != null) {
                return bytes;
            }
            create(document, nodePath, newValue);
            logger.debug("Created {}", nodePath);
            return CanonicalEncoder.encodeBytes(document);
        }

        Text text = nodePath.text(document);
        if (expectedOld != null && !expectedOld.equals(text.getValue())) {
            return bytes; // No change
        }
        text.setValue(newValue);
        logger.debug("Set {}", nodePath);
        return CanonicalEncoder.encodeBytes(document);
    }

    public static byte[] deleteKey(byte[] bytes, String path) {
        return deleteKey(bytes, path, null);
    }

    /**
     * Removes the entry or sequence item at {@code path}, with its comments.
     *
     * @throws PathException if nothing is found at {@code path}
     */
    public static byte[] deleteKey(byte[] bytes, String path, String expectedOld) {
        Document document = TindalwicParser.parse(bytes);
        NodePath nodePath = NodePath.parse(path);
        Node current = nodePath.resolve(document);

        if (expectedOld != null && !(current.isText() && expectedOld.equals(current.asText().getValue()))) {
            return bytes; // No change
        }

        String last = nodePath.last();
        NodePath parentPath = nodePath.parent();
        if (parentPath.isRoot()) {
            document.remove(last);
        } else {
            Node parent = parentPath.resolve(document);
            if (parent.isSequence()) {
                parent.asSequence().remove(NodePath.index(last));
            } else {
                parent.asAssociation().remove(last);
            }
        }
        logger.debug("Deleted {}", nodePath);
        return CanonicalEncoder.encodeBytes(document);
    }

    public static boolean search(byte[] bytes, String path) {
        return search(bytes, path, null);
    }

    /**
     * @return whether {@code path} exists, and when {@code value} is given, whether it leads
     * to a text equal to it
     */
    public static boolean search(byte[] bytes, String path, String value) {
        Document document = TindalwicParser.parse(bytes);
        NodePath nodePath = NodePath.parse(path);
        if (nodePath.isRoot()) {
            return value == null;
        }
        Node node = nodePath.find(document);
        if (node == null) {
            return false;
        }
        if (value == null) {
            return true;
        }
        return node.isText() && value.equals(node.asText().getValue());
    }

    /**
     * Sets the comment after the value at {@code path}: trailing for text, closing for an
     * array. The empty path sets the document's introductory comment. {@code null} removes it.
     */
    public static byte[] setComment(byte[] bytes, String path, String commentText) {
        Document document = TindalwicParser.parse(bytes);
        NodePath nodePath = NodePath.parse(path);
        Comment comment = commentText == null ? null : new Comment(commentText);
        if (nodePath.isRoot()) {
            document.setIntroComment(comment);
        } else {
            Node node = nodePath.resolve(document);
            if (node.isText()) {
                node.asText().setTrailingComment(comment);
            } else {
                ((CollectionNode) node).setClosingComment(comment);
            }
        }
        logger.debug("Commented {}", nodePath);
        return CanonicalEncoder.encodeBytes(document);
    }

    // ==================== Internal Helpers ====================

    private static void create(Document document, NodePath path, String value) {
        if (path.isRoot()) {
            throw new PathException("Path `` leads to the Document, which holds no text");
        }
        String last = path.last();
        NodePath parentPath = path.parent();
        if (parentPath.isRoot()) {
            addEntry(document.entries(), last, value);
            return;
        }
        Node parent = parentPath.resolve(document);
        switch (parent.kind()) {
            case ASSOCIATION:
                addEntry(parent.asAssociation().entries(), last, value);
                break;
            case SEQUENCE:
                Sequence sequence = parent.asSequence();
                if (NodePath.index(last) != sequence.size()) {
                    throw new PathException("Path `" + parentPath + "` leads to Sequence too short, can't step to `" + last + "`");
                }
                sequence.add(Text.of(value));
                break;
            default:
                throw new PathException("Path `" + parentPath + "` leads to Text, can't step to `" + last + "`");
        }
    }

    private static void addEntry(Entries entries, String key, String value) {
        entries.add(key, Text.of(value));
    }
}
