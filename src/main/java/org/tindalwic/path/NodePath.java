package org.tindalwic.path;

import org.tindalwic.error.PathException;
import org.tindalwic.model.Association;
import org.tindalwic.model.Document;
import org.tindalwic.model.Node;
import org.tindalwic.model.Sequence;
import org.tindalwic.model.Text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable route from a {@link Document} down to one of its nodes.
 * <p>
 * Steps are strings. A step meeting an {@link Association} (or the document) is a key; a
 * step meeting a {@link Sequence} is a decimal index. The textual form is a JSON pointer:
 * {@code /servers/0/host}, with {@code ~} written as {@code ~0} and {@code /} as
 * {@code ~1}. The empty path addresses the document itself.
 */
public final class NodePath {

    private static final NodePath ROOT = new NodePath(Collections.emptyList());

    private final List<String> steps;

    private NodePath(List<String> steps) {
        this.steps = steps;
    }

    public static NodePath root() {
        return ROOT;
    }

    /**
     * Builds a path from keys ({@link String}) and indexes ({@link Integer}).
     */
    public static NodePath of(Object... steps) {
        List<String> list = new ArrayList<>(steps.length);
        for (Object step : steps) {
            if (step instanceof String) {
                list.add((String) step);
            } else if (step instanceof Integer) {
                int index = (Integer) step;
                if (index < 0) {
                    throw new IllegalArgumentException("negative index: " + index);
                }
                list.add(Integer.toString(index));
            } else {
                throw new IllegalArgumentException("path step must be a String key or Integer index: " + step);
            }
        }
        return new NodePath(Collections.unmodifiableList(list));
    }

    /**
     * Parses pointer syntax. The leading {@code /} may be left out, so {@code a/b} and
     * {@code /a/b} are the same path; {@code ""} is the document and {@code "/"} the empty key.
     */
    public static NodePath parse(String pointer) {
        Objects.requireNonNull(pointer, "pointer");
        if (pointer.isEmpty()) {
            return ROOT;
        }
        String body = pointer.startsWith("/") ? pointer.substring(1) : pointer;
        List<String> list = new ArrayList<>();
        for (String raw : body.split("/", -1)) {
            list.add(unescape(raw, pointer));
        }
        return new NodePath(Collections.unmodifiableList(list));
    }

    public List<String> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    /** The last step; the root has none. */
    public String last() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("the document path has no last step");
        }
        return steps.get(steps.size() - 1);
    }

    public NodePath parent() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("the document path has no parent");
        }
        return new NodePath(steps.subList(0, steps.size() - 1));
    }

    public NodePath child(String key) {
        List<String> list = new ArrayList<>(steps);
        list.add(Objects.requireNonNull(key, "key"));
        return new NodePath(Collections.unmodifiableList(list));
    }

    public NodePath child(int index) {
        return child(Integer.toString(index));
    }

    // ==================== Resolution ====================

    /**
     * @throws PathException if a step is missing, out of range, or meets a {@link Text}
     */
    public Node resolve(Document document) {
        if (steps.isEmpty()) {
            throw new PathException("Path `` leads to the Document, which is not a node");
        }
        return walk(document, true);
    }

    /** Like {@link #resolve} but {@code null} when any step cannot be taken. */
    public Node find(Document document) {
        return steps.isEmpty() ? null : walk(document, false);
    }

    public Text text(Document document) {
        Node node = resolve(document);
        if (!node.isText()) {
            throw new PathException("Path `" + this + "` leads to " + name(node) + " (not Text)");
        }
        return node.asText();
    }

    public Sequence sequence(Document document) {
        Node node = resolve(document);
        if (!node.isSequence()) {
            throw new PathException("Path `" + this + "` leads to " + name(node) + " (not Sequence)");
        }
        return node.asSequence();
    }

    public Association association(Document document) {
        Node node = resolve(document);
        if (!node.isAssociation()) {
            throw new PathException("Path `" + this + "` leads to " + name(node) + " (not Association)");
        }
        return node.asAssociation();
    }

    private Node walk(Document document, boolean strict) {
        Node node = document.get(steps.get(0));
        if (node == null) {
            return missing(strict, 0, "Document missing key");
        }
        for (int i = 1; i < steps.size() && node != null; i++) {
            node = step(node, i, strict);
        }
        return node;
    }

    private Node step(Node node, int i, boolean strict) {
        String step = steps.get(i);
        switch (node.kind()) {
            case ASSOCIATION:
                Node value = node.asAssociation().get(step);
                return value != null ? value : missing(strict, i, "Association missing key");
            case SEQUENCE:
                Sequence sequence = node.asSequence();
                int index = index(step);
                if (index < 0) {
                    return missing(strict, i, "Sequence");
                }
                if (index >= sequence.size()) {
                    return missing(strict, i, "Sequence too short");
                }
                return sequence.get(index);
            default:
                return missing(strict, i, "Text");
        }
    }

    private Node missing(boolean strict, int failing, String have) {
        if (!strict) {
            return null;
        }
        NodePath passed = new NodePath(steps.subList(0, failing));
        throw new PathException("Path `" + passed + "` leads to " + have
                + ", can't step to `" + steps.get(failing) + "`");
    }

    /** The decimal index a step names, or -1 when it is not one. */
    public static int index(String step) {
        if (step.isEmpty() || step.length() > 9) {
            return -1;
        }
        for (int i = 0; i < step.length(); i++) {
            char c = step.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        if (step.length() > 1 && step.charAt(0) == '0') {
            return -1;
        }
        return Integer.parseInt(step);
    }

    private static String name(Node node) {
        switch (node.kind()) {
            case TEXT:
                return "Text";
            case SEQUENCE:
                return "Sequence";
            default:
                return "Association";
        }
    }

    // ==================== Pointer Syntax ====================

    private static String escape(String step) {
        return step.replace("~", "~0").replace("/", "~1");
    }

    private static String unescape(String raw, String pointer) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '~') {
                sb.append(c);
                continue;
            }
            char next = i + 1 < raw.length() ? raw.charAt(i + 1) : 0;
            if (next == '0') {
                sb.append('~');
            } else if (next == '1') {
                sb.append('/');
            } else {
                throw new PathException("bad escape in path `" + pointer + "`: '~' must be followed by 0 or 1");
            }
            i++;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String step : steps) {
            sb.append('/').append(escape(step));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodePath)) return false;
        return steps.equals(((NodePath) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }
}
