package org.tindalwic.compare;

import org.tindalwic.model.CollectionNode;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Document;
import org.tindalwic.model.Entries;
import org.tindalwic.model.Entry;
import org.tindalwic.model.Node;
import org.tindalwic.model.Sequence;
import org.tindalwic.parse.TindalwicParser;
import org.tindalwic.path.NodePath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural diff of two Tindalwic documents.
 * <p>
 * Each difference is one row {@code [path, valueInLeft, valueInRight]}. Paths are
 * {@link NodePath} pointers such as {@code /servers/0/host}. A Text value is shown as its
 * string, an array as {@code <sequence>} or {@code <association>}, and a side that has no
 * node at the path as {@code null}. Arrays of different kinds are reported once, without
 * recursion. Keys are visited in left order, then keys only the right has.
 * <p>
 * When comments are included, they are compared too and reported on pseudo paths made of
 * the subject's path and a suffix: {@code #trailing}, {@code #intro}, {@code #closing},
 * {@code #key}, {@code #blank} and {@code #hashbang}.
 * <p>
 * An optional exclusion list holds rows in the same format; matching rows are dropped.
 * This class is <strong>stateless</strong> and therefore safe for concurrent use.
 */
public final class DocumentComparator {

    public static final String SEQUENCE = "<sequence>";
    public static final String ASSOCIATION = "<association>";

    private DocumentComparator() {
    }

    /* -------------------------- Public API -------------------------- */

    public static List<List<String>> diff(Document left, Document right) {
        return diff(left, right, null, false);
    }

    public static List<List<String>> diff(byte[] left, byte[] right) {
        return diff(TindalwicParser.parse(left), TindalwicParser.parse(right), null, false);
    }

    /**
     * @param exclusion       optional exclusion list (rows formatted the same as the diff rows)
     * @param includeComments whether comment differences are reported as well
     * @return diff rows: {@code [path, valueLeft, valueRight]}
     */
    public static List<List<String>> diff(Document left, Document right,
                                          List<List<String>> exclusion, boolean includeComments) {
        Walker walker = new Walker(includeComments);
        if (includeComments) {
            walker.comment(NodePath.root(), "#hashbang", left.getHashbang(), right.getHashbang());
            walker.comment(NodePath.root(), "#intro", left.getIntroComment(), right.getIntroComment());
        }
        walker.entries(NodePath.root(), left.entries(), right.entries());

        List<List<String>> diffs = walker.diffs;
        if (exclusion != null && !exclusion.isEmpty()) {
            Set<List<String>> exclSet = new HashSet<>(exclusion);
            diffs.removeIf(exclSet::contains);
        }
        return diffs;
    }

    /* -------------------------- Internal helpers -------------------------- */

    private static final class Walker {

        private final boolean includeComments;
        private final List<List<String>> diffs = new ArrayList<>();

        Walker(boolean includeComments) {
            this.includeComments = includeComments;
        }

        void entries(NodePath path, Entries left, Entries right) {
            Set<String> keys = new LinkedHashSet<>(left.keys());
            keys.addAll(right.keys());
            for (String key : keys) {
                NodePath child = path.child(key);
                Entry l = left.getEntry(key);
                Entry r = right.getEntry(key);
                if (includeComments && l != null && r != null) {
                    comment(child, "#key", l.getKeyComment(), r.getKeyComment());
                    if (l.isBlankBeforeComment() != r.isBlankBeforeComment()) {
                        record(pseudo(child, "#blank"),
                                String.valueOf(l.isBlankBeforeComment()), String.valueOf(r.isBlankBeforeComment()));
                    }
                }
                nodes(child, l == null ? null : l.getValue(), r == null ? null : r.getValue());
            }
        }

        void nodes(NodePath path, Node left, Node right) {
            if (left == null || right == null || left.kind() != right.kind()) {
                record(path.toString(), describe(left), describe(right));
                return;
            }
            switch (left.kind()) {
                case TEXT:
                    if (!left.asText().getValue().equals(right.asText().getValue())) {
                        record(path.toString(), describe(left), describe(right));
                    }
                    if (includeComments) {
                        comment(path, "#trailing", left.asText().getTrailingComment(), right.asText().getTrailingComment());
                    }
                    return;
                case SEQUENCE:
                    collectionComment(path, "#intro", left, right);
                    Sequence l = left.asSequence();
                    Sequence r = right.asSequence();
                    int max = Math.max(l.size(), r.size());
                    for (int i = 0; i < max; i++) {
                        nodes(path.child(i), i < l.size() ? l.get(i) : null, i < r.size() ? r.get(i) : null);
                    }
                    collectionComment(path, "#closing", left, right);
                    return;
                default:
                    collectionComment(path, "#intro", left, right);
                    entries(path, left.asAssociation().entries(), right.asAssociation().entries());
                    collectionComment(path, "#closing", left, right);
            }
        }

        private void collectionComment(NodePath path, String suffix, Node left, Node right) {
            if (!includeComments) {
                return;
            }
            CollectionNode l = (CollectionNode) left;
            CollectionNode r = (CollectionNode) right;
            if ("#intro".equals(suffix)) {
                comment(path, suffix, l.getIntroComment(), r.getIntroComment());
            } else {
                comment(path, suffix, l.getClosingComment(), r.getClosingComment());
            }
        }

        void comment(NodePath path, String suffix, Comment left, Comment right) {
            String l = left == null ? null : left.getText();
            String r = right == null ? null : right.getText();
            if (!Objects.equals(l, r)) {
                record(pseudo(path, suffix), l, r);
            }
        }

        private void record(String path, String left, String right) {
            diffs.add(Arrays.asList(path, left, right));
        }

        private static String pseudo(NodePath path, String suffix) {
            return path + suffix;
        }

        private static String describe(Node node) {
            if (node == null) {
                return null;
            }
            switch (node.kind()) {
                case TEXT:
                    return node.asText().getValue();
                case SEQUENCE:
                    return SEQUENCE;
                default:
                    return ASSOCIATION;
            }
        }
    }
}
