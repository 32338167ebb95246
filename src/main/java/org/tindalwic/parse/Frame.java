package org.tindalwic.parse;

import org.tindalwic.model.Association;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Document;
import org.tindalwic.model.Entries;
import org.tindalwic.model.Node;
import org.tindalwic.model.Sequence;
import org.tindalwic.model.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * One open context on the {@link ContextStack}.
 * <p>
 * Container frames (document, associative and linear arrays) classify their child lines
 * and remember what the next comment may attach to. Text and comment frames are terminal:
 * they collect raw lines until the indentation drops below {@link #childDepth()}.
 */
final class Frame {

    enum Kind {
        DOCUMENT,
        ASSOCIATION,
        SEQUENCE,
        TEXT,
        COMMENT
    }

    private final Kind kind;
    private final int childDepth;
    private final SourceLine opening;

    private Document document;
    private Association association;
    private Sequence sequence;
    private Text text;

    // terminal frames
    private final List<String> lines = new ArrayList<>();
    private Consumer<Comment> commentTarget;

    // container frames
    boolean started;
    Node lastValue;
    Comment pendingKeyComment;
    SourceLine pendingKeyCommentLine;
    SourceLine pendingBlank;

    private Frame(Kind kind, int childDepth, SourceLine opening) {
        this.kind = kind;
        this.childDepth = childDepth;
        this.opening = opening;
    }

    static Frame document(Document document) {
        Frame frame = new Frame(Kind.DOCUMENT, 0, null);
        frame.document = document;
        return frame;
    }

    static Frame association(Association association, SourceLine opening, int childDepth) {
        Frame frame = new Frame(Kind.ASSOCIATION, childDepth, opening);
        frame.association = association;
        return frame;
    }

    static Frame sequence(Sequence sequence, SourceLine opening, int childDepth) {
        Frame frame = new Frame(Kind.SEQUENCE, childDepth, opening);
        frame.sequence = sequence;
        return frame;
    }

    static Frame text(Text text, SourceLine opening, int childDepth) {
        Frame frame = new Frame(Kind.TEXT, childDepth, opening);
        frame.text = text;
        return frame;
    }

    static Frame comment(String firstLine, SourceLine opening, int childDepth, Consumer<Comment> target) {
        Frame frame = new Frame(Kind.COMMENT, childDepth, opening);
        frame.lines.add(firstLine);
        frame.commentTarget = target;
        return frame;
    }

    Kind kind() {
        return kind;
    }

    /** Tab count that lines belonging to this context start with. */
    int childDepth() {
        return childDepth;
    }

    /** The line that opened this context; {@code null} for the document. */
    SourceLine opening() {
        return opening;
    }

    boolean isTerminal() {
        return kind == Kind.TEXT || kind == Kind.COMMENT;
    }

    boolean isKeyed() {
        return kind == Kind.DOCUMENT || kind == Kind.ASSOCIATION;
    }

    Document document() {
        return document;
    }

    Association association() {
        return association;
    }

    Sequence sequence() {
        return sequence;
    }

    Text text() {
        return text;
    }

    /** The node this frame builds, or {@code null} for document and comment frames. */
    Node node() {
        switch (kind) {
            case ASSOCIATION:
                return association;
            case SEQUENCE:
                return sequence;
            case TEXT:
                return text;
            default:
                return null;
        }
    }

    Entries entries() {
        if (kind == Kind.DOCUMENT) {
            return document.entries();
        }
        if (kind == Kind.ASSOCIATION) {
            return association.entries();
        }
        throw new IllegalStateException(kind + " frame has no entries");
    }

    List<String> lines() {
        return lines;
    }

    Consumer<Comment> commentTarget() {
        return commentTarget;
    }

    @Override
    public String toString() {
        return kind + "(" + childDepth + ")";
    }
}
