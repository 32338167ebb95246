package org.tindalwic.parse;

import org.tindalwic.encode.Forms;
import org.tindalwic.error.DuplicateKeyException;
import org.tindalwic.error.MalformedLineException;
import org.tindalwic.error.RequiresLongFormException;
import org.tindalwic.model.Association;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Entries;
import org.tindalwic.model.Entry;
import org.tindalwic.model.Node;
import org.tindalwic.model.Sequence;
import org.tindalwic.model.Text;

import java.util.function.Consumer;

/**
 * Turns classified lines into tree nodes, opening and closing frames on the
 * {@link ContextStack} as it goes.
 */
final class TreeBuilder {

    private final ContextStack stack;

    TreeBuilder(ContextStack stack) {
        this.stack = stack;
    }

    /** Appends a raw line to the open text or comment, minus the context's indentation. */
    void append(Frame terminal, SourceLine line) {
        terminal.lines().add(line.text().substring(terminal.childDepth()));
    }

    /** Handles a line addressed to the container frame on top of the stack. */
    void accept(Frame container, ClassifiedLine line) {
        switch (line.kind()) {
            case HASHBANG:
                openComment(line, CommentAttacher.hashbang(container));
                return;
            case COMMENT:
                openComment(line, CommentAttacher.hash(container, line));
                return;
            case KEY_COMMENT:
                openComment(line, CommentAttacher.keyComment(container, line));
                return;
            default:
                break;
        }
        if (container.isKeyed()) {
            acceptKeyed(container, line);
        } else {
            acceptItem(container, line);
        }
    }

    private void acceptKeyed(Frame container, ClassifiedLine line) {
        if (line.kind() == LineKind.BLANK) {
            CommentAttacher.blank(container, line);
            return;
        }
        if (line.kind() == LineKind.PLAIN) {
            throw new MalformedLineException("expected key=value, <key>, [key] or {key}",
                    line.line().number(), line.offset());
        }
        if (line.kind() == LineKind.KEY_VALUE && !line.text().isEmpty() && Forms.valueNeedsLongForm(line.text())) {
            throw new RequiresLongFormException("value of key '" + line.key() + "' must use the <" + line.key() + "> form",
                    line.line().number(), line.line().offsetOf(line.textIndex()));
        }
        CommentAttacher.beforeKey(container, line);
        Entries entries = container.entries();
        if (entries.containsKey(line.key())) {
            throw new DuplicateKeyException("duplicate key: " + line.key(), line.line().number(), line.offset());
        }
        Node value = open(line, line.kind() == LineKind.KEY_VALUE ? line.text() : null);
        Entry entry = entries.add(line.key(), value);
        CommentAttacher.claim(container, entry);
        container.started = true;
        container.lastValue = line.kind() == LineKind.KEY_VALUE ? value : null;
    }

    private void acceptItem(Frame container, ClassifiedLine line) {
        Node value;
        switch (line.kind()) {
            case BLANK:
                value = open(line, "");
                break;
            case PLAIN:
            case KEY_VALUE:
                value = open(line, line.content());
                break;
            default:
                if (!line.key().isEmpty()) {
                    throw new MalformedLineException("linear array items have no key; expected "
                            + line.content().charAt(0) + line.content().charAt(line.content().length() - 1),
                            line.line().number(), line.offset());
                }
                value = open(line, null);
                break;
        }
        container.sequence().add(value);
        container.started = true;
        container.lastValue = line.kind().opensContext() ? null : value;
    }

    /**
     * Creates the node a line stands for. Short-form text is complete at once; openers push
     * a frame that completes the node when it closes.
     */
    private Node open(ClassifiedLine line, String shortText) {
        int childDepth = line.indent() + 1;
        Node node;
        switch (line.kind()) {
            case TEXT_OPEN:
                Text text = new Text();
                stack.push(Frame.text(text, line.line(), childDepth));
                node = text;
                break;
            case SEQUENCE_OPEN:
                Sequence sequence = new Sequence();
                stack.push(Frame.sequence(sequence, line.line(), childDepth));
                node = sequence;
                break;
            case ASSOCIATION_OPEN:
                Association association = new Association();
                stack.push(Frame.association(association, line.line(), childDepth));
                node = association;
                break;
            default:
                node = new Text(shortText);
                break;
        }
        node.setLine(line.line().number());
        return node;
    }

    private void openComment(ClassifiedLine line, Consumer<Comment> target) {
        stack.push(Frame.comment(line.text(), line.line(), line.indent() + 1, target));
    }

    /** Completes a popped frame and hands its result to {@code parent}. */
    void close(Frame frame, Frame parent) {
        switch (frame.kind()) {
            case TEXT:
                // zero lines read as "", a single line verbatim (even when blank)
                frame.text().setValue(String.join("\n", frame.lines()));
                parent.lastValue = frame.text();
                break;
            case COMMENT:
                Comment comment = new Comment(String.join("\n", frame.lines()));
                comment.setLine(frame.opening().number());
                frame.commentTarget().accept(comment);
                break;
            case ASSOCIATION:
            case SEQUENCE:
                CommentAttacher.checkUnclaimed(frame);
                parent.lastValue = frame.node();
                break;
            default:
                throw new IllegalStateException("cannot close " + frame);
        }
    }

    void finish(Frame document) {
        CommentAttacher.checkUnclaimed(document);
    }
}
