package org.tindalwic.parse;

import org.tindalwic.error.MisplacedCommentException;
import org.tindalwic.model.CollectionNode;
import org.tindalwic.model.Comment;
import org.tindalwic.model.Entry;
import org.tindalwic.model.Node;

import java.util.function.Consumer;

/**
 * Binds each comment line to the only subject its position allows, or rejects it.
 *
 * <table>
 *   <caption>allowed positions</caption>
 *   <tr><th>subject</th><th>comments</th></tr>
 *   <tr><td>document</td><td>{@code #!} on line 1, then one introductory {@code #}</td></tr>
 *   <tr><td>linear or associative array</td><td>one introductory {@code #} as the first child
 *       line, one closing {@code #} after the array at its own depth</td></tr>
 *   <tr><td>key</td><td>one {@code //} right before the key line, optionally preceded by one
 *       blank line</td></tr>
 *   <tr><td>text value</td><td>one trailing {@code #} after the value at its own depth</td></tr>
 * </table>
 */
final class CommentAttacher {

    private CommentAttacher() {
    }

    static Consumer<Comment> hashbang(Frame document) {
        return document.document()::setHashbang;
    }

    /**
     * Target of a {@code #} line read directly inside {@code frame}: the frame's introductory
     * slot when nothing was read yet, otherwise the value completed just before.
     */
    static Consumer<Comment> hash(Frame frame, ClassifiedLine line) {
        if (!frame.started) {
            frame.started = true;
            switch (frame.kind()) {
                case DOCUMENT:
                    return frame.document()::setIntroComment;
                case ASSOCIATION:
                    return frame.association()::setIntroComment;
                case SEQUENCE:
                    return frame.sequence()::setIntroComment;
                default:
                    throw new IllegalStateException("comment inside " + frame);
            }
        }
        Node subject = frame.lastValue;
        if (subject == null) {
            throw misplaced(line, frame.isKeyed() && (frame.pendingBlank != null || frame.pendingKeyComment != null)
                    ? "a '#' comment cannot describe a key; use '//'"
                    : "comment has no subject here; only one comment may follow a value");
        }
        frame.lastValue = null;
        if (subject.isText()) {
            return subject.asText()::setTrailingComment;
        }
        return ((CollectionNode) subject)::setClosingComment;
    }

    static Consumer<Comment> keyComment(Frame frame, ClassifiedLine line) {
        if (!frame.isKeyed()) {
            throw misplaced(line, "key comment inside a linear array");
        }
        if (frame.pendingKeyComment != null) {
            throw misplaced(line, "more than one key comment");
        }
        frame.started = true;
        frame.lastValue = null;
        frame.pendingKeyCommentLine = line.line();
        return comment -> frame.pendingKeyComment = comment;
    }

    static void blank(Frame frame, ClassifiedLine line) {
        if (frame.pendingKeyComment != null) {
            throw misplaced(line, "blank line must precede the key comment, not follow it");
        }
        if (frame.pendingBlank != null) {
            throw misplaced(line, "more than one blank line");
        }
        frame.started = true;
        frame.lastValue = null;
        frame.pendingBlank = line.line();
    }

    /** Checks that a key line may claim what is pending; runs before the entry exists. */
    static void beforeKey(Frame frame, ClassifiedLine line) {
        if (frame.pendingBlank != null && frame.pendingKeyComment == null) {
            throw new MisplacedCommentException("blank line before a key must be followed by a '//' comment",
                    frame.pendingBlank.number(), frame.pendingBlank.offset());
        }
    }

    static void claim(Frame frame, Entry entry) {
        if (frame.pendingKeyComment != null) {
            entry.setKeyComment(frame.pendingKeyComment);
            entry.setBlankBeforeComment(frame.pendingBlank != null);
        }
        frame.pendingKeyComment = null;
        frame.pendingKeyCommentLine = null;
        frame.pendingBlank = null;
    }

    /** A container may not close while a key comment or blank line waits for its key. */
    static void checkUnclaimed(Frame frame) {
        if (frame.pendingKeyComment != null) {
            throw new MisplacedCommentException("key comment is not followed by a key",
                    frame.pendingKeyCommentLine.number(), frame.pendingKeyCommentLine.offset());
        }
        if (frame.pendingBlank != null) {
            throw new MisplacedCommentException("blank line is not followed by a key comment",
                    frame.pendingBlank.number(), frame.pendingBlank.offset());
        }
    }

    private static MisplacedCommentException misplaced(ClassifiedLine line, String message) {
        return new MisplacedCommentException(message, line.line().number(), line.offset());
    }
}
