package org.tindalwic.model;

import org.tindalwic.error.MisplacedCommentException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Opaque (usually GitHub Flavored Markdown) text bound to exactly one {@link Subject}.
 * <p>
 * The text may span several lines, separated by {@code '\n'}. A comment starts out
 * unbound; it becomes bound when handed to one of the comment setters of its subject, and
 * from then on it cannot be handed to another subject. The binding is a plain
 * back-reference: the comment is owned by the collection holding its subject.
 */
public final class Comment {

    private final String text;
    private Subject subject;
    private CommentPosition position;
    private int line;

    public Comment(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    /** The text split at line breaks; never empty. */
    public List<String> lines() {
        return Arrays.asList(text.split("\n", -1));
    }

    /** The bound subject, or {@code null} while unattached. */
    public Subject getSubject() {
        return subject;
    }

    /** The position relative to the subject, or {@code null} while unattached. */
    public CommentPosition getPosition() {
        return position;
    }

    public boolean isAttached() {
        return subject != null;
    }

    /** 1-based line of the comment marker in the parsed source; 0 when built in code. */
    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    /** A fresh, unattached comment with the same text. */
    public Comment copy() {
        Comment copy = new Comment(text);
        copy.line = line;
        return copy;
    }

    void attach(Subject newSubject, CommentPosition newPosition) {
        if (subject != null && (subject != newSubject || position != newPosition)) {
            throw new MisplacedCommentException(
                    "comment is already bound as " + position + "; copy() it to reuse the text");
        }
        subject = newSubject;
        position = newPosition;
    }

    void detach() {
        subject = null;
        position = null;
    }

    /** Binds {@code next} in place of {@code previous} and returns it. */
    static Comment rebind(Comment previous, Comment next, Subject subject, CommentPosition position) {
        if (previous == next) {
            return next;
        }
        if (next != null) {
            next.attach(subject, position);
        }
        if (previous != null) {
            previous.detach();
        }
        return next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comment)) return false;
        Comment other = (Comment) o;
        return text.equals(other.text) && position == other.position;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, position);
    }

    @Override
    public String toString() {
        return "Comment{" + position + ": " + text + "}";
    }
}
