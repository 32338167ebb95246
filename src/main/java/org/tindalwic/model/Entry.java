package org.tindalwic.model;

import org.tindalwic.error.MisplacedCommentException;

import java.util.Objects;

/**
 * One key/value pair of an {@link Association} or {@link Document}. The key is the subject
 * of the optional {@code //} key comment, which may in turn be preceded by one blank line.
 */
public final class Entry implements Subject {

    private final Entries container;
    private String key;
    private Node value;
    private Comment keyComment;
    private boolean blankBeforeComment;

    Entry(Entries container, String key, Node value) {
        this.container = container;
        this.key = key;
        this.value = Node.claim(container.owner(), value);
    }

    public String getKey() {
        return key;
    }

    void setKey(String key) {
        this.key = key;
    }

    public Node getValue() {
        return value;
    }

    /** Replaces the value, keeping key, key comment and position. */
    public Node setValue(Node value) {
        if (value == this.value) {
            return value;
        }
        Node.claim(container.owner(), value);
        Node previous = this.value;
        this.value = value;
        Node.release(previous);
        return previous;
    }

    public Comment getKeyComment() {
        return keyComment;
    }

    /** Binds a {@code //} comment to the key; {@code null} removes it together with the blank line. */
    public void setKeyComment(Comment comment) {
        keyComment = Comment.rebind(keyComment, comment, this, CommentPosition.PRECEDING_KEY);
        if (keyComment == null) {
            blankBeforeComment = false;
        }
    }

    public Entry withKeyComment(String comment) {
        setKeyComment(new Comment(comment));
        return this;
    }

    public boolean isBlankBeforeComment() {
        return blankBeforeComment;
    }

    /**
     * @throws MisplacedCommentException when asking for a blank line while the key has no comment
     */
    public void setBlankBeforeComment(boolean blank) {
        if (blank && keyComment == null) {
            throw new MisplacedCommentException("a blank line may only precede a key comment, key: " + key);
        }
        this.blankBeforeComment = blank;
    }

    Entry copyInto(Entries target) {
        Entry copy = target.add(key, value.copy());
        copy.setKeyComment(Node.copyOf(keyComment));
        copy.blankBeforeComment = blankBeforeComment;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry)) return false;
        Entry other = (Entry) o;
        return key.equals(other.key)
                && value.equals(other.value)
                && blankBeforeComment == other.blankBeforeComment
                && Objects.equals(keyComment, other.keyComment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, keyComment, blankBeforeComment);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
