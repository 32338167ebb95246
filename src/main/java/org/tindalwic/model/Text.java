package org.tindalwic.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A string value. Line breaks are stored as {@code '\n'}; the encoder chooses the
 * bracketed long form whenever the content needs it.
 */
public final class Text extends Node {

    private String value;
    private Comment trailingComment;

    public Text() {
        this("");
    }

    public Text(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Text of(String value) {
        return new Text(value);
    }

    @Override
    public Kind kind() {
        return Kind.TEXT;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /** The value split at line breaks; an empty value has no lines. */
    public List<String> lines() {
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(value.split("\n", -1));
    }

    public Comment getTrailingComment() {
        return trailingComment;
    }

    /** Binds {@code comment} after this value; {@code null} removes the current one. */
    public void setTrailingComment(Comment comment) {
        trailingComment = Comment.rebind(trailingComment, comment, this, CommentPosition.TRAILING_VALUE);
    }

    public Text withTrailingComment(String comment) {
        setTrailingComment(new Comment(comment));
        return this;
    }

    @Override
    public Text copy() {
        Text copy = new Text(value);
        copy.setLine(getLine());
        copy.setTrailingComment(copyOf(trailingComment));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Text)) return false;
        Text other = (Text) o;
        return value.equals(other.value) && Objects.equals(trailingComment, other.trailingComment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, trailingComment);
    }

    @Override
    public String toString() {
        return "Text{" + value + "}";
    }
}
