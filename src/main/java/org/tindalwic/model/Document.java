package org.tindalwic.model;

import java.util.Objects;

/**
 * The root of a Tindalwic tree.
 * <p>
 * Like an {@link Association}, a document holds ordered, uniquely keyed entries. Its
 * comments differ: the first line may be a Unix {@code #!} hashbang, followed by one
 * introductory comment, and there is no closing comment.
 */
public final class Document implements Subject {

    private final Entries entries = new Entries(this);
    private Comment hashbang;
    private Comment introComment;

    public Document() {
    }

    public Entries entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Node get(String key) {
        return entries.get(key);
    }

    public Document with(String key, Node value) {
        entries.add(key, value);
        return this;
    }

    public Document with(String key, String value) {
        return with(key, new Text(value));
    }

    public Entry put(String key, Node value) {
        return entries.put(key, value);
    }

    public Node remove(String key) {
        return entries.remove(key);
    }

    public Comment getHashbang() {
        return hashbang;
    }

    /** The hashbang text excludes the {@code #!} marker. */
    public void setHashbang(Comment comment) {
        hashbang = Comment.rebind(hashbang, comment, this, CommentPosition.HASHBANG);
    }

    public Comment getIntroComment() {
        return introComment;
    }

    public void setIntroComment(Comment comment) {
        introComment = Comment.rebind(introComment, comment, this, CommentPosition.INTRODUCING_COLLECTION);
    }

    public Document copy() {
        Document copy = new Document();
        entries.copyInto(copy.entries);
        copy.setHashbang(Node.copyOf(hashbang));
        copy.setIntroComment(Node.copyOf(introComment));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document)) return false;
        Document other = (Document) o;
        return entries.equals(other.entries)
                && Objects.equals(hashbang, other.hashbang)
                && Objects.equals(introComment, other.introComment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, hashbang, introComment);
    }

    @Override
    public String toString() {
        return "Document" + entries;
    }
}
