package org.tindalwic.model;

import java.util.Objects;

/**
 * An associative array: ordered entries with unique keys.
 */
public final class Association extends CollectionNode {

    private final Entries entries = new Entries(this);

    public Association() {
    }

    @Override
    public Kind kind() {
        return Kind.ASSOCIATION;
    }

    public Entries entries() {
        return entries;
    }

    @Override
    public int size() {
        return entries.size();
    }

    public Node get(String key) {
        return entries.get(key);
    }

    /** Appends an entry and returns this association, for building trees in code. */
    public Association with(String key, Node value) {
        entries.add(key, value);
        return this;
    }

    public Association with(String key, String value) {
        return with(key, new Text(value));
    }

    public Entry put(String key, Node value) {
        return entries.put(key, value);
    }

    public Node remove(String key) {
        return entries.remove(key);
    }

    @Override
    public Association copy() {
        Association copy = new Association();
        entries.copyInto(copy.entries);
        copyCommentsInto(copy);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Association)) return false;
        Association other = (Association) o;
        return entries.equals(other.entries)
                && Objects.equals(getIntroComment(), other.getIntroComment())
                && Objects.equals(getClosingComment(), other.getClosingComment());
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, getIntroComment(), getClosingComment());
    }

    @Override
    public String toString() {
        return "Association" + entries;
    }
}
