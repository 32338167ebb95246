package org.tindalwic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A linear array: an ordered list of nodes without keys.
 */
public final class Sequence extends CollectionNode implements Iterable<Node> {

    private final List<Node> items = new ArrayList<>();

    public Sequence() {
    }

    public Sequence(Node... items) {
        for (Node item : items) {
            add(item);
        }
    }

    /** Convenience for a sequence of plain {@link Text} items. */
    public static Sequence of(String... values) {
        Sequence sequence = new Sequence();
        for (String value : values) {
            sequence.add(new Text(value));
        }
        return sequence;
    }

    @Override
    public Kind kind() {
        return Kind.SEQUENCE;
    }

    @Override
    public int size() {
        return items.size();
    }

    public Node get(int index) {
        return items.get(index);
    }

    /** Read-only view of the items. */
    public List<Node> items() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public Iterator<Node> iterator() {
        return items().iterator();
    }

    public Sequence add(Node item) {
        items.add(claim(this, item));
        return this;
    }

    public Sequence add(int index, Node item) {
        Objects.checkIndex(index, items.size() + 1);
        items.add(index, claim(this, item));
        return this;
    }

    /** Replaces the item at {@code index} and returns the detached previous item. */
    public Node set(int index, Node item) {
        Objects.checkIndex(index, items.size());
        if (items.get(index) == item) {
            return item;
        }
        Node previous = items.set(index, claim(this, item));
        release(previous);
        return previous;
    }

    public Node remove(int index) {
        Node removed = items.remove(index);
        release(removed);
        return removed;
    }

    public boolean remove(Node item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == item) {
                remove(i);
                return true;
            }
        }
        return false;
    }

    public int indexOf(Node item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == item) {
                return i;
            }
        }
        return -1;
    }

    /** Moves the item at {@code from} so that it ends up at index {@code to}. */
    public void move(int from, int to) {
        Objects.checkIndex(from, items.size());
        Objects.checkIndex(to, items.size());
        items.add(to, items.remove(from));
    }

    public void swap(int i, int j) {
        Collections.swap(items, i, j);
    }

    public void clear() {
        for (Node item : items) {
            release(item);
        }
        items.clear();
    }

    @Override
    public Sequence copy() {
        Sequence copy = new Sequence();
        for (Node item : items) {
            copy.add(item.copy());
        }
        copyCommentsInto(copy);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequence)) return false;
        Sequence other = (Sequence) o;
        return items.equals(other.items)
                && Objects.equals(getIntroComment(), other.getIntroComment())
                && Objects.equals(getClosingComment(), other.getClosingComment());
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, getIntroComment(), getClosingComment());
    }

    @Override
    public String toString() {
        return "Sequence" + items;
    }
}
