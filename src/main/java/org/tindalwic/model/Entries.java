package org.tindalwic.model;

import org.tindalwic.error.DuplicateKeyException;
import org.tindalwic.error.InvalidKeyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, uniquely keyed entries shared by {@link Association} and {@link Document}.
 * <p>
 * Insertion order is the encoding order. Every mutator validates before touching the
 * list, so a failed call leaves the entries unchanged.
 */
public final class Entries implements Iterable<Entry> {

    private final Subject owner;
    private final List<Entry> list = new ArrayList<>();
    private final Map<String, Entry> byKey = new HashMap<>();

    Entries(Subject owner) {
        this.owner = owner;
    }

    Subject owner() {
        return owner;
    }

    /**
     * @throws InvalidKeyException if the key is {@code null} or holds a line break
     */
    public static String checkKey(String key) {
        if (key == null) {
            throw new InvalidKeyException("key must not be null");
        }
        if (key.indexOf('\n') >= 0) {
            throw new InvalidKeyException("line break in key: " + key.replace("\n", "\\n"));
        }
        return key;
    }

    public int size() {
        return list.size();
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    public boolean containsKey(String key) {
        return byKey.containsKey(key);
    }

    public int indexOf(String key) {
        Entry entry = byKey.get(key);
        return entry == null ? -1 : list.indexOf(entry);
    }

    public Entry getEntry(String key) {
        return byKey.get(key);
    }

    public Entry getEntry(int index) {
        return list.get(index);
    }

    /** The value under {@code key}, or {@code null} when absent. */
    public Node get(String key) {
        Entry entry = byKey.get(key);
        return entry == null ? null : entry.getValue();
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>(list.size());
        for (Entry entry : list) {
            keys.add(entry.getKey());
        }
        return keys;
    }

    /** Read-only view in encoding order. */
    public List<Entry> list() {
        return Collections.unmodifiableList(list);
    }

    @Override
    public Iterator<Entry> iterator() {
        return list().iterator();
    }

    /**
     * Appends a new entry.
     *
     * @throws DuplicateKeyException if the key is present already
     */
    public Entry add(String key, Node value) {
        return insert(list.size(), key, value);
    }

    public Entry insert(int index, String key, Node value) {
        checkKey(key);
        Objects.checkIndex(index, list.size() + 1);
        if (byKey.containsKey(key)) {
            throw new DuplicateKeyException("duplicate key: " + key);
        }
        Entry entry = new Entry(this, key, value);
        list.add(index, entry);
        byKey.put(key, entry);
        return entry;
    }

    /** Replaces the value of an existing key in place, or appends a new entry. */
    public Entry put(String key, Node value) {
        Entry entry = byKey.get(checkKey(key));
        if (entry == null) {
            return add(key, value);
        }
        entry.setValue(value);
        return entry;
    }

    /** Removes the entry and returns its detached value, or {@code null} when absent. */
    public Node remove(String key) {
        Entry entry = byKey.remove(key);
        if (entry == null) {
            return null;
        }
        list.remove(entry);
        Node value = entry.getValue();
        Node.release(value);
        return value;
    }

    /** Moves the entry so that it ends up at {@code toIndex}. */
    public void move(String key, int toIndex) {
        Entry entry = byKey.get(key);
        if (entry == null) {
            throw new IllegalArgumentException("no such key: " + key);
        }
        Objects.checkIndex(toIndex, list.size());
        list.remove(entry);
        list.add(toIndex, entry);
    }

    public void rename(String oldKey, String newKey) {
        checkKey(newKey);
        Entry entry = byKey.get(oldKey);
        if (entry == null) {
            throw new IllegalArgumentException("no such key: " + oldKey);
        }
        if (oldKey.equals(newKey)) {
            return;
        }
        if (byKey.containsKey(newKey)) {
            throw new DuplicateKeyException("duplicate key: " + newKey);
        }
        byKey.remove(oldKey);
        entry.setKey(newKey);
        byKey.put(newKey, entry);
    }

    public void clear() {
        for (Entry entry : list) {
            Node.release(entry.getValue());
        }
        list.clear();
        byKey.clear();
    }

    void copyInto(Entries target) {
        for (Entry entry : list) {
            entry.copyInto(target);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entries)) return false;
        return list.equals(((Entries) o).list);
    }

    @Override
    public int hashCode() {
        return list.hashCode();
    }

    @Override
    public String toString() {
        return list.toString();
    }
}
