package org.tindalwic.model;

import java.util.Objects;

/**
 * A value in a Tindalwic tree: one of the closed set {@link Text}, {@link Sequence} and
 * {@link Association}, tagged by {@link #kind()}.
 * <p>
 * Every node has at most one owner (the {@link Association}, {@link Sequence} or
 * {@link Document} holding it). Inserting a node that is already owned, or one that would
 * become its own ancestor, is refused; use {@link #copy()} to duplicate a subtree.
 */
public abstract class Node implements Subject {

    /** The variant tag. */
    public enum Kind {
        TEXT,
        SEQUENCE,
        ASSOCIATION
    }

    private Subject owner;
    private int line;

    Node() {
    }

    public abstract Kind kind();

    /** Deep copy, comments included, detached from any owner. */
    public abstract Node copy();

    public boolean isText() {
        return kind() == Kind.TEXT;
    }

    public boolean isSequence() {
        return kind() == Kind.SEQUENCE;
    }

    public boolean isAssociation() {
        return kind() == Kind.ASSOCIATION;
    }

    public Text asText() {
        if (!isText()) {
            throw new IllegalStateException("expected Text but node is " + kind());
        }
        return (Text) this;
    }

    public Sequence asSequence() {
        if (!isSequence()) {
            throw new IllegalStateException("expected Sequence but node is " + kind());
        }
        return (Sequence) this;
    }

    public Association asAssociation() {
        if (!isAssociation()) {
            throw new IllegalStateException("expected Association but node is " + kind());
        }
        return (Association) this;
    }

    /** The collection or document holding this node, or {@code null} when detached. */
    public Subject getOwner() {
        return owner;
    }

    /** 1-based line where the parsed node started; 0 when built in code. */
    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    /**
     * Records {@code newOwner} as the owner of {@code child}.
     *
     * @throws IllegalArgumentException if the child is owned already or is an ancestor of
     *                                  {@code newOwner}
     */
    static <N extends Node> N claim(Subject newOwner, N child) {
        Node node = Objects.requireNonNull(child, "node");
        if (node.owner != null) {
            throw new IllegalArgumentException(node.kind() + " node already has an owner; copy() it first");
        }
        Subject cursor = newOwner;
        while (cursor instanceof Node) {
            if (cursor == node) {
                throw new IllegalArgumentException(node.kind() + " node cannot contain itself");
            }
            cursor = ((Node) cursor).owner;
        }
        node.owner = newOwner;
        return child;
    }

    static void release(Node child) {
        if (child != null) {
            child.owner = null;
        }
    }

    static Comment copyOf(Comment comment) {
        return comment == null ? null : comment.copy();
    }
}
