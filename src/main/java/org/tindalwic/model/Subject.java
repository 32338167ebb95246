package org.tindalwic.model;

/**
 * Anything a {@link Comment} may be bound to: a key ({@link Entry}), a value
 * ({@link Node}) or the whole {@link Document}. A comment is never a subject.
 */
public interface Subject {
}
