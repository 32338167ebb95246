package org.tindalwic.parse;

/**
 * Lexical kinds, decided from the first bytes after the indentation.
 */
public enum LineKind {
    /** Empty (or whitespace only) after the indentation. */
    BLANK,
    /** {@code #!} on the first line of a document. */
    HASHBANG,
    /** {@code #} comment. */
    COMMENT,
    /** {@code //} key comment. */
    KEY_COMMENT,
    /** {@code <key>} or {@code <>}: long-form string. */
    TEXT_OPEN,
    /** {@code [key]} or {@code []}: linear array. */
    SEQUENCE_OPEN,
    /** <code>{key}</code> or <code>{}</code>: associative array. */
    ASSOCIATION_OPEN,
    /** {@code key=value} on one line. */
    KEY_VALUE,
    /** Anything else: a bare string, only meaningful in a linear array. */
    PLAIN;

    public boolean opensContext() {
        return this == TEXT_OPEN || this == SEQUENCE_OPEN || this == ASSOCIATION_OPEN;
    }
}
