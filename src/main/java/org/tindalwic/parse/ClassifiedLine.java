package org.tindalwic.parse;

/**
 * The outcome of {@link LineClassifier#classify(SourceLine, int)}.
 */
public final class ClassifiedLine {

    private final LineKind kind;
    private final SourceLine line;
    private final int indent;
    private final String key;
    private final String text;
    private final int textIndex;

    ClassifiedLine(LineKind kind, SourceLine line, int indent, String key, String text, int textIndex) {
        this.kind = kind;
        this.line = line;
        this.indent = indent;
        this.key = key;
        this.text = text;
        this.textIndex = textIndex;
    }

    public LineKind kind() {
        return kind;
    }

    public SourceLine line() {
        return line;
    }

    public int indent() {
        return indent;
    }

    /** Bracketed text of an opener, or the trimmed key of {@code key=value}; otherwise {@code null}. */
    public String key() {
        return key;
    }

    /**
     * Comment text after the marker, the trimmed value of {@code key=value}, or the whole
     * remainder of a plain line; otherwise {@code null}.
     */
    public String text() {
        return text;
    }

    /** Character index of {@link #text()} within the physical line. */
    public int textIndex() {
        return textIndex;
    }

    /** Everything after the indentation, untouched. */
    public String content() {
        return line.text().substring(indent);
    }

    /** Byte offset of the first character after the indentation. */
    public long offset() {
        return line.offsetOf(indent);
    }

    @Override
    public String toString() {
        return kind + "@" + line.number();
    }
}
