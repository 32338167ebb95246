package org.tindalwic.parse;

import org.tindalwic.encode.Forms;
import org.tindalwic.error.IndentationException;
import org.tindalwic.error.RequiresLongFormException;
import org.tindalwic.error.UnterminatedContextException;

/**
 * Decides the {@link LineKind} of a line outside text and comment contexts by looking
 * only at the first byte (or two) after the indentation, plus the last byte of bracket
 * openers. Decisions are final once made.
 */
public final class LineClassifier {

    private LineClassifier() {
    }

    /**
     * @param line  the physical line
     * @param depth the indentation the enclosing context expects for its children
     * @throws IndentationException         for extra tabs or non-tab whitespace in the indentation
     * @throws RequiresLongFormException    for a lone leading {@code '/'}
     * @throws UnterminatedContextException for an opening bracket without its closing byte
     */
    public static ClassifiedLine classify(SourceLine line, int depth) {
        int tabs = line.tabs();
        if (tabs > depth) {
            throw new IndentationException(
                    "indented by " + tabs + " tabs where the context allows " + depth,
                    line.number(), line.offsetOf(depth));
        }
        if (tabs < depth) {
            throw new IllegalArgumentException("line " + line.number() + " belongs to an outer context");
        }
        String rest = line.text().substring(depth);
        if (Forms.isBlank(rest)) {
            return new ClassifiedLine(LineKind.BLANK, line, depth, null, null, depth);
        }
        char first = rest.charAt(0);
        if (Forms.isInlineWhitespace(first)) {
            throw new IndentationException("indentation must use tabs only", line.number(), line.offsetOf(depth));
        }
        switch (first) {
            case '#':
                if (line.number() == 1 && depth == 0 && rest.startsWith("#!")) {
                    return new ClassifiedLine(LineKind.HASHBANG, line, depth, null, rest.substring(2), depth + 2);
                }
                return new ClassifiedLine(LineKind.COMMENT, line, depth, null, rest.substring(1), depth + 1);
            case '/':
                if (rest.startsWith("//")) {
                    return new ClassifiedLine(LineKind.KEY_COMMENT, line, depth, null, rest.substring(2), depth + 2);
                }
                throw new RequiresLongFormException(
                        "a line may not start with a single '/'; use the <> form", line.number(), line.offsetOf(depth));
            case '<':
                return bracket(line, depth, rest, '>', LineKind.TEXT_OPEN);
            case '[':
                return bracket(line, depth, rest, ']', LineKind.SEQUENCE_OPEN);
            case '{':
                return bracket(line, depth, rest, '}', LineKind.ASSOCIATION_OPEN);
            default:
                int assign = rest.indexOf('=');
                if (assign < 0) {
                    return new ClassifiedLine(LineKind.PLAIN, line, depth, null, rest, depth);
                }
                return keyValue(line, depth, rest, assign);
        }
    }

    private static ClassifiedLine bracket(SourceLine line, int depth, String rest, char close, LineKind kind) {
        if (rest.length() < 2 || rest.charAt(rest.length() - 1) != close) {
            throw new UnterminatedContextException(
                    "'" + rest.charAt(0) + "' opening must end with '" + close + "'",
                    line.number(), line.offsetOf(line.text().length()));
        }
        return new ClassifiedLine(kind, line, depth, rest.substring(1, rest.length() - 1), null, depth + 1);
    }

    // spaces and tabs around the first '=' are layout, not content
    private static ClassifiedLine keyValue(SourceLine line, int depth, String rest, int assign) {
        int keyEnd = assign;
        while (keyEnd > 0 && isPadding(rest.charAt(keyEnd - 1))) {
            keyEnd--;
        }
        int valueStart = assign + 1;
        while (valueStart < rest.length() && isPadding(rest.charAt(valueStart))) {
            valueStart++;
        }
        return new ClassifiedLine(LineKind.KEY_VALUE, line, depth,
                rest.substring(0, keyEnd), rest.substring(valueStart), depth + valueStart);
    }

    private static boolean isPadding(char c) {
        return c == ' ' || c == '\t';
    }
}
