package org.tindalwic.parse;

import org.tindalwic.error.IndentationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The stack of open contexts. The bottom frame is always the document, which is never
 * popped; every other frame expects its children exactly one tab deeper than the line
 * that opened it.
 */
final class ContextStack {

    private static final Logger logger = LoggerFactory.getLogger(ContextStack.class);

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final int maxDepth;

    ContextStack(Frame document, int maxDepth) {
        if (document.kind() != Frame.Kind.DOCUMENT) {
            throw new IllegalArgumentException("bottom frame must be the document, got " + document);
        }
        this.maxDepth = maxDepth;
        frames.push(document);
    }

    Frame top() {
        return frames.peek();
    }

    int size() {
        return frames.size();
    }

    /**
     * Whether a line with {@code tabs} leading tabs closes the top frame. Lines indented to
     * the opening line's depth or less close it.
     */
    boolean closes(int tabs) {
        return frames.size() > 1 && tabs < frames.peek().childDepth();
    }

    void push(Frame frame) {
        if (frame.childDepth() > maxDepth) {
            SourceLine opening = frame.opening();
            throw new IndentationException("nesting deeper than " + maxDepth + " levels",
                    opening == null ? 0 : opening.number(),
                    opening == null ? -1 : opening.offset());
        }
        if (logger.isTraceEnabled()) {
            logger.trace("push {} at line {}", frame, frame.opening() == null ? 0 : frame.opening().number());
        }
        frames.push(frame);
    }

    Frame pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("the document frame is never popped");
        }
        Frame frame = frames.pop();
        logger.trace("pop {}", frame);
        return frame;
    }
}
