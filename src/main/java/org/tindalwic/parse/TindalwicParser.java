package org.tindalwic.parse;

import org.tindalwic.TindalwicConfig;
import org.tindalwic.error.EncodingException;
import org.tindalwic.error.TindalwicException;
import org.tindalwic.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Whole-document parser: classifier, context stack, comment attachment and tree builder
 * driven line by line.
 * <p>
 * A parse either returns the complete tree or throws the first error it meets; there are
 * no partial results. The class is stateless and safe for concurrent use, each call owns
 * its own stack and tree.
 */
public final class TindalwicParser {

    private static final Logger logger = LoggerFactory.getLogger(TindalwicParser.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private TindalwicParser() {
    }

    public static Document parse(byte[] bytes) {
        return parse(bytes, TindalwicConfig.defaults());
    }

    public static Document parse(byte[] bytes, TindalwicConfig config) {
        int start = 0;
        if (hasUtf8Bom(bytes)) {
            if (config.getByteOrderMark() == TindalwicConfig.ByteOrderMark.REJECT) {
                throw new EncodingException("byte order mark is not allowed", 1, 0);
            }
            start = UTF8_BOM.length;
        }
        try {
            List<SourceLine> lines = SourceLine.split(bytes, start);
            Document document = parse(lines, config.getMaxDepth());
            logger.debug("Parsed {} lines into {} top-level entries", lines.size(), document.size());
            return document;
        } catch (TindalwicException e) {
            logger.debug("Parse failed: {}", e.getMessage());
            throw e;
        }
    }

    private static Document parse(List<SourceLine> lines, int maxDepth) {
        Document document = new Document();
        Frame root = Frame.document(document);
        ContextStack stack = new ContextStack(root, maxDepth);
        TreeBuilder builder = new TreeBuilder(stack);

        for (SourceLine line : lines) {
            int tabs = line.tabs();
            Frame top = stack.top();
            if (top.isTerminal() && tabs >= top.childDepth()) {
                builder.append(top, line);
                continue;
            }
            while (stack.closes(tabs)) {
                Frame closed = stack.pop();
                builder.close(closed, stack.top());
            }
            Frame container = stack.top();
            builder.accept(container, LineClassifier.classify(line, container.childDepth()));
        }
        // end of input closes everything down to the document
        while (stack.size() > 1) {
            Frame closed = stack.pop();
            builder.close(closed, stack.top());
        }
        builder.finish(root);
        return document;
    }

    private static boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= 3 && bytes[0] == UTF8_BOM[0] && bytes[1] == UTF8_BOM[1] && bytes[2] == UTF8_BOM[2];
    }
}
