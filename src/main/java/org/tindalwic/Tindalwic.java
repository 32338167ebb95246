package org.tindalwic;

import org.tindalwic.encode.CanonicalEncoder;
import org.tindalwic.error.EncodingException;
import org.tindalwic.model.Document;
import org.tindalwic.parse.TindalwicParser;

/**
 * Entry points for parsing and encoding whole documents.
 */
public final class Tindalwic {

    private Tindalwic() {
    }

    public static Document parse(byte[] bytes) {
        return TindalwicParser.parse(bytes);
    }

    public static Document parse(byte[] bytes, TindalwicConfig config) {
        return TindalwicParser.parse(bytes, config);
    }

    /**
     * @throws EncodingException if the string holds an unpaired surrogate
     */
    public static Document parse(String text) {
        return parse(CanonicalEncoder.toUtf8(text), TindalwicConfig.defaults());
    }

    public static Document parse(String text, TindalwicConfig config) {
        return parse(CanonicalEncoder.toUtf8(text), config);
    }

    public static String encode(Document document) {
        return CanonicalEncoder.encode(document);
    }

    public static byte[] encodeBytes(Document document) {
        return CanonicalEncoder.encodeBytes(document);
    }
}
