package org.tindalwic;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Parser settings, read from a plain properties file or built in code.
 * <p>
 * Every property known to this configuration is prefixed with {@link #ROOT}. Unknown
 * properties are ignored; a known property with an unusable value is refused up front.
 */
public class TindalwicConfig {

    /**
     * Every property known to this configuration is prefixed with this value.
     */
    public static final String ROOT = "tindalwic.";

    /**
     * Maximum nesting depth of arrays, text blocks and comments. Default {@value #DEFAULT_MAX_DEPTH}.
     */
    public static final String MAX_DEPTH = ROOT + "parse.maxDepth";

    /**
     * What to do with a leading UTF-8 byte order mark: {@code REJECT} or {@code STRIP}.
     */
    public static final String BYTE_ORDER_MARK = ROOT + "parse.byteOrderMark";

    public static final int DEFAULT_MAX_DEPTH = 1000;

    public enum ByteOrderMark {
        REJECT,
        STRIP
    }

    private int maxDepth = DEFAULT_MAX_DEPTH;
    private ByteOrderMark byteOrderMark = ByteOrderMark.REJECT;

    public static TindalwicConfig defaults() {
        return new TindalwicConfig();
    }

    /**
     * @throws IllegalArgumentException if a known property holds an unusable value
     */
    public static TindalwicConfig fromProperties(Properties props) {
        TindalwicConfig config = new TindalwicConfig();
        String depth = props.getProperty(MAX_DEPTH);
        if (depth != null) {
            try {
                config.setMaxDepth(Integer.parseInt(depth.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(MAX_DEPTH + " is not a number: " + depth, e);
            }
        }
        String bom = props.getProperty(BYTE_ORDER_MARK);
        if (bom != null) {
            try {
                config.setByteOrderMark(ByteOrderMark.valueOf(bom.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(BYTE_ORDER_MARK + " must be REJECT or STRIP: " + bom, e);
            }
        }
        return config;
    }

    public static TindalwicConfig load(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(in);
        return fromProperties(props);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException(MAX_DEPTH + " must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public ByteOrderMark getByteOrderMark() {
        return byteOrderMark;
    }

    public void setByteOrderMark(ByteOrderMark byteOrderMark) {
        if (byteOrderMark == null) {
            throw new IllegalArgumentException(BYTE_ORDER_MARK + " must not be null");
        }
        this.byteOrderMark = byteOrderMark;
    }

    @Override
    public String toString() {
        return "TindalwicConfig{maxDepth=" + maxDepth + ", byteOrderMark=" + byteOrderMark + "}";
    }
}
