package ai.bigo.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. Tree-sitter reports positions as UTF-8 byte offsets, so every
 * slice of node text goes through here rather than through {@link String#substring}.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char UTF8_BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;
    private final int byteLength;

    private SourceContent(String text, byte[] utf8Bytes, int byteLength) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.byteLength = byteLength;
    }

    /**
     * Creates a SourceContent wrapper for the provided source text. A leading byte-order mark is dropped so that
     * offsets line up with what the parser sees.
     */
    public static SourceContent of(String src) {
        var stripped = !src.isEmpty() && src.charAt(0) == UTF8_BOM ? src.substring(1) : src;
        byte[] bytes = stripped.getBytes(StandardCharsets.UTF_8);
        return new SourceContent(stripped, bytes, bytes.length);
    }

    /**
     * Safely extracts a substring using UTF-8 byte offsets [startByte, endByte).
     *
     * Behavior:
     *  - If startByte < 0 or endByte < startByte, returns empty string and logs a warning.
     *  - If startByte >= underlying byte length returns empty string and logs a warning.
     *  - If endByte > byte length, endByte is truncated to byte length (logs at debug).
     *  - Zero-length ranges return the empty string.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    byteLength,
                    startByte,
                    endByte);
            return "";
        }

        if (startByte >= byteLength) {
            if (startByte > byteLength) {
                log.warn("Start byte offset {} exceeds source byte length {}", startByte, byteLength);
            }
            return "";
        }

        if (endByte > byteLength) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, byteLength);
            endByte = byteLength;
        }

        int len = endByte - startByte;
        if (len == 0) return "";

        return new String(utf8Bytes, startByte, len, StandardCharsets.UTF_8);
    }

    /** Extracts the text covered by a node. */
    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return byteLength;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (SourceContent) obj;
        return Objects.equals(this.text, that.text) && Arrays.equals(this.utf8Bytes, that.utf8Bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, Arrays.hashCode(utf8Bytes));
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + byteLength + ']';
    }
}
