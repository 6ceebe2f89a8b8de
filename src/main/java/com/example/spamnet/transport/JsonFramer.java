package com.example.spamnet.transport;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Recovers message boundaries from a stream of concatenated JSON values.
 *
 * <p>The wire carries no length prefix or delimiter, so a value ends where its
 * bracket depth returns to zero. Brackets inside string literals are ignored and
 * escape sequences are honoured. Scanner state survives between {@link #feed}
 * calls, which makes the output independent of how reads split the stream.
 * Bytes outside any top-level object or array (whitespace, newlines, stray
 * closers) are skipped.
 *
 * <p>Scanning works on raw bytes: every byte of a multi-byte UTF-8 sequence is
 * {@code >= 0x80}, so it can never be mistaken for a bracket, quote or backslash.
 *
 * <p>One instance per connection; not thread-safe.
 */
public final class JsonFramer {

    private final int maxMessageBytes;

    private byte[] buf;
    private int len;
    // Start of the value being scanned, and the scan cursor
    private int head;
    private int pos;
    private int depth;
    private boolean inString;
    private boolean escaped;

    public JsonFramer(int maxMessageBytes) {
        if (maxMessageBytes <= 0) throw new IllegalArgumentException("maxMessageBytes");
        this.maxMessageBytes = maxMessageBytes;
        this.buf = new byte[Math.min(1024, maxMessageBytes)];
    }

    /**
     * Appends {@code count} bytes and returns every message completed by them, in
     * arrival order. Bytes of an unfinished message are retained.
     *
     * @throws FramingException once an unfinished message grows past the limit;
     *                          the framer must not be used afterwards
     */
    public List<String> feed(byte[] data, int offset, int count) throws FramingException {
        append(data, offset, count);
        List<String> out = new ArrayList<>();
        while (true) {
            if (depth == 0 && !seekOpening()) {
                break;
            }
            if (!scan()) {
                break;
            }
            if (pos - head > maxMessageBytes) {
                throw new FramingException(pos - head);
            }
            out.add(new String(buf, head, pos - head, StandardCharsets.UTF_8));
            head = pos;
        }
        compact();
        if (len > maxMessageBytes) {
            throw new FramingException(len);
        }
        return out;
    }

    public List<String> feed(byte[] data) throws FramingException {
        return feed(data, 0, data.length);
    }

    /** Bytes held for a message that has not completed yet. */
    public int pendingBytes() {
        return len;
    }

    /** Drops any partial message, e.g. when the peer closes mid-message. */
    public void reset() {
        len = 0;
        head = 0;
        pos = 0;
        depth = 0;
        inString = false;
        escaped = false;
    }

    /** Skips bytes up to the next top-level opening bracket. */
    private boolean seekOpening() {
        while (pos < len) {
            byte b = buf[pos];
            if (b == '{' || b == '[') {
                head = pos;
                pos++;
                depth = 1;
                return true;
            }
            pos++;
        }
        head = pos;
        return false;
    }

    /** Advances the scan; true when the value starting at {@code head} is complete. */
    private boolean scan() {
        while (pos < len) {
            byte b = buf[pos++];
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (b == '\\') {
                    escaped = true;
                } else if (b == '"') {
                    inString = false;
                }
                continue;
            }
            if (b == '"') {
                inString = true;
            } else if (b == '{' || b == '[') {
                depth++;
            } else if (b == '}' || b == ']') {
                depth--;
                if (depth == 0) {
                    return true;
                }
            }
        }
        return false;
    }

    private void compact() {
        if (head == 0) return;
        int rest = len - head;
        System.arraycopy(buf, head, buf, 0, rest);
        len = rest;
        pos -= head;
        head = 0;
    }

    private void append(byte[] data, int off, int count) {
        int needed = len + count;
        if (needed > buf.length) {
            buf = Arrays.copyOf(buf, Math.max(needed, buf.length * 2));
        }
        System.arraycopy(data, off, buf, len, count);
        len = needed;
    }

    public static class FramingException extends Exception {
        public final int sizeBytes;

        public FramingException(int sizeBytes) {
            super("Frame too large: " + sizeBytes);
            this.sizeBytes = sizeBytes;
        }
    }
}
