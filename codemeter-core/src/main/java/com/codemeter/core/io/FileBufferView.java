package com.codemeter.core.io;

import java.util.Objects;

/**
 * Decoded content of one file.
 *
 * <p>The content occupies {@code buffer[offset, offset + length)}. A leading byte-order mark is
 * excluded from that range; UTF-16 input has already been transcoded to UTF-8.
 *
 * @param buffer backing bytes
 * @param offset first content byte
 * @param length number of content bytes
 * @param text false if the file is binary or could not be decoded; such files are not counted
 */
public record FileBufferView(
    byte[] buffer,
    int offset,
    int length,
    boolean text
) {
    private static final byte[] NO_BYTES = new byte[0];

    /**
     * Compact constructor with validation.
     */
    public FileBufferView {
        Objects.requireNonNull(buffer, "buffer must not be null");
        Objects.checkFromIndexSize(offset, length, buffer.length);
    }

    /**
     * Returns the view of an empty file: zero length, text.
     *
     * @return empty text view
     */
    public static FileBufferView empty() {
        return new FileBufferView(NO_BYTES, 0, 0, true);
    }

    /**
     * Returns a view that marks the file as not countable.
     *
     * @return empty non-text view
     */
    public static FileBufferView nonText() {
        return new FileBufferView(NO_BYTES, 0, 0, false);
    }

    /**
     * Returns true if the content range is empty.
     *
     * @return true for zero-length content
     */
    public boolean isEmpty() {
        return length == 0;
    }
}
