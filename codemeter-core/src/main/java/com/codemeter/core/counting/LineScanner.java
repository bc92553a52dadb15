package com.codemeter.core.counting;

/**
 * Streaming scanner that classifies the lines of a byte buffer for one comment family.
 *
 * <p>Implementations keep all scan state local to a call and are safe for concurrent use.
 */
public interface LineScanner {

    /**
     * Scans {@code length} bytes starting at {@code offset}.
     *
     * @param buffer content bytes (UTF-8 or any ASCII-compatible encoding)
     * @param offset first byte to scan
     * @param length number of bytes to scan
     * @return line tally
     */
    FileLineStats scan(byte[] buffer, int offset, int length);
}
