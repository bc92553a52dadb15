package com.codemeter.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads whole files into memory and normalizes their encoding.
 *
 * <p><b>Encoding handling:</b>
 * <ul>
 *   <li>UTF-8 BOM ({@code EF BB BF}): skipped, content starts after it</li>
 *   <li>UTF-16 BOM ({@code FF FE} little endian, {@code FE FF} big endian): the payload is
 *       transcoded to UTF-8 before counting</li>
 *   <li>UTF-16 payload with an odd byte count, unpaired surrogates, or too large to transcode:
 *       the view is marked non-text</li>
 *   <li>a NUL byte within the first {@value #BINARY_PROBE_LENGTH} content bytes: non-text</li>
 * </ul>
 *
 * <p>Files larger than {@value #MAX_BUFFER_SIZE} bytes do not fit in one array and are skipped
 * with a warning.
 */
public class FileLoader {

    private static final Logger log = LoggerFactory.getLogger(FileLoader.class);

    /**
     * Number of content bytes inspected by the binary heuristic.
     */
    public static final int BINARY_PROBE_LENGTH = 4096;

    /**
     * Largest file that can be loaded into a single array.
     */
    public static final long MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    /**
     * Loads and decodes a file.
     *
     * @param file file to read
     * @return decoded view; {@link FileBufferView#text()} is false if the file must not be counted
     * @throws IOException if the file cannot be opened, sized or read
     */
    public FileBufferView load(Path file) throws IOException {
        long size = Files.size(file);
        if (size > MAX_BUFFER_SIZE) {
            log.warn("Skipping {}: {} bytes exceeds the single-buffer limit", file, size);
            return FileBufferView.nonText();
        }
        if (size == 0) {
            return FileBufferView.empty();
        }

        byte[] bytes = Files.readAllBytes(file);
        FileBufferView view = decode(bytes);
        if (!view.text()) {
            log.debug("Not a text file: {}", file);
        }
        return view;
    }

    /**
     * Decodes raw file bytes.
     *
     * @param bytes whole file content
     * @return decoded view
     */
    public FileBufferView decode(byte[] bytes) {
        if (bytes.length == 0) {
            return FileBufferView.empty();
        }

        if (startsWith(bytes, UTF8_BOM)) {
            return probe(bytes, UTF8_BOM.length, bytes.length - UTF8_BOM.length);
        }

        if (bytes.length >= 2) {
            int first = bytes[0] & 0xFF;
            int second = bytes[1] & 0xFF;
            if (first == 0xFF && second == 0xFE) {
                return transcodeUtf16(bytes, StandardCharsets.UTF_16LE);
            }
            if (first == 0xFE && second == 0xFF) {
                return transcodeUtf16(bytes, StandardCharsets.UTF_16BE);
            }
        }

        return probe(bytes, 0, bytes.length);
    }

    private FileBufferView transcodeUtf16(byte[] bytes, Charset charset) {
        int payloadLength = bytes.length - 2;
        if (payloadLength == 0) {
            return FileBufferView.empty();
        }
        if ((payloadLength & 1) != 0) {
            return FileBufferView.nonText();
        }
        // One UTF-16 code unit expands to at most three UTF-8 bytes.
        if ((long) payloadLength / 2 * 3 > MAX_BUFFER_SIZE) {
            return FileBufferView.nonText();
        }

        CharsetDecoder decoder = charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes, 2, payloadLength));
            ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(chars);
            byte[] utf8 = new byte[encoded.remaining()];
            encoded.get(utf8);
            return probe(utf8, 0, utf8.length);
        } catch (CharacterCodingException e) {
            log.debug("Malformed {} payload: {}", charset, e.getMessage());
            return FileBufferView.nonText();
        }
    }

    private static FileBufferView probe(byte[] buffer, int offset, int length) {
        int limit = offset + Math.min(length, BINARY_PROBE_LENGTH);
        for (int i = offset; i < limit; i++) {
            if (buffer[i] == 0) {
                return new FileBufferView(buffer, offset, length, false);
            }
        }
        return new FileBufferView(buffer, offset, length, true);
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
