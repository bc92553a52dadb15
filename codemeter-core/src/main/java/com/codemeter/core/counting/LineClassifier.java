package com.codemeter.core.counting;

import com.codemeter.core.io.FileBufferView;
import com.codemeter.core.language.CommentFamily;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatches line classification to the scanner of a {@link CommentFamily}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LineClassifier classifier = new LineClassifier();
 * FileLineStats stats = classifier.classify(CommentFamily.C_STYLE, view);
 * }</pre>
 */
public final class LineClassifier {

    private final Map<CommentFamily, LineScanner> scanners;

    /**
     * Creates a classifier with one scanner per family.
     */
    public LineClassifier() {
        Map<CommentFamily, LineScanner> map = new EnumMap<>(CommentFamily.class);
        map.put(CommentFamily.C_STYLE, new CStyleLineScanner());
        map.put(CommentFamily.HASH, new LineCommentScanner("#"));
        map.put(CommentFamily.DOUBLE_DASH, new LineCommentScanner("--"));
        map.put(CommentFamily.SEMICOLON, new LineCommentScanner(";"));
        map.put(CommentFamily.PERCENT, new LineCommentScanner("%"));
        map.put(CommentFamily.XML, new XmlLineScanner());
        map.put(CommentFamily.NONE, LineCommentScanner.withoutComments());
        this.scanners = map;
    }

    /**
     * Returns the scanner used for a family.
     *
     * @param family comment family
     * @return scanner
     */
    public LineScanner scannerFor(CommentFamily family) {
        return scanners.get(Objects.requireNonNull(family, "family must not be null"));
    }

    /**
     * Classifies the content of a decoded file.
     *
     * @param family comment family of the file's language
     * @param view decoded content; must be text
     * @return line tally
     */
    public FileLineStats classify(CommentFamily family, FileBufferView view) {
        if (!view.text()) {
            throw new IllegalArgumentException("cannot classify lines of a non-text buffer");
        }
        return classify(family, view.buffer(), view.offset(), view.length());
    }

    /**
     * Classifies a byte range.
     *
     * @param family comment family
     * @param buffer content bytes
     * @param offset first byte
     * @param length number of bytes
     * @return line tally
     */
    public FileLineStats classify(CommentFamily family, byte[] buffer, int offset, int length) {
        if (length == 0) {
            return FileLineStats.EMPTY;
        }
        return scannerFor(family).scan(buffer, offset, length);
    }
}
