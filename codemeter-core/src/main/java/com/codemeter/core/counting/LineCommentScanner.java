package com.codemeter.core.counting;

import java.nio.charset.StandardCharsets;

/**
 * Scanner for languages with a single line-comment prefix ({@code #}, {@code --}, {@code ;},
 * {@code %}) and quoted strings.
 *
 * <p>With a {@code null} prefix no comments are recognized at all, which is how languages
 * without comment syntax are counted.
 */
public class LineCommentScanner extends AbstractLineScanner {

    private final byte[] prefix;

    /**
     * Creates a scanner for the given comment prefix.
     *
     * @param prefix line comment prefix, or {@code null} to disable comment recognition
     */
    public LineCommentScanner(String prefix) {
        if (prefix != null && prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix must not be empty");
        }
        this.prefix = prefix == null ? null : prefix.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Returns a scanner that recognizes no comments.
     *
     * @return comment-less scanner
     */
    public static LineCommentScanner withoutComments() {
        return new LineCommentScanner(null);
    }

    /**
     * Returns true if this scanner recognizes a comment prefix.
     *
     * @return true unless comments are disabled
     */
    public boolean recognizesComments() {
        return prefix != null;
    }

    @Override
    protected int consume(byte[] buffer, int pos, int end, LineState state) {
        if (state.inLineComment()) {
            return 1;
        }
        if (state.inString()) {
            return consumeStringByte(buffer, pos, end, state);
        }
        if (prefix != null && matches(buffer, pos, end, prefix)) {
            state.startLineComment();
            return prefix.length;
        }
        return consumeCodeByte(buffer, pos, state, true);
    }
}
