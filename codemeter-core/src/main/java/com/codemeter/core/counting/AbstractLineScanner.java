package com.codemeter.core.counting;

import java.util.Objects;

/**
 * Base class for comment-family scanners.
 *
 * <p>Owns the outer loop, which splits the buffer into logical lines (CR, LF or CRLF, with
 * CRLF counted once), and the classification rule applied at every line end:
 * <ul>
 *   <li><b>blank</b>: no non-whitespace byte and no block comment open on the line</li>
 *   <li><b>comment</b>: no code, and a comment marker was seen or a block comment was open</li>
 *   <li><b>code</b>: everything else</li>
 * </ul>
 *
 * <p>Subclasses only decide what a non-terminator byte means through
 * {@link #consume(byte[], int, int, LineState)}. A subclass may consume a terminator byte itself
 * (an escaped newline inside a string); that byte then does not end the line.
 */
public abstract class AbstractLineScanner implements LineScanner {

    @Override
    public final FileLineStats scan(byte[] buffer, int offset, int length) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        Objects.checkFromIndexSize(offset, length, buffer.length);

        LineState state = new LineState();
        int end = offset + length;
        int pos = offset;

        while (pos < end) {
            byte b = buffer[pos];
            if (b == '\n') {
                state.endLine();
                pos++;
            } else if (b == '\r') {
                state.endLine();
                pos += (pos + 1 < end && buffer[pos + 1] == '\n') ? 2 : 1;
            } else {
                state.pending = true;
                int consumed = consume(buffer, pos, end, state);
                pos += Math.max(consumed, 1);
            }
        }

        state.finish();
        return new FileLineStats(state.totalLines, state.blankLines, state.commentLines);
    }

    /**
     * Handles the byte at {@code pos}, which is not a line terminator.
     *
     * @param buffer content
     * @param pos position of the byte to handle
     * @param end exclusive end of the scanned range
     * @param state scan state
     * @return number of bytes consumed, at least 1
     */
    protected abstract int consume(byte[] buffer, int pos, int end, LineState state);

    // ==================== Helpers for subclasses ====================

    /**
     * Returns true if {@code token} occurs at {@code pos}.
     */
    protected static boolean matches(byte[] buffer, int pos, int end, byte[] token) {
        if (pos + token.length > end) {
            return false;
        }
        for (int i = 0; i < token.length; i++) {
            if (buffer[pos + i] != token[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true for space, TAB, VT and FF.
     */
    protected static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == 0x0B || b == '\f';
    }

    /**
     * Handles a byte inside a string literal. A backslash consumes the following byte whatever
     * it is, including a line feed.
     */
    protected static int consumeStringByte(byte[] buffer, int pos, int end, LineState state) {
        byte b = buffer[pos];
        if (b == '\\') {
            return pos + 1 < end ? 2 : 1;
        }
        if (b == state.stringQuote) {
            state.stringQuote = 0;
        }
        return 1;
    }

    /**
     * Handles a byte outside comments and strings.
     *
     * @param stringsEnabled whether quotes open string literals
     */
    protected static int consumeCodeByte(byte[] buffer, int pos, LineState state, boolean stringsEnabled) {
        byte b = buffer[pos];
        if (isWhitespace(b)) {
            return 1;
        }
        if (stringsEnabled && (b == '"' || b == '\'')) {
            state.stringQuote = b;
        }
        state.markCode();
        return 1;
    }

    /**
     * Mutable state of one scan. Block comment state survives line ends; string and line
     * comment state do not.
     */
    protected static final class LineState {

        boolean inBlockComment;
        boolean inLineComment;
        byte stringQuote;

        private boolean nonWhitespace;
        private boolean code;
        private boolean comment;
        private boolean touchedBlock;
        private boolean pending;

        private long totalLines;
        private long blankLines;
        private long commentLines;

        LineState() {
        }

        public boolean inBlockComment() {
            return inBlockComment;
        }

        public boolean inLineComment() {
            return inLineComment;
        }

        public boolean inString() {
            return stringQuote != 0;
        }

        public void markCode() {
            nonWhitespace = true;
            code = true;
        }

        public void markNonWhitespace() {
            nonWhitespace = true;
        }

        public void startLineComment() {
            nonWhitespace = true;
            comment = true;
            inLineComment = true;
        }

        public void openBlockComment() {
            nonWhitespace = true;
            comment = true;
            touchedBlock = true;
            inBlockComment = true;
        }

        public void closeBlockComment() {
            nonWhitespace = true;
            comment = true;
            inBlockComment = false;
        }

        void endLine() {
            classify();
            inLineComment = false;
            stringQuote = 0;
            nonWhitespace = false;
            code = false;
            comment = false;
            pending = false;
            touchedBlock = inBlockComment;
        }

        void finish() {
            if (pending && (nonWhitespace || comment || inBlockComment)) {
                classify();
            }
        }

        private void classify() {
            totalLines++;
            if (!nonWhitespace && !touchedBlock) {
                blankLines++;
            } else if (!code && (comment || touchedBlock)) {
                commentLines++;
            }
        }
    }
}
