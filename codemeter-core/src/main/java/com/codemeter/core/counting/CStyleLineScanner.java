package com.codemeter.core.counting;

/**
 * Scanner for C-like languages: {@code //} line comments, non-nesting {@code /* *}{@code /}
 * block comments, and single- or double-quoted strings with backslash escapes.
 */
public class CStyleLineScanner extends AbstractLineScanner {

    private static final byte[] LINE_COMMENT = {'/', '/'};
    private static final byte[] BLOCK_OPEN = {'/', '*'};
    private static final byte[] BLOCK_CLOSE = {'*', '/'};

    @Override
    protected int consume(byte[] buffer, int pos, int end, LineState state) {
        if (state.inLineComment()) {
            return 1;
        }
        if (state.inBlockComment()) {
            if (matches(buffer, pos, end, BLOCK_CLOSE)) {
                state.closeBlockComment();
                return BLOCK_CLOSE.length;
            }
            if (!isWhitespace(buffer[pos])) {
                state.markNonWhitespace();
            }
            return 1;
        }
        if (state.inString()) {
            return consumeStringByte(buffer, pos, end, state);
        }
        if (matches(buffer, pos, end, LINE_COMMENT)) {
            state.startLineComment();
            return LINE_COMMENT.length;
        }
        if (matches(buffer, pos, end, BLOCK_OPEN)) {
            state.openBlockComment();
            return BLOCK_OPEN.length;
        }
        return consumeCodeByte(buffer, pos, state, true);
    }
}
