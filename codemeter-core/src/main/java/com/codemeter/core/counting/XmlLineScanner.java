package com.codemeter.core.counting;

/**
 * Scanner for markup: {@code <!-- -->} block comments only. Quotes carry no meaning because
 * markup has no escaping.
 */
public class XmlLineScanner extends AbstractLineScanner {

    private static final byte[] BLOCK_OPEN = {'<', '!', '-', '-'};
    private static final byte[] BLOCK_CLOSE = {'-', '-', '>'};

    @Override
    protected int consume(byte[] buffer, int pos, int end, LineState state) {
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
        if (matches(buffer, pos, end, BLOCK_OPEN)) {
            state.openBlockComment();
            return BLOCK_OPEN.length;
        }
        return consumeCodeByte(buffer, pos, state, false);
    }
}
