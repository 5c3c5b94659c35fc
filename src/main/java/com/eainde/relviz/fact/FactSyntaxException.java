package com.eainde.relviz.fact;

import com.eainde.relviz.RelvizException;

import java.util.List;

/**
 * Source text does not conform to the fact grammar.
 *
 * <p>Positions refer to the farthest point the parser reached before every
 * alternative failed; line and column are 1-based.</p>
 */
public class FactSyntaxException extends RelvizException {

    private final int offset;
    private final int line;
    private final int column;
    private final List<String> expected;

    public FactSyntaxException(int offset, int line, int column, List<String> expected) {
        super(buildMessage(line, column, expected));
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.expected = List.copyOf(expected);
    }

    public int getOffset() { return offset; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public List<String> getExpected() { return expected; }

    private static String buildMessage(int line, int column, List<String> expected) {
        String what = expected.isEmpty() ? "end of text" : String.join(" or ", expected);
        return "Expected " + what + " (at line " + line + ", column " + column + ")";
    }
}
