package com.eainde.relviz.fact;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read position over fact source text with save/restore for backtracking.
 *
 * <p>Every failed expectation is recorded; only those at the farthest offset
 * reached are kept, and they become the message of the final
 * {@link FactSyntaxException} when no alternative matches.</p>
 */
final class SourceCursor {

    static final char EOF = '\uFFFF';

    private final String text;
    private int pos;

    private int farthest = -1;
    private final Set<String> expected = new LinkedHashSet<>();

    SourceCursor(String text) {
        this.text = text;
    }

    int position() {
        return pos;
    }

    void reset(int position) {
        this.pos = position;
    }

    boolean atEnd() {
        return pos >= text.length();
    }

    char peek() {
        return atEnd() ? EOF : text.charAt(pos);
    }

    boolean peek(char c) {
        return !atEnd() && text.charAt(pos) == c;
    }

    boolean startsWith(String prefix) {
        return text.startsWith(prefix, pos);
    }

    char next() {
        return text.charAt(pos++);
    }

    void advance(int count) {
        pos += count;
    }

    boolean atLinearWhitespace() {
        char c = peek();
        return c == ' ' || c == '\t';
    }

    void skipLinearWhitespace() {
        while (atLinearWhitespace()) {
            pos++;
        }
    }

    String slice(int from, int to) {
        return text.substring(from, to);
    }

    /**
     * Records that {@code what} was expected at the current position.
     *
     * @return always null, so rules can {@code return cursor.fail(...)}
     */
    <T> T fail(String what) {
        return failAt(pos, what);
    }

    <T> T failAt(int offset, String what) {
        if (offset > farthest) {
            farthest = offset;
            expected.clear();
        }
        if (offset == farthest) {
            expected.add(what);
        }
        return null;
    }

    FactSyntaxException syntaxError() {
        int offset = Math.max(farthest, 0);
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new FactSyntaxException(offset, line, offset - lineStart + 1, new ArrayList<>(expected));
    }
}
