package com.eainde.relviz.fact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses fact-language source text into an ordered list of {@link Fact}s.
 *
 * <h3>Grammar</h3>
 * <pre>
 * source     := ( fact | blank-line )* end
 * fact       := objects | relations | objects-with-relation     (ordered choice)
 * objects    := NAME names NL attributes
 * relations  := names [label] NAME [label] names NL attributes
 * objects-with-relation
 *            := NAME names [label] NAME [label] names NL attributes
 * names      := NAME ( "," NAME )*
 * attributes := ( INDENT ATTR-NAME ":" VALUE NL | blank-line )*
 * NL         := [ "#" comment ] [ CR ] LF
 * </pre>
 *
 * <p>Linear whitespace (space, tab) separates tokens; a line break never does.
 * Indentation before a fact header is skipped. An indented line right after
 * a fact is read as an attribute first and only becomes a fact of its own when
 * it has no {@code :}. The three fact forms share a prefix, so each alternative is tried from the same saved position and the
 * first one that parses through its attribute block wins.</p>
 *
 * <p>Parsing is all-or-nothing: the first mismatch that no alternative can
 * get past raises {@link FactSyntaxException}. Instances hold no state and
 * may be shared between threads.</p>
 */
public class FactParser {

    private static final String NAME_STOP = " \t\r\n#\",";
    private static final String ATTRIBUTE_NAME_STOP = NAME_STOP + ":";
    private static final String VALUE_STOP = "\r\n#\"";
    private static final String TRIPLE_QUOTE = "\"\"\"";

    public List<Fact> parse(String source) {
        SourceCursor in = new SourceCursor(source == null ? "" : source);
        List<Fact> facts = new ArrayList<>();
        while (!in.atEnd()) {
            int start = in.position();
            List<Fact> declared = fact(in);
            if (declared != null) {
                facts.addAll(declared);
                continue;
            }
            in.reset(start);
            if (!newline(in)) {
                break;
            }
        }
        while (!in.atEnd() && Character.isWhitespace(in.peek())) {
            in.advance(1);
        }
        if (!in.atEnd()) {
            in.fail("end of text");
            throw in.syntaxError();
        }
        return Collections.unmodifiableList(facts);
    }

    // =========================================================================
    //  Fact forms
    // =========================================================================

    private List<Fact> fact(SourceCursor in) {
        int start = in.position();
        List<Fact> facts = objects(in);
        if (facts == null) {
            in.reset(start);
            facts = relations(in);
        }
        if (facts == null) {
            in.reset(start);
            facts = objectsWithRelation(in);
        }
        return facts;
    }

    private List<Fact> objects(SourceCursor in) {
        String type = name(in);
        if (type == null) return null;
        List<String> names = names(in);
        if (names == null || !newline(in)) return null;

        Map<String, String> attrs = attributes(in);
        List<Fact> facts = new ArrayList<>(names.size());
        for (String name : names) {
            facts.add(new ObjectFact(type, name, attrs));
        }
        return facts;
    }

    private List<Fact> relations(SourceCursor in) {
        RelationHeader header = relationHeader(in);
        if (header == null) return null;

        Map<String, String> attrs = attributes(in);
        List<Fact> facts = new ArrayList<>(header.lhss().size() * header.rhss().size());
        header.expand(attrs, facts);
        return facts;
    }

    private List<Fact> objectsWithRelation(SourceCursor in) {
        String type = name(in);
        if (type == null) return null;
        RelationHeader header = relationHeader(in);
        if (header == null) return null;

        // the attribute block describes the objects, the implied relations get none
        Map<String, String> attrs = attributes(in);
        List<Fact> facts = new ArrayList<>();
        for (String name : header.lhss()) {
            facts.add(new ObjectFact(type, name, attrs));
        }
        header.expand(Map.of(), facts);
        return facts;
    }

    /** {@code names [label] NAME [label] names NL} */
    private RelationHeader relationHeader(SourceCursor in) {
        List<String> lhss = names(in);
        if (lhss == null) return null;
        String lhsLabel = label(in);
        String rel = name(in);
        if (rel == null) return null;
        String rhsLabel = label(in);
        List<String> rhss = names(in);
        if (rhss == null || !newline(in)) return null;
        return new RelationHeader(lhss, lhsLabel, rel, rhsLabel, rhss);
    }

    private record RelationHeader(List<String> lhss, String lhsLabel, String rel,
                                  String rhsLabel, List<String> rhss) {

        void expand(Map<String, String> attrs, List<Fact> into) {
            for (String lhs : lhss) {
                for (String rhs : rhss) {
                    into.add(new RelationFact(lhs, lhsLabel, rel, rhsLabel, rhs, attrs));
                }
            }
        }
    }

    // =========================================================================
    //  Attribute block
    // =========================================================================

    private Map<String, String> attributes(SourceCursor in) {
        Map<String, String> attrs = new LinkedHashMap<>();
        while (!in.atEnd()) {
            int start = in.position();
            if (attribute(in, attrs)) continue;
            in.reset(start);
            if (newline(in)) continue;
            in.reset(start);
            break;
        }
        return attrs;
    }

    private boolean attribute(SourceCursor in, Map<String, String> attrs) {
        if (!in.atLinearWhitespace()) {
            in.fail("indented attribute");
            return false;
        }
        String key = name(in, ATTRIBUTE_NAME_STOP, "attribute name");
        if (key == null) return false;
        in.skipLinearWhitespace();
        if (!in.peek(':')) {
            in.fail("':'");
            return false;
        }
        in.advance(1);
        String value = attributeValue(in);
        if (value == null || !newline(in)) return false;
        attrs.put(key, value);
        return true;
    }

    /** Rest of the line up to a comment, trailing blanks dropped; or a quoted string. */
    private String attributeValue(SourceCursor in) {
        in.skipLinearWhitespace();
        int start = in.position();
        int end = start;
        while (!in.atEnd() && VALUE_STOP.indexOf(in.peek()) < 0) {
            char c = in.next();
            if (c != ' ' && c != '\t') {
                end = in.position();
            }
        }
        if (end > start) {
            in.reset(end);
            return in.slice(start, end);
        }
        in.reset(start);
        String value = quoted(in);
        return value != null ? value : in.fail("attribute value");
    }

    // =========================================================================
    //  Tokens
    // =========================================================================

    private List<String> names(SourceCursor in) {
        String first = name(in);
        if (first == null) return null;
        List<String> names = new ArrayList<>();
        names.add(first);
        while (true) {
            int mark = in.position();
            in.skipLinearWhitespace();
            if (!in.peek(',')) {
                in.reset(mark);
                return names;
            }
            in.advance(1);
            String next = name(in);
            if (next == null) {
                in.reset(mark);
                return names;
            }
            names.add(next);
        }
    }

    private String name(SourceCursor in) {
        return name(in, NAME_STOP, "name");
    }

    private String name(SourceCursor in, String stop, String what) {
        in.skipLinearWhitespace();
        int start = in.position();
        while (!in.atEnd() && stop.indexOf(in.peek()) < 0) {
            in.advance(1);
        }
        if (in.position() > start) {
            return in.slice(start, in.position());
        }
        String quoted = quoted(in);
        return quoted != null ? quoted : in.fail(what);
    }

    /** {@code """…"""} (may span lines) or {@code "…"} (single line). */
    private String quoted(SourceCursor in) {
        if (in.startsWith(TRIPLE_QUOTE)) {
            String value = tripleQuoted(in);
            if (value != null) return value;
        }
        return in.peek('"') ? singleQuoted(in) : null;
    }

    private String tripleQuoted(SourceCursor in) {
        int start = in.position();
        in.advance(TRIPLE_QUOTE.length());
        StringBuilder sb = new StringBuilder();
        while (!in.atEnd()) {
            if (in.startsWith(TRIPLE_QUOTE)) {
                in.advance(TRIPLE_QUOTE.length());
                return sb.toString();
            }
            char c = in.next();
            if (c == '\\' && !in.atEnd()) {
                sb.append(unescape(in.next()));
            } else {
                sb.append(c);
            }
        }
        in.fail("closing " + TRIPLE_QUOTE);
        in.reset(start);
        return null;
    }

    private String singleQuoted(SourceCursor in) {
        int start = in.position();
        in.advance(1);
        StringBuilder sb = new StringBuilder();
        while (!in.atEnd() && !in.peek('\n') && !in.peek('\r')) {
            char c = in.next();
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                if (in.atEnd() || in.peek('\n') || in.peek('\r')) break;
                sb.append(unescape(in.next()));
            } else {
                sb.append(c);
            }
        }
        in.fail("closing '\"'");
        in.reset(start);
        return null;
    }

    /**
     * Optional parenthetical end label; absent or malformed leaves the position
     * untouched, and {@code ()} is consumed but gives no label.
     */
    private String label(SourceCursor in) {
        int start = in.position();
        in.skipLinearWhitespace();
        if (!in.peek('(')) {
            in.reset(start);
            return null;
        }
        in.advance(1);
        StringBuilder sb = new StringBuilder();
        while (!in.atEnd()) {
            char c = in.next();
            if (c == ')') {
                return sb.length() == 0 ? null : sb.toString();
            }
            if (c == '\\' && !in.atEnd()) {
                sb.append(unescape(in.next()));
            } else {
                sb.append(c);
            }
        }
        in.fail("closing ')'");
        in.reset(start);
        return null;
    }

    /** {@code [ "#" comment ] [ CR ] LF}, after optional linear whitespace. */
    private boolean newline(SourceCursor in) {
        int start = in.position();
        in.skipLinearWhitespace();
        if (in.peek('#')) {
            while (!in.atEnd() && !in.peek('\n')) {
                in.advance(1);
            }
        }
        if (in.peek('\r')) {
            in.advance(1);
        }
        if (in.peek('\n')) {
            in.advance(1);
            return true;
        }
        in.fail("newline");
        in.reset(start);
        return false;
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case 'f': return '\f';
            default:  return c;
        }
    }
}
