package dumb.cogplan;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads PDDL text into {@link Term}s. PDDL has only parentheses and symbols: names, {@code ?variables},
 * {@code :keywords}, the {@code -} of typed lists, operators and numbers. A {@code ;} starts a comment running to the
 * end of the line.
 */
public class TermParser {
    private static final int CONTEXT = 40;

    private final String text;
    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private TermParser(String text) {
        this.text = text;
    }

    public static List<Term> parse(String text) throws ParseException {
        var p = new TermParser(text);
        var terms = new ArrayList<Term>();
        while (p.skipBlank()) terms.add(p.term());
        return terms;
    }

    public static Term parseSingle(String text) throws ParseException {
        var terms = parse(text);
        if (terms.size() != 1)
            throw new ParseException("Expected exactly one expression, found " + terms.size(), text);
        return terms.get(0);
    }

    /** Drops everything from a ';' to the end of its line, keeping the line break. */
    public static String stripComments(String text) {
        return text.replaceAll(";[^\\n]*", "");
    }

    /** @return whether anything but whitespace and comments remains */
    private boolean skipBlank() {
        while (pos < text.length()) {
            var c = text.charAt(pos);
            if (c == ';') {
                while (pos < text.length() && text.charAt(pos) != '\n') advance();
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return true;
            }
        }
        return false;
    }

    private char advance() {
        var c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private Term term() throws ParseException {
        var c = text.charAt(pos);
        if (c == ')') throw fail("Unbalanced ')'");
        return c == '(' ? list() : symbol();
    }

    private Term.Lst list() throws ParseException {
        var openLine = line;
        var openCol = col;
        advance();
        var terms = new ArrayList<Term>();
        while (true) {
            if (!skipBlank())
                throw new ParseException("Unclosed '(' opened", openLine, openCol, context());
            if (text.charAt(pos) == ')') {
                advance();
                return new Term.Lst(terms);
            }
            terms.add(term());
        }
    }

    private Term.Atom symbol() throws ParseException {
        var start = pos;
        while (pos < text.length()) {
            var c = text.charAt(pos);
            if (c == '(' || c == ')' || c == ';' || Character.isWhitespace(c)) break;
            if (c == '"') throw fail("PDDL has no string literals");
            advance();
        }
        var s = text.substring(start, pos);
        if (s.equals("?")) throw fail("Variable without a name");
        return new Term.Atom(s);
    }

    private ParseException fail(String message) {
        return new ParseException(message, line, col, context());
    }

    private String context() {
        return text.substring(Math.max(0, pos - CONTEXT), Math.min(text.length(), pos + 1));
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message, String context) {
            this(message, -1, -1, context);
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var where = line < 0 ? "" : " at line " + line + ", col " + col;
            return super.getMessage() + where + (context == null || context.isEmpty() ? "" : " near '" + context + "'");
        }
    }
}
