package ai.designerkit.analyzer.vb;

import ai.designerkit.analyzer.vb.VbToken.Kind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits VB source into logical lines of tokens. Comments ({@code '} and {@code REM}) and preprocessor lines
 * ({@code #Region}) are dropped. A line ending in {@code " _"} continues on the next one, as does a line that stops
 * inside parentheses or braces or right after a comma, an opening bracket or an operator. A colon outside brackets
 * separates statements.
 */
final class VbLexer {
    /** One logical line: the tokens of a single statement. */
    record Line(List<VbToken> tokens) {
        int start() {
            return tokens.get(0).start();
        }

        int end() {
            return tokens.get(tokens.size() - 1).end();
        }
    }

    private static final Set<String> TWO_CHAR_OPERATORS =
            Set.of("+=", "-=", "&=", "*=", "/=", "\\=", "^=", "<=", ">=", "<>", ":=", "<<", ">>");
    private static final Set<String> CONTINUING = Set.of(",", "(", "{", ".", "&", "+", "-", "*", "/", "=", "+=",
            "-=", "&=", "*=", "/=", "\\=", "^=", ":=", "<>", "<=", ">=", "<", ">");

    private final String source;
    private final List<Line> lines = new ArrayList<>();
    private List<VbToken> current = new ArrayList<>();
    private int pos;
    private int depth;
    private boolean atLineStart = true;

    private VbLexer(String source) {
        this.source = source;
    }

    static List<Line> logicalLines(String source) {
        var lexer = new VbLexer(source);
        lexer.run();
        return lexer.lines;
    }

    private void run() {
        int n = source.length();
        while (pos < n) {
            char c = source.charAt(pos);
            if (c == '\r' || c == '\n') {
                pos += (c == '\r' && pos + 1 < n && source.charAt(pos + 1) == '\n') ? 2 : 1;
                if (depth == 0 && !continuesAfterLastToken()) {
                    endStatement();
                }
                atLineStart = true;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                continue;
            }
            if (c == '\'' || c == '\u2018' || c == '\u2019' || isRemComment()) {
                skipToLineEnd();
                continue;
            }
            if (c == '#' && atLineStart) {
                skipToLineEnd();
                continue;
            }
            atLineStart = false;
            if (c == '_' && isLineContinuation()) {
                skipToLineEnd();
                if (pos < n) {
                    pos += (source.charAt(pos) == '\r' && pos + 1 < n && source.charAt(pos + 1) == '\n') ? 2 : 1;
                }
                continue;
            }
            if (c == '"') {
                lexString();
            } else if (c == '#') {
                lexDate();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < n && Character.isDigit(source.charAt(pos + 1)))) {
                lexNumber(pos);
            } else if (c == '&' && isPrefixedNumber()) {
                lexNumber(pos);
            } else if (Character.isLetter(c) || c == '_') {
                lexIdentifier();
            } else if (c == '[') {
                lexBracketedIdentifier();
            } else {
                lexPunctuation();
            }
        }
        endStatement();
    }

    private boolean continuesAfterLastToken() {
        if (current.isEmpty()) {
            return false;
        }
        var last = current.get(current.size() - 1);
        return last.kind() == Kind.PUNCTUATION && CONTINUING.contains(last.text());
    }

    private void endStatement() {
        if (!current.isEmpty()) {
            lines.add(new Line(List.copyOf(current)));
            current = new ArrayList<>();
        }
        depth = 0;
    }

    private boolean isRemComment() {
        if (!source.regionMatches(true, pos, "REM", 0, 3)) {
            return false;
        }
        boolean boundaryBefore = pos == 0 || !isIdentifierChar(source.charAt(pos - 1));
        boolean boundaryAfter = pos + 3 >= source.length() || !isIdentifierChar(source.charAt(pos + 3));
        return boundaryBefore && boundaryAfter && current.isEmpty();
    }

    /** A lone underscore preceded by whitespace with nothing but whitespace or a comment after it. */
    private boolean isLineContinuation() {
        if (pos > 0 && !Character.isWhitespace(source.charAt(pos - 1))) {
            return false;
        }
        for (int i = pos + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r' || c == '\n' || c == '\'') {
                return true;
            }
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    private void skipToLineEnd() {
        while (pos < source.length() && source.charAt(pos) != '\r' && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void lexString() {
        int start = pos;
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '"') {
                    pos += 2;
                    continue;
                }
                pos++;
                break;
            }
            if (c == '\r' || c == '\n') {
                break;
            }
            pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'c' || source.charAt(pos) == 'C')) {
            pos++;
        }
        add(Kind.STRING, source.substring(start, pos), start);
    }

    private void lexDate() {
        int start = pos;
        int close = source.indexOf('#', pos + 1);
        int lineEnd = lineEnd(pos);
        pos = close < 0 || close > lineEnd ? pos + 1 : close + 1;
        add(Kind.DATE, source.substring(start, pos), start);
    }

    private boolean isPrefixedNumber() {
        if (pos + 2 >= source.length()) {
            return false;
        }
        char radix = Character.toUpperCase(source.charAt(pos + 1));
        return (radix == 'H' || radix == 'O' || radix == 'B')
                && Character.isLetterOrDigit(source.charAt(pos + 2));
    }

    private void lexNumber(int start) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else if (c == '!' || c == '#' || c == '@' || c == '%') {
                pos++;
                break;
            } else {
                break;
            }
        }
        add(Kind.NUMBER, source.substring(start, pos), start);
    }

    private void lexIdentifier() {
        int start = pos;
        while (pos < source.length() && isIdentifierChar(source.charAt(pos))) {
            pos++;
        }
        add(Kind.IDENTIFIER, source.substring(start, pos), start);
    }

    private void lexBracketedIdentifier() {
        int start = pos;
        int close = source.indexOf(']', pos);
        if (close < 0 || close > lineEnd(pos)) {
            pos++;
            add(Kind.PUNCTUATION, "[", start);
            return;
        }
        pos = close + 1;
        current.add(new VbToken(Kind.IDENTIFIER, source.substring(start + 1, close), start, pos));
    }

    private void lexPunctuation() {
        int start = pos;
        if (pos + 1 < source.length()) {
            var two = source.substring(pos, pos + 2);
            if (TWO_CHAR_OPERATORS.contains(two)) {
                pos += 2;
                add(Kind.PUNCTUATION, two, start);
                return;
            }
        }
        char c = source.charAt(pos++);
        if (c == ':' && depth == 0) {
            endStatement();
            return;
        }
        if (c == '(' || c == '{') {
            depth++;
        } else if ((c == ')' || c == '}') && depth > 0) {
            depth--;
        }
        add(Kind.PUNCTUATION, String.valueOf(c), start);
    }

    private void add(Kind kind, String text, int start) {
        current.add(new VbToken(kind, text, start, pos));
    }

    private int lineEnd(int from) {
        int i = from;
        while (i < source.length() && source.charAt(i) != '\r' && source.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
