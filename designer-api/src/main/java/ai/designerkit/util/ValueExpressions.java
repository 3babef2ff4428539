package ai.designerkit.util;

import ai.designerkit.analyzer.Dialect;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Helpers for reading numbers and strings out of raw property values without evaluating them.
 *
 * <p>Numeric fields follow one convention: find the first parenthesised argument list, as in
 * {@code new System.Drawing.Size(75, 23)}, split it on top-level commas and parse the parts positionally.
 */
public final class ValueExpressions {
    private ValueExpressions() {}

    /** Width/height or x/y read from a two-argument constructor expression. */
    public record IntPair(int first, int second) {}

    /** The comma-separated parts of the first argument list in {@code raw}, stripped; empty if there is none. */
    public static Optional<List<String>> arguments(String raw) {
        int open = indexOutsideStrings(raw, '(', 0);
        if (open < 0) {
            return Optional.empty();
        }
        var parts = new ArrayList<String>();
        int depth = 0;
        int partStart = open + 1;
        for (int i = open + 1; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '"') {
                i = skipString(raw, i);
                continue;
            }
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if ((c == ')' || c == '}' || c == ']') && depth > 0) {
                depth--;
            } else if (c == ')') {
                var last = raw.substring(partStart, i).strip();
                if (!last.isEmpty() || !parts.isEmpty()) {
                    parts.add(last);
                }
                return Optional.of(parts);
            } else if (c == ',' && depth == 0) {
                parts.add(raw.substring(partStart, i).strip());
                partStart = i + 1;
            }
        }
        return Optional.empty();
    }

    public static OptionalInt intArgument(String raw, int index) {
        var args = arguments(raw);
        if (args.isEmpty() || args.get().size() <= index) {
            return OptionalInt.empty();
        }
        return parseInt(args.get().get(index));
    }

    /** Both integers of a two-argument constructor such as {@code Size} or {@code Point}. */
    public static Optional<IntPair> intPair(String raw) {
        var first = intArgument(raw, 0);
        var second = intArgument(raw, 1);
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new IntPair(first.getAsInt(), second.getAsInt()));
    }

    public static OptionalInt parseInt(String raw) {
        var text = raw.strip();
        try {
            return OptionalInt.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public static boolean isStringLiteral(String raw) {
        var text = raw.strip();
        if (text.startsWith("@")) {
            text = text.substring(1);
        }
        return text.length() >= 2 && text.charAt(0) == '"' && text.charAt(text.length() - 1) == '"';
    }

    /**
     * The content of a string literal, with the dialect's escapes resolved ({@code ""} in both, backslash escapes in
     * regular C# literals); empty when {@code raw} is not a plain literal.
     */
    public static Optional<String> unquote(String raw, Dialect dialect) {
        if (!isStringLiteral(raw)) {
            return Optional.empty();
        }
        var text = raw.strip();
        boolean verbatim = text.startsWith("@") || dialect == Dialect.VISUAL_BASIC;
        var body = text.substring(text.startsWith("@") ? 2 : 1, text.length() - 1);
        var sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '"' && i + 1 < body.length() && body.charAt(i + 1) == '"') {
                sb.append('"');
                i++;
            } else if (c == '\\' && !verbatim && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return Optional.of(sb.toString());
    }

    private static int indexOutsideStrings(String raw, char wanted, int from) {
        for (int i = from; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '"') {
                i = skipString(raw, i);
            } else if (c == wanted) {
                return i;
            }
        }
        return -1;
    }

    /** Index of the closing quote of the literal opening at {@code quote}. */
    private static int skipString(String raw, int quote) {
        boolean backslashEscapes = quote == 0 || raw.charAt(quote - 1) != '@';
        for (int i = quote + 1; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && backslashEscapes) {
                i++;
            } else if (c == '"') {
                if (i + 1 < raw.length() && raw.charAt(i + 1) == '"') {
                    i++;
                } else {
                    return i;
                }
            }
        }
        return raw.length();
    }
}
