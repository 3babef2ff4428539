package ai.designerkit.analyzer.csharp;

import ai.designerkit.analyzer.ManagedRegions;
import ai.designerkit.analyzer.RegionLocator;
import ai.designerkit.analyzer.TextRange;
import ai.designerkit.util.SourceFiles;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates {@code InitializeComponent}'s braces and the field declarations that follow the method (after
 * {@code #endregion} when present). The field block is one contiguous run of initializer-free field lines; a blank
 * line after the first field ends it, so hand-written members further down are left alone. Searches run over a masked copy of the text in which comments and string or
 * character literals are blanked out, so braces and keywords inside them are never matched.
 */
public final class CSharpRegionLocator implements RegionLocator {
    private static final Pattern METHOD_HEADER = Pattern.compile("\\bvoid\\s+InitializeComponent\\s*\\(\\s*\\)");
    private static final Pattern END_REGION = Pattern.compile("(?m)^[ \\t]*#endregion\\b");
    static final Pattern FIELD_LINE = Pattern.compile("^\\s*(?:\\[[^\\]]*\\]\\s*)*"
            + "(?:(?:private|protected|internal|public|readonly|static|new|volatile)\\s+)*"
            + "(?!return\\b|throw\\b|else\\b|await\\b|goto\\b|yield\\b|using\\b)"
            + "[\\w.]+(?:<[^;=()]*>)?(?:\\[\\s*\\])*\\??\\s+\\w+(?:\\s*,\\s*\\w+)*\\s*;\\s*$");
    private static final String INDENT_UNIT = "    ";

    @Override
    public Optional<ManagedRegions> locate(String source) {
        var masked = mask(source);
        var header = METHOD_HEADER.matcher(masked);
        if (!header.find()) {
            return Optional.empty();
        }
        int open = header.end();
        while (open < masked.length() && Character.isWhitespace(masked.charAt(open))) {
            open++;
        }
        if (open >= masked.length() || masked.charAt(open) != '{') {
            return Optional.empty();
        }
        int[] match = matchBraces(masked);
        int close = match[open];
        if (close < 0) {
            return Optional.empty();
        }
        int typeOpen = enclosingOpenBrace(masked, match, open, close);
        if (typeOpen < 0) {
            return Optional.empty();
        }
        int typeClose = match[typeOpen];

        var memberIndent = RegionLocator.indentationAt(source, header.start());
        var closingIndent = onlyWhitespaceBefore(source, close) ? RegionLocator.indentationAt(source, close) : memberIndent;
        var statementIndent = firstLineIndent(source, masked, open + 1, close).orElse(closingIndent + INDENT_UNIT);

        int anchorEnd = close + 1;
        var endRegion = END_REGION.matcher(masked);
        endRegion.region(close + 1, typeClose);
        if (endRegion.find()) {
            anchorEnd = endRegion.end();
        }
        int fieldStart = RegionLocator.nextLineStart(source, anchorEnd);
        if (fieldStart > typeClose) {
            fieldStart = close + 1;
        }
        int fieldEnd = fieldStart;
        var fieldIndent = memberIndent;
        boolean indentTaken = false;
        for (int lineStart = fieldStart; lineStart < typeClose; lineStart = RegionLocator.nextLineStart(source, lineStart)) {
            var maskedLine = RegionLocator.lineAt(masked, lineStart);
            if (maskedLine.isBlank()) {
                if (indentTaken) {
                    break;
                }
                continue;
            }
            if (!FIELD_LINE.matcher(maskedLine).matches() || lineStart + maskedLine.length() >= typeClose) {
                break;
            }
            if (!indentTaken) {
                fieldIndent = RegionLocator.indentationAt(source, lineStart);
                indentTaken = true;
            }
            fieldEnd = RegionLocator.nextLineStart(source, lineStart);
        }

        return Optional.of(new ManagedRegions(
                new TextRange(open + 1, close),
                statementIndent,
                closingIndent,
                new TextRange(fieldStart, fieldEnd),
                fieldIndent,
                SourceFiles.lineSeparatorOf(source)));
    }

    /**
     * Copy of {@code source} with the contents of comments and of string and character literals replaced by spaces.
     * Line breaks and length are preserved so offsets carry over.
     */
    static String mask(String source) {
        var out = source.toCharArray();
        int n = out.length;
        int i = 0;
        while (i < n) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                int end = source.indexOf('\n', i);
                i = blank(out, i, end < 0 ? n : end);
            } else if (c == '/' && next == '*') {
                int end = source.indexOf("*/", i + 2);
                i = blank(out, i, end < 0 ? n : end + 2);
            } else if (c == '"' && source.startsWith("\"\"\"", i)) {
                int end = source.indexOf("\"\"\"", i + 3);
                i = blank(out, i, end < 0 ? n : end + 3);
            } else if (c == '"') {
                boolean verbatim = isVerbatimPrefix(source, i);
                i = blank(out, i, stringEnd(source, i, verbatim));
            } else if (c == '\'') {
                i = blank(out, i, charEnd(source, i));
            } else {
                i++;
            }
        }
        return new String(out);
    }

    private static boolean isVerbatimPrefix(String source, int quote) {
        for (int k = quote - 1; k >= 0 && k >= quote - 2; k--) {
            char p = source.charAt(k);
            if (p == '@') {
                return true;
            }
            if (p != '$') {
                return false;
            }
        }
        return false;
    }

    private static int stringEnd(String source, int quote, boolean verbatim) {
        for (int i = quote + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (!verbatim && c == '\\') {
                i++;
            } else if (verbatim && c == '"' && i + 1 < source.length() && source.charAt(i + 1) == '"') {
                i++;
            } else if (c == '"' || (!verbatim && c == '\n')) {
                return i + 1;
            }
        }
        return source.length();
    }

    private static int charEnd(String source, int quote) {
        for (int i = quote + 1; i < source.length() && i <= quote + 10; i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '\'' || c == '\n') {
                return i + 1;
            }
        }
        return quote + 1;
    }

    /** Blanks {@code [from, to)} except line breaks and returns {@code to}. */
    private static int blank(char[] out, int from, int to) {
        for (int k = from; k < to; k++) {
            if (out[k] != '\n' && out[k] != '\r') {
                out[k] = ' ';
            }
        }
        return to;
    }

    /** For every '{' offset, the offset of its matching '}'; -1 elsewhere and for unbalanced braces. */
    static int[] matchBraces(String masked) {
        int[] match = new int[masked.length()];
        Arrays.fill(match, -1);
        var stack = new ArrayDeque<Integer>();
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                stack.push(i);
            } else if (c == '}' && !stack.isEmpty()) {
                match[stack.pop()] = i;
            }
        }
        return match;
    }

    private static int enclosingOpenBrace(String masked, int[] match, int open, int close) {
        for (int i = open - 1; i >= 0; i--) {
            if (masked.charAt(i) == '{' && match[i] > close) {
                return i;
            }
        }
        return -1;
    }

    private static boolean onlyWhitespaceBefore(String source, int offset) {
        return source.substring(RegionLocator.lineStart(source, offset), offset).isBlank();
    }

    private static Optional<String> firstLineIndent(String source, String masked, int from, int to) {
        for (int lineStart = RegionLocator.nextLineStart(source, from);
                lineStart < to;
                lineStart = RegionLocator.nextLineStart(source, lineStart)) {
            if (!RegionLocator.lineAt(masked, lineStart).isBlank()
                    && RegionLocator.lineStart(source, to) != lineStart) {
                return Optional.of(RegionLocator.indentationAt(source, lineStart));
            }
        }
        return Optional.empty();
    }
}
