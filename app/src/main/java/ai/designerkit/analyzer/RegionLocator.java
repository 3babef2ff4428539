package ai.designerkit.analyzer;

import java.util.Optional;

/**
 * Finds the managed region of a designer file from textual anchors, without a full parse. Missing anchors are
 * reported as an empty result, never as an exception; the writer then generates the whole file.
 */
public interface RegionLocator {
    Optional<ManagedRegions> locate(String source);

    /** Leading spaces and tabs of the line containing {@code offset}. */
    static String indentationAt(String text, int offset) {
        int lineStart = lineStart(text, offset);
        int i = lineStart;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(lineStart, i);
    }

    static int lineStart(String text, int offset) {
        int i = Math.min(offset, text.length());
        while (i > 0 && text.charAt(i - 1) != '\n') {
            i--;
        }
        return i;
    }

    /** Offset just past the newline ending the line that contains {@code offset}, or the text length. */
    static int nextLineStart(String text, int offset) {
        int nl = text.indexOf('\n', offset);
        return nl < 0 ? text.length() : nl + 1;
    }

    /** The line starting at {@code lineStart}, without its terminator. */
    static String lineAt(String text, int lineStart) {
        int end = text.indexOf('\n', lineStart);
        if (end < 0) {
            end = text.length();
        }
        if (end > lineStart && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(lineStart, end);
    }
}
