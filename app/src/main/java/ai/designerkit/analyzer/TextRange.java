package ai.designerkit.analyzer;

/** Half-open character span {@code [start, end)} of a source string. */
public record TextRange(int start, int end) {
    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public String slice(String text) {
        return text.substring(start, end);
    }
}
