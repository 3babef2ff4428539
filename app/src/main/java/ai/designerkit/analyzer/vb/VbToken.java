package ai.designerkit.analyzer.vb;

/**
 * One lexical token of VB source. {@code text} is the token as written except for bracketed identifiers, which lose
 * their brackets; {@code start} and {@code end} are character offsets into the source.
 */
record VbToken(Kind kind, String text, int start, int end) {
    enum Kind {
        IDENTIFIER,
        NUMBER,
        STRING,
        DATE,
        PUNCTUATION
    }

    boolean isWord(String word) {
        return kind == Kind.IDENTIFIER && text.equalsIgnoreCase(word);
    }

    boolean isPunctuation(String symbol) {
        return kind == Kind.PUNCTUATION && text.equals(symbol);
    }
}
