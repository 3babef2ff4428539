package ai.designerkit.analyzer;

/**
 * Where the two rewritable parts of a designer file sit.
 *
 * @param methodBody span inside {@code InitializeComponent} that statements are rendered into
 * @param statementIndent indentation of statements inside the method
 * @param closingIndent indentation to put back before the token closing the method, when the body span ends right
 *     before it; empty when the span ends at a line start
 * @param fieldBlock run of control field declarations after the method; an empty span marks the insertion point
 * @param fieldIndent indentation of field declarations
 * @param lineSeparator newline convention of the file
 */
public record ManagedRegions(
        TextRange methodBody,
        String statementIndent,
        String closingIndent,
        TextRange fieldBlock,
        String fieldIndent,
        String lineSeparator) {}
