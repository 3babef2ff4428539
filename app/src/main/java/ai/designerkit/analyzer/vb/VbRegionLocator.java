package ai.designerkit.analyzer.vb;

import ai.designerkit.analyzer.ManagedRegions;
import ai.designerkit.analyzer.RegionLocator;
import ai.designerkit.analyzer.TextRange;
import ai.designerkit.util.SourceFiles;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Line-based locator for VB: the body runs from the line after {@code Sub InitializeComponent()} to the first
 * {@code End Sub}, and the field block is the contiguous run of field declarations without initializers that
 * follows it.
 */
public final class VbRegionLocator implements RegionLocator {
    private static final Pattern SUB_HEADER = Pattern.compile("^\\s*(?:<[^>]*>\\s*_?\\s*)*"
            + "(?:(?:Private|Friend|Protected|Public|Overrides|Overloads|Shadows|Shared)\\s+)*"
            + "Sub\\s+InitializeComponent\\s*(?:\\(\\s*\\))?\\s*(?:'.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_SUB = Pattern.compile("^\\s*End\\s+Sub\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMENT_LINE = Pattern.compile("^\\s*(?:'|REM\\b).*$", Pattern.CASE_INSENSITIVE);
    static final Pattern FIELD_LINE = Pattern.compile("^\\s*(?:<[^>]*>\\s*)*"
            + "(?:(?:Private|Friend|Protected|Public|Dim|Shared|ReadOnly|WithEvents|Const)\\s+)+"
            + "\\[?\\w+\\]?(?:\\s*,\\s*\\[?\\w+\\]?)*\\s+As\\s+[\\w.]+(?:\\s*\\(Of[^)]*\\))?(?:\\(\\))?"
            + "\\s*(?:'.*)?$", Pattern.CASE_INSENSITIVE);
    private static final String INDENT_UNIT = "    ";

    @Override
    public Optional<ManagedRegions> locate(String source) {
        int header = -1;
        for (int lineStart = 0; lineStart < source.length(); lineStart = RegionLocator.nextLineStart(source, lineStart)) {
            if (SUB_HEADER.matcher(RegionLocator.lineAt(source, lineStart)).matches()) {
                header = lineStart;
                break;
            }
        }
        if (header < 0) {
            return Optional.empty();
        }
        int bodyStart = RegionLocator.nextLineStart(source, header);
        int endSub = -1;
        for (int lineStart = bodyStart; lineStart < source.length(); lineStart = RegionLocator.nextLineStart(source, lineStart)) {
            if (END_SUB.matcher(RegionLocator.lineAt(source, lineStart)).find()) {
                endSub = lineStart;
                break;
            }
        }
        if (endSub < 0) {
            return Optional.empty();
        }

        var memberIndent = RegionLocator.indentationAt(source, endSub);
        var statementIndent = memberIndent + INDENT_UNIT;
        for (int lineStart = bodyStart; lineStart < endSub; lineStart = RegionLocator.nextLineStart(source, lineStart)) {
            var line = RegionLocator.lineAt(source, lineStart);
            if (!line.isBlank() && !COMMENT_LINE.matcher(line).matches()) {
                statementIndent = RegionLocator.indentationAt(source, lineStart);
                break;
            }
        }

        int fieldStart = RegionLocator.nextLineStart(source, endSub);
        int fieldEnd = fieldStart;
        var fieldIndent = memberIndent;
        boolean indentTaken = false;
        for (int lineStart = fieldStart; lineStart < source.length(); lineStart = RegionLocator.nextLineStart(source, lineStart)) {
            var line = RegionLocator.lineAt(source, lineStart);
            if (line.isBlank() || COMMENT_LINE.matcher(line).matches()) {
                if (indentTaken) {
                    break;
                }
                continue;
            }
            if (!FIELD_LINE.matcher(line).matches()) {
                break;
            }
            if (!indentTaken) {
                fieldIndent = RegionLocator.indentationAt(source, lineStart);
                indentTaken = true;
            }
            fieldEnd = RegionLocator.nextLineStart(source, lineStart);
        }

        return Optional.of(new ManagedRegions(
                new TextRange(bodyStart, endSub),
                statementIndent,
                "",
                new TextRange(fieldStart, fieldEnd),
                fieldIndent,
                SourceFiles.lineSeparatorOf(source)));
    }
}
