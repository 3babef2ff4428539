package ai.designerkit.analyzer;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The two surface syntaxes a designer file can be written in. Besides recognising files by extension, each constant
 * knows how to spell the handful of value expressions that tools need to synthesise.
 */
public enum Dialect {
    CSHARP("C#", List.of(".designer.cs", ".cs"), "this") {
        @Override
        public String newExpression(String typeName, String arguments) {
            return "new " + typeName + "(" + arguments + ")";
        }

        @Override
        public String booleanLiteral(boolean value) {
            return value ? "true" : "false";
        }

        @Override
        public String stringLiteral(String value) {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
    },
    VISUAL_BASIC("VB.NET", List.of(".designer.vb", ".vb"), "Me") {
        @Override
        public String newExpression(String typeName, String arguments) {
            return "New " + typeName + "(" + arguments + ")";
        }

        @Override
        public String booleanLiteral(boolean value) {
            return value ? "True" : "False";
        }

        @Override
        public String stringLiteral(String value) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
    };

    private final String displayName;
    private final List<String> extensions;
    private final String selfReference;

    Dialect(String displayName, List<String> extensions, String selfReference) {
        this.displayName = displayName;
        this.extensions = extensions;
        this.selfReference = selfReference;
    }

    public String displayName() {
        return displayName;
    }

    /** Lowercase file suffixes, most specific first. */
    public List<String> extensions() {
        return extensions;
    }

    /** The keyword naming the current instance: {@code this} or {@code Me}. */
    public String selfReference() {
        return selfReference;
    }

    public abstract String newExpression(String typeName, String arguments);

    public abstract String booleanLiteral(boolean value);

    /** Quotes and escapes a plain string for use as a literal. */
    public abstract String stringLiteral(String value);

    public static Optional<Dialect> forPath(Path file) {
        var fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        var lower = fileName.toString().toLowerCase(Locale.ROOT);
        for (var dialect : values()) {
            for (var ext : dialect.extensions) {
                if (lower.endsWith(ext)) {
                    return Optional.of(dialect);
                }
            }
        }
        return Optional.empty();
    }
}
