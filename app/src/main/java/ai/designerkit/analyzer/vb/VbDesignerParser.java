package ai.designerkit.analyzer.vb;

import ai.designerkit.analyzer.AbstractDesignerParser;
import ai.designerkit.analyzer.DesignerParseException;
import ai.designerkit.analyzer.DesignerParseException.MissingAnchor;
import ai.designerkit.analyzer.DesignerSource;
import ai.designerkit.analyzer.Dialect;
import ai.designerkit.analyzer.vb.VbToken.Kind;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Parses VB designer files. A line scan over the lexer's logical lines finds the namespace, the first class, its
 * fields and the {@code InitializeComponent} statements; each statement is then parsed into a {@link VbNode}.
 */
public final class VbDesignerParser extends AbstractDesignerParser<VbNode> {
    private static final Logger logger = LogManager.getLogger(VbDesignerParser.class);

    private static final Set<String> MODIFIERS = Set.of("partial", "public", "private", "friend", "protected",
            "shared", "overrides", "overloads", "overridable", "notoverridable", "mustoverride", "notinheritable",
            "mustinherit", "shadows", "readonly", "writeonly", "withevents", "dim", "static", "default", "async",
            "iterator", "widening", "narrowing", "const");
    private static final Set<String> FIELD_MODIFIERS =
            Set.of("public", "private", "friend", "protected", "shared", "readonly", "withevents", "dim", "const");
    private static final Set<String> BLOCK_KEYWORDS = Set.of("sub", "function", "operator", "get", "set");
    private static final Set<String> NOT_FIELDS = Set.of("event", "delegate", "enum", "structure", "interface",
            "module", "declare", "class", "sub", "function", "property", "operator", "custom", "type", "inherits",
            "implements", "imports");

    @Override
    public Dialect dialect() {
        return Dialect.VISUAL_BASIC;
    }

    @Override
    protected Parsed<VbNode> readStructure(String source, @Nullable Path origin) {
        var lines = VbLexer.logicalLines(source);
        var namespaces = new ArrayDeque<String>();
        String formName = null;
        String namespace = null;
        var members = new LinkedHashSet<String>();
        List<VbNode> statements = null;
        int classDepth = 0;
        boolean classClosed = false;
        int blockDepth = 0;

        for (int i = 0; i < lines.size(); i++) {
            var tokens = stripAttributes(lines.get(i).tokens());
            if (tokens.isEmpty()) {
                continue;
            }
            var first = tokens.get(0);
            if (first.isWord("End") && tokens.size() > 1) {
                var what = tokens.get(1).text().toLowerCase(Locale.ROOT);
                if (what.equals("namespace") && !namespaces.isEmpty()) {
                    namespaces.pop();
                } else if (what.equals("class") && classDepth > 0) {
                    classDepth--;
                    classClosed = classDepth == 0;
                } else if (BLOCK_KEYWORDS.contains(what) && blockDepth > 0) {
                    blockDepth--;
                }
                continue;
            }
            if (first.isWord("Namespace") && tokens.size() > 1) {
                namespaces.push(source.substring(tokens.get(1).start(), tokens.get(tokens.size() - 1).end()));
                continue;
            }

            int idx = 0;
            boolean fieldModifier = false;
            boolean mustOverride = false;
            while (idx < tokens.size() && isModifier(tokens.get(idx))) {
                var word = tokens.get(idx).text().toLowerCase(Locale.ROOT);
                fieldModifier |= FIELD_MODIFIERS.contains(word);
                mustOverride |= word.equals("mustoverride");
                idx++;
            }
            if (idx >= tokens.size()) {
                continue;
            }
            var keyword = tokens.get(idx);

            if (keyword.isWord("Class") && idx + 1 < tokens.size()) {
                if (formName == null) {
                    formName = tokens.get(idx + 1).text();
                    namespace = namespaces.isEmpty() ? null : joinNamespaces(namespaces);
                    classDepth = 1;
                } else if (classDepth > 0) {
                    classDepth++;
                }
                continue;
            }
            if (formName == null || classDepth != 1 || classClosed) {
                continue;
            }

            if (keyword.isWord("Sub") || keyword.isWord("Function")) {
                boolean initializer = keyword.isWord("Sub")
                        && idx + 1 < tokens.size()
                        && tokens.get(idx + 1).isWord("InitializeComponent");
                if (initializer && statements == null && blockDepth == 0) {
                    statements = new ArrayList<>();
                    int j = i + 1;
                    for (; j < lines.size(); j++) {
                        var line = lines.get(j);
                        var lineTokens = line.tokens();
                        if (lineTokens.size() > 1
                                && lineTokens.get(0).isWord("End")
                                && lineTokens.get(1).isWord("Sub")) {
                            break;
                        }
                        statements.add(VbStatementParser.parse(source, line));
                    }
                    i = j;
                } else if (!mustOverride && !isDeclareLine(tokens)) {
                    blockDepth++;
                }
                continue;
            }
            if ((keyword.isWord("Get") || keyword.isWord("Set") || keyword.isWord("Operator"))) {
                blockDepth++;
                continue;
            }
            if (blockDepth == 0 && fieldModifier && keyword.kind() == Kind.IDENTIFIER
                    && !NOT_FIELDS.contains(keyword.text().toLowerCase(Locale.ROOT))) {
                collectFieldNames(tokens, idx, members);
            }
        }

        if (formName == null) {
            throw new DesignerParseException(MissingAnchor.TYPE_DECLARATION, origin);
        }
        if (statements == null) {
            throw new DesignerParseException(MissingAnchor.INITIALIZE_COMPONENT, origin);
        }
        logger.trace("{}: {} fields, {} statements in InitializeComponent", formName, members.size(), statements.size());

        var designerSource = new DesignerSource<>(Dialect.VISUAL_BASIC, origin, formName, namespace,
                Collections.unmodifiableSet(members), List.copyOf(statements));
        return new Parsed<>(designerSource, new VbGrammar(source));
    }

    /** Names declared by {@code Friend WithEvents A, B As T} style lines, starting at {@code idx}. */
    private static void collectFieldNames(List<VbToken> tokens, int idx, Set<String> into) {
        for (int i = idx; i < tokens.size(); i++) {
            var t = tokens.get(i);
            if (t.isWord("As") || t.isPunctuation("=")) {
                return;
            }
            if (t.kind() == Kind.IDENTIFIER) {
                into.add(t.text());
            } else if (!t.isPunctuation(",") && !t.isPunctuation("(") && !t.isPunctuation(")")) {
                return;
            }
        }
    }

    /** Drops leading {@code <...>} attribute blocks. */
    private static List<VbToken> stripAttributes(List<VbToken> tokens) {
        int i = 0;
        while (i < tokens.size() && tokens.get(i).isPunctuation("<")) {
            int close = i + 1;
            while (close < tokens.size() && !tokens.get(close).isPunctuation(">")) {
                close++;
            }
            if (close >= tokens.size()) {
                return tokens;
            }
            i = close + 1;
        }
        return tokens.subList(i, tokens.size());
    }

    private static boolean isModifier(VbToken token) {
        return token.kind() == Kind.IDENTIFIER && MODIFIERS.contains(token.text().toLowerCase(Locale.ROOT));
    }

    /** Interface-style or {@code Declare} signatures have no body. */
    private static boolean isDeclareLine(List<VbToken> tokens) {
        return tokens.stream().anyMatch(t -> t.isWord("Declare"));
    }

    private static String joinNamespaces(ArrayDeque<String> namespaces) {
        var parts = new ArrayList<>(namespaces);
        Collections.reverse(parts);
        return String.join(".", parts);
    }
}
