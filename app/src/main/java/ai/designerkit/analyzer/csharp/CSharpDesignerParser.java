package ai.designerkit.analyzer.csharp;

import static ai.designerkit.analyzer.csharp.CSharpTreeSitterNodeTypes.*;

import ai.designerkit.analyzer.AbstractDesignerParser;
import ai.designerkit.analyzer.DesignerParseException;
import ai.designerkit.analyzer.DesignerParseException.MissingAnchor;
import ai.designerkit.analyzer.DesignerSource;
import ai.designerkit.analyzer.Dialect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterCSharp;

/** Parses C# designer files with tree-sitter. A new parser is created per call, so instances can be shared. */
public final class CSharpDesignerParser extends AbstractDesignerParser<TSNode> {
    private static final Logger logger = LogManager.getLogger(CSharpDesignerParser.class);

    static final String INITIALIZE_COMPONENT = "InitializeComponent";

    @Override
    public Dialect dialect() {
        return Dialect.CSHARP;
    }

    @Override
    protected Parsed<TSNode> readStructure(String source, @Nullable Path origin) {
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterCSharp());
        var tree = parser.parseString(null, source);
        var root = tree.getRootNode();
        if (root.hasError()) {
            logger.debug("Syntax errors in {}; continuing with the recoverable tree", origin);
        }
        var grammar = new CSharpGrammar(source.getBytes(StandardCharsets.UTF_8), tree);

        var classNode = findFirst(root, CLASS_DECLARATION);
        if (classNode == null) {
            throw new DesignerParseException(MissingAnchor.TYPE_DECLARATION, origin);
        }
        var className = CSharpGrammar.field(classNode, FIELD_NAME);
        if (className == null) {
            throw new DesignerParseException(MissingAnchor.TYPE_DECLARATION, origin, "Class declaration has no name");
        }
        var formName = grammar.text(className);
        var namespace = namespaceOf(classNode, root, grammar);

        var body = CSharpGrammar.field(classNode, FIELD_BODY);
        var members = new LinkedHashSet<String>();
        TSNode method = null;
        if (body != null) {
            for (int i = 0; i < body.getNamedChildCount(); i++) {
                var member = body.getNamedChild(i);
                var type = member.getType();
                if (FIELD_DECLARATION.equals(type)) {
                    collectFieldNames(member, grammar, members);
                } else if (method == null && METHOD_DECLARATION.equals(type)) {
                    var name = CSharpGrammar.field(member, FIELD_NAME);
                    if (name != null && INITIALIZE_COMPONENT.equals(grammar.text(name))) {
                        method = member;
                    }
                }
            }
        }
        if (method == null) {
            throw new DesignerParseException(MissingAnchor.INITIALIZE_COMPONENT, origin);
        }
        var block = CSharpGrammar.field(method, FIELD_BODY);
        if (block == null || !BLOCK.equals(block.getType())) {
            throw new DesignerParseException(
                    MissingAnchor.INITIALIZE_COMPONENT, origin, "InitializeComponent has no block body");
        }

        var statements = new ArrayList<TSNode>();
        for (int i = 0; i < block.getNamedChildCount(); i++) {
            var statement = block.getNamedChild(i);
            if (!COMMENT.equals(statement.getType())) {
                statements.add(statement);
            }
        }
        logger.trace("{}: {} fields, {} statements in InitializeComponent", formName, members.size(), statements.size());

        var designerSource = new DesignerSource<>(Dialect.CSHARP, origin, formName, namespace,
                Collections.unmodifiableSet(members), List.copyOf(statements));
        return new Parsed<>(designerSource, grammar);
    }

    private static void collectFieldNames(TSNode fieldDeclaration, CSharpGrammar grammar, Set<String> into) {
        for (int i = 0; i < fieldDeclaration.getNamedChildCount(); i++) {
            var declaration = fieldDeclaration.getNamedChild(i);
            if (!VARIABLE_DECLARATION.equals(declaration.getType())) {
                continue;
            }
            for (int j = 0; j < declaration.getNamedChildCount(); j++) {
                var declarator = declaration.getNamedChild(j);
                if (!VARIABLE_DECLARATOR.equals(declarator.getType())) {
                    continue;
                }
                var name = CSharpGrammar.field(declarator, FIELD_NAME);
                if (name == null) {
                    name = firstChildOfType(declarator, IDENTIFIER);
                }
                if (name != null) {
                    into.add(grammar.text(name));
                }
            }
        }
    }

    /** Dotted namespace enclosing the class: nested block namespaces joined, or the file-scoped one. */
    private static @Nullable String namespaceOf(TSNode classNode, TSNode root, CSharpGrammar grammar) {
        var parts = new ArrayList<String>();
        var current = classNode.getParent();
        while (current != null && !current.isNull()) {
            var type = current.getType();
            if (NAMESPACE_DECLARATION.equals(type) || FILE_SCOPED_NAMESPACE_DECLARATION.equals(type)) {
                var name = CSharpGrammar.field(current, FIELD_NAME);
                if (name != null) {
                    parts.add(grammar.text(name));
                }
            }
            current = current.getParent();
        }
        if (parts.isEmpty()) {
            // older grammars leave the file-scoped namespace as a sibling of the type
            var fileScoped = firstChildOfType(root, FILE_SCOPED_NAMESPACE_DECLARATION);
            if (fileScoped != null) {
                var name = CSharpGrammar.field(fileScoped, FIELD_NAME);
                if (name != null) {
                    parts.add(grammar.text(name));
                }
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        Collections.reverse(parts);
        return String.join(".", parts);
    }

    private static @Nullable TSNode findFirst(TSNode node, String type) {
        if (type.equals(node.getType())) {
            return node;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var found = findFirst(node.getNamedChild(i), type);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static @Nullable TSNode firstChildOfType(TSNode node, String type) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }
}
