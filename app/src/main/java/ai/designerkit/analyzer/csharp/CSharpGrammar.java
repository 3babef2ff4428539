package ai.designerkit.analyzer.csharp;

import static ai.designerkit.analyzer.csharp.CSharpTreeSitterNodeTypes.*;

import ai.designerkit.analyzer.DesignerGrammar;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * Answers the classifier's syntax questions over a tree-sitter C# tree. Offsets reported by tree-sitter are UTF-8
 * byte offsets, so all text is sliced from the encoded source. The tree is held here so its nodes stay valid for as
 * long as the grammar is in use.
 */
final class CSharpGrammar implements DesignerGrammar<TSNode> {
    private final byte[] sourceBytes;

    @SuppressWarnings("unused")
    private final TSTree tree;

    CSharpGrammar(byte[] sourceBytes, TSTree tree) {
        this.sourceBytes = sourceBytes;
        this.tree = tree;
    }

    @Override
    public boolean isSelfReference(TSNode expression) {
        return THIS_KEYWORD.equals(text(expression).strip());
    }

    @Override
    public Optional<MemberAccess<TSNode>> memberAccess(TSNode expression) {
        if (!MEMBER_ACCESS_EXPRESSION.equals(expression.getType())) {
            return Optional.empty();
        }
        var receiver = field(expression, FIELD_EXPRESSION);
        var name = field(expression, FIELD_NAME);
        if (receiver == null || name == null) {
            return Optional.empty();
        }
        return Optional.of(new MemberAccess<>(receiver, text(name)));
    }

    @Override
    public Optional<ObjectCreation<TSNode>> objectCreation(TSNode expression) {
        if (!OBJECT_CREATION_EXPRESSION.equals(expression.getType())) {
            return Optional.empty();
        }
        var type = field(expression, FIELD_TYPE);
        if (type == null) {
            return Optional.empty();
        }
        var argumentList = field(expression, FIELD_ARGUMENTS);
        if (argumentList == null) {
            return Optional.of(new ObjectCreation<>(text(type), List.of(), ""));
        }
        return Optional.of(new ObjectCreation<>(text(type), arguments(argumentList), innerText(argumentList)));
    }

    @Override
    public Optional<String> identifier(TSNode expression) {
        return IDENTIFIER.equals(expression.getType()) ? Optional.of(text(expression)) : Optional.empty();
    }

    @Override
    public Optional<Invocation<TSNode>> invocationStatement(TSNode statement) {
        var expression = statementExpression(statement);
        if (expression == null || !INVOCATION_EXPRESSION.equals(expression.getType())) {
            return Optional.empty();
        }
        var function = field(expression, FIELD_FUNCTION);
        var argumentList = field(expression, FIELD_ARGUMENTS);
        if (function == null || argumentList == null) {
            return Optional.empty();
        }
        return Optional.of(new Invocation<>(function, arguments(argumentList)));
    }

    @Override
    public Optional<Binary<TSNode>> simpleAssignment(TSNode statement) {
        return assignment(statement, "=");
    }

    @Override
    public Optional<Binary<TSNode>> handlerAttachment(TSNode statement) {
        return assignment(statement, "+=");
    }

    @Override
    public TSNode unwrapHandler(TSNode handlerExpression) {
        var creation = objectCreation(handlerExpression);
        if (creation.isPresent() && creation.get().arguments().size() == 1) {
            return creation.get().arguments().get(0);
        }
        return handlerExpression;
    }

    @Override
    public String text(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return slice(node.getStartByte(), node.getEndByte());
    }

    private Optional<Binary<TSNode>> assignment(TSNode statement, String operator) {
        var expression = statementExpression(statement);
        if (expression == null || !ASSIGNMENT_EXPRESSION.equals(expression.getType())) {
            return Optional.empty();
        }
        var left = field(expression, FIELD_LEFT);
        var right = field(expression, FIELD_RIGHT);
        if (left == null || right == null) {
            return Optional.empty();
        }
        // the operator token sits between the two operands; its node shape differs across grammar releases
        var actual = slice(left.getEndByte(), right.getStartByte()).strip();
        return operator.equals(actual) ? Optional.of(new Binary<>(left, right)) : Optional.empty();
    }

    /** The expression of an expression statement, or null for any other statement. */
    private static @Nullable TSNode statementExpression(TSNode statement) {
        if (!EXPRESSION_STATEMENT.equals(statement.getType()) || statement.getNamedChildCount() == 0) {
            return null;
        }
        return statement.getNamedChild(0);
    }

    private static List<TSNode> arguments(TSNode argumentList) {
        var result = new ArrayList<TSNode>();
        for (int i = 0; i < argumentList.getNamedChildCount(); i++) {
            var argument = argumentList.getNamedChild(i);
            if (ARGUMENT.equals(argument.getType()) && argument.getNamedChildCount() > 0) {
                // named arguments carry the name first; the value is always last
                result.add(argument.getNamedChild(argument.getNamedChildCount() - 1));
            }
        }
        return result;
    }

    /** Text between the parentheses of an argument list. */
    private String innerText(TSNode argumentList) {
        var full = text(argumentList).strip();
        if (full.startsWith("(") && full.endsWith(")")) {
            return full.substring(1, full.length() - 1).strip();
        }
        return full;
    }

    static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return child == null || child.isNull() ? null : child;
    }

    String slice(int startByte, int endByte) {
        if (startByte < 0 || endByte > sourceBytes.length || startByte > endByte) {
            return "";
        }
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
