package ai.designerkit.analyzer.vb;

import ai.designerkit.analyzer.DesignerGrammar;
import java.util.Optional;

/** Answers the classifier's syntax questions over {@link VbNode} trees. */
final class VbGrammar implements DesignerGrammar<VbNode> {
    private final String source;

    VbGrammar(String source) {
        this.source = source;
    }

    @Override
    public boolean isSelfReference(VbNode expression) {
        return expression instanceof VbNode.MeReference;
    }

    @Override
    public Optional<MemberAccess<VbNode>> memberAccess(VbNode expression) {
        if (expression instanceof VbNode.MemberAccess access) {
            return Optional.of(new MemberAccess<>(access.receiver(), access.name()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<ObjectCreation<VbNode>> objectCreation(VbNode expression) {
        if (expression instanceof VbNode.ObjectCreation creation) {
            return Optional.of(new ObjectCreation<>(creation.typeName(), creation.arguments(), creation.argumentText()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> identifier(VbNode expression) {
        if (expression instanceof VbNode.Identifier identifier) {
            return Optional.of(identifier.name());
        }
        return Optional.empty();
    }

    @Override
    public Optional<Invocation<VbNode>> invocationStatement(VbNode statement) {
        if (statement instanceof VbNode.ExpressionStatement expressionStatement
                && expressionStatement.expression() instanceof VbNode.Invocation invocation) {
            return Optional.of(new Invocation<>(invocation.callee(), invocation.arguments()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Binary<VbNode>> simpleAssignment(VbNode statement) {
        if (statement instanceof VbNode.Assignment assignment && assignment.operator().equals("=")) {
            return Optional.of(new Binary<>(assignment.left(), assignment.right()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Binary<VbNode>> handlerAttachment(VbNode statement) {
        if (statement instanceof VbNode.AddHandler addHandler) {
            return Optional.of(new Binary<>(addHandler.event(), addHandler.handler()));
        }
        return Optional.empty();
    }

    @Override
    public VbNode unwrapHandler(VbNode handlerExpression) {
        if (handlerExpression instanceof VbNode.AddressOf addressOf) {
            return addressOf.operand();
        }
        // New EventHandler(AddressOf Me.Handler)
        if (handlerExpression instanceof VbNode.ObjectCreation creation && creation.arguments().size() == 1) {
            return unwrapHandler(creation.arguments().get(0));
        }
        return handlerExpression;
    }

    @Override
    public String text(VbNode node) {
        return source.substring(node.start(), node.end());
    }
}
