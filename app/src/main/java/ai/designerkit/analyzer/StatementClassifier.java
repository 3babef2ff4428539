package ai.designerkit.analyzer;

import ai.designerkit.analyzer.DesignerGrammar.Binary;
import ai.designerkit.analyzer.DesignerGrammar.Invocation;
import ai.designerkit.analyzer.DesignerStatement.ChildAdd;
import ai.designerkit.analyzer.DesignerStatement.Declaration;
import ai.designerkit.analyzer.DesignerStatement.EventWiring;
import ai.designerkit.analyzer.DesignerStatement.PropertyAssignment;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Sorts {@code InitializeComponent} statements into the four shapes the form model understands. The rules are the same
 * for every dialect; the {@link DesignerGrammar} answers the syntax questions.
 */
public final class StatementClassifier<N> {
    private final DesignerGrammar<N> grammar;

    public StatementClassifier(DesignerGrammar<N> grammar) {
        this.grammar = grammar;
    }

    /** {@code <self>.<member>} (target null) or {@code <self>.<target>.<member>}. */
    private record MemberPath(@Nullable String target, String member) {}

    /**
     * @param knownMembers field names of the enclosing type; must compare ignoring case. A constructed value only counts
     *     as a control declaration when it is assigned to one of these.
     */
    public DesignerStatement classify(N statement, Set<String> knownMembers) {
        var attachment = grammar.handlerAttachment(statement);
        if (attachment.isPresent()) {
            return eventWiring(attachment.get()).orElse(DesignerStatement.Unrecognized.INSTANCE);
        }
        var assignment = grammar.simpleAssignment(statement);
        if (assignment.isPresent()) {
            var declaration = declaration(assignment.get(), knownMembers);
            if (declaration.isPresent()) {
                return declaration.get();
            }
            return propertyAssignment(assignment.get()).orElse(DesignerStatement.Unrecognized.INSTANCE);
        }
        var invocation = grammar.invocationStatement(statement);
        if (invocation.isPresent()) {
            return childAdd(invocation.get()).orElse(DesignerStatement.Unrecognized.INSTANCE);
        }
        return DesignerStatement.Unrecognized.INSTANCE;
    }

    private Optional<DesignerStatement> declaration(Binary<N> assignment, Set<String> knownMembers) {
        var path = memberPath(assignment.left());
        if (path.isEmpty() || path.get().target() != null || !knownMembers.contains(path.get().member())) {
            return Optional.empty();
        }
        return grammar.objectCreation(assignment.right())
                .map(creation -> new Declaration(path.get().member(), creation.typeName(), creation.argumentText()));
    }

    private Optional<DesignerStatement> propertyAssignment(Binary<N> assignment) {
        return memberPath(assignment.left())
                .map(path -> new PropertyAssignment(path.target(), path.member(), grammar.text(assignment.right())));
    }

    private Optional<DesignerStatement> childAdd(Invocation<N> invocation) {
        if (invocation.arguments().isEmpty()) {
            return Optional.empty();
        }
        var add = grammar.memberAccess(invocation.callee());
        if (add.isEmpty() || !add.get().name().equals("Add")) {
            return Optional.empty();
        }
        var controls = memberPath(add.get().receiver());
        if (controls.isEmpty() || !controls.get().member().equals("Controls")) {
            return Optional.empty();
        }
        var child = memberPath(invocation.arguments().get(0));
        if (child.isEmpty() || child.get().target() != null) {
            return Optional.empty();
        }
        return Optional.of(new ChildAdd(controls.get().target(), child.get().member()));
    }

    private Optional<DesignerStatement> eventWiring(Binary<N> attachment) {
        var path = memberPath(attachment.left());
        if (path.isEmpty()) {
            return Optional.empty();
        }
        var handler = handlerName(grammar.unwrapHandler(attachment.right()));
        return handler.map(h -> new EventWiring(path.get().target(), path.get().member(), h));
    }

    private Optional<String> handlerName(N expression) {
        var access = grammar.memberAccess(expression);
        if (access.isPresent()) {
            return Optional.of(access.get().name());
        }
        return grammar.identifier(expression);
    }

    private Optional<MemberPath> memberPath(N expression) {
        var outer = grammar.memberAccess(expression);
        if (outer.isEmpty()) {
            return Optional.empty();
        }
        N receiver = outer.get().receiver();
        if (grammar.isSelfReference(receiver)) {
            return Optional.of(new MemberPath(null, outer.get().name()));
        }
        var inner = grammar.memberAccess(receiver);
        if (inner.isPresent() && grammar.isSelfReference(inner.get().receiver())) {
            return Optional.of(new MemberPath(inner.get().name(), outer.get().name()));
        }
        return Optional.empty();
    }
}
