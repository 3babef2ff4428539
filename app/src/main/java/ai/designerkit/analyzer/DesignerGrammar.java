package ai.designerkit.analyzer;

import java.util.List;
import java.util.Optional;

/**
 * The small set of syntactic questions the classifier asks about a dialect's syntax tree. {@code N} is the dialect's
 * node type; statements and expressions are both nodes.
 */
public interface DesignerGrammar<N> {

    record MemberAccess<N>(N receiver, String name) {}

    /** {@code argumentText} is the verbatim text between the parentheses, empty when there are none. */
    record ObjectCreation<N>(String typeName, List<N> arguments, String argumentText) {}

    record Invocation<N>(N callee, List<N> arguments) {}

    /** A two-sided statement: a plain assignment or a handler attachment. */
    record Binary<N>(N left, N right) {}

    /** {@code this} or {@code Me}. */
    boolean isSelfReference(N expression);

    Optional<MemberAccess<N>> memberAccess(N expression);

    Optional<ObjectCreation<N>> objectCreation(N expression);

    Optional<String> identifier(N expression);

    /** A statement consisting of a single method call. */
    Optional<Invocation<N>> invocationStatement(N statement);

    /** A statement using the plain assignment operator; compound operators never match. */
    Optional<Binary<N>> simpleAssignment(N statement);

    /** The dialect's way of attaching a handler: {@code event += handler} or {@code AddHandler event, handler}. */
    Optional<Binary<N>> handlerAttachment(N statement);

    /**
     * Strips the dialect's handler wrapper from an attached handler expression: a single-argument delegate creation in
     * C#, {@code AddressOf} in VB (on its own or inside a delegate creation). Returns the expression itself when there
     * is no wrapper.
     */
    N unwrapHandler(N handlerExpression);

    /** Verbatim source text of a node. */
    String text(N node);
}
