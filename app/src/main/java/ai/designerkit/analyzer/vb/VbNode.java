package ai.designerkit.analyzer.vb;

import java.util.List;

/**
 * Syntax tree for the subset of VB that {@code InitializeComponent} uses. Every node records its character span in the
 * source; anything the parser does not model becomes an {@link Opaque} span so its text is still available.
 */
sealed interface VbNode {
    int start();

    int end();

    /** {@code Me} */
    record MeReference(int start, int end) implements VbNode {}

    record Identifier(String name, int start, int end) implements VbNode {}

    /** {@code receiver.name} */
    record MemberAccess(VbNode receiver, String name, int start, int end) implements VbNode {}

    /** {@code New T(args)}; {@code argumentText} is the raw text inside the parentheses. */
    record ObjectCreation(String typeName, List<VbNode> arguments, String argumentText, int start, int end)
            implements VbNode {}

    /** {@code callee(args)} */
    record Invocation(VbNode callee, List<VbNode> arguments, int start, int end) implements VbNode {}

    /** {@code AddressOf operand} */
    record AddressOf(VbNode operand, int start, int end) implements VbNode {}

    /** Literals, parenthesised and otherwise unmodelled expressions. */
    record Opaque(int start, int end) implements VbNode {}

    // statements

    /** {@code left = right}, or a compound form such as {@code left += right}. */
    record Assignment(VbNode left, String operator, VbNode right, int start, int end) implements VbNode {}

    /** {@code AddHandler eventExpression, handler} */
    record AddHandler(VbNode event, VbNode handler, int start, int end) implements VbNode {}

    /** A bare expression or a {@code Call} statement. */
    record ExpressionStatement(VbNode expression, int start, int end) implements VbNode {}

    record OpaqueStatement(int start, int end) implements VbNode {}
}
