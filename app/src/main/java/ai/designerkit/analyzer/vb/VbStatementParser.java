package ai.designerkit.analyzer.vb;

import ai.designerkit.analyzer.vb.VbNode.AddHandler;
import ai.designerkit.analyzer.vb.VbNode.AddressOf;
import ai.designerkit.analyzer.vb.VbNode.Assignment;
import ai.designerkit.analyzer.vb.VbNode.ExpressionStatement;
import ai.designerkit.analyzer.vb.VbNode.Identifier;
import ai.designerkit.analyzer.vb.VbNode.Invocation;
import ai.designerkit.analyzer.vb.VbNode.MeReference;
import ai.designerkit.analyzer.vb.VbNode.MemberAccess;
import ai.designerkit.analyzer.vb.VbNode.ObjectCreation;
import ai.designerkit.analyzer.vb.VbNode.Opaque;
import ai.designerkit.analyzer.vb.VbNode.OpaqueStatement;
import ai.designerkit.analyzer.vb.VbToken.Kind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * Recursive-descent parser for one logical VB line. Member access, invocation, {@code New} and {@code AddressOf} are
 * modelled; any expression that does not fully consume its token range becomes {@link Opaque}.
 */
final class VbStatementParser {
    private static final Set<String> ASSIGNMENT_OPERATORS =
            Set.of("=", "+=", "-=", "&=", "*=", "/=", "\\=", "^=");

    private final String source;
    private final List<VbToken> tokens;
    private int pos;
    private int limit;

    private VbStatementParser(String source, List<VbToken> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    static VbNode parse(String source, VbLexer.Line line) {
        return new VbStatementParser(source, line.tokens()).statement();
    }

    private VbNode statement() {
        int size = tokens.size();
        int start = tokens.get(0).start();
        int end = tokens.get(size - 1).end();
        var first = tokens.get(0);

        if (first.isWord("AddHandler")) {
            int comma = topLevel(1, size, t -> t.isPunctuation(","));
            if (comma < 0) {
                return new OpaqueStatement(start, end);
            }
            return new AddHandler(expression(1, comma), expression(comma + 1, size), start, end);
        }
        if (first.isWord("RemoveHandler")) {
            return new OpaqueStatement(start, end);
        }
        if (first.isWord("Call")) {
            return new ExpressionStatement(expression(1, size), start, end);
        }
        int operator = topLevel(1, size, t -> t.kind() == Kind.PUNCTUATION && ASSIGNMENT_OPERATORS.contains(t.text()));
        if (operator > 0) {
            return new Assignment(
                    expression(0, operator), tokens.get(operator).text(), expression(operator + 1, size), start, end);
        }
        return new ExpressionStatement(expression(0, size), start, end);
    }

    /** Index of the first token in {@code [from, to)} outside brackets that passes {@code test}, or -1. */
    private int topLevel(int from, int to, Predicate<VbToken> test) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            var t = tokens.get(i);
            if (t.isPunctuation("(") || t.isPunctuation("{")) {
                depth++;
            } else if (t.isPunctuation(")") || t.isPunctuation("}")) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && test.test(t)) {
                return i;
            }
        }
        return -1;
    }

    /** Parses tokens {@code [from, to)} as a single expression. */
    private VbNode expression(int from, int to) {
        if (from >= to) {
            int at = from < tokens.size() ? tokens.get(from).start() : tokens.get(tokens.size() - 1).end();
            return new Opaque(at, at);
        }
        int savedPos = pos;
        int savedLimit = limit;
        pos = from;
        limit = to;
        try {
            var node = postfix();
            if (node != null && pos == limit) {
                return node;
            }
            return new Opaque(tokens.get(from).start(), tokens.get(to - 1).end());
        } finally {
            pos = savedPos;
            limit = savedLimit;
        }
    }

    private @Nullable VbNode postfix() {
        var node = primary();
        while (node != null && pos < limit) {
            var t = tokens.get(pos);
            if (t.isPunctuation(".") && pos + 1 < limit && tokens.get(pos + 1).kind() == Kind.IDENTIFIER) {
                var name = tokens.get(pos + 1);
                node = new MemberAccess(node, name.text(), node.start(), name.end());
                pos += 2;
            } else if (t.isPunctuation("(")) {
                int close = matching(pos);
                if (close < 0) {
                    return null;
                }
                var args = arguments(pos, close);
                node = new Invocation(node, args, node.start(), tokens.get(close).end());
                pos = close + 1;
            } else {
                break;
            }
        }
        return node;
    }

    private @Nullable VbNode primary() {
        if (pos >= limit) {
            return null;
        }
        var t = tokens.get(pos);
        switch (t.kind()) {
            case STRING, NUMBER, DATE -> {
                pos++;
                return new Opaque(t.start(), t.end());
            }
            case PUNCTUATION -> {
                if (t.isPunctuation("(")) {
                    int close = matching(pos);
                    if (close < 0) {
                        return null;
                    }
                    pos = close + 1;
                    return new Opaque(t.start(), tokens.get(close).end());
                }
                if (t.isPunctuation("-") || t.isPunctuation("+")) {
                    pos++;
                    var operand = postfix();
                    return operand == null ? null : new Opaque(t.start(), operand.end());
                }
                return null;
            }
            default -> {
                if (t.isWord("Me")) {
                    pos++;
                    return new MeReference(t.start(), t.end());
                }
                if (t.isWord("AddressOf")) {
                    pos++;
                    var operand = postfix();
                    return operand == null ? null : new AddressOf(operand, t.start(), operand.end());
                }
                if (t.isWord("New")) {
                    return objectCreation();
                }
                pos++;
                return new Identifier(t.text(), t.start(), t.end());
            }
        }
    }

    private @Nullable VbNode objectCreation() {
        var newToken = tokens.get(pos++);
        if (pos >= limit || tokens.get(pos).kind() != Kind.IDENTIFIER) {
            return null;
        }
        int typeStart = tokens.get(pos).start();
        int typeEnd = tokens.get(pos).end();
        pos++;
        while (pos + 1 < limit && tokens.get(pos).isPunctuation(".")
                && tokens.get(pos + 1).kind() == Kind.IDENTIFIER) {
            typeEnd = tokens.get(pos + 1).end();
            pos += 2;
        }
        if (pos + 1 < limit && tokens.get(pos).isPunctuation("(") && tokens.get(pos + 1).isWord("Of")) {
            int close = matching(pos);
            if (close < 0) {
                return null;
            }
            typeEnd = tokens.get(close).end();
            pos = close + 1;
        }
        var typeName = source.substring(typeStart, typeEnd);
        List<VbNode> args = List.of();
        var argumentText = "";
        int end = typeEnd;
        if (pos < limit && tokens.get(pos).isPunctuation("(")) {
            int open = pos;
            int close = matching(open);
            if (close < 0) {
                return null;
            }
            args = arguments(open, close);
            argumentText = source.substring(tokens.get(open).end(), tokens.get(close).start()).strip();
            end = tokens.get(close).end();
            pos = close + 1;
        }
        if (pos < limit && (tokens.get(pos).isWord("With") || tokens.get(pos).isWord("From"))) {
            end = tokens.get(limit - 1).end();
            pos = limit;
        }
        return new ObjectCreation(typeName, args, argumentText, newToken.start(), end);
    }

    /** Arguments between the parenthesis at {@code open} and its match at {@code close}. */
    private List<VbNode> arguments(int open, int close) {
        var args = new ArrayList<VbNode>();
        if (close == open + 1) {
            return args;
        }
        int from = open + 1;
        while (true) {
            int comma = topLevel(from, close, t -> t.isPunctuation(","));
            int to = comma < 0 ? close : comma;
            args.add(expression(from, to));
            if (comma < 0) {
                return args;
            }
            from = comma + 1;
        }
    }

    private int matching(int open) {
        int depth = 0;
        for (int i = open; i < limit; i++) {
            var t = tokens.get(i);
            if (t.isPunctuation("(") || t.isPunctuation("{")) {
                depth++;
            } else if (t.isPunctuation(")") || t.isPunctuation("}")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
