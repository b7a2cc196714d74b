package org.carball.queryflow.serializer;

import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.ast.Bound;
import org.carball.queryflow.model.ast.Group;
import org.carball.queryflow.model.ast.Identifier;
import org.carball.queryflow.model.ast.Literal;
import org.carball.queryflow.model.ast.Node;
import org.carball.queryflow.model.ast.Not;
import org.carball.queryflow.model.ast.Range;
import org.carball.queryflow.model.ast.Raw;
import org.carball.queryflow.model.ast.Term;
import org.carball.queryflow.parser.QueryStringEscaper;

import java.util.stream.Collectors;

/**
 * Writes a syntax tree back to query string text.
 * <p>
 * Parentheses are emitted only where they are needed to keep the tree's
 * grouping: around a child group whose operator differs from its parent, around
 * single-child groups, and under {@code NOT}. A group whose children are all
 * terms on the same field is written as {@code field: (v1 OR v2)}.
 */
public class QueryStringSerializer {

    public String serialize(Node node) {
        StringBuilder sb = new StringBuilder();
        write(node, sb);
        return sb.toString();
    }

    private void write(Node node, StringBuilder sb) {
        if (node instanceof Term term) {
            writeTerm(term, sb);
        } else if (node instanceof Range range) {
            writeRange(range, sb);
        } else if (node instanceof Not not) {
            sb.append("NOT ");
            writeOperand(not.inner(), sb);
        } else if (node instanceof Group group) {
            writeGroup(group, sb);
        } else if (node instanceof Raw raw) {
            sb.append(raw.text());
        } else {
            throw new IllegalStateException("Unknown node type: " + (node == null ? "null" : node.getClass().getName()));
        }
    }

    private void writeGroup(Group group, StringBuilder sb) {
        if (group.isParenthesizedSingle()) {
            sb.append('(');
            write(group.children().get(0), sb);
            sb.append(')');
            return;
        }
        Identifier sharedField = sharedField(group);
        if (sharedField != null) {
            sb.append(sharedField.name()).append(": (");
            sb.append(group.children().stream()
                    .map(child -> formatValue(((Term) child).value(), ((Term) child).wildcard()))
                    .collect(Collectors.joining(separator(group.op()))));
            sb.append(')');
            return;
        }
        String separator = separator(group.op());
        boolean first = true;
        for (Node child : group.children()) {
            if (!first) {
                sb.append(separator);
            }
            first = false;
            if (child instanceof Group nested && needsParentheses(nested, group.op())) {
                sb.append('(');
                write(nested, sb);
                sb.append(')');
            } else {
                write(child, sb);
            }
        }
    }

    private void writeOperand(Node operand, StringBuilder sb) {
        if (operand instanceof Group group && !group.isParenthesizedSingle() && sharedField(group) == null) {
            sb.append('(');
            write(group, sb);
            sb.append(')');
        } else {
            write(operand, sb);
        }
    }

    private static boolean needsParentheses(Group child, BooleanOp parentOp) {
        return !child.isParenthesizedSingle() && sharedField(child) == null && child.op() != parentOp;
    }

    private static String separator(BooleanOp op) {
        return " " + op.keyword() + " ";
    }

    /**
     * The common field when every child is a term on the same field, otherwise null.
     */
    private static Identifier sharedField(Group group) {
        if (group.children().size() < 2) {
            return null;
        }
        Identifier field = null;
        for (Node child : group.children()) {
            if (!(child instanceof Term term) || term.field() == null) {
                return null;
            }
            if (field == null) {
                field = term.field();
            } else if (!field.equals(term.field())) {
                return null;
            }
        }
        return field;
    }

    private void writeTerm(Term term, StringBuilder sb) {
        if (term.field() != null) {
            sb.append(term.field().name()).append(": ");
        }
        sb.append(formatValue(term.value(), term.wildcard()));
    }

    private void writeRange(Range range, StringBuilder sb) {
        sb.append(range.field().name()).append(": ");
        Bound lower = range.lower();
        Bound upper = range.upper();
        if (lower != null && upper == null) {
            sb.append(lower.inclusive() ? ">=" : ">").append(formatValue(lower.value(), false));
        } else if (lower == null && upper != null) {
            sb.append(upper.inclusive() ? "<=" : "<").append(formatValue(upper.value(), false));
        } else {
            sb.append(lower == null || lower.inclusive() ? '[' : '{')
                    .append(lower == null ? "*" : formatValue(lower.value(), false))
                    .append(" TO ")
                    .append(upper == null ? "*" : formatValue(upper.value(), false))
                    .append(upper == null || upper.inclusive() ? ']' : '}');
        }
    }

    /**
     * Formats one literal. Wildcard patterns keep their wildcards; every other
     * value is quoted when written as a phrase or when it could not stand bare.
     */
    public static String formatValue(Literal literal, boolean wildcard) {
        String text = literal.text();
        if (wildcard) {
            return QueryStringEscaper.escapeWildcardPattern(text);
        }
        if (literal.quoted() || QueryStringEscaper.needsQuoting(text)) {
            return QueryStringEscaper.quote(text);
        }
        return QueryStringEscaper.escapeBare(text);
    }
}
