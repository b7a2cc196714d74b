package org.carball.queryflow.model.ast;

import java.util.List;
import java.util.Objects;

/**
 * Children combined with one boolean operator, in order.
 * <p>
 * A group always has at least one child. A single-child group stands for
 * explicit parentheses around one clause.
 */
public record Group(BooleanOp op, List<Node> children) implements Node {

    public Group {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(children, "children");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Group must have at least one child");
        }
        children = List.copyOf(children);
    }

    public static Group of(BooleanOp op, Node... children) {
        return new Group(op, List.of(children));
    }

    public static Group parenthesized(Node child) {
        return new Group(BooleanOp.AND, List.of(child));
    }

    public boolean isParenthesizedSingle() {
        return children.size() == 1;
    }
}
