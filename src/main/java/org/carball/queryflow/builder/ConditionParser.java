package org.carball.queryflow.builder;

import org.carball.queryflow.model.ast.Node;
import org.carball.queryflow.model.condition.Condition;

/**
 * Turns one structured condition into a query string tree.
 * <p>
 * Implementations must only produce valid identifiers and well-formed nodes,
 * and return {@code null} when the condition contributes nothing (for example
 * an operator that needs values but got none).
 */
public interface ConditionParser {

    Node parse(Condition condition);
}
