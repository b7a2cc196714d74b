package org.carball.queryflow.model.ast;

/**
 * A node of a parsed or built query string tree.
 * <p>
 * Implementations are immutable records: {@link Term}, {@link Range},
 * {@link Not}, {@link Group} and {@link Raw}. Rewriting produces a new tree
 * and leaves untouched subtrees shared with the input.
 */
public interface Node {
}
