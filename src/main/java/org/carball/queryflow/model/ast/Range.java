package org.carball.queryflow.model.ast;

import java.util.Objects;

/**
 * A range over one field. A missing bound is open ended; a single bound is the
 * {@code field: >x} family of comparisons.
 */
public record Range(Identifier field, Bound lower, Bound upper) implements Node {

    public Range {
        Objects.requireNonNull(field, "field");
    }

    public Range withField(Identifier newField) {
        return new Range(newField, lower, upper);
    }

    public Range withBounds(Bound newLower, Bound newUpper) {
        return new Range(field, newLower, newUpper);
    }
}
