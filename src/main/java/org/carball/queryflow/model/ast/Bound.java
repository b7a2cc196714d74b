package org.carball.queryflow.model.ast;

import java.util.Objects;

public record Bound(Literal value, boolean inclusive) {

    public Bound {
        Objects.requireNonNull(value, "value");
    }

    public static Bound inclusive(String text) {
        return new Bound(Literal.bare(text), true);
    }

    public static Bound exclusive(String text) {
        return new Bound(Literal.bare(text), false);
    }

    public Bound withValue(Literal newValue) {
        return new Bound(newValue, inclusive);
    }
}
