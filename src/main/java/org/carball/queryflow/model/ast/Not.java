package org.carball.queryflow.model.ast;

import java.util.Objects;

public record Not(Node inner) implements Node {

    public Not {
        Objects.requireNonNull(inner, "inner");
    }
}
