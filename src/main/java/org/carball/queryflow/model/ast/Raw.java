package org.carball.queryflow.model.ast;

import java.util.Objects;

/**
 * Well-formed query text that is passed through untouched, such as a
 * {@code field: /regex/} clause.
 */
public record Raw(String text) implements Node {

    public Raw {
        Objects.requireNonNull(text, "text");
    }
}
