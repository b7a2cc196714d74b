package org.carball.queryflow.model.ast;

import java.util.Objects;

/**
 * A value as written in the query.
 * <p>
 * {@code text} holds the unescaped characters. For wildcard terms it holds the
 * pattern form instead: {@code *} and {@code ?} are wildcards, while
 * {@code \*}, {@code \?} and {@code \\} stand for the literal characters.
 * {@code quoted} records whether the value was written as a phrase.
 */
public record Literal(String text, boolean quoted) {

    public Literal {
        Objects.requireNonNull(text, "text");
    }

    public static Literal bare(String text) {
        return new Literal(text, false);
    }

    public static Literal quoted(String text) {
        return new Literal(text, true);
    }

    public Literal withText(String newText) {
        return new Literal(newText, quoted);
    }
}
