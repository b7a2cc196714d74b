package org.carball.queryflow.model.ast;

import java.util.Objects;

/**
 * A single field/value match. {@code field} is {@code null} for a bare value
 * searched across the default fields.
 */
public record Term(Identifier field, Literal value, boolean wildcard) implements Node {

    public Term {
        Objects.requireNonNull(value, "value");
    }

    public static Term of(String field, Literal value) {
        return new Term(Identifier.of(field), value, false);
    }

    public static Term freeText(Literal value) {
        return new Term(null, value, false);
    }

    public boolean hasField() {
        return field != null;
    }

    public Term withField(Identifier newField) {
        return new Term(newField, value, wildcard);
    }

    public Term withValue(Literal newValue) {
        return new Term(field, newValue, wildcard);
    }
}
