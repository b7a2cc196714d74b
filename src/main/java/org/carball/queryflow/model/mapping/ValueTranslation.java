package org.carball.queryflow.model.mapping;

import java.util.Objects;

/**
 * One entry of a field's translation list: the stored value and the label users type.
 */
public record ValueTranslation(String canonicalValue, String displayValue) {

    public ValueTranslation {
        Objects.requireNonNull(canonicalValue, "canonicalValue");
        Objects.requireNonNull(displayValue, "displayValue");
    }

    public static ValueTranslation of(Object canonicalValue, String displayValue) {
        return new ValueTranslation(String.valueOf(canonicalValue), displayValue);
    }
}
