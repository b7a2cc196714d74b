package org.carball.queryflow.model.mapping;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.model.ast.Identifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only rename table from display field names to canonical field names.
 */
@Slf4j
public final class FieldMapping {

    private static final FieldMapping EMPTY = new FieldMapping(Map.of());

    private final Map<String, Identifier> mapping;

    private FieldMapping(Map<String, String> source) {
        Map<String, Identifier> copy = new LinkedHashMap<>();
        source.forEach((display, canonical) -> {
            Objects.requireNonNull(display, "display field");
            if (!Identifier.isValid(display)) {
                log.warn("Field mapping key '{}' is not a valid identifier and can never match", display);
            }
            copy.put(display, Identifier.of(canonical));
        });
        this.mapping = Collections.unmodifiableMap(copy);
    }

    public static FieldMapping of(Map<String, String> mapping) {
        return mapping == null || mapping.isEmpty() ? EMPTY : new FieldMapping(mapping);
    }

    public static FieldMapping empty() {
        return EMPTY;
    }

    public Optional<Identifier> lookup(String displayField) {
        return Optional.ofNullable(mapping.get(displayField));
    }

    /**
     * Returns the canonical name, or the given name when it is not mapped.
     */
    public String resolve(String displayField) {
        Identifier mapped = mapping.get(displayField);
        return mapped != null ? mapped.name() : displayField;
    }

    public boolean isEmpty() {
        return mapping.isEmpty();
    }

    public int size() {
        return mapping.size();
    }

    public Map<String, Identifier> asMap() {
        return mapping;
    }

    @Override
    public String toString() {
        return "FieldMapping" + mapping;
    }
}
