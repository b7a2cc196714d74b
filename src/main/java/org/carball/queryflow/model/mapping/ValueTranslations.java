package org.carball.queryflow.model.mapping;

import org.carball.queryflow.model.ast.Identifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only per-field tables of (canonical value, display value) pairs.
 * <p>
 * Field order and pair order are kept as declared; lookups return the first match.
 */
public final class ValueTranslations {

    private static final ValueTranslations EMPTY = new ValueTranslations(Map.of());

    private final Map<Identifier, List<ValueTranslation>> translations;

    private ValueTranslations(Map<String, List<ValueTranslation>> source) {
        Map<Identifier, List<ValueTranslation>> copy = new LinkedHashMap<>();
        source.forEach((field, pairs) -> copy.put(Identifier.of(field), List.copyOf(pairs)));
        this.translations = Collections.unmodifiableMap(copy);
    }

    /**
     * @param translations canonical field name to its ordered translation list; use an
     *                     ordered map when several fields share display values
     */
    public static ValueTranslations of(Map<String, List<ValueTranslation>> translations) {
        return translations == null || translations.isEmpty() ? EMPTY : new ValueTranslations(translations);
    }

    public static ValueTranslations empty() {
        return EMPTY;
    }

    /**
     * Translates a display value typed against a known field.
     */
    public Optional<String> translate(Identifier field, String displayValue) {
        List<ValueTranslation> pairs = translations.get(field);
        if (pairs == null) {
            return Optional.empty();
        }
        for (ValueTranslation pair : pairs) {
            if (pair.displayValue().equals(displayValue)) {
                return Optional.of(pair.canonicalValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first field, in declaration order, whose table contains the display value.
     */
    public Optional<Match> findField(String displayValue) {
        for (Map.Entry<Identifier, List<ValueTranslation>> entry : translations.entrySet()) {
            for (ValueTranslation pair : entry.getValue()) {
                if (pair.displayValue().equals(displayValue)) {
                    return Optional.of(new Match(entry.getKey(), pair.canonicalValue()));
                }
            }
        }
        return Optional.empty();
    }

    public boolean hasField(Identifier field) {
        return translations.containsKey(field);
    }

    public boolean isEmpty() {
        return translations.isEmpty();
    }

    public Map<Identifier, List<ValueTranslation>> asMap() {
        return translations;
    }

    public record Match(Identifier field, String canonicalValue) {
    }

    @Override
    public String toString() {
        return "ValueTranslations" + translations;
    }
}
