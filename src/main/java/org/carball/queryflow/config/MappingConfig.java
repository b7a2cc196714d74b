package org.carball.queryflow.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping file contents, in YAML or JSON:
 * <pre>
 * field_mapping:
 *   level: severity
 * value_translations:
 *   severity:
 *     - value: 1
 *       display: 致命
 * condition_relation: and
 * operator_aliases:
 *   eq: equal
 * </pre>
 */
@Data
public class MappingConfig {

    @JsonProperty("field_mapping")
    private Map<String, String> fieldMapping = new LinkedHashMap<>();

    @JsonProperty("value_translations")
    private Map<String, List<TranslationEntry>> valueTranslations = new LinkedHashMap<>();

    @JsonProperty("condition_relation")
    private String conditionRelation = "and";

    @JsonProperty("operator_aliases")
    private Map<String, String> operatorAliases = new LinkedHashMap<>();

    public static MappingConfig empty() {
        return new MappingConfig();
    }

    public String getDescription() {
        int pairs = valueTranslations == null ? 0 : valueTranslations.values().stream()
                .mapToInt(entries -> entries == null ? 0 : entries.size())
                .sum();
        return String.format("Mapping: fields=%d, translatedFields=%d, translations=%d, relation=%s, aliases=%d",
                fieldMapping == null ? 0 : fieldMapping.size(),
                valueTranslations == null ? 0 : valueTranslations.size(),
                pairs,
                conditionRelation,
                operatorAliases == null ? 0 : operatorAliases.size());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TranslationEntry {

        /**
         * Stored value; numbers are accepted and compared as text.
         */
        @JsonProperty("value")
        private Object value;

        @JsonProperty("display")
        private String display;
    }
}
