package org.carball.queryflow.transformer;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class TransformerSettings {

    /**
     * Returned as is for null or blank input.
     */
    @Builder.Default
    private String blankQueryResult = "";

    /**
     * Emit free text that matched no value translation as a quoted phrase.
     */
    @Builder.Default
    private boolean quoteUnmatchedFreeText = false;

    public static TransformerSettings defaults() {
        return TransformerSettings.builder().build();
    }

    /**
     * Validates the settings, failing on values the transformer cannot work with.
     */
    public void validate() {
        if (blankQueryResult == null) {
            throw new IllegalArgumentException("blankQueryResult must not be null");
        }
        if (!blankQueryResult.isBlank() && !"*".equals(blankQueryResult.trim())) {
            log.warn("Blank queries will be answered with '{}' which is neither empty nor match-all",
                    blankQueryResult);
        }
        log.debug("Using transformer settings - {}", getConfigurationSummary());
    }

    public String getConfigurationSummary() {
        return String.format("Blank result: '%s' | Quote unmatched free text: %s",
                blankQueryResult, quoteUnmatchedFreeText);
    }
}
