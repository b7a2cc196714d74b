package org.carball.queryflow.config;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.transformer.TransformerSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class ConfigurationLoader {

    public static final String MAPPING_FILE_ENV = "QUERYFLOW_MAPPING_FILE";
    public static final String QUOTE_FREE_TEXT_ENV = "QUERYFLOW_QUOTE_FREE_TEXT";
    public static final String BLANK_RESULT_ENV = "QUERYFLOW_BLANK_RESULT";

    private final Map<String, String> environment;
    private final MappingConfigLoader mappingConfigLoader;

    public ConfigurationLoader() {
        this(System.getenv(), new MappingConfigLoader());
    }

    public ConfigurationLoader(Map<String, String> environment, MappingConfigLoader mappingConfigLoader) {
        this.environment = environment;
        this.mappingConfigLoader = mappingConfigLoader;
    }

    /**
     * Resolves the mapping file using the hierarchy: CLI args > env vars > none
     */
    public Optional<Path> resolveMappingFile(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--mapping".equals(args[i]) || "-m".equals(args[i])) {
                return Optional.of(Paths.get(args[i + 1]));
            }
        }
        String fromEnv = environment.get(MAPPING_FILE_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            log.debug("Using mapping file from {}", MAPPING_FILE_ENV);
            return Optional.of(Paths.get(fromEnv.trim()));
        }
        return Optional.empty();
    }

    /**
     * Loads the resolved mapping file, or an empty mapping when none is configured.
     */
    public MappingConfig loadMappingConfig(String[] args) throws IOException {
        Optional<Path> mappingFile = resolveMappingFile(args);
        if (mappingFile.isEmpty()) {
            log.info("No mapping file configured, fields and values pass through unchanged");
            return MappingConfig.empty();
        }
        return mappingConfigLoader.load(mappingFile.get());
    }

    /**
     * Loads transformer settings using the hierarchy: CLI args > env vars > defaults
     */
    public TransformerSettings loadSettings(String[] args) {
        TransformerSettings.TransformerSettingsBuilder builder = TransformerSettings.defaults().toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        TransformerSettings settings = builder.build();
        settings.validate();
        log.debug("Settings loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    public MappingConfigLoader getMappingConfigLoader() {
        return mappingConfigLoader;
    }

    private void applyEnvironmentVariables(TransformerSettings.TransformerSettingsBuilder builder) {
        if (environment.containsKey(QUOTE_FREE_TEXT_ENV)) {
            builder.quoteUnmatchedFreeText(Boolean.parseBoolean(environment.get(QUOTE_FREE_TEXT_ENV).trim()));
        }
        if (environment.containsKey(BLANK_RESULT_ENV)) {
            builder.blankQueryResult(environment.get(BLANK_RESULT_ENV));
        }
    }

    private void applyCLIArguments(TransformerSettings.TransformerSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--quote-free-text":
                    builder.quoteUnmatchedFreeText(true);
                    break;
                case "--no-quote-free-text":
                    builder.quoteUnmatchedFreeText(false);
                    break;
                case "--blank-result":
                    if (i + 1 < args.length) {
                        builder.blankQueryResult(args[++i]);
                    } else {
                        log.warn("Missing value for --blank-result");
                    }
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --mapping, -m <file>      YAML or JSON mapping file (field_mapping, value_translations)
              --quote-free-text         Quote free text that matches no value translation
              --no-quote-free-text      Leave unmatched free text as written (default)
              --blank-result <text>     Result for a blank query (default: empty)

            Environment Variables:
              QUERYFLOW_MAPPING_FILE    Same as --mapping
              QUERYFLOW_QUOTE_FREE_TEXT Same as --quote-free-text when 'true'
              QUERYFLOW_BLANK_RESULT    Same as --blank-result

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
