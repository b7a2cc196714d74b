package org.carball.queryflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.exception.QueryFlowException;
import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.condition.OperatorKind;
import org.carball.queryflow.model.mapping.FieldMapping;
import org.carball.queryflow.model.mapping.ValueTranslation;
import org.carball.queryflow.model.mapping.ValueTranslations;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads mapping files and turns them into the read-only tables the
 * transformer and builders take.
 */
@Slf4j
public class MappingConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();

    /**
     * Loads a {@code .yml}/{@code .yaml} file as YAML and anything else as JSON.
     *
     * @throws IOException              when the file is missing or unreadable
     * @throws IllegalArgumentException when the content is not a valid mapping file
     */
    public MappingConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Mapping file not found: " + path);
        }
        String content = Files.readString(path);
        if (content.isBlank()) {
            log.warn("Mapping file {} is empty, using an empty mapping", path);
            return MappingConfig.empty();
        }
        ObjectMapper mapper = isYaml(path) ? yamlMapper : jsonMapper;

        MappingConfig config;
        try {
            config = mapper.readValue(content, MappingConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid mapping file " + path + ": " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            log.warn("Mapping file {} holds no mapping, using an empty mapping", path);
            return MappingConfig.empty();
        }
        log.info("Loaded mapping configuration from: {} ({})", path, config.getDescription());
        return config;
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    public FieldMapping toFieldMapping(MappingConfig config) {
        try {
            return FieldMapping.of(config.getFieldMapping());
        } catch (QueryFlowException e) {
            throw new IllegalArgumentException("Invalid field_mapping: " + e.getMessage(), e);
        }
    }

    public ValueTranslations toValueTranslations(MappingConfig config) {
        Map<String, List<MappingConfig.TranslationEntry>> source = config.getValueTranslations();
        if (source == null || source.isEmpty()) {
            return ValueTranslations.empty();
        }
        Map<String, List<ValueTranslation>> tables = new LinkedHashMap<>();
        source.forEach((field, entries) -> {
            List<ValueTranslation> pairs = new ArrayList<>();
            if (entries != null) {
                for (MappingConfig.TranslationEntry entry : entries) {
                    if (entry.getValue() == null || entry.getDisplay() == null) {
                        throw new IllegalArgumentException(
                                "Translation for field '" + field + "' needs both value and display: " + entry);
                    }
                    pairs.add(ValueTranslation.of(entry.getValue(), entry.getDisplay()));
                }
            }
            tables.put(field, pairs);
        });
        try {
            return ValueTranslations.of(tables);
        } catch (QueryFlowException e) {
            throw new IllegalArgumentException("Invalid value_translations: " + e.getMessage(), e);
        }
    }

    public BooleanOp toConditionRelation(MappingConfig config) {
        String relation = config.getConditionRelation();
        return relation == null || relation.isBlank() ? BooleanOp.AND : BooleanOp.fromName(relation);
    }

    public Map<String, OperatorKind> toOperatorAliases(MappingConfig config) {
        Map<String, OperatorKind> aliases = new LinkedHashMap<>();
        if (config.getOperatorAliases() != null) {
            config.getOperatorAliases().forEach((alias, operator) -> {
                try {
                    aliases.put(alias, OperatorKind.fromName(operator));
                } catch (QueryFlowException e) {
                    throw new IllegalArgumentException("Invalid operator alias '" + alias + "': " + e.getMessage(), e);
                }
            });
        }
        return aliases;
    }
}
