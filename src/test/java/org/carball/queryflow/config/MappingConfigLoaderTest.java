package org.carball.queryflow.config;

import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.ast.Identifier;
import org.carball.queryflow.model.condition.OperatorKind;
import org.carball.queryflow.model.mapping.FieldMapping;
import org.carball.queryflow.model.mapping.ValueTranslations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingConfigLoaderTest {

    @TempDir
    Path tempDir;

    private MappingConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new MappingConfigLoader();
    }

    @Test
    void shouldLoadYamlMapping() throws IOException {
        // Given
        Path file = tempDir.resolve("mapping.yml");
        Files.writeString(file, """
                field_mapping:
                  lvl: severity
                value_translations:
                  severity:
                    - value: 1
                      display: 致命
                    - value: 2
                      display: 预警
                condition_relation: or
                operator_aliases:
                  eq: equal
                """);

        // When
        MappingConfig config = loader.load(file);
        FieldMapping fieldMapping = loader.toFieldMapping(config);
        ValueTranslations translations = loader.toValueTranslations(config);

        // Then
        assertThat(fieldMapping.resolve("lvl")).isEqualTo("severity");
        assertThat(translations.translate(Identifier.of("severity"), "预警")).contains("2");
        assertThat(loader.toConditionRelation(config)).isEqualTo(BooleanOp.OR);
        assertThat(loader.toOperatorAliases(config)).containsEntry("eq", OperatorKind.EQUAL);
    }

    @Test
    void shouldLoadJsonMapping() throws IOException {
        Path file = tempDir.resolve("mapping.json");
        Files.writeString(file, """
                {
                  "field_mapping": {"level": "severity"},
                  "value_translations": {"severity": [{"value": "1", "display": "致命"}]}
                }
                """);

        MappingConfig config = loader.load(file);

        assertThat(config.getFieldMapping()).containsEntry("level", "severity");
        assertThat(loader.toConditionRelation(config)).isEqualTo(BooleanOp.AND);
        assertThat(loader.toValueTranslations(config).findField("致命"))
                .hasValueSatisfying(match -> assertThat(match.canonicalValue()).isEqualTo("1"));
    }

    @Test
    void shouldKeepTranslationTableDeclarationOrder() throws IOException {
        Path file = tempDir.resolve("collision.yaml");
        Files.writeString(file, """
                value_translations:
                  risk:
                    - value: high
                      display: 高
                  priority:
                    - value: p1
                      display: 高
                """);

        ValueTranslations translations = loader.toValueTranslations(loader.load(file));

        assertThat(translations.findField("高"))
                .hasValueSatisfying(match -> assertThat(match.field().name()).isEqualTo("risk"));
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Mapping file not found");
    }

    @Test
    void shouldRejectMalformedContent() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "field_mapping: [1, 2]\n");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid mapping file");
    }

    @Test
    void shouldRejectInvalidCanonicalField() throws IOException {
        Path file = tempDir.resolve("fields.yml");
        Files.writeString(file, """
                field_mapping:
                  level: "not valid"
                """);
        MappingConfig config = loader.load(file);

        assertThatThrownBy(() -> loader.toFieldMapping(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid field_mapping");
    }

    @Test
    void shouldRejectUnknownOperatorAlias() throws IOException {
        Path file = tempDir.resolve("aliases.yml");
        Files.writeString(file, """
                operator_aliases:
                  like: fuzzy
                """);
        MappingConfig config = loader.load(file);

        assertThatThrownBy(() -> loader.toOperatorAliases(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("like");
    }

    @Test
    void shouldTreatEmptyFileAsEmptyMapping() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        MappingConfig config = loader.load(file);

        assertThat(loader.toFieldMapping(config).isEmpty()).isTrue();
        assertThat(loader.toValueTranslations(config).isEmpty()).isTrue();
    }
}
