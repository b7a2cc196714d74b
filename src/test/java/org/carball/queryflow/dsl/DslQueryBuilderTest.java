package org.carball.queryflow.dsl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.condition.Condition;
import org.carball.queryflow.model.condition.OperatorKind;
import org.carball.queryflow.model.mapping.FieldMapping;
import org.carball.queryflow.model.mapping.ValueTranslation;
import org.carball.queryflow.model.mapping.ValueTranslations;
import org.carball.queryflow.transformer.QueryStringTransformer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DslQueryBuilderTest {

    @Test
    void shouldMatchAllWhenNothingIsConfigured() {
        ObjectNode body = new DslQueryBuilder().build();

        assertThat(body.at("/query/match_all").isObject()).isTrue();
        assertThat(body.get("from").asInt()).isZero();
        assertThat(body.get("size").asInt()).isEqualTo(10);
        assertThat(body.has("sort")).isFalse();
    }

    @Test
    void shouldAssembleFiltersQueryStringSortAndPage() {
        // Given
        FieldMapping fieldMapping = FieldMapping.of(Map.of("lvl", "severity", "created", "created_at"));
        ValueTranslations translations = ValueTranslations.of(Map.of("severity", List.of(ValueTranslation.of(1, "致命"))));
        QueryStringTransformer transformer = new QueryStringTransformer(fieldMapping, translations);

        // When
        ObjectNode body = new DslQueryBuilder(fieldMapping, transformer)
                .conditions(List.of(
                        Condition.of("status", OperatorKind.EQUAL, "error"),
                        Condition.of("lvl", OperatorKind.GTE, 3)))
                .queryString("lvl: 致命")
                .ordering(List.of("-created", "name"))
                .pagination(3, 20)
                .build();

        // Then
        assertThat(body.at("/query/bool/filter").size()).isEqualTo(2);
        assertThat(body.at("/query/bool/filter/0/terms/status/0").asText()).isEqualTo("error");
        assertThat(body.at("/query/bool/filter/1/range/severity/gte").asInt()).isEqualTo(3);
        assertThat(body.at("/query/bool/must/query_string/query").asText()).isEqualTo("severity: 1");
        assertThat(body.at("/sort/0/created_at/order").asText()).isEqualTo("desc");
        assertThat(body.at("/sort/1/name/order").asText()).isEqualTo("asc");
        assertThat(body.get("from").asInt()).isEqualTo(40);
        assertThat(body.get("size").asInt()).isEqualTo(20);
    }

    @Test
    void shouldClampPagination() {
        ObjectNode body = new DslQueryBuilder().pagination(0, -5).build();

        assertThat(body.get("from").asInt()).isZero();
        assertThat(body.get("size").asInt()).isEqualTo(1);
    }

    @Test
    void shouldCombineConditionsWithOr() {
        ObjectNode body = new DslQueryBuilder()
                .conditions(List.of(
                        Condition.of("a", OperatorKind.EXISTS),
                        Condition.of("b", OperatorKind.EXISTS)))
                .conditionRelation(BooleanOp.OR)
                .build();

        JsonNode filter = body.at("/query/bool/filter");
        assertThat(filter.at("/bool/minimum_should_match").asInt()).isEqualTo(1);
        assertThat(filter.at("/bool/should").size()).isEqualTo(2);
    }

    @Test
    void shouldEmbedQueryStringUnchangedWithoutTransformer() {
        ObjectNode body = new DslQueryBuilder().queryString("  message: timeout ").build();

        assertThat(body.at("/query/bool/must/query_string/query").asText()).isEqualTo("message: timeout");
    }

    @Test
    void shouldAddExtraFiltersAndReset() {
        DslQueryBuilder builder = new DslQueryBuilder()
                .addFilter(DslQueryHelper.existsQuery("tags"))
                .pagination(2, 5);

        assertThat(builder.build().at("/query/bool/filter/exists/field").asText()).isEqualTo("tags");

        ObjectNode cleared = builder.clear().build();
        assertThat(cleared.at("/query/match_all").isObject()).isTrue();
        assertThat(cleared.get("size").asInt()).isEqualTo(10);
    }

    @Test
    void shouldWriteJson() throws Exception {
        String json = new DslQueryBuilder()
                .conditions(List.of(Condition.of("status", OperatorKind.EQUAL, "ok")))
                .toJson();

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.at("/query/bool/filter/terms/status/0").asText()).isEqualTo("ok");
    }

    @Test
    void shouldNotOverflowOffsetForLargePages() {
        ObjectNode body = new DslQueryBuilder().pagination(Integer.MAX_VALUE, 100).build();

        assertThat(body.get("from").asLong()).isEqualTo((Integer.MAX_VALUE - 1L) * 100L);
    }
}
