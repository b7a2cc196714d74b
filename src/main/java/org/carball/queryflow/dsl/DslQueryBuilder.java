package org.carball.queryflow.dsl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.exception.QueryFlowException;
import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.condition.Condition;
import org.carball.queryflow.model.mapping.FieldMapping;
import org.carball.queryflow.transformer.QueryStringTransformer;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles an Elasticsearch search body from conditions, a query string,
 * ordering and pagination.
 * <pre>
 * new DslQueryBuilder(fieldMapping, transformer)
 *         .conditions(conditions)
 *         .queryString("message: timeout")
 *         .ordering(List.of("-created_at"))
 *         .pagination(1, 20)
 *         .build();
 * </pre>
 */
@Slf4j
public class DslQueryBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_PAGE_SIZE = 10;

    private final FieldMapping fieldMapping;
    private final QueryStringTransformer transformer;
    private final DslConditionParser conditionParser;

    private final List<Condition> conditions = new ArrayList<>();
    private final List<ObjectNode> extraFilters = new ArrayList<>();
    private final List<String> ordering = new ArrayList<>();
    private BooleanOp conditionRelation = BooleanOp.AND;
    private String queryString = "";
    private int page = 1;
    private int pageSize = DEFAULT_PAGE_SIZE;

    public DslQueryBuilder() {
        this(FieldMapping.empty(), null);
    }

    /**
     * @param transformer applied to the query string before it is embedded; may be null
     */
    public DslQueryBuilder(FieldMapping fieldMapping, QueryStringTransformer transformer) {
        this(fieldMapping, transformer, new DslConditionParser());
    }

    public DslQueryBuilder(FieldMapping fieldMapping, QueryStringTransformer transformer,
                           DslConditionParser conditionParser) {
        this.fieldMapping = fieldMapping != null ? fieldMapping : FieldMapping.empty();
        this.transformer = transformer;
        this.conditionParser = conditionParser;
    }

    public DslQueryBuilder conditions(List<Condition> conditions) {
        this.conditions.addAll(conditions);
        return this;
    }

    public DslQueryBuilder conditionRelation(BooleanOp relation) {
        this.conditionRelation = relation != null ? relation : BooleanOp.AND;
        return this;
    }

    public DslQueryBuilder queryString(String queryString) {
        this.queryString = queryString != null ? queryString : "";
        return this;
    }

    /**
     * @param ordering field names, a leading {@code -} sorts descending
     */
    public DslQueryBuilder ordering(List<String> ordering) {
        this.ordering.clear();
        this.ordering.addAll(ordering);
        return this;
    }

    /**
     * Page numbers start at 1; both values are clamped to at least 1.
     */
    public DslQueryBuilder pagination(int page, int pageSize) {
        this.page = Math.max(1, page);
        this.pageSize = Math.max(1, pageSize);
        return this;
    }

    public DslQueryBuilder addFilter(ObjectNode filter) {
        if (filter != null) {
            extraFilters.add(filter);
        }
        return this;
    }

    public ObjectNode build() {
        ObjectNode bool = DslQueryHelper.boolQuery();
        boolean hasClauses = false;

        List<ObjectNode> conditionClauses = buildConditions();
        if (!conditionClauses.isEmpty()) {
            if (conditionRelation == BooleanOp.OR) {
                DslQueryHelper.boolAddFilter(bool, DslQueryHelper.combine(conditionClauses, true));
            } else {
                conditionClauses.forEach(clause -> DslQueryHelper.boolAddFilter(bool, clause));
            }
            hasClauses = true;
        }
        for (ObjectNode filter : extraFilters) {
            DslQueryHelper.boolAddFilter(bool, filter);
            hasClauses = true;
        }
        String query = queryString.trim();
        if (!query.isEmpty()) {
            if (transformer != null) {
                query = transformer.transform(query);
            }
            DslQueryHelper.boolAddMust(bool, DslQueryHelper.queryStringQuery(query));
            hasClauses = true;
        }

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.set("query", hasClauses ? bool : DslQueryHelper.matchAllQuery());
        body.put("from", (long) (page - 1) * pageSize);
        body.put("size", pageSize);
        if (!ordering.isEmpty()) {
            ArrayNode sort = body.putArray("sort");
            for (String field : ordering) {
                boolean descending = field.startsWith("-");
                String name = fieldMapping.resolve(descending ? field.substring(1) : field);
                sort.addObject().putObject(name).put("order", descending ? "desc" : "asc");
            }
        }
        log.debug("Built search body with {} conditions, page {} of size {}", conditions.size(), page, pageSize);
        return body;
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(build());
        } catch (JsonProcessingException e) {
            throw new QueryFlowException("Failed to write search body", e);
        }
    }

    public DslQueryBuilder clear() {
        conditions.clear();
        extraFilters.clear();
        ordering.clear();
        conditionRelation = BooleanOp.AND;
        queryString = "";
        page = 1;
        pageSize = DEFAULT_PAGE_SIZE;
        return this;
    }

    private List<ObjectNode> buildConditions() {
        List<ObjectNode> clauses = new ArrayList<>();
        for (Condition condition : conditions) {
            Condition mapped = condition.toBuilder()
                    .field(fieldMapping.resolve(condition.getField()))
                    .build();
            ObjectNode clause = conditionParser.parse(mapped);
            if (clause != null) {
                clauses.add(clause);
            }
        }
        return clauses;
    }
}
