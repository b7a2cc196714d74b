package org.carball.queryflow.dsl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Static factories for Elasticsearch query clauses as Jackson trees.
 */
public final class DslQueryHelper {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DslQueryHelper() {
        // Utility class - prevent instantiation
    }

    public static ObjectNode boolQuery() {
        ObjectNode query = NODES.objectNode();
        query.putObject("bool");
        return query;
    }

    public static ObjectNode boolQuery(int minimumShouldMatch) {
        ObjectNode query = boolQuery();
        ((ObjectNode) query.get("bool")).put("minimum_should_match", minimumShouldMatch);
        return query;
    }

    public static void boolAddFilter(ObjectNode bool, ObjectNode filter) {
        boolAdd(bool, filter, "filter");
    }

    public static void boolAddMust(ObjectNode bool, ObjectNode must) {
        boolAdd(bool, must, "must");
    }

    public static void boolAddMustNot(ObjectNode bool, ObjectNode mustNot) {
        boolAdd(bool, mustNot, "must_not");
    }

    public static void boolAddShould(ObjectNode bool, ObjectNode should) {
        boolAdd(bool, should, "should");
    }

    /**
     * Adds a clause under the given occurrence type unless an equal clause is
     * already there. A second clause turns the single object into an array.
     */
    private static void boolAdd(ObjectNode bool, ObjectNode clause, String occurrenceType) {
        ObjectNode body = (ObjectNode) bool.get("bool");
        JsonNode existing = body.get(occurrenceType);
        if (existing == null) {
            body.set(occurrenceType, clause);
        } else if (existing.isArray()) {
            ArrayNode clauses = (ArrayNode) existing;
            for (JsonNode present : clauses) {
                if (present.equals(clause)) {
                    return;
                }
            }
            clauses.add(clause);
        } else if (!existing.equals(clause)) {
            body.putArray(occurrenceType).add(existing).add(clause);
        }
    }

    /**
     * Combines clauses: one clause is returned as is, several are wrapped in a
     * bool query as {@code filter} (AND) or {@code should} with
     * {@code minimum_should_match: 1} (OR).
     */
    public static ObjectNode combine(List<ObjectNode> clauses, boolean any) {
        if (clauses.size() == 1) {
            return clauses.get(0);
        }
        ObjectNode bool = any ? boolQuery(1) : boolQuery();
        for (ObjectNode clause : clauses) {
            if (any) {
                boolAddShould(bool, clause);
            } else {
                boolAddFilter(bool, clause);
            }
        }
        return bool;
    }

    public static ObjectNode not(ObjectNode query) {
        ObjectNode bool = boolQuery();
        boolAddMustNot(bool, query);
        return bool;
    }

    public static ObjectNode termsQuery(String name, List<?> values) {
        ObjectNode query = NODES.objectNode();
        ArrayNode array = query.putObject("terms").putArray(name);
        for (Object value : values) {
            array.add(toJson(value));
        }
        return query;
    }

    public static ObjectNode wildcardQuery(String name, String pattern) {
        ObjectNode query = NODES.objectNode();
        query.putObject("wildcard").put(name, pattern);
        return query;
    }

    /**
     * @param operator one of {@code gt}, {@code gte}, {@code lt}, {@code lte}
     */
    public static ObjectNode rangeQuery(String name, String operator, Object value) {
        ObjectNode query = NODES.objectNode();
        query.putObject("range").putObject(name).set(operator, toJson(value));
        return query;
    }

    public static ObjectNode rangeQuery(String name, Object gte, Object lte) {
        ObjectNode query = NODES.objectNode();
        ObjectNode bounds = query.putObject("range").putObject(name);
        bounds.set("gte", toJson(gte));
        bounds.set("lte", toJson(lte));
        return query;
    }

    public static ObjectNode existsQuery(String name) {
        ObjectNode query = NODES.objectNode();
        query.putObject("exists").put("field", name);
        return query;
    }

    public static ObjectNode regexpQuery(String name, String regex) {
        ObjectNode query = NODES.objectNode();
        query.putObject("regexp").put(name, regex);
        return query;
    }

    public static ObjectNode queryStringQuery(String queryString) {
        ObjectNode query = NODES.objectNode();
        query.putObject("query_string").put("query", queryString);
        return query;
    }

    public static ObjectNode matchAllQuery() {
        ObjectNode query = NODES.objectNode();
        query.putObject("match_all");
        return query;
    }

    /**
     * Numbers, booleans and strings keep their JSON type.
     */
    public static JsonNode toJson(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        return MAPPER.valueToTree(value);
    }
}
