package org.carball.queryflow.dsl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.exception.UnsupportedOperatorException;
import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.ast.Identifier;
import org.carball.queryflow.model.condition.Condition;
import org.carball.queryflow.model.condition.OperatorKind;
import org.carball.queryflow.parser.QueryStringEscaper;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.carball.queryflow.dsl.DslQueryHelper.combine;
import static org.carball.queryflow.dsl.DslQueryHelper.existsQuery;
import static org.carball.queryflow.dsl.DslQueryHelper.not;
import static org.carball.queryflow.dsl.DslQueryHelper.rangeQuery;
import static org.carball.queryflow.dsl.DslQueryHelper.regexpQuery;
import static org.carball.queryflow.dsl.DslQueryHelper.termsQuery;
import static org.carball.queryflow.dsl.DslQueryHelper.wildcardQuery;

/**
 * Turns the same {@link Condition} shape the query string builder reads into
 * Elasticsearch query clauses.
 */
@Slf4j
public class DslConditionParser {

    /**
     * @return the clause, or {@code null} when a value-taking operator got no values
     */
    public ObjectNode parse(Condition condition) {
        OperatorKind operator = condition.getOperator();
        if (operator == null) {
            throw new UnsupportedOperatorException(null);
        }
        String field = Identifier.of(condition.getField()).name();
        if (operator.isValueRequired() && !condition.hasValues()) {
            log.debug("Skipping {} condition on {} without values", operator.getOperatorName(), field);
            return null;
        }
        List<Object> values = condition.hasValues() ? condition.getValues() : List.of();
        boolean any = condition.getGroupRelation() != BooleanOp.AND;

        return switch (operator) {
            case EXISTS -> existsQuery(field);
            case NOT_EXISTS -> not(existsQuery(field));
            case EQUAL -> equal(field, values, any);
            case NOT_EQUAL -> not(equal(field, values, any));
            case INCLUDE -> each(values, any, value -> contains(field, value, condition.isWildcard()));
            case NOT_INCLUDE -> not(each(values, any, value -> contains(field, value, condition.isWildcard())));
            case GT -> rangeQuery(field, "gt", values.get(0));
            case GTE -> rangeQuery(field, "gte", values.get(0));
            case LT -> rangeQuery(field, "lt", values.get(0));
            case LTE -> rangeQuery(field, "lte", values.get(0));
            case BETWEEN -> between(field, values);
            case REG -> each(values, any, value -> regexpQuery(field, String.valueOf(value)));
            case NREG -> not(each(values, any, value -> regexpQuery(field, String.valueOf(value))));
        };
    }

    /**
     * A terms clause already matches any of its values; requiring all of them
     * needs one clause per value.
     */
    private static ObjectNode equal(String field, List<Object> values, boolean any) {
        if (any || values.size() == 1) {
            return termsQuery(field, values);
        }
        return each(values, false, value -> termsQuery(field, List.of(value)));
    }

    private static ObjectNode each(List<Object> values, boolean any, Function<Object, ObjectNode> factory) {
        return combine(values.stream().map(factory).collect(Collectors.toList()), any);
    }

    private static ObjectNode contains(String field, Object value, boolean keepWildcards) {
        String text = String.valueOf(value);
        if (keepWildcards && QueryStringEscaper.hasWildcard(text)) {
            return wildcardQuery(field, text);
        }
        return wildcardQuery(field, "*" + (keepWildcards ? text : QueryStringEscaper.toWildcardPattern(text)) + "*");
    }

    private static ObjectNode between(String field, List<Object> values) {
        if (values.size() < 2) {
            throw new IllegalArgumentException("BETWEEN operator requires 2 values");
        }
        return rangeQuery(field, values.get(0), values.get(1));
    }
}
