package org.carball.queryflow.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.exception.UnsupportedOperatorException;
import org.carball.queryflow.model.ast.Bound;
import org.carball.queryflow.model.ast.Group;
import org.carball.queryflow.model.ast.Identifier;
import org.carball.queryflow.model.ast.Literal;
import org.carball.queryflow.model.ast.Node;
import org.carball.queryflow.model.ast.Not;
import org.carball.queryflow.model.ast.Range;
import org.carball.queryflow.model.ast.Raw;
import org.carball.queryflow.model.ast.Term;
import org.carball.queryflow.model.condition.Condition;
import org.carball.queryflow.model.condition.OperatorKind;
import org.carball.queryflow.parser.QueryStringEscaper;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps each operator onto query string nodes.
 * <ul>
 *   <li>equal / not_equal: quoted term, optionally negated</li>
 *   <li>include / not_include: {@code *value*} wildcard term, or the caller's own pattern when it
 *   already holds wildcards</li>
 *   <li>gt, gte, lt, lte: single bound range on the first value</li>
 *   <li>between: inclusive range on the first two values</li>
 *   <li>exists / not_exists: {@code field: *}</li>
 *   <li>reg / nreg: {@code field: /regex/}</li>
 * </ul>
 */
@Slf4j
public class DefaultConditionParser implements ConditionParser {

    @Override
    public Node parse(Condition condition) {
        OperatorKind operator = condition.getOperator();
        if (operator == null) {
            throw new UnsupportedOperatorException(null);
        }
        Identifier field = Identifier.of(condition.getField());
        if (operator.isValueRequired() && !condition.hasValues()) {
            log.debug("Skipping {} condition on {} without values", operator.getOperatorName(), field);
            return null;
        }
        List<String> values = condition.hasValues()
                ? condition.getValues().stream().map(String::valueOf).collect(Collectors.toList())
                : List.of();

        return switch (operator) {
            case EXISTS -> exists(field);
            case NOT_EXISTS -> new Not(exists(field));
            case EQUAL -> combine(condition, values, value -> new Term(field, Literal.quoted(value), false));
            case NOT_EQUAL -> new Not(combine(condition, values, value -> new Term(field, Literal.quoted(value), false)));
            case INCLUDE -> combine(condition, values, value -> contains(field, value, condition.isWildcard()));
            case NOT_INCLUDE -> new Not(combine(condition, values, value -> contains(field, value, condition.isWildcard())));
            case GT -> new Range(field, new Bound(Literal.bare(values.get(0)), false), null);
            case GTE -> new Range(field, new Bound(Literal.bare(values.get(0)), true), null);
            case LT -> new Range(field, null, new Bound(Literal.bare(values.get(0)), false));
            case LTE -> new Range(field, null, new Bound(Literal.bare(values.get(0)), true));
            case BETWEEN -> between(field, values);
            case REG -> combine(condition, values, value -> regex(field, value));
            case NREG -> new Not(combine(condition, values, value -> regex(field, value)));
        };
    }

    private static Node combine(Condition condition, List<String> values, Function<String, Node> factory) {
        if (values.size() == 1) {
            return factory.apply(values.get(0));
        }
        List<Node> nodes = values.stream().map(factory).collect(Collectors.toList());
        return new Group(condition.getGroupRelation(), nodes);
    }

    private static Term exists(Identifier field) {
        return new Term(field, Literal.bare("*"), true);
    }

    private static Term contains(Identifier field, String value, boolean keepWildcards) {
        if (keepWildcards && QueryStringEscaper.hasWildcard(value)) {
            return new Term(field, Literal.bare(value), true);
        }
        String pattern = "*" + (keepWildcards ? value : QueryStringEscaper.toWildcardPattern(value)) + "*";
        return new Term(field, Literal.bare(pattern), true);
    }

    private static Range between(Identifier field, List<String> values) {
        if (values.size() < 2) {
            throw new IllegalArgumentException("BETWEEN operator requires 2 values");
        }
        return new Range(field, Bound.inclusive(values.get(0)), Bound.inclusive(values.get(1)));
    }

    private static Raw regex(Identifier field, String value) {
        return new Raw(field.name() + ": /" + QueryStringEscaper.escapeRegex(value) + "/");
    }
}
