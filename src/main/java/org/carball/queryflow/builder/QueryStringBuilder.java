package org.carball.queryflow.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.ast.Group;
import org.carball.queryflow.model.ast.Node;
import org.carball.queryflow.model.condition.Condition;
import org.carball.queryflow.model.condition.OperatorKind;
import org.carball.queryflow.serializer.QueryStringSerializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds query string text from structured conditions without going through
 * the lexer. Conditions are joined with the condition relation, AND unless
 * configured otherwise.
 */
@Slf4j
public class QueryStringBuilder {

    private final ConditionParser conditionParser;
    private final Map<String, OperatorKind> operatorAliases;
    private final BooleanOp conditionRelation;
    private final QueryStringSerializer serializer = new QueryStringSerializer();
    private final List<Condition> conditions = new ArrayList<>();

    public QueryStringBuilder() {
        this(new DefaultConditionParser(), Map.of(), BooleanOp.AND);
    }

    public QueryStringBuilder(Map<String, OperatorKind> operatorAliases, BooleanOp conditionRelation) {
        this(new DefaultConditionParser(), operatorAliases, conditionRelation);
    }

    public QueryStringBuilder(ConditionParser conditionParser, Map<String, OperatorKind> operatorAliases,
                              BooleanOp conditionRelation) {
        this.conditionParser = conditionParser;
        this.conditionRelation = conditionRelation != null ? conditionRelation : BooleanOp.AND;
        Map<String, OperatorKind> aliases = new LinkedHashMap<>();
        if (operatorAliases != null) {
            operatorAliases.forEach((alias, kind) -> aliases.put(alias.toLowerCase(Locale.ROOT), kind));
        }
        this.operatorAliases = Collections.unmodifiableMap(aliases);
    }

    public QueryStringBuilder addFilter(Condition condition) {
        conditions.add(condition);
        return this;
    }

    public QueryStringBuilder addFilter(String field, String operator, List<?> values) {
        return addFilter(field, resolveOperator(operator), values);
    }

    public QueryStringBuilder addFilter(String field, OperatorKind operator, List<?> values) {
        return addFilter(Condition.builder()
                .field(field)
                .operator(operator)
                .values(values == null ? List.of() : new ArrayList<>(values))
                .build());
    }

    /**
     * Resolves an operator name, trying the configured aliases first.
     */
    public OperatorKind resolveOperator(String operator) {
        if (operator != null) {
            OperatorKind aliased = operatorAliases.get(operator.trim().toLowerCase(Locale.ROOT));
            if (aliased != null) {
                return aliased;
            }
        }
        return OperatorKind.fromName(operator);
    }

    public String build() {
        return build(conditions);
    }

    public String build(List<Condition> conditions) {
        Node root = buildNode(conditions);
        String result = root == null ? "" : serializer.serialize(root);
        log.debug("Built query string from {} conditions: {}", conditions.size(), result);
        return result;
    }

    public Node buildNode() {
        return buildNode(conditions);
    }

    /**
     * @return the combined tree, or {@code null} when no condition contributes a clause
     */
    public Node buildNode(List<Condition> conditions) {
        List<Node> clauses = new ArrayList<>();
        for (Condition condition : conditions) {
            Node clause = conditionParser.parse(condition);
            if (clause != null) {
                clauses.add(clause);
            }
        }
        if (clauses.isEmpty()) {
            return null;
        }
        return clauses.size() == 1 ? clauses.get(0) : new Group(conditionRelation, clauses);
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public QueryStringBuilder clear() {
        conditions.clear();
        return this;
    }
}
