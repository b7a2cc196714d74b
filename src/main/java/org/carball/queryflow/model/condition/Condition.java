package org.carball.queryflow.model.condition;

import lombok.Builder;
import lombok.Data;
import org.carball.queryflow.model.ast.BooleanOp;

import java.util.List;

/**
 * A structured filter: one field, one operator and its values.
 * Shared input of the query string builder and the DSL builder.
 */
@Data
@Builder(toBuilder = true)
public class Condition {
    private String field;
    private OperatorKind operator;

    @Builder.Default
    private List<Object> values = List.of();

    /**
     * How several values of this condition combine.
     */
    @Builder.Default
    private BooleanOp groupRelation = BooleanOp.OR;

    /**
     * The values are wildcard patterns: {@code *} and {@code ?} are kept as written, and
     * include only adds the surrounding {@code *...*} when a value holds neither.
     */
    private boolean wildcard;

    public static Condition of(String field, OperatorKind operator, Object... values) {
        return Condition.builder()
                .field(field)
                .operator(operator)
                .values(List.of(values))
                .build();
    }

    public boolean hasValues() {
        return values != null && !values.isEmpty();
    }
}
