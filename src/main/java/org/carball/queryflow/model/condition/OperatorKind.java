package org.carball.queryflow.model.condition;

import lombok.Getter;
import org.carball.queryflow.exception.UnsupportedOperatorException;

import java.util.Locale;

@Getter
public enum OperatorKind {
    EXISTS("exists", false),
    NOT_EXISTS("not_exists", false),
    EQUAL("equal", true),
    NOT_EQUAL("not_equal", true),
    INCLUDE("include", true),
    NOT_INCLUDE("not_include", true),
    GT("gt", true),
    GTE("gte", true),
    LT("lt", true),
    LTE("lte", true),
    BETWEEN("between", true),
    REG("reg", true),
    NREG("nreg", true);

    private final String operatorName;
    private final boolean valueRequired;

    OperatorKind(String operatorName, boolean valueRequired) {
        this.operatorName = operatorName;
        this.valueRequired = valueRequired;
    }

    /**
     * Finds an operator by its wire name ("equal", "not_exists", ...), case-insensitive.
     */
    public static OperatorKind fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (OperatorKind kind : values()) {
                if (kind.operatorName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new UnsupportedOperatorException(name);
    }
}
