package org.carball.queryflow.model.ast;

import java.util.Locale;

public enum BooleanOp {
    AND,
    OR;

    public String keyword() {
        return name();
    }

    /**
     * Resolves "and"/"or" in any case, as used for group relations in condition input.
     */
    public static BooleanOp fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Boolean operator must not be null");
        }
        try {
            return BooleanOp.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid boolean operator: " + name + ", must be 'and' or 'or'");
        }
    }
}
