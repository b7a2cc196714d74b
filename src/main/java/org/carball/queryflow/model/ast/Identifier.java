package org.carball.queryflow.model.ast;

import org.carball.queryflow.exception.InvalidIdentifierException;

import java.util.regex.Pattern;

/**
 * A field name. Always matches {@code [A-Za-z_][A-Za-z0-9_.]*}.
 */
public record Identifier(String name) {

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    public Identifier {
        if (!isValid(name)) {
            throw new InvalidIdentifierException(name);
        }
    }

    public static Identifier of(String name) {
        return new Identifier(name);
    }

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER_PATTERN.matcher(name).matches();
    }

    @Override
    public String toString() {
        return name;
    }
}
