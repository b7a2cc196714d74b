package org.carball.queryflow.parser;

/**
 * A classified lexeme with its character offset in the source text.
 * For wildcard values {@code text} is in pattern form (see {@link org.carball.queryflow.model.ast.Literal}).
 */
public record Token(TokenType type, String text, int offset, boolean quoted, boolean wildcard) {

    public static Token of(TokenType type, String text, int offset) {
        return new Token(type, text, offset, false, false);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isComparison() {
        return type == TokenType.OPERATOR && !":".equals(text);
    }

    /**
     * Human readable form for error messages.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of input";
        }
        if (type == TokenType.REGEX) {
            return "'/" + text + "/'";
        }
        return quoted ? "'\"" + text + "\"'" : "'" + text + "'";
    }
}
