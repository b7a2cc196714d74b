package org.carball.queryflow.parser;

public enum TokenType {
    FIELD,
    /** {@code :}, {@code >}, {@code >=}, {@code <}, {@code <=} */
    OPERATOR,
    VALUE,
    /** Body of a {@code /regex/}, escapes kept as written. */
    REGEX,
    LPAREN,
    RPAREN,
    AND,
    OR,
    NOT,
    /** {@code [} inclusive or <code>{</code> exclusive */
    RANGE_OPEN,
    /** {@code ]} inclusive or <code>}</code> exclusive */
    RANGE_CLOSE,
    TO,
    EOF
}
