package org.carball.queryflow.exception;

import lombok.Getter;

/**
 * Raised when a query string cannot be turned into a syntax tree.
 * The offset is a zero-based character index into the input.
 */
@Getter
public class QueryStringParseException extends QueryFlowException {

    private final int offset;
    private final String detail;

    public QueryStringParseException(int offset, String detail) {
        super("Failed to parse query string at offset " + offset + ": " + detail);
        this.offset = offset;
        this.detail = detail;
    }
}
