package org.carball.queryflow.exception;

import lombok.Getter;

/**
 * Grammar violation found while turning tokens into a syntax tree.
 */
@Getter
public class ParseException extends QueryStringParseException {

    private final String expected;
    private final String found;

    public ParseException(int offset, String expected, String found) {
        this(offset, expected, found, "expected " + expected + " but found " + found);
    }

    public ParseException(int offset, String expected, String found, String detail) {
        super(offset, detail);
        this.expected = expected;
        this.found = found;
    }
}
