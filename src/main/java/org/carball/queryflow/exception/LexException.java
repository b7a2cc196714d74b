package org.carball.queryflow.exception;

/**
 * Malformed token: unterminated quote or regex, unbalanced range bracket,
 * dangling escape or a control character inside an unquoted value.
 */
public class LexException extends QueryStringParseException {

    public LexException(int offset, String reason) {
        super(offset, reason);
    }

    public String getReason() {
        return getDetail();
    }
}
