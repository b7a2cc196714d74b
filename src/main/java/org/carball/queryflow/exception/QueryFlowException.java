package org.carball.queryflow.exception;

/**
 * Root of every error raised by the query string engine and its builders.
 */
public class QueryFlowException extends RuntimeException {

    public QueryFlowException(String message) {
        super(message);
    }

    public QueryFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
