package org.carball.queryflow.exception;

import lombok.Getter;

@Getter
public class UnsupportedOperatorException extends QueryFlowException {

    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Unsupported operator: " + operator);
        this.operator = operator;
    }
}
