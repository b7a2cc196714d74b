package org.carball.queryflow.exception;

import lombok.Getter;

@Getter
public class InvalidIdentifierException extends QueryFlowException {

    private final String identifier;

    public InvalidIdentifierException(String identifier) {
        super("Invalid field identifier: '" + identifier + "'");
        this.identifier = identifier;
    }
}
