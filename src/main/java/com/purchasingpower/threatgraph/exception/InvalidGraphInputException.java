package com.purchasingpower.threatgraph.exception;

import lombok.Getter;

/**
 * Malformed input rejected before it reaches the graph store: unknown node or relationship
 * values, out-of-range weights or depths, missing ids.
 */
@Getter
public class InvalidGraphInputException extends GraphException {

    private final String field;
    private final String rejectedValue;

    public InvalidGraphInputException(String field, String rejectedValue) {
        super("Invalid " + field + ": " + rejectedValue);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public InvalidGraphInputException(String field, String rejectedValue, String reason) {
        super("Invalid " + field + " '" + rejectedValue + "': " + reason);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
}
