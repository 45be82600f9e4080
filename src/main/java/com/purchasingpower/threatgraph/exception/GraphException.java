package com.purchasingpower.threatgraph.exception;

/**
 * Base type for errors raised by the knowledge graph engine.
 */
public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }
}
