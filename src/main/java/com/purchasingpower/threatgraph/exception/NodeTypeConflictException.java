package com.purchasingpower.threatgraph.exception;

import com.purchasingpower.threatgraph.model.graph.NodeType;
import lombok.Getter;

/**
 * Raised when an upsert would change the type of an existing node. Node types are fixed at
 * creation, so this always indicates a bug in the caller.
 */
@Getter
public class NodeTypeConflictException extends GraphException {

    private final String nodeId;
    private final NodeType existingType;
    private final NodeType requestedType;

    public NodeTypeConflictException(String nodeId, NodeType existingType, NodeType requestedType) {
        super(String.format("Node %s already exists as %s, cannot upsert it as %s",
                nodeId, existingType, requestedType));
        this.nodeId = nodeId;
        this.existingType = existingType;
        this.requestedType = requestedType;
    }
}
