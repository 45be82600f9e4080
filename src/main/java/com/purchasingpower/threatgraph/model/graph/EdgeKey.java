package com.purchasingpower.threatgraph.model.graph;

/**
 * Uniqueness key of an edge: at most one edge per (source, target, relationship).
 */
public record EdgeKey(String sourceId, String targetId, RelationshipType relationship) {

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }
}
