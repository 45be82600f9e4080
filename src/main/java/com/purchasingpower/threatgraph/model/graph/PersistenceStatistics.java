package com.purchasingpower.threatgraph.model.graph;

/**
 * Node and edge counts as seen by the durable store, for comparing against the in-memory graph.
 */
public record PersistenceStatistics(long persistedNodes, long persistedEdges, int memoryNodes, int memoryEdges) {

    public boolean inSync() {
        return persistedNodes == memoryNodes && persistedEdges == memoryEdges;
    }
}
