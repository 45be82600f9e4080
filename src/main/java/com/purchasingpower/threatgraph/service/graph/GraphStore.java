package com.purchasingpower.threatgraph.service.graph;

import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.GraphStatistics;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;

import java.util.Optional;
import java.util.function.Function;

/**
 * Owner of the authoritative in-memory knowledge graph.
 *
 * <p>The graph is a directed multigraph: at most one edge per (source, target, relationship),
 * but several relationships may connect the same pair. Mutations are serialized; reads run
 * concurrently. Every mutation is applied in memory first and then queued, in the same order,
 * for the {@link GraphPersistenceService} without waiting for the write.
 *
 * <p>The store is the only component that mutates the graph; every other component reads
 * it through {@link #read(Function)}.
 */
public interface GraphStore {

    /**
     * Insert or replace a node by id.
     *
     * @throws com.purchasingpower.threatgraph.exception.NodeTypeConflictException if a node with
     *         this id exists with a different type
     */
    GraphNode upsertNode(GraphNode node);

    /**
     * Insert the node only if no node with its id exists. The check and the insert happen
     * under one write lock, so concurrent callers never overwrite each other.
     *
     * @return true if the node was inserted, false if a node with this id was already present
     * @throws com.purchasingpower.threatgraph.exception.NodeTypeConflictException if the existing
     *         node has a different type
     */
    boolean upsertNodeIfAbsent(GraphNode node);

    /**
     * Insert or replace the edge keyed by (source, target, relationship).
     *
     * @return the stored edge, or empty if either endpoint is not in the graph
     */
    Optional<GraphEdge> upsertEdge(String sourceId, String targetId, RelationshipType relationship, double weight);

    /**
     * Remove a node and every edge touching it.
     *
     * @return false if the node was not in the graph
     */
    boolean deleteNode(String nodeId);

    /**
     * @return false if no such edge was in the graph
     */
    boolean deleteEdge(String sourceId, String targetId, RelationshipType relationship);

    Optional<GraphNode> findNode(String nodeId);

    boolean containsNode(String nodeId);

    /**
     * Run a read-only computation against a consistent view of the graph.
     */
    <T> T read(Function<GraphReadView, T> reader);

    /**
     * Replace the in-memory graph with the persisted one.
     *
     * @return number of nodes loaded; 0 when the store is empty or could not be read
     */
    int loadFromPersistence();

    /**
     * Empty the in-memory graph. Persistence is not touched.
     */
    void clear();

    GraphStatistics statistics();
}
