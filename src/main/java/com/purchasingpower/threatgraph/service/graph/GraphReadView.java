package com.purchasingpower.threatgraph.service.graph;

import com.purchasingpower.threatgraph.model.graph.EdgeKey;
import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import org.jgrapht.Graph;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the graph for the duration of one {@link GraphStore#read} call.
 *
 * Instances must not escape the callback: they read live structures guarded by the
 * store's read lock.
 */
public interface GraphReadView {

    boolean containsNode(String nodeId);

    Optional<GraphNode> getNode(String nodeId);

    /**
     * Distinct targets of edges leaving {@code nodeId}, in insertion order. Empty for unknown nodes.
     */
    Set<String> successors(String nodeId);

    /**
     * Distinct sources of edges entering {@code nodeId}, in insertion order. Empty for unknown nodes.
     */
    Set<String> predecessors(String nodeId);

    /**
     * Union of successors and predecessors: the node's neighbors with direction ignored.
     */
    Set<String> neighbors(String nodeId);

    Collection<GraphEdge> outgoingEdges(String nodeId);

    Optional<GraphEdge> getEdge(EdgeKey key);

    /**
     * Read-only directed topology: node ids as vertices, one {@link EdgeKey} per edge.
     */
    Graph<String, EdgeKey> topology();

    /**
     * Read-only view of {@link #topology()} with edge direction ignored.
     */
    Graph<String, EdgeKey> undirected();

    /**
     * All edges in insertion order.
     */
    Collection<GraphEdge> edges();

    int nodeCount();

    int edgeCount();
}
