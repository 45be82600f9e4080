package com.purchasingpower.threatgraph.service.graph;

import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;

import java.util.List;

/**
 * Durable store contract for the knowledge graph.
 *
 * The in-memory graph mirrors every mutation here and reloads from here on startup.
 * Implementations may throw on any call; the graph store treats write failures as
 * best-effort and read failures as "nothing loaded".
 */
public interface GraphPersistenceService {

    /**
     * Insert or replace a node by id.
     */
    void upsertNode(GraphNode node);

    /**
     * Insert or replace an edge by its (source, target, relationship) triple.
     */
    void upsertEdge(GraphEdge edge);

    List<GraphNode> listNodesByType(NodeType type, int limit);

    List<GraphNode> listAllNodes(int limit);

    List<GraphEdge> listAllEdges(int limit);

    /**
     * Delete a node together with every edge where it is source or target.
     */
    void deleteNode(String nodeId);

    void deleteEdge(String sourceId, String targetId, RelationshipType relationship);

    long countNodes();

    long countEdges();
}
