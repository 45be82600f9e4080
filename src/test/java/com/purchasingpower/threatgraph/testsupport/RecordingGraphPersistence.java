package com.purchasingpower.threatgraph.testsupport;

import com.purchasingpower.threatgraph.model.graph.EdgeKey;
import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import com.purchasingpower.threatgraph.service.graph.GraphPersistenceService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Map-backed persistence double. Can be switched to fail every write or every read to
 * exercise the store's best-effort mirroring and load fallbacks. Thread-safe, so it can sit
 * behind a real mirror executor.
 */
public class RecordingGraphPersistence implements GraphPersistenceService {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();

    private boolean failWrites;
    private boolean failReads;
    private int writeCalls;
    private final List<String> nodeWrites = new ArrayList<>();

    public synchronized void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public synchronized void setFailReads(boolean failReads) {
        this.failReads = failReads;
    }

    public synchronized int getWriteCalls() {
        return writeCalls;
    }

    public synchronized Map<String, GraphNode> nodes() {
        return nodes;
    }

    public synchronized Map<EdgeKey, GraphEdge> edges() {
        return edges;
    }

    @Override
    public synchronized void upsertNode(GraphNode node) {
        write();
        nodeWrites.add(node.getId());
        nodes.put(node.getId(), node);
    }

    @Override
    public synchronized void upsertEdge(GraphEdge edge) {
        write();
        edges.put(edge.key(), edge);
    }

    @Override
    public synchronized List<GraphNode> listNodesByType(NodeType type, int limit) {
        read();
        return nodes.values().stream()
                .filter(node -> node.getType() == type)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<GraphNode> listAllNodes(int limit) {
        read();
        return nodes.values().stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized List<GraphEdge> listAllEdges(int limit) {
        read();
        return edges.values().stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteNode(String nodeId) {
        write();
        nodes.remove(nodeId);
        edges.keySet().removeIf(key -> key.touches(nodeId));
    }

    @Override
    public synchronized void deleteEdge(String sourceId, String targetId, RelationshipType relationship) {
        write();
        edges.remove(new EdgeKey(sourceId, targetId, relationship));
    }

    @Override
    public synchronized long countNodes() {
        read();
        return nodes.size();
    }

    @Override
    public synchronized long countEdges() {
        read();
        return edges.size();
    }

    private void write() {
        writeCalls++;
        if (failWrites) {
            throw new IllegalStateException("database unavailable");
        }
    }

    private void read() {
        if (failReads) {
            throw new IllegalStateException("database unavailable");
        }
    }

    /**
     * @return how many times a node with this id was written
     */
    public synchronized int nodeWriteCount(String nodeId) {
        return (int) nodeWrites.stream().filter(nodeId::equals).count();
    }

    public synchronized List<String> nodeIds() {
        return new ArrayList<>(nodes.keySet());
    }
}
