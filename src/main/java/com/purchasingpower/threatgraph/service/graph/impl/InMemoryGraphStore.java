package com.purchasingpower.threatgraph.service.graph.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.threatgraph.configuration.AsyncConfig;
import com.purchasingpower.threatgraph.configuration.GraphProperties;
import com.purchasingpower.threatgraph.exception.NodeTypeConflictException;
import com.purchasingpower.threatgraph.model.CallContext;
import com.purchasingpower.threatgraph.model.ServiceType;
import com.purchasingpower.threatgraph.model.graph.EdgeKey;
import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.GraphStatistics;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import com.purchasingpower.threatgraph.service.graph.GraphPersistenceService;
import com.purchasingpower.threatgraph.service.graph.GraphReadView;
import com.purchasingpower.threatgraph.service.graph.GraphStore;
import com.purchasingpower.threatgraph.util.ExternalCallLogger;
import com.purchasingpower.threatgraph.util.GraphInputValidator;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.AsUndirectedGraph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DirectedPseudograph;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Knowledge graph held in process memory, guarded by a read-write lock.
 *
 * <p>Topology lives in a JGraphT {@link DirectedPseudograph} with node ids as vertices and
 * {@link EdgeKey}s as edges, so parallel relationships between one pair are separate edges.
 * Node and edge payloads are kept in insertion-ordered maps beside it. Per-type node counters
 * keep {@link #statistics()} O(1).
 *
 * <p>Each mutation is handed to the {@code graphPersistenceExecutor} before the write lock is
 * released, so the single mirror thread sees writes in the order they were applied here.
 * Failures there are logged and dropped; the in-memory graph stays authoritative until the
 * next reload.
 */
@Slf4j
@Service
public class InMemoryGraphStore implements GraphStore {

    private final GraphPersistenceService persistence;
    private final Executor persistenceExecutor;
    private final GraphProperties properties;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<NodeType, Integer> nodeTypeCounts = new EnumMap<>(NodeType.class);

    // Replaced only under the write lock
    private Graph<String, EdgeKey> topology;
    private Graph<String, EdgeKey> readOnlyTopology;
    private Graph<String, EdgeKey> undirectedTopology;

    private final GraphReadView view = new LockedView();

    public InMemoryGraphStore(GraphPersistenceService persistence,
                              @Qualifier(AsyncConfig.GRAPH_PERSISTENCE_EXECUTOR) Executor persistenceExecutor,
                              GraphProperties properties) {
        this.persistence = Preconditions.checkNotNull(persistence, "Persistence service cannot be null");
        this.persistenceExecutor = Preconditions.checkNotNull(persistenceExecutor, "Executor cannot be null");
        this.properties = Preconditions.checkNotNull(properties, "Graph properties cannot be null");
        resetTopology();
    }

    // ================================================================
    // MUTATIONS
    // ================================================================

    @Override
    public GraphNode upsertNode(GraphNode node) {
        GraphInputValidator.validateNode(node);

        lock.writeLock().lock();
        try {
            putNodeLocked(node);
            log.debug("Upserted node {} ({})", node.getId(), node.getType());
            mirror("UpsertNode", node.getId(), () -> persistence.upsertNode(node));
        } finally {
            lock.writeLock().unlock();
        }
        return node;
    }

    @Override
    public boolean upsertNodeIfAbsent(GraphNode node) {
        GraphInputValidator.validateNode(node);

        lock.writeLock().lock();
        try {
            GraphNode existing = nodes.get(node.getId());
            if (existing != null) {
                if (existing.getType() != node.getType()) {
                    throw new NodeTypeConflictException(node.getId(), existing.getType(), node.getType());
                }
                return false;
            }
            putNodeLocked(node);
            log.debug("Inserted node {} ({})", node.getId(), node.getType());
            mirror("UpsertNode", node.getId(), () -> persistence.upsertNode(node));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private void putNodeLocked(GraphNode node) {
        GraphNode existing = nodes.get(node.getId());
        if (existing != null && existing.getType() != node.getType()) {
            throw new NodeTypeConflictException(node.getId(), existing.getType(), node.getType());
        }
        nodes.put(node.getId(), node);
        if (existing == null) {
            topology.addVertex(node.getId());
            nodeTypeCounts.merge(node.getType(), 1, Integer::sum);
        }
    }

    @Override
    public Optional<GraphEdge> upsertEdge(String sourceId, String targetId, RelationshipType relationship, double weight) {
        GraphInputValidator.requireId("sourceId", sourceId);
        GraphInputValidator.requireId("targetId", targetId);
        Preconditions.checkNotNull(relationship, "Relationship cannot be null");
        GraphInputValidator.validateWeight(weight);

        GraphEdge edge = GraphEdge.builder()
                .sourceId(sourceId)
                .targetId(targetId)
                .relationship(relationship)
                .weight(weight)
                .timestamp(Instant.now())
                .build();

        lock.writeLock().lock();
        try {
            if (!nodes.containsKey(sourceId) || !nodes.containsKey(targetId)) {
                log.warn("Rejected edge {} -> {} ({}): endpoint not in graph (source={}, target={})",
                        sourceId, targetId, relationship.getValue(),
                        nodes.containsKey(sourceId), nodes.containsKey(targetId));
                return Optional.empty();
            }
            putEdgeLocked(edge);
            log.debug("Upserted edge {} -> {} ({}, weight={})", sourceId, targetId, relationship.getValue(), weight);
            mirror("UpsertEdge", sourceId + "->" + targetId, () -> persistence.upsertEdge(edge));
        } finally {
            lock.writeLock().unlock();
        }
        return Optional.of(edge);
    }

    // Caller holds the write lock and has checked both endpoints
    private void putEdgeLocked(GraphEdge edge) {
        EdgeKey key = edge.key();
        if (edges.put(key, edge) == null) {
            topology.addEdge(edge.getSourceId(), edge.getTargetId(), key);
        }
    }

    @Override
    public boolean deleteNode(String nodeId) {
        GraphInputValidator.requireId("nodeId", nodeId);

        lock.writeLock().lock();
        try {
            GraphNode removed = nodes.remove(nodeId);
            if (removed == null) {
                return false;
            }
            nodeTypeCounts.merge(removed.getType(), -1, Integer::sum);

            List<EdgeKey> touching = new ArrayList<>(topology.edgesOf(nodeId));
            touching.forEach(edges::remove);
            topology.removeVertex(nodeId);

            log.info("Deleted node {} and {} incident edges", nodeId, touching.size());
            mirror("DeleteNode", nodeId, () -> persistence.deleteNode(nodeId));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean deleteEdge(String sourceId, String targetId, RelationshipType relationship) {
        Preconditions.checkNotNull(relationship, "Relationship cannot be null");
        EdgeKey key = new EdgeKey(
                GraphInputValidator.requireId("sourceId", sourceId),
                GraphInputValidator.requireId("targetId", targetId),
                relationship);

        lock.writeLock().lock();
        try {
            if (edges.remove(key) == null) {
                return false;
            }
            topology.removeEdge(key);

            log.info("Deleted edge {} -> {} ({})", sourceId, targetId, relationship.getValue());
            mirror("DeleteEdge", sourceId + "->" + targetId,
                    () -> persistence.deleteEdge(sourceId, targetId, relationship));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ================================================================
    // READS
    // ================================================================

    @Override
    public Optional<GraphNode> findNode(String nodeId) {
        return read(v -> v.getNode(nodeId));
    }

    @Override
    public boolean containsNode(String nodeId) {
        return read(v -> v.containsNode(nodeId));
    }

    @Override
    public <T> T read(Function<GraphReadView, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(view);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GraphStatistics statistics() {
        lock.readLock().lock();
        try {
            Map<NodeType, Integer> byType = new EnumMap<>(NodeType.class);
            for (NodeType type : NodeType.values()) {
                byType.put(type, nodeTypeCounts.getOrDefault(type, 0));
            }
            int articles = byType.get(NodeType.ARTICLE);
            return GraphStatistics.builder()
                    .totalNodes(nodes.size())
                    .totalEdges(edges.size())
                    .articleNodes(articles)
                    .entityNodes(nodes.size() - articles)
                    .nodesByType(byType)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ================================================================
    // LIFECYCLE
    // ================================================================

    @Override
    public int loadFromPersistence() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GRAPH_DB, "LoadGraph", log);

        List<GraphNode> persistedNodes;
        List<GraphEdge> persistedEdges;
        try {
            ctx.logRequest("Loading persisted graph",
                    "NodeLimit", properties.getLoadNodeLimit(),
                    "EdgeLimit", properties.getLoadEdgeLimit());

            persistedNodes = persistence.listAllNodes(properties.getLoadNodeLimit());
            persistedEdges = persistence.listAllEdges(properties.getLoadEdgeLimit());

            ctx.logResponse("Persisted graph fetched",
                    "Nodes", persistedNodes == null ? 0 : persistedNodes.size(),
                    "Edges", persistedEdges == null ? 0 : persistedEdges.size());
        } catch (RuntimeException e) {
            ctx.logError("Failed to load graph from database, keeping current in-memory graph", e);
            return 0;
        }

        if (persistedNodes == null) {
            persistedNodes = Collections.emptyList();
        }
        if (persistedEdges == null) {
            persistedEdges = Collections.emptyList();
        }

        int skippedNodes = 0;
        int skippedEdges = 0;

        lock.writeLock().lock();
        try {
            clearLocked();

            for (GraphNode node : persistedNodes) {
                if (node == null || node.getId() == null || node.getType() == null
                        || nodes.containsKey(node.getId())) {
                    skippedNodes++;
                    continue;
                }
                putNodeLocked(node);
            }

            for (GraphEdge edge : persistedEdges) {
                if (edge == null || edge.getRelationship() == null
                        || !nodes.containsKey(edge.getSourceId()) || !nodes.containsKey(edge.getTargetId())) {
                    skippedEdges++;
                    continue;
                }
                putEdgeLocked(edge);
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (skippedNodes > 0 || skippedEdges > 0) {
            log.warn("Skipped {} malformed nodes and {} edges with missing endpoints while loading graph",
                    skippedNodes, skippedEdges);
        }

        GraphStatistics stats = statistics();
        log.info("Loaded graph from database: {} nodes, {} edges", stats.getTotalNodes(), stats.getTotalEdges());
        return stats.getTotalNodes();
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            clearLocked();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Cleared in-memory graph");
    }

    private void clearLocked() {
        nodes.clear();
        edges.clear();
        nodeTypeCounts.clear();
        resetTopology();
    }

    private void resetTopology() {
        topology = new DirectedPseudograph<>(EdgeKey.class);
        readOnlyTopology = new AsUnmodifiableGraph<>(topology);
        undirectedTopology = new AsUndirectedGraph<>(topology);
    }

    // ================================================================
    // PERSISTENCE MIRROR
    // ================================================================

    // Called with the write lock held so submission order matches mutation order
    private void mirror(String operation, String subject, Runnable write) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GRAPH_MIRROR, operation, log);
        try {
            persistenceExecutor.execute(() -> {
                try {
                    ctx.logRequest(subject);
                    write.run();
                    ctx.logResponse(subject);
                } catch (RuntimeException e) {
                    ctx.logWarning("Failed to persist " + subject, e);
                }
            });
        } catch (RejectedExecutionException e) {
            ctx.logWarning("Mirror queue full, dropped write for " + subject, e);
        }
    }

    // ================================================================
    // READ VIEW
    // ================================================================

    /**
     * View over the live structures. Only handed out inside {@link #read(Function)},
     * while the read lock is held.
     */
    private final class LockedView implements GraphReadView {

        @Override
        public boolean containsNode(String nodeId) {
            return nodeId != null && nodes.containsKey(nodeId);
        }

        @Override
        public Optional<GraphNode> getNode(String nodeId) {
            return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
        }

        @Override
        public Set<String> successors(String nodeId) {
            if (!containsNode(nodeId)) {
                return new LinkedHashSet<>();
            }
            return new LinkedHashSet<>(Graphs.successorListOf(topology, nodeId));
        }

        @Override
        public Set<String> predecessors(String nodeId) {
            if (!containsNode(nodeId)) {
                return new LinkedHashSet<>();
            }
            return new LinkedHashSet<>(Graphs.predecessorListOf(topology, nodeId));
        }

        @Override
        public Set<String> neighbors(String nodeId) {
            if (!containsNode(nodeId)) {
                return new LinkedHashSet<>();
            }
            return Graphs.neighborSetOf(undirectedTopology, nodeId);
        }

        @Override
        public Collection<GraphEdge> outgoingEdges(String nodeId) {
            List<GraphEdge> result = new ArrayList<>();
            if (containsNode(nodeId)) {
                for (EdgeKey key : topology.outgoingEdgesOf(nodeId)) {
                    result.add(edges.get(key));
                }
            }
            return result;
        }

        @Override
        public Optional<GraphEdge> getEdge(EdgeKey key) {
            return Optional.ofNullable(edges.get(key));
        }

        @Override
        public Graph<String, EdgeKey> topology() {
            return readOnlyTopology;
        }

        @Override
        public Graph<String, EdgeKey> undirected() {
            return undirectedTopology;
        }

        @Override
        public Collection<GraphEdge> edges() {
            return Collections.unmodifiableCollection(edges.values());
        }

        @Override
        public int nodeCount() {
            return nodes.size();
        }

        @Override
        public int edgeCount() {
            return edges.size();
        }
    }
}
