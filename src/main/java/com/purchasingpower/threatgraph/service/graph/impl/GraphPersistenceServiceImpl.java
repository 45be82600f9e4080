package com.purchasingpower.threatgraph.service.graph.impl;

import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphEdgeEntity;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.GraphNodeEntity;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import com.purchasingpower.threatgraph.repository.GraphEdgeRepository;
import com.purchasingpower.threatgraph.repository.GraphNodeRepository;
import com.purchasingpower.threatgraph.service.graph.GraphPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Relational graph storage through Spring Data JPA.
 *
 * Upserts are find-then-save inside one transaction; the unique constraint on
 * (source_id, target_id, relationship) backs the edge idempotence the graph relies on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphPersistenceServiceImpl implements GraphPersistenceService {

    private final GraphNodeRepository nodeRepository;
    private final GraphEdgeRepository edgeRepository;

    @Override
    @Transactional
    public void upsertNode(GraphNode node) {
        GraphNodeEntity entity = nodeRepository.findById(node.getId())
                .map(existing -> {
                    existing.setNodeType(node.getType());
                    existing.setLabel(node.getLabel());
                    existing.setProperties(node.getProperties());
                    existing.setSize(node.getSize());
                    return existing;
                })
                .orElseGet(() -> GraphNodeEntity.fromNode(node));

        nodeRepository.save(entity);
        log.debug("Upserted graph node: {}", node.getId());
    }

    @Override
    @Transactional
    public void upsertEdge(GraphEdge edge) {
        GraphEdgeEntity entity = edgeRepository.findBySourceIdAndTargetIdAndRelationship(
                        edge.getSourceId(), edge.getTargetId(), edge.getRelationship())
                .map(existing -> {
                    existing.setWeight(edge.getWeight());
                    existing.setCreatedAt(edge.getTimestamp() != null ? edge.getTimestamp() : Instant.now());
                    return existing;
                })
                .orElseGet(() -> GraphEdgeEntity.fromEdge(edge));

        edgeRepository.save(entity);
        log.debug("Upserted graph edge: {} -> {} ({})",
                edge.getSourceId(), edge.getTargetId(), edge.getRelationship().getValue());
    }

    @Override
    @Transactional(readOnly = true)
    public List<GraphNode> listNodesByType(NodeType type, int limit) {
        return nodeRepository.findByNodeType(type, PageRequest.of(0, limit, Sort.by("id"))).stream()
                .map(GraphNodeEntity::toNode)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<GraphNode> listAllNodes(int limit) {
        return nodeRepository.findAll(PageRequest.of(0, limit, Sort.by("createdAt", "id"))).stream()
                .map(GraphNodeEntity::toNode)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<GraphEdge> listAllEdges(int limit) {
        return edgeRepository.findAll(PageRequest.of(0, limit, Sort.by("id"))).stream()
                .map(GraphEdgeEntity::toEdge)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void deleteNode(String nodeId) {
        int edgesRemoved = edgeRepository.deleteByNodeId(nodeId);
        nodeRepository.deleteById(nodeId);
        log.debug("Deleted graph node: {} ({} edges)", nodeId, edgesRemoved);
    }

    @Override
    @Transactional
    public void deleteEdge(String sourceId, String targetId, RelationshipType relationship) {
        int removed = edgeRepository.deleteByTriple(sourceId, targetId, relationship);
        log.debug("Deleted graph edge: {} -> {} ({}), rows={}",
                sourceId, targetId, relationship.getValue(), removed);
    }

    @Override
    @Transactional(readOnly = true)
    public long countNodes() {
        return nodeRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public long countEdges() {
        return edgeRepository.count();
    }
}
