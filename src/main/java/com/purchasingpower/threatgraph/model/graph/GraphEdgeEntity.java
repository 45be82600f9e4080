package com.purchasingpower.threatgraph.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity mirroring a directed relationship between two graph nodes.
 * Maps to the table 'graph_edges'; one row per (source, target, relationship).
 */
@Entity
@Table(name = "graph_edges",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_graph_edge_triple",
                columnNames = {"source_id", "target_id", "relationship"}),
        indexes = {
                @Index(name = "idx_graph_edge_source", columnList = "source_id"),
                @Index(name = "idx_graph_edge_target", columnList = "target_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdgeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false, length = 500)
    private String sourceId;

    @Column(name = "target_id", nullable = false, length = 500)
    private String targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "relationship", nullable = false, length = 32)
    private RelationshipType relationship;

    @Column(name = "weight", nullable = false)
    private double weight;

    @Column(name = "created_at")
    private Instant createdAt;

    public static GraphEdgeEntity fromEdge(GraphEdge edge) {
        return GraphEdgeEntity.builder()
                .sourceId(edge.getSourceId())
                .targetId(edge.getTargetId())
                .relationship(edge.getRelationship())
                .weight(edge.getWeight())
                .createdAt(edge.getTimestamp())
                .build();
    }

    public GraphEdge toEdge() {
        return GraphEdge.builder()
                .sourceId(sourceId)
                .targetId(targetId)
                .relationship(relationship)
                .weight(weight)
                .timestamp(createdAt)
                .build();
    }
}
