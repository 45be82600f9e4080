package com.purchasingpower.threatgraph.model.graph;

import com.purchasingpower.threatgraph.repository.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * JPA Entity mirroring a knowledge graph node.
 * Maps to the table 'graph_nodes'.
 */
@Entity
@Table(name = "graph_nodes", indexes = {
        @Index(name = "idx_graph_node_type", columnList = "node_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNodeEntity {

    @Id
    @Column(name = "id", length = 500)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false, length = 32)
    private NodeType nodeType;

    @Column(name = "label", nullable = false, length = 1000)
    private String label;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "properties", length = 20000)
    private Map<String, Object> properties;

    @Column(name = "node_size")
    private double size;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    public void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public static GraphNodeEntity fromNode(GraphNode node) {
        return GraphNodeEntity.builder()
                .id(node.getId())
                .nodeType(node.getType())
                .label(node.getLabel())
                .properties(node.getProperties())
                .size(node.getSize())
                .build();
    }

    public GraphNode toNode() {
        return GraphNode.builder()
                .id(id)
                .type(nodeType)
                .label(label)
                .properties(properties)
                .size(size)
                .build();
    }
}
