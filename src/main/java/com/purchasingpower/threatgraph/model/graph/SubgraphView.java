package com.purchasingpower.threatgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Visualization-ready projection of the neighborhood around a focus node.
 *
 * An unknown focus node yields an instance with no nodes or edges but with
 * {@code focusId} still set, so callers can tell "no data" from an error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubgraphView {

    @Builder.Default
    private List<VisNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<VisEdge> edges = new ArrayList<>();

    private String focusId;
    private int depth;

    private int totalNodes;
    private int totalEdges;

    public static SubgraphView empty(String focusId, int depth) {
        return SubgraphView.builder()
                .focusId(focusId)
                .depth(depth)
                .build();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Renders the vis.js network shape used by the graph explorer frontend.
     */
    public Map<String, Object> toVisJsFormat() {
        List<Map<String, Object>> visNodes = new ArrayList<>();
        for (VisNode node : nodes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", node.getId());
            entry.put("label", node.getLabel());
            entry.put("group", node.getNodeType().getValue());
            entry.put("value", node.getSize());
            entry.put("title", node.getLabel());
            visNodes.add(entry);
        }

        List<Map<String, Object>> visEdges = new ArrayList<>();
        for (VisEdge edge : edges) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("from", edge.getSource());
            entry.put("to", edge.getTarget());
            entry.put("label", edge.getRelationship().getValue());
            entry.put("value", edge.getWeight());
            visEdges.add(entry);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("nodes", visNodes);
        result.put("edges", visEdges);
        return result;
    }

    @Value
    @Builder
    public static class VisNode {
        String id;
        String label;
        NodeType nodeType;
        double size;
        Map<String, Object> properties;
    }

    @Value
    @Builder
    public static class VisEdge {
        String source;
        String target;
        RelationshipType relationship;
        double weight;
    }
}
