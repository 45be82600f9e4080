package com.purchasingpower.threatgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatistics {

    private int totalNodes;
    private int totalEdges;

    private int articleNodes;

    // Every node type other than ARTICLE
    private int entityNodes;

    private Map<NodeType, Integer> nodesByType;
}
