package com.purchasingpower.threatgraph.model.context;

import com.purchasingpower.threatgraph.model.graph.NodeType;

public record LinkedEntity(String entityId, NodeType type, String label) {
}
