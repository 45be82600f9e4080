package com.purchasingpower.threatgraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A typed vertex in the in-memory knowledge graph: an article or an extracted entity.
 *
 * Immutable; the store replaces the whole value on upsert. The {@code properties} map and any
 * list values in it are copied on construction so callers cannot mutate a stored node.
 */
@Value
public class GraphNode {

    String id;

    NodeType type;

    String label;

    Map<String, Object> properties;

    double size;

    @Builder(toBuilder = true)
    public GraphNode(String id, NodeType type, String label, Map<String, Object> properties, double size) {
        this.id = id;
        this.type = type;
        this.label = label;
        this.properties = properties == null ? Collections.emptyMap() : freeze(properties);
        this.size = size;
    }

    // List values (e.g. categories) are copied too, so no caller can reach a mutable collection
    private static Map<String, Object> freeze(Map<String, Object> properties) {
        Map<String, Object> copy = new LinkedHashMap<>();
        properties.forEach((key, value) -> copy.put(key, value instanceof List
                ? Collections.unmodifiableList(new ArrayList<>((List<?>) value))
                : value));
        return Collections.unmodifiableMap(copy);
    }

    public boolean isArticle() {
        return type == NodeType.ARTICLE;
    }
}
