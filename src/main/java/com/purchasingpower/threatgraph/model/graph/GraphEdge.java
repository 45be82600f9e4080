package com.purchasingpower.threatgraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A directed, weighted relationship between two graph nodes.
 *
 * Identity within the graph is the {@link EdgeKey} triple; weight and timestamp are
 * replaced when the same triple is upserted again.
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {

    String sourceId;

    String targetId;

    RelationshipType relationship;

    double weight;

    Instant timestamp;

    public EdgeKey key() {
        return new EdgeKey(sourceId, targetId, relationship);
    }
}
