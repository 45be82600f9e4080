package com.purchasingpower.threatgraph.util;

import com.purchasingpower.threatgraph.exception.InvalidGraphInputException;
import com.purchasingpower.threatgraph.model.graph.GraphNode;

/**
 * Boundary checks for values entering the graph store.
 *
 * Malformed input is rejected here so the store never holds an edge with a NaN weight or a
 * node without an id.
 */
public final class GraphInputValidator {

    private GraphInputValidator() {
    }

    /**
     * @throws InvalidGraphInputException if the id is null or blank
     */
    public static String requireId(String field, String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidGraphInputException(field, String.valueOf(id), "must not be blank");
        }
        return id;
    }

    public static void validateNode(GraphNode node) {
        if (node == null) {
            throw new InvalidGraphInputException("node", "null");
        }
        requireId("nodeId", node.getId());
        if (node.getType() == null) {
            throw new InvalidGraphInputException("nodeType", "null", "node " + node.getId() + " has no type");
        }
        if (node.getLabel() == null) {
            throw new InvalidGraphInputException("label", "null", "node " + node.getId() + " has no label");
        }
        if (Double.isNaN(node.getSize()) || node.getSize() < 0) {
            throw new InvalidGraphInputException("size", String.valueOf(node.getSize()), "must be >= 0");
        }
    }

    /**
     * Weights are similarity-style scores in [0, 1].
     */
    public static void validateWeight(double weight) {
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new InvalidGraphInputException("weight", String.valueOf(weight), "must be within [0, 1]");
        }
    }

    public static void validateDepth(int depth, int maxDepth) {
        if (depth < 1 || depth > maxDepth) {
            throw new InvalidGraphInputException("depth", String.valueOf(depth),
                    "must be between 1 and " + maxDepth);
        }
    }
}
