package com.purchasingpower.threatgraph.model.graph;

import com.purchasingpower.threatgraph.exception.InvalidGraphInputException;

import java.util.Locale;

/**
 * Types of nodes in the threat knowledge graph.
 *
 * Each type carries the lowercase value used in persisted rows and entity ids
 * (e.g. "threat_actor" in "threat_actor-apt29").
 */
public enum NodeType {
    ARTICLE("article"),
    ENTITY("entity"),
    VULNERABILITY("vulnerability"),
    THREAT_ACTOR("threat_actor"),
    PRODUCT("product"),
    TECHNIQUE("technique");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses either the wire value ("threat_actor") or the constant name ("THREAT_ACTOR").
     *
     * @throws InvalidGraphInputException if the value names no known type
     */
    public static NodeType fromValue(String value) {
        if (value == null) {
            throw new InvalidGraphInputException("nodeType", "null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.value.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new InvalidGraphInputException("nodeType", value);
    }
}
