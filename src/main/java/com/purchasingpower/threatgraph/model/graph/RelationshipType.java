package com.purchasingpower.threatgraph.model.graph;

import com.purchasingpower.threatgraph.exception.InvalidGraphInputException;

import java.util.Locale;

/**
 * Types of directed relationships between graph nodes.
 */
public enum RelationshipType {
    MENTIONS("mentions"),
    EXPLOITS("exploits"),
    RELATED_TO("related_to"),
    EVOLVES_FROM("evolves_from"),
    TARGETS("targets"),
    USES("uses"),
    ATTRIBUTED_TO("attributed_to");

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws InvalidGraphInputException if the value names no known relationship
     */
    public static RelationshipType fromValue(String value) {
        if (value == null) {
            throw new InvalidGraphInputException("relationship", "null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RelationshipType type : values()) {
            if (type.value.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new InvalidGraphInputException("relationship", value);
    }
}
