package com.purchasingpower.threatgraph.model;

/**
 * Enumeration of storage call categories for unified logging.
 *
 * Used by ExternalCallLogger to tag calls into the durable graph store. Synchronous reads
 * (startup load, counts) are GRAPH_DB; fire-and-forget write mirroring is GRAPH_MIRROR.
 *
 * @see com.purchasingpower.threatgraph.util.ExternalCallLogger
 */
public enum ServiceType {
    GRAPH_DB("🟠", "GraphDB"),
    GRAPH_MIRROR("🟣", "GraphMirror");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
