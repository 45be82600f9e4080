package com.purchasingpower.threatgraph.util;

import com.purchasingpower.threatgraph.model.graph.NodeType;

import java.util.Locale;

/**
 * Deterministic node ids for extracted entities.
 *
 * The same entity name always maps to the same id, whichever article introduces it:
 * {@code "<type value>-<slug>"}, e.g. {@code "vulnerability-cve-2025-1111"}.
 *
 * Known limitation: distinct names that slug identically ("APT 29" and "apt-29") share a node.
 */
public final class EntityIds {

    private EntityIds() {
    }

    public static String entityId(NodeType type, String name) {
        return type.getValue() + "-" + slug(name);
    }

    public static String slug(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace(' ', '-');
    }
}
