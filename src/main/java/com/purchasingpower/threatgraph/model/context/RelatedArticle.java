package com.purchasingpower.threatgraph.model.context;

import com.purchasingpower.threatgraph.model.graph.RelationshipType;

public record RelatedArticle(String id, String title, RelationshipType relationship) {
}
