package com.purchasingpower.threatgraph.model.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An article's outgoing neighborhood split into other articles and extracted entities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleConnections {

    @Builder.Default
    private List<RelatedArticle> connections = new ArrayList<>();

    @Builder.Default
    private List<LinkedEntity> entities = new ArrayList<>();

    public static ArticleConnections none() {
        return ArticleConnections.builder().build();
    }

    public int size() {
        return connections.size() + entities.size();
    }
}
