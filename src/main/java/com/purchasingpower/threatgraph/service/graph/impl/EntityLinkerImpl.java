package com.purchasingpower.threatgraph.service.graph.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.threatgraph.configuration.GraphProperties;
import com.purchasingpower.threatgraph.model.article.Article;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import com.purchasingpower.threatgraph.service.graph.EntityLinker;
import com.purchasingpower.threatgraph.service.graph.GraphStore;
import com.purchasingpower.threatgraph.util.EntityIds;
import com.purchasingpower.threatgraph.util.GraphInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class EntityLinkerImpl implements EntityLinker {

    static final double ARTICLE_NODE_SIZE = 1.5;
    static final double ENTITY_NODE_SIZE = 1.0;
    static final double MENTION_WEIGHT = 1.0;

    private final GraphStore graphStore;
    private final GraphProperties properties;

    @Override
    public GraphNode linkArticle(Article article) {
        Preconditions.checkNotNull(article, "Article cannot be null");
        GraphInputValidator.requireId("articleId", article.getId());

        GraphNode articleNode = graphStore.upsertNode(toArticleNode(article));

        int mentions = 0;
        mentions += linkEntities(article.getId(), article.getVulnerabilities(), NodeType.VULNERABILITY);
        mentions += linkEntities(article.getId(), article.getThreatActors(), NodeType.THREAT_ACTOR);
        mentions += linkEntities(article.getId(), article.getCategories(), NodeType.ENTITY);

        log.debug("Linked article {} to {} entities", article.getId(), mentions);
        return articleNode;
    }

    private int linkEntities(String articleId, List<String> names, NodeType type) {
        if (names == null || names.isEmpty()) {
            return 0;
        }

        // Distinct by id, first spelling wins as the label
        Map<String, String> labelsById = new LinkedHashMap<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            labelsById.putIfAbsent(EntityIds.entityId(type, name), name.trim());
        }

        int linked = 0;
        for (Map.Entry<String, String> entry : labelsById.entrySet()) {
            String entityId = entry.getKey();
            // First spelling wins; an existing entity is never relabelled
            graphStore.upsertNodeIfAbsent(GraphNode.builder()
                    .id(entityId)
                    .type(type)
                    .label(entry.getValue())
                    .size(ENTITY_NODE_SIZE)
                    .build());
            if (graphStore.upsertEdge(articleId, entityId, RelationshipType.MENTIONS, MENTION_WEIGHT).isPresent()) {
                linked++;
            }
        }
        return linked;
    }

    private GraphNode toArticleNode(Article article) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("url", article.getUrl());
        props.put("published_at", article.getPublishedAt() != null ? article.getPublishedAt().toString() : null);
        props.put("categories", article.getCategories() != null
                ? new ArrayList<>(article.getCategories())
                : new ArrayList<>());

        return GraphNode.builder()
                .id(article.getId())
                .type(NodeType.ARTICLE)
                .label(truncateLabel(article.getTitle() != null ? article.getTitle() : article.getId()))
                .properties(props)
                .size(ARTICLE_NODE_SIZE)
                .build();
    }

    private String truncateLabel(String title) {
        int max = properties.getLabelMaxLength();
        return title.length() > max ? title.substring(0, max) + "..." : title;
    }
}
