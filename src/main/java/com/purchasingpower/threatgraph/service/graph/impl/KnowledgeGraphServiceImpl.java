package com.purchasingpower.threatgraph.service.graph.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.threatgraph.configuration.GraphProperties;
import com.purchasingpower.threatgraph.model.CallContext;
import com.purchasingpower.threatgraph.model.ServiceType;
import com.purchasingpower.threatgraph.model.article.Article;
import com.purchasingpower.threatgraph.model.article.SimilarArticle;
import com.purchasingpower.threatgraph.model.context.ArticleConnections;
import com.purchasingpower.threatgraph.model.context.GraphContext;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.GraphStatistics;
import com.purchasingpower.threatgraph.model.graph.PersistenceStatistics;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import com.purchasingpower.threatgraph.model.graph.SubgraphView;
import com.purchasingpower.threatgraph.service.graph.EntityLinker;
import com.purchasingpower.threatgraph.service.graph.GraphContextService;
import com.purchasingpower.threatgraph.service.graph.GraphPersistenceService;
import com.purchasingpower.threatgraph.service.graph.GraphStore;
import com.purchasingpower.threatgraph.service.graph.GraphTraversalService;
import com.purchasingpower.threatgraph.service.graph.KnowledgeGraphService;
import com.purchasingpower.threatgraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

    private final GraphStore graphStore;
    private final EntityLinker entityLinker;
    private final GraphTraversalService traversalService;
    private final GraphContextService contextService;
    private final GraphPersistenceService persistenceService;
    private final GraphProperties properties;

    @Override
    public GraphNode addArticleNode(Article article) {
        return entityLinker.linkArticle(article);
    }

    @Override
    public int connectSimilarArticles(Article article, List<SimilarArticle> similarArticles) {
        Preconditions.checkNotNull(article, "Article cannot be null");
        if (similarArticles == null || similarArticles.isEmpty()) {
            return 0;
        }

        int connected = 0;
        for (SimilarArticle similar : similarArticles) {
            if (similar == null || similar.article() == null) {
                continue;
            }
            String otherId = similar.article().getId();
            boolean added = graphStore.upsertEdge(
                    article.getId(), otherId, RelationshipType.RELATED_TO, similar.similarity()).isPresent();
            if (added) {
                connected++;
                if (article.getRelatedArticleIds() == null) {
                    article.setRelatedArticleIds(new ArrayList<>());
                }
                if (!article.getRelatedArticleIds().contains(otherId)) {
                    article.getRelatedArticleIds().add(otherId);
                }
            }
        }

        log.debug("Connected article {} to {}/{} similar articles",
                article.getId(), connected, similarArticles.size());
        return connected;
    }

    @Override
    public SubgraphView getSubgraph(String focusId, int depth) {
        return traversalService.getSubgraph(focusId, depth);
    }

    @Override
    public SubgraphView getSubgraph(String focusId) {
        return traversalService.getSubgraph(focusId, properties.getDefaultSubgraphDepth());
    }

    @Override
    public List<List<String>> findPaths(String articleId1, String articleId2) {
        return traversalService.findPaths(articleId1, articleId2);
    }

    @Override
    public ArticleConnections getArticleConnections(String articleId) {
        return traversalService.getArticleConnections(articleId);
    }

    @Override
    public GraphStatistics getStatistics() {
        return graphStore.statistics();
    }

    @Override
    public GraphContext getPredictionContext(String articleId) {
        return contextService.getPredictionContext(articleId);
    }

    @Override
    public int loadFromPersistence() {
        return graphStore.loadFromPersistence();
    }

    @Override
    public void clearAndRebuild() {
        log.info("Rebuilding knowledge graph from persistence");
        graphStore.clear();
        int loaded = graphStore.loadFromPersistence();
        log.info("Knowledge graph rebuilt with {} nodes", loaded);
    }

    @Override
    public boolean deleteNode(String nodeId) {
        return graphStore.deleteNode(nodeId);
    }

    @Override
    public boolean deleteEdge(String sourceId, String targetId, RelationshipType relationship) {
        return graphStore.deleteEdge(sourceId, targetId, relationship);
    }

    @Override
    public PersistenceStatistics getPersistenceStatistics() {
        GraphStatistics memory = graphStore.statistics();
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GRAPH_DB, "CountGraph", log);
        try {
            ctx.logRequest("Counting persisted nodes and edges");
            long persistedNodes = persistenceService.countNodes();
            long persistedEdges = persistenceService.countEdges();
            ctx.logResponse("Counted", "Nodes", persistedNodes, "Edges", persistedEdges);
            return new PersistenceStatistics(persistedNodes, persistedEdges,
                    memory.getTotalNodes(), memory.getTotalEdges());
        } catch (RuntimeException e) {
            ctx.logError("Failed to count persisted graph", e);
            throw e;
        }
    }
}
