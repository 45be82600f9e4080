package com.purchasingpower.threatgraph.service.graph;

import com.purchasingpower.threatgraph.model.article.Article;
import com.purchasingpower.threatgraph.model.article.SimilarArticle;
import com.purchasingpower.threatgraph.model.context.ArticleConnections;
import com.purchasingpower.threatgraph.model.context.GraphContext;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.GraphStatistics;
import com.purchasingpower.threatgraph.model.graph.PersistenceStatistics;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import com.purchasingpower.threatgraph.model.graph.SubgraphView;

import java.util.List;

/**
 * Entry point to the threat knowledge graph for ingestion, prediction, chat, infographic and
 * API collaborators.
 *
 * <p>Query methods never throw for unknown ids: they return empty results so callers can
 * proceed with partial graph intelligence during cold start.
 */
public interface KnowledgeGraphService {

    /**
     * Add an article and link it to all of its extracted entities.
     *
     * @return the article node
     */
    GraphNode addArticleNode(Article article);

    /**
     * Add RELATED_TO edges from {@code article} to each similar article, weighted by similarity.
     * Each accepted edge also records the other article id in {@code article.relatedArticleIds}.
     *
     * @return number of edges created or refreshed
     */
    int connectSimilarArticles(Article article, List<SimilarArticle> similarArticles);

    SubgraphView getSubgraph(String focusId, int depth);

    /**
     * Subgraph at the configured default depth.
     */
    SubgraphView getSubgraph(String focusId);

    /**
     * @return at most three shortest undirected paths between the two nodes
     */
    List<List<String>> findPaths(String articleId1, String articleId2);

    ArticleConnections getArticleConnections(String articleId);

    GraphStatistics getStatistics();

    GraphContext getPredictionContext(String articleId);

    /**
     * Replace the in-memory graph with the persisted one.
     *
     * @return nodes loaded
     */
    int loadFromPersistence();

    /**
     * Clear the in-memory graph and reload it from persistence.
     */
    void clearAndRebuild();

    /**
     * Administrative removal of a node and its incident edges.
     */
    boolean deleteNode(String nodeId);

    boolean deleteEdge(String sourceId, String targetId, RelationshipType relationship);

    /**
     * Compare persisted counts with the in-memory graph. Performs database reads.
     */
    PersistenceStatistics getPersistenceStatistics();
}
