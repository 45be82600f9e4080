package com.purchasingpower.threatgraph.service.graph;

import com.purchasingpower.threatgraph.model.context.ArticleConnections;
import com.purchasingpower.threatgraph.model.graph.SubgraphView;

import java.util.List;

/**
 * Neighborhood and path queries over the in-memory graph.
 *
 * Both traversals ignore edge direction: an article reaches the entity it mentions and the
 * entity reaches every article mentioning it.
 */
public interface GraphTraversalService {

    /**
     * Bounded-depth neighborhood around a focus node, ready for visualization.
     *
     * @param focusId Node to center on
     * @param depth Number of hops, 1 to the configured maximum (5)
     * @return nodes and edges within {@code depth} hops; empty (but tagged with {@code focusId})
     *         if the focus node is unknown
     * @throws com.purchasingpower.threatgraph.exception.InvalidGraphInputException if depth is out of range
     */
    SubgraphView getSubgraph(String focusId, int depth);

    /**
     * Up to the configured number (3) of shortest paths between two nodes.
     *
     * @return node-id paths from {@code startId} to {@code endId}, all of minimum length;
     *         empty if either node is unknown or they are disconnected
     */
    List<List<String>> findPaths(String startId, String endId);

    /**
     * Direct successors of an article, split into related articles and linked entities.
     * One entry per distinct successor, labelled with the first relationship recorded to it.
     */
    ArticleConnections getArticleConnections(String articleId);
}
