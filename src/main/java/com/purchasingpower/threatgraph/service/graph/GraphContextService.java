package com.purchasingpower.threatgraph.service.graph;

import com.purchasingpower.threatgraph.model.context.GraphContext;

/**
 * Summarizes how well-attested an article's threats are across the graph.
 */
public interface GraphContextService {

    /**
     * Build the graph context for an article.
     *
     * @param articleId Article node id
     * @return the signal bundle; {@code hasGraphData == false} when the article is not in the graph
     */
    GraphContext getPredictionContext(String articleId);
}
