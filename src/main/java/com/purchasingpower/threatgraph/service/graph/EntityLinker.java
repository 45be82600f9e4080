package com.purchasingpower.threatgraph.service.graph;

import com.purchasingpower.threatgraph.model.article.Article;
import com.purchasingpower.threatgraph.model.graph.GraphNode;

/**
 * Connects an article to the entities extracted from it.
 */
public interface EntityLinker {

    /**
     * Upsert the article node, then one entity node and one MENTIONS edge per distinct
     * vulnerability, threat actor and category. Re-linking the same article creates nothing new.
     *
     * @return the article node
     */
    GraphNode linkArticle(Article article);
}
