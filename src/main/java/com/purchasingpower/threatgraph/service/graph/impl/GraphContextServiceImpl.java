package com.purchasingpower.threatgraph.service.graph.impl;

import com.purchasingpower.threatgraph.configuration.GraphProperties;
import com.purchasingpower.threatgraph.model.context.CveMention;
import com.purchasingpower.threatgraph.model.context.GraphContext;
import com.purchasingpower.threatgraph.model.context.RelatedArticle;
import com.purchasingpower.threatgraph.model.context.ThreatActorActivity;
import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import com.purchasingpower.threatgraph.service.graph.GraphContextService;
import com.purchasingpower.threatgraph.service.graph.GraphReadView;
import com.purchasingpower.threatgraph.service.graph.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

/**
 * Derives prediction signals from an article's position in the graph.
 *
 * <p>For every vulnerability and threat actor the article mentions, counts the articles that
 * mention the same entity (the entity's article predecessors, the subject article included).
 * Thresholds and the density normalizer come from {@code app.graph.context}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphContextServiceImpl implements GraphContextService {

    private final GraphStore graphStore;
    private final GraphProperties properties;

    @Override
    public GraphContext getPredictionContext(String articleId) {
        GraphContext context = graphStore.read(graph -> buildContext(graph, articleId));

        if (context.isHasGraphData()) {
            log.debug("Graph context for {}: {} connections, {} CVEs, {} actors, {} related articles",
                    articleId,
                    context.getConnectionCount(),
                    context.getRelatedCves().size(),
                    context.getRelatedThreatActors().size(),
                    context.getRelatedArticles().size());
        } else {
            log.debug("No graph data for article {}", articleId);
        }
        return context;
    }

    private GraphContext buildContext(GraphReadView graph, String articleId) {
        if (!graph.containsNode(articleId)) {
            return GraphContext.noData();
        }

        GraphProperties.Context thresholds = properties.getContext();
        GraphContext context = GraphContext.builder().hasGraphData(true).build();
        Set<String> seen = new HashSet<>();

        for (GraphEdge edge : graph.outgoingEdges(articleId)) {
            if (!seen.add(edge.getTargetId())) {
                continue;
            }
            GraphNode target = graph.getNode(edge.getTargetId()).orElse(null);
            if (target == null) {
                continue;
            }

            if (target.getType() == NodeType.ARTICLE) {
                context.getRelatedArticles().add(
                        new RelatedArticle(target.getId(), target.getLabel(), edge.getRelationship()));
            } else if (target.getType() == NodeType.VULNERABILITY) {
                int articleCount = countMentioningArticles(graph, target.getId());
                context.getRelatedCves().add(target.getLabel());
                context.getCveSeverityContext().add(new CveMention(
                        target.getLabel(),
                        articleCount,
                        articleCount > thresholds.getTrendingThreshold()));
            } else if (target.getType() == NodeType.THREAT_ACTOR) {
                int articleCount = countMentioningArticles(graph, target.getId());
                context.getRelatedThreatActors().add(target.getLabel());
                context.getThreatActorHistory().add(new ThreatActorActivity(
                        target.getLabel(),
                        articleCount,
                        articleCount > thresholds.getActiveCampaignThreshold()));
            }
        }

        int connectionCount = seen.size();
        context.setConnectionCount(connectionCount);
        context.setConnectionDensity(Math.min(1.0, connectionCount / thresholds.getConnectionDensityNormalizer()));
        return context;
    }

    private int countMentioningArticles(GraphReadView graph, String entityId) {
        int count = 0;
        for (String predecessor : graph.predecessors(entityId)) {
            if (graph.getNode(predecessor).map(GraphNode::isArticle).orElse(false)) {
                count++;
            }
        }
        return count;
    }
}
