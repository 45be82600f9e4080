package com.purchasingpower.threatgraph.service.graph.impl;

import com.purchasingpower.threatgraph.configuration.GraphProperties;
import com.purchasingpower.threatgraph.model.context.ArticleConnections;
import com.purchasingpower.threatgraph.model.context.LinkedEntity;
import com.purchasingpower.threatgraph.model.context.RelatedArticle;
import com.purchasingpower.threatgraph.model.graph.EdgeKey;
import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.SubgraphView;
import com.purchasingpower.threatgraph.service.graph.GraphReadView;
import com.purchasingpower.threatgraph.service.graph.GraphStore;
import com.purchasingpower.threatgraph.service.graph.GraphTraversalService;
import com.purchasingpower.threatgraph.util.GraphInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.AsSubgraph;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphTraversalServiceImpl implements GraphTraversalService {

    private final GraphStore graphStore;
    private final GraphProperties properties;

    @Override
    public SubgraphView getSubgraph(String focusId, int depth) {
        GraphInputValidator.validateDepth(depth, properties.getMaxSubgraphDepth());

        SubgraphView view = graphStore.read(graph -> extractSubgraph(graph, focusId, depth));
        log.debug("Subgraph for {} (depth {}): {} nodes, {} edges",
                focusId, depth, view.getTotalNodes(), view.getTotalEdges());
        return view;
    }

    @Override
    public List<List<String>> findPaths(String startId, String endId) {
        List<List<String>> paths = graphStore.read(graph -> shortestPaths(graph, startId, endId));
        log.debug("Found {} shortest paths between {} and {}", paths.size(), startId, endId);
        return paths;
    }

    @Override
    public ArticleConnections getArticleConnections(String articleId) {
        ArticleConnections connections = graphStore.read(graph -> collectConnections(graph, articleId));
        log.debug("Article {} has {} connections ({} articles, {} entities)",
                articleId, connections.size(), connections.getConnections().size(), connections.getEntities().size());
        return connections;
    }

    // ================================================================
    // SUBGRAPH
    // ================================================================

    private SubgraphView extractSubgraph(GraphReadView graph, String focusId, int depth) {
        if (!graph.containsNode(focusId)) {
            return SubgraphView.empty(focusId, depth);
        }

        // BFS yields vertices in non-decreasing hop distance, so stop at the first one too far
        Set<String> closure = new LinkedHashSet<>();
        BreadthFirstIterator<String, EdgeKey> bfs = new BreadthFirstIterator<>(graph.undirected(), focusId);
        while (bfs.hasNext()) {
            String nodeId = bfs.next();
            if (bfs.getDepth(nodeId) > depth) {
                break;
            }
            closure.add(nodeId);
        }

        List<SubgraphView.VisNode> visNodes = new ArrayList<>();
        for (String nodeId : closure) {
            graph.getNode(nodeId).ifPresent(node -> visNodes.add(SubgraphView.VisNode.builder()
                    .id(node.getId())
                    .label(node.getLabel())
                    .nodeType(node.getType())
                    .size(node.getId().equals(focusId) ? node.getSize() * 2 : node.getSize())
                    .properties(node.getProperties())
                    .build()));
        }

        List<SubgraphView.VisEdge> visEdges = new ArrayList<>();
        for (EdgeKey key : new AsSubgraph<>(graph.topology(), closure).edgeSet()) {
            graph.getEdge(key).ifPresent(edge -> visEdges.add(SubgraphView.VisEdge.builder()
                    .source(edge.getSourceId())
                    .target(edge.getTargetId())
                    .relationship(edge.getRelationship())
                    .weight(edge.getWeight())
                    .build()));
        }

        return SubgraphView.builder()
                .nodes(visNodes)
                .edges(visEdges)
                .focusId(focusId)
                .depth(depth)
                .totalNodes(visNodes.size())
                .totalEdges(visEdges.size())
                .build();
    }

    // ================================================================
    // SHORTEST PATHS
    // ================================================================

    /**
     * Hop distances to {@code end} from a BFS over the undirected view; every path that steps
     * to a neighbor one hop closer to {@code end} is a shortest path.
     */
    private List<List<String>> shortestPaths(GraphReadView graph, String start, String end) {
        if (!graph.containsNode(start) || !graph.containsNode(end)) {
            return Collections.emptyList();
        }
        if (start.equals(end)) {
            return List.of(List.of(start));
        }

        Graph<String, EdgeKey> undirected = graph.undirected();
        ShortestPathAlgorithm.SingleSourcePaths<String, EdgeKey> toEnd =
                new BFSShortestPath<>(undirected).getPaths(end);
        if (Double.isInfinite(toEnd.getWeight(start))) {
            return Collections.emptyList();
        }

        List<List<String>> paths = new ArrayList<>();
        Deque<String> prefix = new ArrayDeque<>();
        prefix.addLast(start);
        collectPaths(undirected, toEnd, start, end, prefix, paths);
        return paths;
    }

    private void collectPaths(Graph<String, EdgeKey> undirected,
                              ShortestPathAlgorithm.SingleSourcePaths<String, EdgeKey> toEnd,
                              String node, String end, Deque<String> prefix, List<List<String>> paths) {
        if (node.equals(end)) {
            paths.add(new ArrayList<>(prefix));
            return;
        }
        long remaining = Math.round(toEnd.getWeight(node));
        for (String neighbor : Graphs.neighborSetOf(undirected, node)) {
            if (paths.size() >= properties.getMaxPaths()) {
                return;
            }
            if (Math.round(toEnd.getWeight(neighbor)) != remaining - 1) {
                continue;
            }
            prefix.addLast(neighbor);
            collectPaths(undirected, toEnd, neighbor, end, prefix, paths);
            prefix.removeLast();
        }
    }

    // ================================================================
    // ARTICLE CONNECTIONS
    // ================================================================

    private ArticleConnections collectConnections(GraphReadView graph, String articleId) {
        if (!graph.containsNode(articleId)) {
            return ArticleConnections.none();
        }

        ArticleConnections connections = ArticleConnections.none();
        Set<String> seen = new HashSet<>();

        for (GraphEdge edge : graph.outgoingEdges(articleId)) {
            String targetId = edge.getTargetId();
            if (!seen.add(targetId)) {
                continue;
            }
            GraphNode target = graph.getNode(targetId).orElse(null);
            if (target == null) {
                continue;
            }
            if (target.isArticle()) {
                connections.getConnections().add(
                        new RelatedArticle(target.getId(), target.getLabel(), edge.getRelationship()));
            } else {
                connections.getEntities().add(
                        new LinkedEntity(target.getId(), target.getType(), target.getLabel()));
            }
        }
        return connections;
    }
}
