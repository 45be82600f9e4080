package com.purchasingpower.threatgraph.testsupport;

import com.purchasingpower.threatgraph.configuration.GraphProperties;
import com.purchasingpower.threatgraph.model.article.Article;
import com.purchasingpower.threatgraph.service.graph.GraphPersistenceService;
import com.purchasingpower.threatgraph.service.graph.impl.EntityLinkerImpl;
import com.purchasingpower.threatgraph.service.graph.impl.GraphContextServiceImpl;
import com.purchasingpower.threatgraph.service.graph.impl.GraphTraversalServiceImpl;
import com.purchasingpower.threatgraph.service.graph.impl.InMemoryGraphStore;
import com.purchasingpower.threatgraph.service.graph.impl.KnowledgeGraphServiceImpl;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires a fresh graph per test, without a Spring context. Mirroring runs on the calling thread.
 */
public final class TestGraphs {

    private TestGraphs() {
    }

    public static InMemoryGraphStore store(GraphPersistenceService persistence) {
        return new InMemoryGraphStore(persistence, Runnable::run, new GraphProperties());
    }

    public static KnowledgeGraphServiceImpl knowledgeGraph(GraphPersistenceService persistence) {
        return knowledgeGraph(store(persistence), persistence, new GraphProperties());
    }

    public static KnowledgeGraphServiceImpl knowledgeGraph(InMemoryGraphStore store,
                                                           GraphPersistenceService persistence,
                                                           GraphProperties properties) {
        return new KnowledgeGraphServiceImpl(
                store,
                new EntityLinkerImpl(store, properties),
                new GraphTraversalServiceImpl(store, properties),
                new GraphContextServiceImpl(store, properties),
                persistence,
                properties);
    }

    public static Article article(String id, List<String> vulnerabilities, List<String> threatActors,
                                  List<String> categories) {
        return Article.builder()
                .id(id)
                .title("Article " + id)
                .url("https://news.example.com/" + id)
                .publishedAt(OffsetDateTime.of(2025, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC))
                .vulnerabilities(new ArrayList<>(vulnerabilities))
                .threatActors(new ArrayList<>(threatActors))
                .categories(new ArrayList<>(categories))
                .build();
    }

    public static Article article(String id) {
        return article(id, List.of(), List.of(), List.of());
    }
}
