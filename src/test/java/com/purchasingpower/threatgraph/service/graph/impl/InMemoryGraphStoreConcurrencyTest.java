package com.purchasingpower.threatgraph.service.graph.impl;

import com.purchasingpower.threatgraph.configuration.GraphProperties;
import com.purchasingpower.threatgraph.model.article.Article;
import com.purchasingpower.threatgraph.model.article.SimilarArticle;
import com.purchasingpower.threatgraph.model.graph.EdgeKey;
import com.purchasingpower.threatgraph.model.graph.GraphEdge;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import com.purchasingpower.threatgraph.model.graph.RelationshipType;
import com.purchasingpower.threatgraph.testsupport.RecordingGraphPersistence;
import com.purchasingpower.threatgraph.testsupport.TestGraphs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("In-memory graph store under concurrent use")
class InMemoryGraphStoreConcurrencyTest {

    private static final int WRITERS = 2;
    private static final int READERS = 4;
    private static final int ARTICLES_PER_WRITER = 60;

    private static GraphNode node(String id, NodeType type, String label) {
        return GraphNode.builder().id(id).type(type).label(label).size(1.0).build();
    }

    @Test
    @DisplayName("Two writers on one edge leave the database with the same weight as memory")
    void interleavedEdgeWriters_persistInMutationOrder() throws Exception {
        RecordingGraphPersistence persistence = new RecordingGraphPersistence();
        List<Runnable> submitted = new ArrayList<>();
        AtomicBoolean gateArmed = new AtomicBoolean(false);
        CountDownLatch firstWriterSubmitting = new CountDownLatch(1);
        CountDownLatch releaseFirstWriter = new CountDownLatch(1);

        // Holds the first writer inside the hand-off until the second writer has queued up behind it
        InMemoryGraphStore store = new InMemoryGraphStore(persistence, task -> {
            if (gateArmed.compareAndSet(true, false)) {
                firstWriterSubmitting.countDown();
                try {
                    releaseFirstWriter.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            synchronized (submitted) {
                submitted.add(task);
            }
        }, new GraphProperties());

        store.upsertNode(node("a1", NodeType.ARTICLE, "A1"));
        store.upsertNode(node("a2", NodeType.ARTICLE, "A2"));
        gateArmed.set(true);

        Thread first = new Thread(() -> store.upsertEdge("a1", "a2", RelationshipType.RELATED_TO, 0.2));
        first.start();
        assertThat(firstWriterSubmitting.await(5, TimeUnit.SECONDS)).isTrue();

        Thread second = new Thread(() -> store.upsertEdge("a1", "a2", RelationshipType.RELATED_TO, 0.9));
        second.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (isRunning(second) && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }

        releaseFirstWriter.countDown();
        first.join(5_000);
        second.join(5_000);

        List<Runnable> inOrder;
        synchronized (submitted) {
            inOrder = new ArrayList<>(submitted);
        }
        inOrder.forEach(Runnable::run);

        double inMemory = store.read(graph -> graph.outgoingEdges("a1").iterator().next().getWeight());
        GraphEdge persisted = persistence.edges().get(new EdgeKey("a1", "a2", RelationshipType.RELATED_TO));
        assertThat(inMemory).isEqualTo(0.9);
        assertThat(persisted.getWeight()).isEqualTo(inMemory);
    }

    private static boolean isRunning(Thread thread) {
        Thread.State state = thread.getState();
        return state == Thread.State.NEW || state == Thread.State.RUNNABLE;
    }

    @Test
    @DisplayName("Concurrent spellings of one entity are written once with the label memory keeps")
    void concurrentEntityLinking_writesEntityOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                RecordingGraphPersistence persistence = new RecordingGraphPersistence();
                InMemoryGraphStore store = TestGraphs.store(persistence);
                EntityLinkerImpl linker = new EntityLinkerImpl(store, new GraphProperties());
                CyclicBarrier barrier = new CyclicBarrier(2);

                List<Future<GraphNode>> linked = List.of(
                        pool.submit(() -> {
                            barrier.await();
                            return linker.linkArticle(TestGraphs.article("a1", List.of(), List.of("APT29"), List.of()));
                        }),
                        pool.submit(() -> {
                            barrier.await();
                            return linker.linkArticle(TestGraphs.article("a2", List.of(), List.of("apt29"), List.of()));
                        }));
                for (Future<GraphNode> future : linked) {
                    future.get(5, TimeUnit.SECONDS);
                }

                String memoryLabel = store.findNode("threat_actor-apt29").map(GraphNode::getLabel).orElseThrow();
                assertThat(persistence.nodeWriteCount("threat_actor-apt29")).as("round %d", round).isEqualTo(1);
                assertThat(persistence.nodes().get("threat_actor-apt29").getLabel()).isEqualTo(memoryLabel);
                assertThat(store.<Set<String>>read(graph -> graph.predecessors("threat_actor-apt29")))
                        .containsExactlyInAnyOrder("a1", "a2");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Readers never fail while writers add, connect and delete")
    void readersAndWriters_runTogether() throws Exception {
        RecordingGraphPersistence persistence = new RecordingGraphPersistence();
        ExecutorService mirror = Executors.newSingleThreadExecutor();
        GraphProperties properties = new GraphProperties();
        InMemoryGraphStore store = new InMemoryGraphStore(persistence, mirror, properties);
        KnowledgeGraphServiceImpl graph = TestGraphs.knowledgeGraph(store, persistence, properties);

        ExecutorService workers = Executors.newFixedThreadPool(WRITERS + READERS);
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch writersDone = new CountDownLatch(WRITERS);

        for (int w = 0; w < WRITERS; w++) {
            int writer = w;
            workers.execute(() -> {
                try {
                    start.await();
                    Article previous = null;
                    for (int i = 0; i < ARTICLES_PER_WRITER; i++) {
                        Article article = TestGraphs.article("w" + writer + "-" + i,
                                List.of("CVE-2025-000" + (i % 5)), List.of("APT" + (i % 3)), List.of("Ransomware"));
                        graph.addArticleNode(article);
                        if (previous != null) {
                            graph.connectSimilarArticles(article, List.of(new SimilarArticle(previous, 0.7)));
                        }
                        if (i % 4 == 3) {
                            graph.deleteNode("vulnerability-cve-2025-000" + (i % 5));
                        }
                        if (i % 7 == 6) {
                            graph.deleteNode(previous.getId());
                        }
                        previous = article;
                    }
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    writersDone.countDown();
                }
            });
        }

        for (int r = 0; r < READERS; r++) {
            workers.execute(() -> {
                try {
                    start.await();
                    while (writersDone.getCount() > 0) {
                        graph.getSubgraph("w0-0", 3);
                        graph.getSubgraph("vulnerability-cve-2025-0001", 2);
                        graph.findPaths("w0-1", "w1-1");
                        graph.getPredictionContext("w1-2");
                        graph.getArticleConnections("w0-2");
                        graph.getStatistics();
                    }
                } catch (Throwable t) {
                    failures.add(t);
                }
            });
        }

        start.countDown();
        workers.shutdown();
        assertThat(workers.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
        mirror.shutdown();
        assertThat(mirror.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(failures).isEmpty();

        Set<String> memoryNodes = new HashSet<>();
        Set<EdgeKey> memoryEdges = new HashSet<>();
        store.read(view -> {
            memoryNodes.addAll(view.topology().vertexSet());
            for (GraphEdge edge : view.edges()) {
                assertThat(view.containsNode(edge.getSourceId())).as("source of %s", edge.key()).isTrue();
                assertThat(view.containsNode(edge.getTargetId())).as("target of %s", edge.key()).isTrue();
                memoryEdges.add(edge.key());
            }
            return null;
        });

        assertThat(memoryNodes).isNotEmpty();
        assertThat(persistence.nodes().keySet()).isEqualTo(memoryNodes);
        assertThat(persistence.edges().keySet()).isEqualTo(memoryEdges);
    }
}
