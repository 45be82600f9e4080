package com.purchasingpower.threatgraph;

import com.purchasingpower.threatgraph.model.article.Article;
import com.purchasingpower.threatgraph.model.article.SimilarArticle;
import com.purchasingpower.threatgraph.model.context.GraphContext;
import com.purchasingpower.threatgraph.model.graph.GraphStatistics;
import com.purchasingpower.threatgraph.repository.GraphEdgeRepository;
import com.purchasingpower.threatgraph.repository.GraphNodeRepository;
import com.purchasingpower.threatgraph.service.graph.GraphStore;
import com.purchasingpower.threatgraph.service.graph.KnowledgeGraphService;
import com.purchasingpower.threatgraph.testsupport.TestGraphs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the full context against in-memory H2 with synchronous mirroring.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Knowledge graph with database")
class KnowledgeGraphIntegrationTest {

    @Autowired
    private KnowledgeGraphService knowledgeGraph;

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private GraphNodeRepository nodeRepository;

    @Autowired
    private GraphEdgeRepository edgeRepository;

    @BeforeEach
    void setUp() {
        edgeRepository.deleteAll();
        nodeRepository.deleteAll();
        graphStore.clear();
    }

    @Test
    @DisplayName("Ingested articles are mirrored to the database")
    void ingestion_isMirrored() {
        knowledgeGraph.addArticleNode(TestGraphs.article("a1",
                List.of("CVE-2025-1111"), List.of("APT29"), List.of("ransomware")));

        assertThat(nodeRepository.count()).isEqualTo(4);
        assertThat(edgeRepository.count()).isEqualTo(3);
        assertThat(knowledgeGraph.getPersistenceStatistics().inSync()).isTrue();
    }

    @Test
    @DisplayName("A restart restores the same graph and the same prediction context")
    void restart_restoresGraph() {
        for (String id : List.of("a1", "a2", "a3")) {
            knowledgeGraph.addArticleNode(TestGraphs.article(id, List.of("CVE-2025-1111"), List.of(), List.of()));
        }
        Article a1 = TestGraphs.article("a1", List.of("CVE-2025-1111"), List.of(), List.of());
        knowledgeGraph.connectSimilarArticles(a1,
                List.of(new SimilarArticle(TestGraphs.article("a2"), 0.87)));

        GraphStatistics before = knowledgeGraph.getStatistics();
        GraphContext contextBefore = knowledgeGraph.getPredictionContext("a1");

        // Simulates a process restart: memory is lost, the database survives
        graphStore.clear();
        assertThat(knowledgeGraph.getStatistics().getTotalNodes()).isZero();

        int loaded = knowledgeGraph.loadFromPersistence();

        assertThat(loaded).isEqualTo(before.getTotalNodes());
        assertThat(knowledgeGraph.getStatistics()).isEqualTo(before);
        assertThat(knowledgeGraph.getPredictionContext("a1")).isEqualTo(contextBefore);
        assertThat(knowledgeGraph.findPaths("a1", "a2")).containsExactly(List.of("a1", "a2"));
    }

    @Test
    @DisplayName("Administrative deletes reach the database")
    void deletes_areMirrored() {
        knowledgeGraph.addArticleNode(TestGraphs.article("a1", List.of("CVE-2025-1111"), List.of(), List.of()));
        knowledgeGraph.addArticleNode(TestGraphs.article("a2", List.of("CVE-2025-1111"), List.of(), List.of()));

        knowledgeGraph.deleteNode("vulnerability-cve-2025-1111");

        assertThat(nodeRepository.count()).isEqualTo(2);
        assertThat(edgeRepository.count()).isZero();
        assertThat(knowledgeGraph.findPaths("a1", "a2")).isEmpty();
    }
}
