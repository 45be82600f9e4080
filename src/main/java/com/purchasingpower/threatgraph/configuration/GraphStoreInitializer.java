package com.purchasingpower.threatgraph.configuration;

import com.purchasingpower.threatgraph.service.graph.KnowledgeGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Restores the in-memory graph from the database once the context is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphStoreInitializer implements ApplicationRunner {

    private final KnowledgeGraphService knowledgeGraphService;
    private final GraphProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isLoadOnStartup()) {
            log.info("Graph load on startup disabled (app.graph.load-on-startup=false)");
            return;
        }
        int loaded = knowledgeGraphService.loadFromPersistence();
        log.info("✅ Knowledge graph ready: {} nodes restored", loaded);
    }
}
