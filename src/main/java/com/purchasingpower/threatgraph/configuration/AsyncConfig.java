package com.purchasingpower.threatgraph.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for mirroring graph mutations to the durable store.
 *
 * The store submits each write while it still holds its write lock, and a single worker
 * thread drains them in submission order, so the database sees writes in the order the
 * in-memory graph applied them and an edge never arrives before its endpoints.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String GRAPH_PERSISTENCE_EXECUTOR = "graphPersistenceExecutor";

    @Bean(name = GRAPH_PERSISTENCE_EXECUTOR)
    public Executor graphPersistenceExecutor(GraphProperties properties) {
        GraphProperties.Persistence persistence = properties.getPersistence();

        if (!persistence.isAsync()) {
            log.info("Graph persistence mirroring runs synchronously on the calling thread");
            return new SyncTaskExecutor();
        }

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(persistence.getQueueCapacity());
        executor.setThreadNamePrefix("graph-mirror-");

        // Drain pending writes on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Graph persistence executor configured: threads={}, queue={}",
                executor.getMaxPoolSize(),
                persistence.getQueueCapacity());

        return executor;
    }
}
