package com.purchasingpower.threatgraph.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Context for tracking one call into the graph store with logging support.
 *
 * Gives request/response lines a short call id and elapsed time so a mirrored write can be
 * followed across the caller and executor threads.
 *
 * @see com.purchasingpower.threatgraph.util.ExternalCallLogger
 * @see ServiceType
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.debug("{} {} → {} [{}] {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                summary == null ? "" : summary);
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        logger.debug("{} {} ← {} [{}] ({}ms) {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                summary == null ? "" : summary);
        logDetails(details);
    }

    /**
     * Logs a failure that the caller recovers from, such as a dropped mirror write.
     */
    public void logWarning(String message, Throwable ex) {
        logger.warn("{} {} ✖ {} [{}] ({}ms) - {}: {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                message,
                ex == null ? "unknown cause" : ex.getMessage());

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                errorMessage);

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
