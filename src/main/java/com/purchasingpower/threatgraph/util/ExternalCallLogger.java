package com.purchasingpower.threatgraph.util;

import com.purchasingpower.threatgraph.model.CallContext;
import com.purchasingpower.threatgraph.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls into the durable graph store.
 * Provides consistent, structured request/response logging.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }
}
