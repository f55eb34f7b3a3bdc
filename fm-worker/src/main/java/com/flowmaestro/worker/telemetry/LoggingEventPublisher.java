package com.flowmaestro.worker.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when no event transport is configured. */
public final class LoggingEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventPublisher.class);

    @Override
    public void publish(ExecutionEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Event | type={} | executionId={} | nodeId={} | payload={}",
                    event.getType().getValue(), event.getExecutionId(), event.getNodeId(), event.toJson());
        }
    }
}
