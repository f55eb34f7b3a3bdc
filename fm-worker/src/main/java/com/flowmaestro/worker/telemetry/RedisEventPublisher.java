package com.flowmaestro.worker.telemetry;

import com.flowmaestro.annotations.ResourceCleanup;
import com.flowmaestro.config.RedisChannelWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes each event as JSON on {@code <prefix>:<type>} (e.g. {@code workflow:events:node:completed}).
 */
public final class RedisEventPublisher implements EventPublisher, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(RedisEventPublisher.class);

    private final RedisChannelWriter writer;
    private final String channelPrefix;

    public RedisEventPublisher(RedisChannelWriter writer, String channelPrefix) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.channelPrefix = channelPrefix;
    }

    @Override
    public void publish(ExecutionEvent event) {
        String channel = event.getType().channel(channelPrefix);
        long receivers = writer.publish(channel, event.toJson());
        if (log.isDebugEnabled()) {
            log.debug("Event published | channel={} | executionId={} | receivers={}", channel, event.getExecutionId(), receivers);
        }
    }

    @Override
    public void onExit() {
        writer.close();
    }
}
