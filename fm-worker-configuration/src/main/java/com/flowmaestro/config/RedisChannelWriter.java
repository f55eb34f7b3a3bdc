package com.flowmaestro.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.Objects;

/**
 * Pooled Redis connection used to publish run and step events on pub/sub channels.
 * Host and port come from {@link FlowConfig} (FM_CACHE_HOST, FM_CACHE_PORT).
 */
public final class RedisChannelWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisChannelWriter.class);

    private final JedisPool pool;

    public RedisChannelWriter(FlowConfig config) {
        this(config.getCacheHost(), config.getCachePort(), new JedisPoolConfig());
    }

    RedisChannelWriter(String host, int port, JedisPoolConfig poolConfig) {
        Objects.requireNonNull(host, "host");
        this.pool = new JedisPool(poolConfig, host, port);
        log.info("RedisChannelWriter connected to {}:{}", host, port);
    }

    /**
     * Publishes the message on the channel. Returns the number of subscribers that received it.
     */
    public long publish(String channel, String message) {
        try (var jedis = pool.getResource()) {
            return jedis.publish(channel, message);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
