package com.work.archive.indexer.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 通过 Redis Pub/Sub 发布。
 */
public class RedisChangeNotifier extends AbstractJsonChangeNotifier {

    private final StringRedisTemplate redisTemplate;
    private final String channel;

    public RedisChangeNotifier(StringRedisTemplate redisTemplate, String channel, ObjectMapper objectMapper, ArchiveMetrics metrics) {
        super(objectMapper, metrics);
        this.redisTemplate = redisTemplate;
        this.channel = channel;
    }

    @Override
    protected void send(String payload) {
        redisTemplate.convertAndSend(channel, payload);
    }
}
