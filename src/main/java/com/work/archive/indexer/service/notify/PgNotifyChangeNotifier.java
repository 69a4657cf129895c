package com.work.archive.indexer.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.indexer.repository.mapper.NotifyMapper;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;

/**
 * 通过 pg_notify 发往 PostgreSQL 频道，监听方使用 LISTEN channel 接收。
 */
public class PgNotifyChangeNotifier extends AbstractJsonChangeNotifier {

    private final NotifyMapper notifyMapper;
    private final String channel;

    public PgNotifyChangeNotifier(NotifyMapper notifyMapper, String channel, ObjectMapper objectMapper, ArchiveMetrics metrics) {
        super(objectMapper, metrics);
        this.notifyMapper = notifyMapper;
        this.channel = channel;
    }

    @Override
    protected void send(String payload) {
        notifyMapper.notify(channel, payload);
    }
}
