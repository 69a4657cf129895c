package com.work.archive.indexer.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 以 JSON 文本为载荷的通知实现基类：统一序列化、异常吸收与计数。
 */
public abstract class AbstractJsonChangeNotifier implements ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(AbstractJsonChangeNotifier.class);

    private final ObjectMapper objectMapper;
    private final ArchiveMetrics metrics;

    protected AbstractJsonChangeNotifier(ObjectMapper objectMapper, ArchiveMetrics metrics) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void publish(ChangeEvent event) {
        if (event == null) {
            return;
        }
        try {
            send(objectMapper.writeValueAsString(event));
            metrics.notifyPublished("success");
        } catch (JsonProcessingException e) {
            log.warn("serialize change event failed. event={} err={}", event, e.toString());
            metrics.notifyPublished("error");
        } catch (RuntimeException e) {
            // 通知丢失不影响已提交数据，监听方可通过轮询补偿
            log.warn("publish change event failed. event={} err={}", event, e.toString());
            metrics.notifyPublished("error");
        }
    }

    protected abstract void send(String payload);
}
