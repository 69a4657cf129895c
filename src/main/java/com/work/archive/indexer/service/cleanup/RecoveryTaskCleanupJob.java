package com.work.archive.indexer.service.cleanup;

import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.repository.mapper.RecoveryTaskMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

import static com.work.archive.core.support.ValidationUtils.requirePositive;

/**
 * recovery_tasks 历史清理：
 * - 默认关闭
 * - 只删除超过保留期的 DONE 任务，且其块已有 storage 行；FAILED / PENDING / RUNNING 不动
 */
@Component
@ConditionalOnProperty(prefix = "archive.cleanup", name = "enabled", havingValue = "true")
public class RecoveryTaskCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(RecoveryTaskCleanupJob.class);

    private final ArchiveProperties properties;
    private final RecoveryTaskMapper taskMapper;

    public RecoveryTaskCleanupJob(ArchiveProperties properties, RecoveryTaskMapper taskMapper) {
        this.properties = properties;
        this.taskMapper = taskMapper;
    }

    @Scheduled(fixedDelayString = "#{@archiveProperties.cleanup.interval.toMillis()}")
    public void runOnce() {
        Duration retention = requirePositive(properties.getCleanup().getRetention(), "archive.cleanup.retention");
        Instant before = Instant.now().minus(retention);
        int deleted = taskMapper.deleteDoneBefore(before);
        if (deleted > 0) {
            log.info("recovery task cleanup deleted {} rows before {}", deleted, before);
        }
    }
}
