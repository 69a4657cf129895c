package com.work.archive.indexer.service.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.core.exception.ArchiveException;
import com.work.archive.core.support.Backoff;
import com.work.archive.core.support.StatementSplitter;
import com.work.archive.core.support.ValidationUtils;
import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.RecoveryJob;
import com.work.archive.indexer.domain.RecoveryTaskStatus;
import com.work.archive.indexer.repository.entity.RecoveryTaskEntity;
import com.work.archive.indexer.repository.mapper.RecoveryTaskMapper;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * storage 恢复任务的持久化队列（recovery_tasks 表的唯一写入方）。
 *
 * 状态流转见 {@link RecoveryTaskStatus}。所有状态变更都带当前状态条件，
 * 同一任务不会被两个 worker 同时推进。
 */
@Service
public class StorageRecoveryQueue {

    private static final Logger log = LoggerFactory.getLogger(StorageRecoveryQueue.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ArchiveProperties props;
    private final RecoveryTaskMapper taskMapper;
    private final ObjectMapper objectMapper;
    private final ArchiveMetrics metrics;
    private final Clock clock;

    @Autowired
    public StorageRecoveryQueue(ArchiveProperties props,
                                RecoveryTaskMapper taskMapper,
                                ObjectMapper objectMapper,
                                ArchiveMetrics metrics) {
        this(props, taskMapper, objectMapper, metrics, Clock.systemUTC());
    }

    StorageRecoveryQueue(ArchiveProperties props,
                         RecoveryTaskMapper taskMapper,
                         ObjectMapper objectMapper,
                         ArchiveMetrics metrics,
                         Clock clock) {
        this.props = props;
        this.taskMapper = taskMapper;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 进程崩溃遗留的 RUNNING 任务回到 PENDING（至少一次语义）。
     */
    @PostConstruct
    public void resetOrphans() {
        int n = taskMapper.resetOrphans(clock.instant());
        if (n > 0) {
            log.warn("reset orphaned recovery tasks to PENDING. count={}", n);
        }
    }

    /**
     * 入队；已有任务的高度（任意状态）保持不变。
     *
     * @return 新入队的任务数
     */
    public int enqueue(List<Long> heights, RecoveryJob job) {
        if (heights == null || heights.isEmpty()) {
            return 0;
        }
        String payload = toPayload(job);
        List<Long> sorted = new ArrayList<>(new TreeSet<>(heights));
        Instant now = clock.instant();
        int inserted = 0;
        for (List<Long> chunk : StatementSplitter.split(sorted, RecoveryTaskMapper.COLUMNS,
                props.getMaxParamsPerStatement(), props.getBatchSize())) {
            inserted += taskMapper.enqueue(chunk, payload, now);
        }
        if (inserted > 0) {
            log.debug("recovery tasks enqueued. requested={} inserted={}", sorted.size(), inserted);
        }
        return inserted;
    }

    /**
     * 领取到期的 PENDING 任务（同时置为 RUNNING，attempt_count + 1）。
     */
    public List<RecoveryTaskEntity> claim(int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<RecoveryTaskEntity> claimed = taskMapper.claim(limit, clock.instant());
        return claimed == null ? Collections.emptyList() : claimed;
    }

    public RecoveryJob jobOf(RecoveryTaskEntity task) {
        String payload = task.getPayload();
        if (payload == null || payload.trim().isEmpty()) {
            return RecoveryJob.executeBlock();
        }
        try {
            return objectMapper.readValue(payload, RecoveryJob.class);
        } catch (JsonProcessingException e) {
            throw new ArchiveException("unreadable recovery payload taskId=" + task.getId(), e);
        }
    }

    public void markDone(RecoveryTaskEntity task) {
        int updated = taskMapper.markDone(task.getId(), clock.instant());
        if (updated != 1) {
            log.warn("markDone lost race. taskId={} height={}", task.getId(), task.getTargetHeight());
        }
        metrics.recoveryTask("done");
    }

    /**
     * 记录失败：未达最大尝试次数时按指数退避安排重试，否则置为永久失败。
     *
     * @return true 表示已永久失败
     */
    public boolean markFailed(RecoveryTaskEntity task, String error) {
        int attempts = task.getAttemptCount() == null ? 1 : task.getAttemptCount();
        int maxAttempts = Math.max(1, props.getRecoveryMaxAttempts());
        Instant now = clock.instant();
        boolean permanent = attempts >= maxAttempts;
        Instant nextRunAt = permanent
                ? null
                : now.plus(Backoff.exponential(attempts, props.getBackoffBase(), props.getBackoffMax()));
        taskMapper.markFailed(task.getId(), truncate(error), nextRunAt, now);
        if (permanent) {
            log.error("recovery task permanently failed. taskId={} height={} attempts={} err={}",
                    task.getId(), task.getTargetHeight(), attempts, error);
            metrics.recoveryTask("failed_permanent");
        } else {
            log.warn("recovery task failed. taskId={} height={} attempts={} next={} err={}",
                    task.getId(), task.getTargetHeight(), attempts, nextRunAt, error);
            metrics.recoveryTask("failed_retryable");
        }
        return permanent;
    }

    public int requeueDueFailures() {
        return taskMapper.requeueDueFailures(clock.instant());
    }

    /**
     * 人工重试永久失败的任务。
     *
     * @return false 表示任务不存在或不处于 FAILED
     */
    public boolean retry(long taskId) {
        boolean ok = taskMapper.retry(taskId, clock.instant()) == 1;
        if (ok) {
            log.info("recovery task requeued by operator. taskId={}", taskId);
        }
        return ok;
    }

    /**
     * 人工请求某高度的全量 storage 快照（is_full=true）。
     *
     * @return false 表示该高度已有恢复任务（任意状态）
     */
    public boolean requestFullStorage(long height) {
        ValidationUtils.requireNonNegative(height, "height");
        boolean ok = enqueue(Collections.singletonList(height), RecoveryJob.fullStorage()) == 1;
        if (ok) {
            log.info("full storage snapshot requested by operator. height={}", height);
        }
        return ok;
    }

    public List<RecoveryTaskEntity> listFailed(int limit) {
        return taskMapper.listPermanentlyFailed(Math.max(1, limit));
    }

    public List<Long> failedHeights(int limit) {
        return taskMapper.selectPermanentlyFailedHeights(Math.max(1, limit));
    }

    public long count(RecoveryTaskStatus status) {
        return taskMapper.countByStatus(status.name());
    }

    private String toPayload(RecoveryJob job) {
        try {
            return objectMapper.writeValueAsString(job == null ? RecoveryJob.executeBlock() : job);
        } catch (JsonProcessingException e) {
            throw new ArchiveException("serialize recovery job failed", e);
        }
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
