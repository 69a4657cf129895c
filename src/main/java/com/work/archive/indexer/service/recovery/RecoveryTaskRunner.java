package com.work.archive.indexer.service.recovery;

import com.work.archive.core.exception.BlockExecutionException;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.chain.StorageChange;
import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.RecoveryJob;
import com.work.archive.indexer.repository.entity.RecoveryTaskEntity;
import com.work.archive.indexer.service.writer.WriteCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 消费恢复队列：领取任务 -> 重放区块 -> 经 WriteCoordinator 写入 storage -> markDone。
 *
 * 并发受 recovery-workers 限制（领取数不超过空闲槽位）。槽位由链调用本身持有，
 * 调用真正结束才释放；超时的任务立即记为失败，但仍在运行的重放继续占用槽位。
 * 链调用与写入各自受 task-timeout 约束，超时视为一次失败，按退避重试。
 */
@Service
public class RecoveryTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(RecoveryTaskRunner.class);

    private final ArchiveProperties props;
    private final StorageRecoveryQueue queue;
    private final ChainClient chain;
    private final WriteCoordinator writer;

    private Semaphore slots;
    private ExecutorService workers;
    private ExecutorService calls;

    public RecoveryTaskRunner(ArchiveProperties props,
                              StorageRecoveryQueue queue,
                              ChainClient chain,
                              WriteCoordinator writer) {
        this.props = props;
        this.queue = queue;
        this.chain = chain;
        this.writer = writer;
    }

    @PostConstruct
    public void start() {
        int n = Math.max(1, props.getRecoveryWorkers());
        this.slots = new Semaphore(n);
        this.workers = Executors.newFixedThreadPool(n, r -> {
            Thread t = new Thread(r, "recovery-worker");
            t.setDaemon(true);
            return t;
        });
        this.calls = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "recovery-call");
            t.setDaemon(true);
            return t;
        });
        log.info("RecoveryTaskRunner started workers={}", n);
    }

    @PreDestroy
    public void stop() {
        if (workers != null) {
            workers.shutdownNow();
        }
        if (calls != null) {
            calls.shutdownNow();
        }
    }

    @Scheduled(fixedDelayString = "#{@archiveProperties.recoveryScanInterval.toMillis()}")
    public void poll() {
        if (!props.isStorageIndexing()) {
            return;
        }
        int requeued = queue.requeueDueFailures();
        if (requeued > 0) {
            log.debug("recovery tasks due for retry. count={}", requeued);
        }
        int free = slots.availablePermits();
        if (free <= 0) {
            return;
        }
        List<RecoveryTaskEntity> tasks = queue.claim(free);
        for (RecoveryTaskEntity task : tasks) {
            slots.acquireUninterruptibly();
            try {
                workers.submit(() -> handle(task));
            } catch (RejectedExecutionException e) {
                slots.release();
                queue.markFailed(task, "runner stopped");
            }
        }
    }

    // package-private for unit tests (run one task on the caller thread)
    void handleTaskForTest(RecoveryTaskEntity task) {
        slots.acquireUninterruptibly();
        handle(task);
    }

    int availableSlots() {
        return slots.availablePermits();
    }

    /**
     * 调用方已占用一个槽位；槽位的释放权随链调用转移。
     */
    private void handle(RecoveryTaskEntity task) {
        long height = task.getTargetHeight();
        long timeoutMs = props.getTaskTimeout().toMillis();
        SlotCall slotCall = new SlotCall();
        Future<List<StorageChange>> call = null;
        try {
            RecoveryJob job = queue.jobOf(task);
            call = calls.submit(() -> slotCall.run(() -> load(job, height)));
            List<StorageChange> changes = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            writer.submitStorage(height, changes, job.isFull()).get(timeoutMs, TimeUnit.MILLISECONDS);
            queue.markDone(task);
            log.debug("storage recovered. height={} changes={}", height, changes.size());
        } catch (TimeoutException te) {
            if (call != null) {
                call.cancel(true);
            }
            queue.markFailed(task, "timeout after " + timeoutMs + "ms");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            queue.markFailed(task, "interrupted");
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() == null ? ee : ee.getCause();
            queue.markFailed(task, cause.toString());
        } catch (Exception e) {
            queue.markFailed(task, e.toString());
        } finally {
            // 链调用未开始（未提交、排队中被取消）时由这里归还槽位
            slotCall.releaseIfNotStarted();
        }
    }

    private List<StorageChange> load(RecoveryJob job, long height) {
        List<StorageChange> changes = job.isFull() ? chain.fullStorage(height) : chain.executeBlock(height);
        if (changes == null) {
            throw new BlockExecutionException("chain client returned no change set, height=" + height);
        }
        return changes;
    }

    /**
     * 一次链调用对槽位的所有权：调用开始即接管，结束时释放；
     * 从未开始的调用由 handle 释放。started 只会被置位一次。
     */
    private final class SlotCall {

        private final AtomicBoolean started = new AtomicBoolean(false);

        List<StorageChange> run(Callable<List<StorageChange>> body) throws Exception {
            if (!started.compareAndSet(false, true)) {
                throw new CancellationException("recovery call abandoned before start");
            }
            try {
                return body.call();
            } finally {
                slots.release();
            }
        }

        void releaseIfNotStarted() {
            if (started.compareAndSet(false, true)) {
                slots.release();
            }
        }
    }
}
