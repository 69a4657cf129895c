package com.work.archive.indexer.service.decode;

import com.work.archive.core.codec.BlockCodec;
import com.work.archive.core.codec.DecodedBody;
import com.work.archive.core.exception.ChainClientException;
import com.work.archive.core.exception.DecodeException;
import com.work.archive.core.exception.SchemaNotFoundException;
import com.work.archive.core.support.Backoff;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.chain.RawBlock;
import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.DecodeFailure;
import com.work.archive.indexer.domain.DecodedBlock;
import com.work.archive.indexer.service.FatalErrorHandler;
import com.work.archive.indexer.service.version.RuntimeVersionService;
import com.work.archive.indexer.service.writer.WriteCoordinator;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 固定大小的取块 + 解码线程池，不直接写库。
 *
 * 每个高度的结果：
 * - 成功：DecodedBlock，交由调用方提交给 WriteCoordinator
 * - codec 失败：DecodeException，已记录到 decode_errors，该高度跳过
 * - 取块重试耗尽：ChainClientException，下轮扫描仍是缺口
 * - 找不到 schema：SchemaNotFoundException，已交给 FatalErrorHandler
 * - 超时（task-timeout，从开始执行计时）：TimeoutException，worker 被中断并释放
 */
@Service
public class DecodeWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(DecodeWorkerPool.class);

    private final ArchiveProperties props;
    private final ChainClient chain;
    private final BlockCodec codec;
    private final RuntimeVersionService versions;
    private final WriteCoordinator writer;
    private final FatalErrorHandler fatal;
    private final ArchiveMetrics metrics;

    private ExecutorService workers;
    private ScheduledExecutorService timeouts;

    public DecodeWorkerPool(ArchiveProperties props,
                            ChainClient chain,
                            BlockCodec codec,
                            RuntimeVersionService versions,
                            WriteCoordinator writer,
                            FatalErrorHandler fatal,
                            ArchiveMetrics metrics) {
        this.props = props;
        this.chain = chain;
        this.codec = codec;
        this.versions = versions;
        this.writer = writer;
        this.fatal = fatal;
        this.metrics = metrics;
    }

    @PostConstruct
    public void start() {
        int n = Math.max(1, props.getDecodeWorkers());
        this.workers = Executors.newFixedThreadPool(n, r -> {
            Thread t = new Thread(r, "decode-worker");
            t.setDaemon(true);
            return t;
        });
        this.timeouts = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "decode-timeout");
            t.setDaemon(true);
            return t;
        });
        log.info("DecodeWorkerPool started workers={}", n);
    }

    @PreDestroy
    public void stop() {
        if (workers != null) {
            workers.shutdownNow();
        }
        if (timeouts != null) {
            timeouts.shutdownNow();
        }
    }

    public CompletableFuture<DecodedBlock> submit(long height) {
        CompletableFuture<DecodedBlock> result = new CompletableFuture<>();
        long timeoutMs = props.getTaskTimeout().toMillis();
        workers.execute(() -> runGuarded(height, result, timeoutMs));
        return result;
    }

    private void runGuarded(long height, CompletableFuture<DecodedBlock> result, long timeoutMs) {
        if (result.isDone()) {
            return;
        }
        final Thread worker = Thread.currentThread();
        final TaskGuard guard = new TaskGuard();
        ScheduledFuture<?> timer = timeouts.schedule(() -> {
            synchronized (guard) {
                if (!guard.finished && result.completeExceptionally(
                        new TimeoutException("decode timed out after " + timeoutMs + "ms, height=" + height))) {
                    log.warn("decode task timed out. height={} timeoutMs={}", height, timeoutMs);
                    worker.interrupt();
                }
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        try {
            result.complete(decode(height));
        } catch (Exception e) {
            result.completeExceptionally(e);
        } finally {
            synchronized (guard) {
                guard.finished = true;
            }
            timer.cancel(false);
            // 清除超时留下的中断标记，避免影响该线程的下一个任务
            Thread.interrupted();
        }
    }

    // package-private for unit tests (decode on the caller thread)
    DecodedBlock decodeForTest(long height) {
        return decode(height);
    }

    private DecodedBlock decode(long height) {
        RawBlock raw = fetchWithRetry(height);
        int version;
        try {
            version = versions.versionFor(raw);
        } catch (SchemaNotFoundException e) {
            metrics.blockDecoded("schema_missing");
            fatal.onFatal("no schema version known at height=" + height, e);
            throw e;
        }
        byte[] meta = versions.metadata(version, height);
        try {
            DecodedBody body = codec.decode(raw.getBody(), version, meta);
            metrics.blockDecoded("ok");
            return new DecodedBlock(raw, version, body);
        } catch (DecodeException e) {
            log.warn("decode failed, height skipped. height={} spec={} err={}", height, version, e.getMessage());
            metrics.blockDecoded("decode_error");
            writer.submitDecodeFailure(new DecodeFailure(height, version, String.valueOf(e.getMessage())));
            throw e;
        }
    }

    private RawBlock fetchWithRetry(long height) {
        int maxAttempts = Math.max(1, props.getFetchMaxAttempts());
        ChainClientException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return chain.fetchBlock(height);
            } catch (ChainClientException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration backoff = Backoff.exponential(attempt, props.getBackoffBase(), props.getBackoffMax());
                log.debug("fetch block failed, retrying. height={} attempt={} backoff={} err={}",
                        height, attempt, backoff, e.toString());
                metrics.fetchRetry();
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ChainClientException("interrupted while fetching height=" + height, ie);
                }
            }
        }
        log.warn("fetch block gave up. height={} attempts={} err={}", height, maxAttempts, String.valueOf(last));
        throw last;
    }

    private static final class TaskGuard {
        private boolean finished;
    }
}
