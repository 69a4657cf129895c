package com.work.archive.indexer.service;

import com.work.archive.core.exception.ArchiveException;
import com.work.archive.core.exception.DecodeException;
import com.work.archive.core.exception.SchemaNotFoundException;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.DecodedBlock;
import com.work.archive.indexer.domain.GapReport;
import com.work.archive.indexer.domain.RecoveryJob;
import com.work.archive.indexer.service.decode.DecodeWorkerPool;
import com.work.archive.indexer.service.gap.GapDetector;
import com.work.archive.indexer.service.recovery.StorageRecoveryQueue;
import com.work.archive.indexer.service.version.RuntimeVersionService;
import com.work.archive.indexer.service.writer.WriteCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 主调度：读链头 -> 扫描缺口 -> 块缺口交给解码池、解码结果交给写入协调器；storage 缺口入恢复队列。
 *
 * 块缺口按 batch-size 分波处理，每波写入完成后再提交下一波。
 * 链或存储的瞬时错误只记录日志，下一轮重新扫描。
 */
@Service
public class IndexerScheduler {

    private static final Logger log = LoggerFactory.getLogger(IndexerScheduler.class);

    private final ArchiveProperties props;
    private final ChainClient chain;
    private final GapDetector gapDetector;
    private final DecodeWorkerPool decodePool;
    private final WriteCoordinator writer;
    private final StorageRecoveryQueue recoveryQueue;
    private final RuntimeVersionService versions;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile GapReport lastReport;

    public IndexerScheduler(ArchiveProperties props,
                            ChainClient chain,
                            GapDetector gapDetector,
                            DecodeWorkerPool decodePool,
                            WriteCoordinator writer,
                            StorageRecoveryQueue recoveryQueue,
                            RuntimeVersionService versions) {
        this.props = props;
        this.chain = chain;
        this.gapDetector = gapDetector;
        this.decodePool = decodePool;
        this.writer = writer;
        this.recoveryQueue = recoveryQueue;
        this.versions = versions;
    }

    @Scheduled(fixedDelayString = "#{@archiveProperties.scanInterval.toMillis()}")
    public void tick() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            runOnce();
        } catch (Exception e) {
            log.warn("indexer tick failed, retry next tick. err={}", e.toString());
        } finally {
            running.set(false);
        }
    }

    /**
     * 执行一轮完整的扫描与摄取。
     */
    public IngestStats runOnce() {
        long canonical = chain.canonicalHeight();
        versions.bootstrapIfEmpty(props.getStartHeight());
        GapReport report = gapDetector.detect(canonical, props.getMaxBlockLoad());
        lastReport = report;

        if (props.isStorageIndexing() && !report.getStorageGaps().isEmpty()) {
            recoveryQueue.enqueue(report.getStorageGaps(), RecoveryJob.executeBlock());
        }
        if (!report.getFailedStorage().isEmpty()) {
            log.warn("permanently failed storage recovery heights present. count={} first={}",
                    report.getFailedStorage().size(), report.getFailedStorage().get(0));
        }

        IngestStats stats = ingest(report.getBlockGaps());
        if (stats.written > 0 || stats.skipped > 0 || stats.failed > 0) {
            log.info("indexer tick canonical={} written={} skipped={} failed={} storageGaps={}",
                    canonical, stats.written, stats.skipped, stats.failed, report.getStorageGaps().size());
        }
        return stats;
    }

    public GapReport getLastReport() {
        return lastReport;
    }

    private IngestStats ingest(List<Long> heights) {
        IngestStats stats = new IngestStats();
        int wave = Math.max(1, props.getBatchSize());
        for (int from = 0; from < heights.size(); from += wave) {
            List<Long> slice = heights.subList(from, Math.min(heights.size(), from + wave));
            if (!ingestWave(slice, stats)) {
                break;
            }
        }
        return stats;
    }

    /**
     * @return false 表示遇到致命错误，停止本轮
     */
    private boolean ingestWave(List<Long> heights, IngestStats stats) {
        List<CompletableFuture<DecodedBlock>> decoding = new ArrayList<>(heights.size());
        for (Long h : heights) {
            decoding.add(decodePool.submit(h));
        }
        List<CompletableFuture<Void>> writes = new ArrayList<>(heights.size());
        boolean fatal = false;
        for (int i = 0; i < decoding.size(); i++) {
            try {
                DecodedBlock block = decoding.get(i).join();
                writes.add(writer.submitBlock(block));
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof SchemaNotFoundException) {
                    fatal = true;
                } else if (cause instanceof DecodeException) {
                    stats.skipped++;
                } else {
                    stats.failed++;
                    if (cause instanceof TimeoutException) {
                        log.warn("decode timed out, height stays a gap. height={}", heights.get(i));
                    } else if (cause instanceof ArchiveException && !((ArchiveException) cause).isRetryable()) {
                        log.warn("decode failed, height stays a gap. height={} err={}", heights.get(i), cause.toString());
                    } else {
                        log.debug("decode failed, height stays a gap. height={} err={}", heights.get(i), cause.toString());
                    }
                }
            }
        }
        for (CompletableFuture<Void> w : writes) {
            try {
                w.join();
                stats.written++;
            } catch (CompletionException e) {
                stats.failed++;
                log.warn("block write failed, height stays a gap. err={}", String.valueOf(e.getCause()));
            }
        }
        return !fatal;
    }

    /**
     * 一轮摄取的计数。
     */
    public static class IngestStats {
        int written;
        int skipped;
        int failed;

        public int getWritten() {
            return written;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getFailed() {
            return failed;
        }
    }
}
