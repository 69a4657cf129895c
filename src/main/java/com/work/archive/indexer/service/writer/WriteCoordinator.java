package com.work.archive.indexer.service.writer;

import com.work.archive.core.codec.DecodedEvent;
import com.work.archive.core.codec.DecodedExtrinsic;
import com.work.archive.core.exception.ArchiveException;
import com.work.archive.core.support.StatementSplitter;
import com.work.archive.indexer.chain.RawBlock;
import com.work.archive.indexer.chain.StorageChange;
import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.DecodeFailure;
import com.work.archive.indexer.domain.DecodedBlock;
import com.work.archive.indexer.domain.RecoveryJob;
import com.work.archive.indexer.repository.entity.BlockEntity;
import com.work.archive.indexer.repository.entity.EventEntity;
import com.work.archive.indexer.repository.entity.ExtrinsicEntity;
import com.work.archive.indexer.repository.entity.StorageEntryEntity;
import com.work.archive.indexer.repository.mapper.BlockMapper;
import com.work.archive.indexer.repository.mapper.DecodeErrorMapper;
import com.work.archive.indexer.repository.mapper.EventMapper;
import com.work.archive.indexer.repository.mapper.ExtrinsicMapper;
import com.work.archive.indexer.repository.mapper.MetadataMapper;
import com.work.archive.indexer.repository.mapper.StorageMapper;
import com.work.archive.indexer.service.notify.ChangeEvent;
import com.work.archive.indexer.service.notify.ChangeNotifier;
import com.work.archive.indexer.service.recovery.StorageRecoveryQueue;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

import static com.work.archive.core.support.ValidationUtils.requireNonNull;

/**
 * 链数据的唯一写入方：blocks / extrinsics / events / storage / metadata / decode_errors。
 *
 * - 固定 writer worker，按高度路由到分片队列，同一高度总落在同一 worker
 * - worker take + drainTo 成批，每批一个 READ_COMMITTED 事务
 * - 多行 INSERT ... ON CONFLICT DO NOTHING，按绑定参数上限自动拆分语句
 * - 同一批内写入顺序：metadata -> blocks -> extrinsics -> events -> storage -> decode_errors
 * - 事务提交后：完成 future、发布变更通知、为缺少 storage 的新块入恢复队列
 */
@Service
public class WriteCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WriteCoordinator.class);

    private final ArchiveProperties props;
    private final BlockMapper blockMapper;
    private final ExtrinsicMapper extrinsicMapper;
    private final EventMapper eventMapper;
    private final StorageMapper storageMapper;
    private final MetadataMapper metadataMapper;
    private final DecodeErrorMapper decodeErrorMapper;
    private final StorageRecoveryQueue recoveryQueue;
    private final ChangeNotifier notifier;
    private final ArchiveMetrics metrics;
    private final DataSource dataSource;

    private final List<BlockingQueue<WriteOp>> queues = new ArrayList<>();
    private final List<Thread> workers = new ArrayList<>();

    @Autowired
    @Lazy
    private WriteCoordinator self;

    public WriteCoordinator(ArchiveProperties props,
                            BlockMapper blockMapper,
                            ExtrinsicMapper extrinsicMapper,
                            EventMapper eventMapper,
                            StorageMapper storageMapper,
                            MetadataMapper metadataMapper,
                            DecodeErrorMapper decodeErrorMapper,
                            StorageRecoveryQueue recoveryQueue,
                            ChangeNotifier notifier,
                            ArchiveMetrics metrics,
                            DataSource dataSource) {
        this.props = props;
        this.blockMapper = blockMapper;
        this.extrinsicMapper = extrinsicMapper;
        this.eventMapper = eventMapper;
        this.storageMapper = storageMapper;
        this.metadataMapper = metadataMapper;
        this.decodeErrorMapper = decodeErrorMapper;
        this.recoveryQueue = recoveryQueue;
        this.notifier = notifier;
        this.metrics = metrics;
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void start() {
        int n = Math.max(1, props.getWriterWorkers());
        if (dataSource instanceof HikariDataSource) {
            checkPoolCapacity(n, ((HikariDataSource) dataSource).getMaximumPoolSize());
        }
        int capacity = Math.max(1, props.getBatchSize()) * 4;
        for (int i = 0; i < n; i++) {
            final int workerIdx = i;
            BlockingQueue<WriteOp> q = new LinkedBlockingQueue<>(capacity);
            queues.add(q);
            Thread t = new Thread(() -> runWorkerLoop(workerIdx, q), "archive-writer-" + workerIdx);
            t.setDaemon(true);
            workers.add(t);
            t.start();
        }
        log.info("WriteCoordinator started with workers={} queueCapacity={}", n, capacity);
    }

    @PreDestroy
    public void stop() {
        for (Thread t : workers) {
            t.interrupt();
        }
    }

    /**
     * writer 独占的连接之外，至少为恢复队列与缺口扫描保留一个连接。
     */
    static void checkPoolCapacity(int writerWorkers, int maxPoolSize) {
        if (maxPoolSize > 0 && writerWorkers >= maxPoolSize) {
            throw new IllegalStateException("archive.writer-workers=" + writerWorkers
                    + " must be below spring.datasource.hikari.maximum-pool-size=" + maxPoolSize);
        }
    }

    public CompletableFuture<Void> submitBlock(DecodedBlock block) {
        requireNonNull(block, "block");
        return enqueue(WriteOp.block(block));
    }

    /**
     * 写入某高度的 storage 变更集；该高度的块必须已提交（或在同一批内）。
     */
    public CompletableFuture<Void> submitStorage(long height, List<StorageChange> changes, boolean full) {
        return enqueue(WriteOp.storage(height, changes == null ? Collections.emptyList() : changes, full));
    }

    public CompletableFuture<Void> submitDecodeFailure(DecodeFailure failure) {
        requireNonNull(failure, "failure");
        return enqueue(WriteOp.decodeFailure(failure));
    }

    public CompletableFuture<Void> submitMetadata(int version, long firstHeight, byte[] meta) {
        requireNonNull(meta, "meta");
        return enqueue(WriteOp.metadata(version, firstHeight, meta));
    }

    private CompletableFuture<Void> enqueue(WriteOp op) {
        if (queues.isEmpty()) {
            throw new IllegalStateException("WriteCoordinator not started");
        }
        int idx = workerIndex(op.routingKey);
        BlockingQueue<WriteOp> q = queues.get(idx);
        try {
            q.put(op);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            op.future.completeExceptionally(ie);
            return op.future;
        }
        metrics.writerQueueDepth("writer-" + idx, q.size());
        return op.future;
    }

    private int workerIndex(long routingKey) {
        return (int) Math.floorMod(routingKey, (long) queues.size());
    }

    private void runWorkerLoop(int workerIndex, BlockingQueue<WriteOp> q) {
        int batchSize = Math.max(1, props.getBatchSize());
        while (!Thread.currentThread().isInterrupted()) {
            try {
                WriteOp first = q.take();
                List<WriteOp> batch = new ArrayList<>(batchSize);
                batch.add(first);
                q.drainTo(batch, batchSize - 1);
                processBatch(batch);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.error("writer loop error worker={}", workerIndex, e);
            }
        }
    }

    /**
     * 执行一批写入并处理提交后的动作。
     *
     * 整批事务失败时逐个 op 单独重试，只有自身写入失败的 op 异常完成，
     * 避免一个坏高度拖住同批的其它高度。
     */
    void processBatch(List<WriteOp> batch) {
        if (batch.isEmpty()) {
            return;
        }
        BatchOutcome outcome;
        try {
            outcome = (self != null ? self : this).processBatchTx(batch);
        } catch (Exception e) {
            if (batch.size() == 1) {
                WriteOp op = batch.get(0);
                log.warn("write rolled back. kind={} height={} err={}", op.kind, op.height, e.toString());
                op.future.completeExceptionally(e);
                return;
            }
            log.warn("write batch rolled back, retrying ops one by one. ops={} err={}", batch.size(), e.toString());
            // metadata 先行：blocks.spec 外键依赖它
            for (WriteOp op : batch) {
                if (op.kind == WriteOp.Kind.METADATA) {
                    processBatch(Collections.singletonList(op));
                }
            }
            for (WriteOp op : batch) {
                if (op.kind != WriteOp.Kind.METADATA) {
                    processBatch(Collections.singletonList(op));
                }
            }
            return;
        }
        afterCommit(batch, outcome);
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public BatchOutcome processBatchTx(List<WriteOp> batch) {
        BatchOutcome outcome = new BatchOutcome();
        Instant now = Instant.now();

        List<BlockEntity> blocks = new ArrayList<>();
        List<ExtrinsicEntity> extrinsics = new ArrayList<>();
        List<EventEntity> events = new ArrayList<>();
        List<StorageEntryEntity> storage = new ArrayList<>();
        Map<Long, byte[]> hashByHeight = new HashMap<>();
        Map<Long, Boolean> inlineByHeight = new HashMap<>();
        List<Long> decodedHeights = new ArrayList<>();

        // metadata 先于 blocks：blocks.spec 外键引用 metadata.version
        for (WriteOp op : batch) {
            if (op.kind == WriteOp.Kind.METADATA) {
                if (metadataMapper.insertIfAbsent(op.version, op.height, op.meta) > 0) {
                    outcome.events.add(ChangeEvent.inserted("metadata", op.version));
                }
            }
        }

        for (WriteOp op : batch) {
            if (op.kind != WriteOp.Kind.BLOCK) {
                continue;
            }
            DecodedBlock b = op.block;
            RawBlock raw = b.getRaw();
            long height = b.getHeight();
            hashByHeight.put(height, raw.getHash());
            inlineByHeight.put(height, b.hasInlineStorage());
            decodedHeights.add(height);
            blocks.add(toBlockEntity(b));
            for (DecodedExtrinsic x : b.getBody().getExtrinsics()) {
                extrinsics.add(toExtrinsicEntity(raw, x));
            }
            for (DecodedEvent e : b.getBody().getEvents()) {
                events.add(toEventEntity(raw, e));
            }
            if (b.hasInlineStorage()) {
                appendStorage(storage, raw.getHash(), height, raw.getInlineStorage(), false);
            }
        }

        List<Long> insertedHeights = insertBlocks(blocks);
        long rows = insertedHeights.size();
        for (List<ExtrinsicEntity> chunk : split(extrinsics, ExtrinsicMapper.COLUMNS)) {
            rows += extrinsicMapper.insertBatch(chunk);
        }
        for (List<EventEntity> chunk : split(events, EventMapper.COLUMNS)) {
            rows += eventMapper.insertBatch(chunk);
        }

        for (WriteOp op : batch) {
            if (op.kind != WriteOp.Kind.STORAGE) {
                continue;
            }
            byte[] hash = hashByHeight.get(op.height);
            if (hash == null) {
                BlockEntity existing = blockMapper.selectByHeight(op.height);
                hash = existing == null ? null : existing.getHash();
            }
            if (hash == null) {
                op.error = new ArchiveException("block not indexed for storage height=" + op.height);
                continue;
            }
            appendStorage(storage, hash, op.height, op.changes, op.full);
        }
        // 只为真正插入了 storage 行的高度发通知
        Set<Long> storageHeights = new TreeSet<>();
        for (List<StorageEntryEntity> chunk : split(storage, StorageMapper.COLUMNS)) {
            List<Long> inserted = storageMapper.insertBatch(chunk);
            if (inserted != null) {
                rows += inserted.size();
                storageHeights.addAll(inserted);
            }
        }

        for (WriteOp op : batch) {
            if (op.kind == WriteOp.Kind.DECODE_FAILURE) {
                DecodeFailure f = op.failure;
                decodeErrorMapper.upsert(f.getHeight(), f.getSpecVersion(), f.getError(), now);
            }
        }
        if (!decodedHeights.isEmpty()) {
            decodeErrorMapper.deleteByHeights(decodedHeights);
        }

        for (Long h : insertedHeights) {
            outcome.events.add(ChangeEvent.inserted("blocks", h));
            if (!Boolean.TRUE.equals(inlineByHeight.get(h))) {
                outcome.needRecovery.add(h);
            }
        }
        for (Long h : storageHeights) {
            outcome.events.add(ChangeEvent.inserted("storage", h));
        }
        outcome.blocks = insertedHeights.size();
        outcome.rows = rows;
        return outcome;
    }

    private void afterCommit(List<WriteOp> batch, BatchOutcome outcome) {
        metrics.batchCommitted(outcome.blocks, outcome.rows);
        if (props.isStorageIndexing() && !outcome.needRecovery.isEmpty()) {
            try {
                recoveryQueue.enqueue(outcome.needRecovery, RecoveryJob.executeBlock());
            } catch (Exception e) {
                // 未入队的高度会被下一轮缺口扫描重新发现
                log.warn("enqueue storage recovery failed. heights={} err={}", outcome.needRecovery.size(), e.toString());
            }
        }
        for (ChangeEvent event : outcome.events) {
            notifier.publish(event);
        }
        for (WriteOp op : batch) {
            if (op.error != null) {
                op.future.completeExceptionally(op.error);
            } else {
                op.future.complete(null);
            }
        }
    }

    private List<Long> insertBlocks(List<BlockEntity> blocks) {
        if (blocks.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> inserted = new ArrayList<>();
        for (List<BlockEntity> chunk : split(blocks, BlockMapper.COLUMNS)) {
            List<Long> heights = blockMapper.insertBatch(chunk);
            if (heights != null) {
                inserted.addAll(heights);
            }
        }
        Collections.sort(inserted);
        return inserted;
    }

    private <T> List<List<T>> split(List<T> rows, int columns) {
        return StatementSplitter.split(rows, columns, props.getMaxParamsPerStatement(), props.getBatchSize());
    }

    private static void appendStorage(List<StorageEntryEntity> out, byte[] blockHash, long height,
                                      List<StorageChange> changes, boolean full) {
        for (StorageChange c : changes) {
            StorageEntryEntity e = new StorageEntryEntity();
            e.setBlockHash(blockHash);
            e.setBlockNum(height);
            e.setFull(full);
            e.setKey(c.getKey());
            e.setData(c.getValue());
            out.add(e);
        }
    }

    private static BlockEntity toBlockEntity(DecodedBlock b) {
        RawBlock raw = b.getRaw();
        BlockEntity e = new BlockEntity();
        e.setHash(raw.getHash());
        e.setParentHash(raw.getParentHash());
        e.setBlockNum(raw.getHeight());
        e.setStateRoot(raw.getStateRoot());
        e.setExtrinsicsRoot(raw.getExtrinsicsRoot());
        e.setDigest(raw.getDigest());
        e.setExt(raw.getBody());
        e.setSpec(b.getSpecVersion());
        return e;
    }

    private static ExtrinsicEntity toExtrinsicEntity(RawBlock raw, DecodedExtrinsic x) {
        ExtrinsicEntity e = new ExtrinsicEntity();
        e.setBlockHash(raw.getHash());
        e.setIdx(x.getIndex());
        e.setBlockNum(raw.getHeight());
        e.setModule(x.getModule());
        e.setCallName(x.getCallName());
        e.setSignature(x.getSignature());
        e.setArgs(x.getArgsJson());
        return e;
    }

    private static EventEntity toEventEntity(RawBlock raw, DecodedEvent ev) {
        EventEntity e = new EventEntity();
        e.setBlockHash(raw.getHash());
        e.setIdx(ev.getIndex());
        e.setBlockNum(raw.getHeight());
        e.setModule(ev.getModule());
        e.setEventName(ev.getEventName());
        e.setParameters(ev.getParametersJson());
        return e;
    }

    /**
     * 一批写入提交后需要执行的动作。
     */
    public static class BatchOutcome {
        final List<ChangeEvent> events = new ArrayList<>();
        final List<Long> needRecovery = new ArrayList<>();
        int blocks;
        long rows;
    }

    static class WriteOp {

        enum Kind {
            BLOCK,
            STORAGE,
            DECODE_FAILURE,
            METADATA
        }

        final Kind kind;
        final long routingKey;
        final CompletableFuture<Void> future = new CompletableFuture<>();

        long height;
        DecodedBlock block;
        List<StorageChange> changes;
        boolean full;
        DecodeFailure failure;
        int version;
        byte[] meta;

        ArchiveException error;

        private WriteOp(Kind kind, long routingKey) {
            this.kind = kind;
            this.routingKey = routingKey;
        }

        static WriteOp block(DecodedBlock block) {
            WriteOp op = new WriteOp(Kind.BLOCK, block.getHeight());
            op.height = block.getHeight();
            op.block = block;
            return op;
        }

        static WriteOp storage(long height, List<StorageChange> changes, boolean full) {
            WriteOp op = new WriteOp(Kind.STORAGE, height);
            op.height = height;
            op.changes = changes;
            op.full = full;
            return op;
        }

        static WriteOp decodeFailure(DecodeFailure failure) {
            WriteOp op = new WriteOp(Kind.DECODE_FAILURE, failure.getHeight());
            op.height = failure.getHeight();
            op.failure = failure;
            return op;
        }

        static WriteOp metadata(int version, long firstHeight, byte[] meta) {
            WriteOp op = new WriteOp(Kind.METADATA, firstHeight);
            op.height = firstHeight;
            op.version = version;
            op.meta = meta;
            return op;
        }
    }
}
