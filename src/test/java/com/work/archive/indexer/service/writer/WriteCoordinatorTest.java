package com.work.archive.indexer.service.writer;

import com.work.archive.core.exception.ArchiveException;
import com.work.archive.indexer.TestBlocks;
import com.work.archive.indexer.chain.StorageChange;
import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.DecodeFailure;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class WriteCoordinatorTest {

    private ArchiveProperties props;
    private BlockMapper blockMapper;
    private ExtrinsicMapper extrinsicMapper;
    private EventMapper eventMapper;
    private StorageMapper storageMapper;
    private MetadataMapper metadataMapper;
    private DecodeErrorMapper decodeErrorMapper;
    private StorageRecoveryQueue recoveryQueue;
    private ChangeNotifier notifier;

    /** 模拟 blocks 唯一约束：已存在的高度不会再次返回。 */
    private final Set<Long> committedHeights = new HashSet<>();

    @BeforeEach
    public void setUp() {
        props = new ArchiveProperties();
        blockMapper = mock(BlockMapper.class);
        extrinsicMapper = mock(ExtrinsicMapper.class);
        eventMapper = mock(EventMapper.class);
        storageMapper = mock(StorageMapper.class);
        metadataMapper = mock(MetadataMapper.class);
        decodeErrorMapper = mock(DecodeErrorMapper.class);
        recoveryQueue = mock(StorageRecoveryQueue.class);
        notifier = mock(ChangeNotifier.class);

        when(blockMapper.insertBatch(anyList())).thenAnswer(inv -> {
            List<BlockEntity> rows = inv.getArgument(0);
            List<Long> inserted = new ArrayList<>();
            for (BlockEntity b : rows) {
                if (committedHeights.add(b.getBlockNum())) {
                    inserted.add(b.getBlockNum());
                }
            }
            return inserted;
        });
        when(extrinsicMapper.insertBatch(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());
        when(eventMapper.insertBatch(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());
        when(storageMapper.insertBatch(anyList())).thenAnswer(inv -> {
            List<StorageEntryEntity> rows = inv.getArgument(0);
            List<Long> heights = new ArrayList<>();
            for (StorageEntryEntity r : rows) {
                heights.add(r.getBlockNum());
            }
            return heights;
        });
    }

    private WriteCoordinator newCoordinator() {
        return new WriteCoordinator(props, blockMapper, extrinsicMapper, eventMapper, storageMapper,
                metadataMapper, decodeErrorMapper, recoveryQueue, notifier, mock(ArchiveMetrics.class), null);
    }

    @Test
    public void ten_thousand_rows_are_split_into_several_statements_without_loss() {
        assertEquals(32767, props.getMaxParamsPerStatement());
        props.setBatchSize(50_000);
        List<Integer> statementSizes = new ArrayList<>();
        Set<Integer> seenIdx = new HashSet<>();
        when(extrinsicMapper.insertBatch(anyList())).thenAnswer(inv -> {
            List<ExtrinsicEntity> rows = inv.getArgument(0);
            assertTrue(rows.size() * ExtrinsicMapper.COLUMNS <= Short.MAX_VALUE);
            statementSizes.add(rows.size());
            for (ExtrinsicEntity e : rows) {
                seenIdx.add(e.getIdx());
            }
            return rows.size();
        });

        WriteCoordinator writer = newCoordinator();
        WriteCoordinator.WriteOp op = WriteCoordinator.WriteOp.block(TestBlocks.decoded(42, 10_000, true));
        writer.processBatch(Collections.singletonList(op));

        assertTrue(op.future.isDone());
        assertFalse(op.future.isCompletedExceptionally());
        assertTrue(statementSizes.size() >= 2, "expected several statements, got " + statementSizes);
        assertEquals(10_000, statementSizes.stream().mapToInt(Integer::intValue).sum());
        assertEquals(10_000, seenIdx.size());
    }

    @Test
    public void batch_size_caps_rows_per_statement() {
        props.setBatchSize(300);
        List<Integer> statementSizes = new ArrayList<>();
        when(extrinsicMapper.insertBatch(anyList())).thenAnswer(inv -> {
            statementSizes.add(((List<?>) inv.getArgument(0)).size());
            return statementSizes.get(statementSizes.size() - 1);
        });

        WriteCoordinator writer = newCoordinator();
        writer.processBatch(Collections.singletonList(WriteCoordinator.WriteOp.block(TestBlocks.decoded(1, 1000, true))));

        assertEquals(Arrays.asList(300, 300, 300, 100), statementSizes);
    }

    @Test
    public void reingesting_the_same_block_is_idempotent() {
        WriteCoordinator writer = newCoordinator();

        writer.processBatch(Collections.singletonList(WriteCoordinator.WriteOp.block(TestBlocks.decoded(7, 2, false))));
        writer.processBatch(Collections.singletonList(WriteCoordinator.WriteOp.block(TestBlocks.decoded(7, 2, false))));

        assertEquals(Collections.singleton(7L), committedHeights);
        // 只有第一次真正插入的块触发通知与恢复入队
        ArgumentCaptor<ChangeEvent> events = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(notifier, times(1)).publish(events.capture());
        assertEquals("blocks", events.getValue().getTable());
        assertEquals(7L, events.getValue().getKey());
        verify(recoveryQueue, times(1)).enqueue(eq(Collections.singletonList(7L)), any(RecoveryJob.class));
    }

    @Test
    public void block_with_inline_storage_is_not_enqueued_for_recovery() {
        WriteCoordinator writer = newCoordinator();

        writer.processBatch(Collections.singletonList(WriteCoordinator.WriteOp.block(TestBlocks.decoded(3, 1, true))));

        verify(storageMapper, times(1)).insertBatch(anyList());
        verify(recoveryQueue, never()).enqueue(anyList(), any());
        verify(notifier, times(2)).publish(any(ChangeEvent.class));
    }

    @Test
    public void storage_for_unknown_block_fails_only_that_op() {
        when(blockMapper.selectByHeight(99L)).thenReturn(null);
        WriteCoordinator writer = newCoordinator();

        WriteCoordinator.WriteOp orphan = WriteCoordinator.WriteOp.storage(99, Collections.singletonList(
                new StorageChange(new byte[]{1}, new byte[]{2})), false);
        WriteCoordinator.WriteOp block = WriteCoordinator.WriteOp.block(TestBlocks.decoded(5, 1, false));
        writer.processBatch(Arrays.asList(orphan, block));

        ExecutionException ee = assertThrows(ExecutionException.class, () -> orphan.future.get());
        assertTrue(ee.getCause() instanceof ArchiveException);
        assertFalse(block.future.isCompletedExceptionally());
        verify(storageMapper, never()).insertBatch(anyList());
    }

    @Test
    public void storage_for_committed_block_uses_its_hash() {
        BlockEntity existing = new BlockEntity();
        existing.setBlockNum(8L);
        existing.setHash(TestBlocks.hash(8));
        when(blockMapper.selectByHeight(8L)).thenReturn(existing);
        WriteCoordinator writer = newCoordinator();

        WriteCoordinator.WriteOp op = WriteCoordinator.WriteOp.storage(8, Arrays.asList(
                new StorageChange(new byte[]{1}, new byte[]{2}),
                new StorageChange(new byte[]{3}, null)), false);
        writer.processBatch(Collections.singletonList(op));

        assertFalse(op.future.isCompletedExceptionally());
        verify(storageMapper).insertBatch(argThat(rows -> rows.size() == 2
                && Arrays.equals(TestBlocks.hash(8), rows.get(0).getBlockHash())
                && rows.get(1).getData() == null));
    }

    @Test
    public void metadata_is_written_before_blocks_in_the_same_batch() {
        WriteCoordinator writer = newCoordinator();
        when(metadataMapper.insertIfAbsent(anyInt(), anyLong(), any())).thenReturn(1);

        WriteCoordinator.WriteOp block = WriteCoordinator.WriteOp.block(TestBlocks.decoded(100, 1, true));
        WriteCoordinator.WriteOp meta = WriteCoordinator.WriteOp.metadata(1, 100, new byte[]{9});
        writer.processBatch(Arrays.asList(block, meta));

        org.mockito.InOrder order = inOrder(metadataMapper, blockMapper);
        order.verify(metadataMapper).insertIfAbsent(eq(1), eq(100L), any());
        order.verify(blockMapper).insertBatch(anyList());
    }

    @Test
    public void decode_failure_is_recorded_and_cleared_once_block_lands() {
        WriteCoordinator writer = newCoordinator();

        writer.processBatch(Collections.singletonList(
                WriteCoordinator.WriteOp.decodeFailure(new DecodeFailure(11, 1, "bad call index"))));
        verify(decodeErrorMapper).upsert(eq(11L), eq(1), eq("bad call index"), any());

        writer.processBatch(Collections.singletonList(WriteCoordinator.WriteOp.block(TestBlocks.decoded(11, 1, true))));
        verify(decodeErrorMapper).deleteByHeights(Collections.singletonList(11L));
    }

    @Test
    public void failed_transaction_fails_every_op_and_publishes_nothing() {
        when(eventMapper.insertBatch(anyList())).thenThrow(new RuntimeException("connection reset"));
        WriteCoordinator writer = newCoordinator();

        WriteCoordinator.WriteOp a = WriteCoordinator.WriteOp.block(TestBlocks.decoded(1, 1, false));
        WriteCoordinator.WriteOp b = WriteCoordinator.WriteOp.block(TestBlocks.decoded(2, 1, false));
        writer.processBatch(Arrays.asList(a, b));

        assertTrue(a.future.isCompletedExceptionally());
        assertTrue(b.future.isCompletedExceptionally());
        verify(notifier, never()).publish(any());
        verify(recoveryQueue, never()).enqueue(anyList(), any());
    }

    @Test
    public void storage_already_indexed_publishes_no_storage_event() {
        BlockEntity existing = new BlockEntity();
        existing.setBlockNum(8L);
        existing.setHash(TestBlocks.hash(8));
        when(blockMapper.selectByHeight(8L)).thenReturn(existing);
        when(storageMapper.insertBatch(anyList())).thenReturn(Collections.emptyList());
        WriteCoordinator writer = newCoordinator();

        WriteCoordinator.WriteOp op = WriteCoordinator.WriteOp.storage(8, Collections.singletonList(
                new StorageChange(new byte[]{1}, new byte[]{2})), false);
        writer.processBatch(Collections.singletonList(op));

        assertFalse(op.future.isCompletedExceptionally());
        verify(notifier, never()).publish(any());
    }

    @Test
    public void recovered_storage_publishes_one_event_per_height() {
        BlockEntity existing = new BlockEntity();
        existing.setBlockNum(8L);
        existing.setHash(TestBlocks.hash(8));
        when(blockMapper.selectByHeight(8L)).thenReturn(existing);
        WriteCoordinator writer = newCoordinator();

        writer.processBatch(Collections.singletonList(WriteCoordinator.WriteOp.storage(8, Arrays.asList(
                new StorageChange(new byte[]{1}, new byte[]{2}),
                new StorageChange(new byte[]{3}, new byte[]{4})), false)));

        ArgumentCaptor<ChangeEvent> events = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(notifier, times(1)).publish(events.capture());
        assertEquals("storage", events.getValue().getTable());
        assertEquals(8L, events.getValue().getKey());
    }

    @Test
    public void bad_height_fails_alone_and_batch_mates_commit() {
        // 事务回滚后重试时，已“插入”的高度仍需再次返回
        when(blockMapper.insertBatch(anyList())).thenAnswer(inv -> {
            List<Long> heights = new ArrayList<>();
            for (BlockEntity b : inv.<List<BlockEntity>>getArgument(0)) {
                heights.add(b.getBlockNum());
            }
            return heights;
        });
        when(eventMapper.insertBatch(anyList())).thenAnswer(inv -> {
            for (EventEntity e : inv.<List<EventEntity>>getArgument(0)) {
                if (e.getBlockNum() == 1L) {
                    throw new IllegalStateException("value too long for type character varying(128)");
                }
            }
            return inv.<List<EventEntity>>getArgument(0).size();
        });
        WriteCoordinator writer = newCoordinator();

        WriteCoordinator.WriteOp bad = WriteCoordinator.WriteOp.block(TestBlocks.decoded(1, 1, true));
        WriteCoordinator.WriteOp good = WriteCoordinator.WriteOp.block(TestBlocks.decoded(2, 1, true));
        writer.processBatch(Arrays.asList(bad, good));

        assertTrue(bad.future.isCompletedExceptionally());
        assertTrue(good.future.isDone());
        assertFalse(good.future.isCompletedExceptionally());
        ArgumentCaptor<ChangeEvent> events = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(notifier, atLeastOnce()).publish(events.capture());
        for (ChangeEvent e : events.getAllValues()) {
            assertEquals(2L, e.getKey());
        }
    }

    @Test
    public void recovery_enqueue_failure_does_not_fail_committed_batch() {
        when(recoveryQueue.enqueue(anyList(), any())).thenThrow(new RuntimeException("pool exhausted"));
        WriteCoordinator writer = newCoordinator();

        WriteCoordinator.WriteOp op = WriteCoordinator.WriteOp.block(TestBlocks.decoded(4, 1, false));
        writer.processBatch(Collections.singletonList(op));

        assertFalse(op.future.isCompletedExceptionally());
    }

    @Test
    public void writer_workers_must_leave_a_pool_connection_free() {
        WriteCoordinator.checkPoolCapacity(3, 4);
        assertThrows(IllegalStateException.class, () -> WriteCoordinator.checkPoolCapacity(4, 4));
        assertThrows(IllegalStateException.class, () -> WriteCoordinator.checkPoolCapacity(8, 4));
    }

    @Test
    public void submit_before_start_is_rejected() {
        WriteCoordinator writer = newCoordinator();
        assertThrows(IllegalStateException.class, () -> writer.submitBlock(TestBlocks.decoded(1, 1, true)));
    }

    @Test
    public void started_coordinator_commits_submitted_blocks() throws Exception {
        props.setWriterWorkers(2);
        WriteCoordinator writer = newCoordinator();
        writer.start();
        try {
            writer.submitBlock(TestBlocks.decoded(20, 1, true)).get();
            writer.submitBlock(TestBlocks.decoded(21, 1, true)).get();
        } finally {
            writer.stop();
        }
        assertEquals(new HashSet<>(Arrays.asList(20L, 21L)), committedHeights);
    }
}
