package com.work.archive.indexer.service.decode;

import com.work.archive.core.codec.BlockCodec;
import com.work.archive.core.codec.DecodedBody;
import com.work.archive.core.exception.ChainClientException;
import com.work.archive.core.exception.DecodeException;
import com.work.archive.core.exception.SchemaNotFoundException;
import com.work.archive.indexer.TestBlocks;
import com.work.archive.indexer.chain.ChainClient;
import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.DecodeFailure;
import com.work.archive.indexer.domain.DecodedBlock;
import com.work.archive.indexer.service.FatalErrorHandler;
import com.work.archive.indexer.service.version.RuntimeVersionService;
import com.work.archive.indexer.service.writer.WriteCoordinator;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class DecodeWorkerPoolTest {

    private ArchiveProperties props;
    private ChainClient chain;
    private BlockCodec codec;
    private RuntimeVersionService versions;
    private WriteCoordinator writer;
    private FatalErrorHandler fatal;
    private ArchiveMetrics metrics;
    private DecodeWorkerPool pool;

    private final DecodedBody body = new DecodedBody(Collections.emptyList(), Collections.emptyList());

    @BeforeEach
    public void setUp() {
        props = new ArchiveProperties();
        props.setBackoffBase(Duration.ofMillis(1));
        props.setBackoffMax(Duration.ofMillis(5));
        props.setFetchMaxAttempts(3);
        chain = mock(ChainClient.class);
        codec = mock(BlockCodec.class);
        versions = mock(RuntimeVersionService.class);
        writer = mock(WriteCoordinator.class);
        fatal = mock(FatalErrorHandler.class);
        metrics = mock(ArchiveMetrics.class);

        when(chain.fetchBlock(anyLong())).thenAnswer(inv -> TestBlocks.raw(inv.<Long>getArgument(0), 1, null));
        when(versions.versionFor(any())).thenReturn(1);
        when(versions.metadata(eq(1), anyLong())).thenReturn(new byte[]{1});
        when(codec.decode(any(), eq(1), any())).thenReturn(body);
        when(writer.submitDecodeFailure(any())).thenReturn(CompletableFuture.completedFuture(null));

        pool = new DecodeWorkerPool(props, chain, codec, versions, writer, fatal, metrics);
    }

    @AfterEach
    public void tearDown() {
        pool.stop();
    }

    @Test
    public void decodes_block_with_resolved_version() {
        DecodedBlock block = pool.decodeForTest(5);

        assertEquals(5, block.getHeight());
        assertEquals(1, block.getSpecVersion());
        assertSame(body, block.getBody());
        verify(metrics).blockDecoded("ok");
    }

    @Test
    public void codec_failure_is_recorded_and_rethrown() {
        when(codec.decode(any(), eq(1), any())).thenThrow(new DecodeException("unknown call index 0x2a"));

        assertThrows(DecodeException.class, () -> pool.decodeForTest(7));

        ArgumentCaptor<DecodeFailure> failure = ArgumentCaptor.forClass(DecodeFailure.class);
        verify(writer).submitDecodeFailure(failure.capture());
        assertEquals(7, failure.getValue().getHeight());
        assertEquals(1, failure.getValue().getSpecVersion());
        assertTrue(failure.getValue().getError().contains("0x2a"));
        verifyNoInteractions(fatal);
    }

    @Test
    public void fetch_retries_stop_at_max_attempts() {
        when(chain.fetchBlock(9L)).thenThrow(new ChainClientException("connection refused"));

        assertThrows(ChainClientException.class, () -> pool.decodeForTest(9));

        verify(chain, times(3)).fetchBlock(9L);
        verify(metrics, times(2)).fetchRetry();
        verifyNoInteractions(codec);
    }

    @Test
    public void transient_fetch_failure_recovers_on_retry() {
        when(chain.fetchBlock(9L))
                .thenThrow(new ChainClientException("502"))
                .thenReturn(TestBlocks.raw(9, 1, null));

        assertEquals(9, pool.decodeForTest(9).getHeight());
        verify(chain, times(2)).fetchBlock(9L);
    }

    @Test
    public void missing_schema_goes_to_fatal_handler() {
        when(versions.versionFor(any())).thenThrow(new SchemaNotFoundException(3));

        assertThrows(SchemaNotFoundException.class, () -> pool.decodeForTest(3));

        verify(fatal).onFatal(contains("height=3"), any(SchemaNotFoundException.class));
        verifyNoInteractions(codec);
        verify(writer, never()).submitDecodeFailure(any());
    }

    @Test
    public void submitted_heights_complete_through_the_pool() throws Exception {
        pool.start();

        CompletableFuture<DecodedBlock> a = pool.submit(1);
        CompletableFuture<DecodedBlock> b = pool.submit(2);

        assertEquals(1, a.get(5, TimeUnit.SECONDS).getHeight());
        assertEquals(2, b.get(5, TimeUnit.SECONDS).getHeight());
    }

    @Test
    public void timed_out_task_releases_its_worker() throws Exception {
        props.setDecodeWorkers(1);
        props.setFetchMaxAttempts(1);
        props.setTaskTimeout(Duration.ofMillis(200));
        CountDownLatch blocker = new CountDownLatch(1);
        when(chain.fetchBlock(1L)).thenAnswer(inv -> {
            try {
                blocker.await();
            } catch (InterruptedException e) {
                throw new ChainClientException("interrupted", e);
            }
            return TestBlocks.raw(1, 1, null);
        });
        pool.start();

        CompletableFuture<DecodedBlock> stuck = pool.submit(1);
        CompletableFuture<DecodedBlock> next = pool.submit(2);

        ExecutionException ee = assertThrows(ExecutionException.class, () -> stuck.get(5, TimeUnit.SECONDS));
        assertTrue(ee.getCause() instanceof TimeoutException);
        // 唯一的 worker 被释放后，排队的任务照常完成
        assertEquals(2, next.get(5, TimeUnit.SECONDS).getHeight());
    }
}
