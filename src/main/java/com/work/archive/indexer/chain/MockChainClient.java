package com.work.archive.indexer.chain;

import com.work.archive.core.exception.BlockNotFoundException;
import org.web3j.crypto.Hash;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Demo 级链客户端：确定性地“生成”区块，仅用于跑通最小链路。
 *
 * - 每次 canonicalHeight() 调用链头前进一个块（模拟出块）
 * - 每 upgradeEvery 个块 spec 版本 +1
 * - 高度为 3 的倍数的块不随块返回 storage，触发恢复队列重放
 */
public class MockChainClient implements ChainClient {

    private final AtomicLong head;
    private final long upgradeEvery;

    public MockChainClient(long initialHead, long upgradeEvery) {
        this.head = new AtomicLong(Math.max(0L, initialHead));
        this.upgradeEvery = Math.max(1L, upgradeEvery);
    }

    @Override
    public long canonicalHeight() {
        return head.getAndIncrement();
    }

    @Override
    public RawBlock fetchBlock(long height) {
        if (height < 0 || height > head.get()) {
            throw new BlockNotFoundException(height);
        }
        byte[] parent = height == 0 ? new byte[32] : hashOf(height - 1);
        String body = "{\"extrinsics\":[{\"module\":\"Timestamp\",\"call\":\"set\",\"args\":{\"now\":" + (height * 6000L) + "}}],"
                + "\"events\":[{\"module\":\"System\",\"event\":\"ExtrinsicSuccess\",\"params\":{\"height\":" + height + "}}]}";
        List<StorageChange> inline = height % 3 == 0 ? null : changesOf(height);
        return new RawBlock(height,
                hashOf(height),
                parent,
                Hash.sha3(("state-" + height).getBytes(StandardCharsets.UTF_8)),
                Hash.sha3(("ext-" + height).getBytes(StandardCharsets.UTF_8)),
                null,
                body.getBytes(StandardCharsets.UTF_8),
                runtimeVersionAt(height),
                inline);
    }

    @Override
    public List<StorageChange> executeBlock(long height) {
        if (height < 0 || height > head.get()) {
            throw new BlockNotFoundException(height);
        }
        return changesOf(height);
    }

    /**
     * 截至该高度的状态：System.Number 取该高度，每个 System.Events-k 取最后一次写入，已删除的键不出现。
     */
    @Override
    public List<StorageChange> fullStorage(long height) {
        if (height < 0 || height > head.get()) {
            throw new BlockNotFoundException(height);
        }
        List<StorageChange> out = new ArrayList<>(10);
        out.add(new StorageChange(Hash.sha3("System.Number".getBytes(StandardCharsets.UTF_8)),
                Long.toString(height).getBytes(StandardCharsets.UTF_8)));
        for (int k = 0; k < 9; k++) {
            long last = height - Math.floorMod(height - k, 10L);
            if (last >= 0) {
                out.add(new StorageChange(Hash.sha3(("System.Events-" + k).getBytes(StandardCharsets.UTF_8)),
                        Hash.sha3(("events-" + last).getBytes(StandardCharsets.UTF_8))));
            }
        }
        return out;
    }

    @Override
    public int runtimeVersionAt(long height) {
        return (int) (height / upgradeEvery);
    }

    @Override
    public byte[] fetchMetadata(long height) {
        return ("metadata-v" + runtimeVersionAt(height)).getBytes(StandardCharsets.UTF_8);
    }

    private byte[] hashOf(long height) {
        return Hash.sha3(("block-" + height).getBytes(StandardCharsets.UTF_8));
    }

    private List<StorageChange> changesOf(long height) {
        List<StorageChange> out = new ArrayList<>(2);
        out.add(new StorageChange(Hash.sha3("System.Number".getBytes(StandardCharsets.UTF_8)),
                Long.toString(height).getBytes(StandardCharsets.UTF_8)));
        out.add(new StorageChange(Hash.sha3(("System.Events-" + height % 10).getBytes(StandardCharsets.UTF_8)),
                height % 10 == 9 ? null : Hash.sha3(("events-" + height).getBytes(StandardCharsets.UTF_8))));
        return out;
    }
}
