package com.work.archive.indexer;

import com.work.archive.core.codec.DecodedBody;
import com.work.archive.core.codec.DecodedEvent;
import com.work.archive.core.codec.DecodedExtrinsic;
import com.work.archive.indexer.chain.RawBlock;
import com.work.archive.indexer.chain.StorageChange;
import com.work.archive.indexer.domain.DecodedBlock;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 测试用区块构造。
 */
public final class TestBlocks {

    private TestBlocks() {
    }

    public static byte[] hash(long height) {
        return ByteBuffer.allocate(32).putLong(0, height).putLong(24, ~height).array();
    }

    public static RawBlock raw(long height, Integer spec, List<StorageChange> inline) {
        return new RawBlock(height, hash(height), height == 0 ? new byte[32] : hash(height - 1),
                hash(height + 1_000_000), hash(height + 2_000_000), null,
                "{}".getBytes(), spec, inline);
    }

    public static DecodedBlock decoded(long height, int extrinsics, boolean inlineStorage) {
        List<DecodedExtrinsic> xs = new ArrayList<>(extrinsics);
        for (int i = 0; i < extrinsics; i++) {
            xs.add(new DecodedExtrinsic(i, "Timestamp", "set", null, "{\"i\":" + i + "}"));
        }
        List<DecodedEvent> evs = Collections.singletonList(new DecodedEvent(0, "System", "ExtrinsicSuccess", "{}"));
        List<StorageChange> inline = inlineStorage
                ? Collections.singletonList(new StorageChange(new byte[]{1, 2}, new byte[]{(byte) height}))
                : null;
        return new DecodedBlock(raw(height, 1, inline), 1, new DecodedBody(xs, evs));
    }
}
