package com.work.archive.indexer.chain;

import java.util.List;

/**
 * 链客户端返回的原始区块。
 *
 * specVersion 为 null 表示链实现不随块返回版本，此时完全依赖 VersionResolver；
 * inlineStorage 为 null 表示 storage 未能随块捕获，需要走恢复队列重放。
 */
public class RawBlock {

    private final long height;
    private final byte[] hash;
    private final byte[] parentHash;
    private final byte[] stateRoot;
    private final byte[] extrinsicsRoot;
    private final byte[] digest;
    private final byte[] body;
    private final Integer specVersion;
    private final List<StorageChange> inlineStorage;

    public RawBlock(long height,
                    byte[] hash,
                    byte[] parentHash,
                    byte[] stateRoot,
                    byte[] extrinsicsRoot,
                    byte[] digest,
                    byte[] body,
                    Integer specVersion,
                    List<StorageChange> inlineStorage) {
        this.height = height;
        this.hash = hash;
        this.parentHash = parentHash;
        this.stateRoot = stateRoot;
        this.extrinsicsRoot = extrinsicsRoot;
        this.digest = digest;
        this.body = body;
        this.specVersion = specVersion;
        this.inlineStorage = inlineStorage;
    }

    public long getHeight() {
        return height;
    }

    public byte[] getHash() {
        return hash;
    }

    public byte[] getParentHash() {
        return parentHash;
    }

    public byte[] getStateRoot() {
        return stateRoot;
    }

    public byte[] getExtrinsicsRoot() {
        return extrinsicsRoot;
    }

    public byte[] getDigest() {
        return digest;
    }

    public byte[] getBody() {
        return body;
    }

    public Integer getSpecVersion() {
        return specVersion;
    }

    public List<StorageChange> getInlineStorage() {
        return inlineStorage;
    }
}
