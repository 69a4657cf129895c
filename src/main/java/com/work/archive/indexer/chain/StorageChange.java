package com.work.archive.indexer.chain;

/**
 * 单个 storage key 的变更。value == null 表示该 key 被删除。
 */
public class StorageChange {

    private final byte[] key;
    private final byte[] value;

    public StorageChange(byte[] key, byte[] value) {
        this.key = key;
        this.value = value;
    }

    public byte[] getKey() {
        return key;
    }

    public byte[] getValue() {
        return value;
    }
}
