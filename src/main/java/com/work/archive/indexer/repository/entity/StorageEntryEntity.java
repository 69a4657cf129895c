package com.work.archive.indexer.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * storage 行。data 为 null 表示该 key 在此块被删除；full=true 表示来自全量快照。
 */
@TableName("storage")
public class StorageEntryEntity {

    private byte[] blockHash;

    private Long blockNum;

    private boolean full;

    private byte[] key;

    private byte[] data;

    public byte[] getBlockHash() {
        return blockHash;
    }

    public void setBlockHash(byte[] blockHash) {
        this.blockHash = blockHash;
    }

    public Long getBlockNum() {
        return blockNum;
    }

    public void setBlockNum(Long blockNum) {
        this.blockNum = blockNum;
    }

    public boolean isFull() {
        return full;
    }

    public void setFull(boolean full) {
        this.full = full;
    }

    public byte[] getKey() {
        return key;
    }

    public void setKey(byte[] key) {
        this.key = key;
    }

    public byte[] getData() {
        return data;
    }

    public void setData(byte[] data) {
        this.data = data;
    }
}
