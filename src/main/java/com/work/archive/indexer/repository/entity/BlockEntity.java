package com.work.archive.indexer.repository.entity;

import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * blocks 行：写入后不可变，重复写入由 ON CONFLICT DO NOTHING 吸收。
 */
@TableName("blocks")
public class BlockEntity {

    @TableId
    private byte[] hash;

    private byte[] parentHash;

    private Long blockNum;

    private byte[] stateRoot;

    private byte[] extrinsicsRoot;

    private byte[] digest;

    private byte[] ext;

    private Integer spec;

    private Instant createdAt;

    public byte[] getHash() {
        return hash;
    }

    public void setHash(byte[] hash) {
        this.hash = hash;
    }

    public byte[] getParentHash() {
        return parentHash;
    }

    public void setParentHash(byte[] parentHash) {
        this.parentHash = parentHash;
    }

    public Long getBlockNum() {
        return blockNum;
    }

    public void setBlockNum(Long blockNum) {
        this.blockNum = blockNum;
    }

    public byte[] getStateRoot() {
        return stateRoot;
    }

    public void setStateRoot(byte[] stateRoot) {
        this.stateRoot = stateRoot;
    }

    public byte[] getExtrinsicsRoot() {
        return extrinsicsRoot;
    }

    public void setExtrinsicsRoot(byte[] extrinsicsRoot) {
        this.extrinsicsRoot = extrinsicsRoot;
    }

    public byte[] getDigest() {
        return digest;
    }

    public void setDigest(byte[] digest) {
        this.digest = digest;
    }

    public byte[] getExt() {
        return ext;
    }

    public void setExt(byte[] ext) {
        this.ext = ext;
    }

    public Integer getSpec() {
        return spec;
    }

    public void setSpec(Integer spec) {
        this.spec = spec;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
