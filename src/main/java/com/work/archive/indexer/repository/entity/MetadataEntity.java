package com.work.archive.indexer.repository.entity;

import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * metadata 行：每个 spec 版本一行，first_height 即版本断点。
 */
@TableName("metadata")
public class MetadataEntity {

    @TableId
    private Integer version;

    private Long firstHeight;

    private byte[] meta;

    private Instant createdAt;

    public Integer getVersion() {
        return version;
    }

    public void setVersion(Integer version) {
        this.version = version;
    }

    public Long getFirstHeight() {
        return firstHeight;
    }

    public void setFirstHeight(Long firstHeight) {
        this.firstHeight = firstHeight;
    }

    public byte[] getMeta() {
        return meta;
    }

    public void setMeta(byte[] meta) {
        this.meta = meta;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
