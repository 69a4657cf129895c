package com.work.archive.indexer.domain;

import com.work.archive.core.codec.DecodedBody;
import com.work.archive.indexer.chain.RawBlock;

/**
 * 解码完成、等待写入的区块：原始头部 + 已解析的 spec 版本 + 解码结果。
 */
public class DecodedBlock {

    private final RawBlock raw;
    private final int specVersion;
    private final DecodedBody body;

    public DecodedBlock(RawBlock raw, int specVersion, DecodedBody body) {
        this.raw = raw;
        this.specVersion = specVersion;
        this.body = body;
    }

    public long getHeight() {
        return raw.getHeight();
    }

    public RawBlock getRaw() {
        return raw;
    }

    public int getSpecVersion() {
        return specVersion;
    }

    public DecodedBody getBody() {
        return body;
    }

    /**
     * storage 是否随块捕获（否则需入恢复队列）。
     */
    public boolean hasInlineStorage() {
        return raw.getInlineStorage() != null;
    }
}
