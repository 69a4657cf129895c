package com.work.archive.indexer.domain;

/**
 * 解码失败记录（写入 decode_errors，该高度本轮跳过）。
 */
public class DecodeFailure {

    private final long height;
    private final Integer specVersion;
    private final String error;

    public DecodeFailure(long height, Integer specVersion, String error) {
        this.height = height;
        this.specVersion = specVersion;
        this.error = error;
    }

    public long getHeight() {
        return height;
    }

    public Integer getSpecVersion() {
        return specVersion;
    }

    public String getError() {
        return error;
    }
}
