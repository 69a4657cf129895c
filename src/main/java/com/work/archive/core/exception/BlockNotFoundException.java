package com.work.archive.core.exception;

/**
 * 链上（暂时）不存在该高度的区块。
 */
public class BlockNotFoundException extends ChainClientException {

    private final long height;

    public BlockNotFoundException(long height) {
        super("block not found at height=" + height);
        this.height = height;
    }

    public long getHeight() {
        return height;
    }
}
