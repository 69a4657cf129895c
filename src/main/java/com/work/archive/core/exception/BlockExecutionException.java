package com.work.archive.core.exception;

/**
 * 重放区块以恢复 storage 变更时失败。
 */
public class BlockExecutionException extends ArchiveException {

    public BlockExecutionException(String message) {
        super(message);
    }

    public BlockExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
