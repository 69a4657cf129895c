package com.work.archive.core.exception;

/**
 * 可重试异常：瞬时 I/O 错误（链 RPC、数据库连接）使用该类型，由调用方按退避策略重试。
 */
public class ArchiveRetryableException extends ArchiveException {

    public ArchiveRetryableException(String message) {
        super(message);
    }

    public ArchiveRetryableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
