package com.work.archive.core.exception;

/**
 * 归档组件内部的统一异常类型，便于调度层区分“可重试 / 不可重试”。
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（链 RPC 抖动、连接中断等）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
