package com.work.archive.core.exception;

/**
 * 链客户端调用失败（网络、RPC 返回错误等），可重试。
 */
public class ChainClientException extends ArchiveRetryableException {

    public ChainClientException(String message) {
        super(message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
