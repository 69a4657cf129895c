package com.work.archive.indexer.service;

/**
 * 不可恢复错误的出口（例如某高度找不到任何 schema 版本）。实现负责停止摄取。
 */
public interface FatalErrorHandler {

    void onFatal(String reason, Throwable cause);
}
