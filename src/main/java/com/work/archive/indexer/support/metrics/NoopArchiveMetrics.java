package com.work.archive.indexer.support.metrics;

/**
 * 默认 no-op 实现：不引入任何 metrics 依赖时工程仍可运行。
 */
public class NoopArchiveMetrics implements ArchiveMetrics {
}
