package com.work.archive.indexer.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；需要接入具体 metrics 实现时提供自定义 Bean 即可。
 */
public interface ArchiveMetrics {

    default void gapScan(int blockGaps, int storageGaps) {
    }

    default void blockDecoded(String result) {
    }

    default void fetchRetry() {
    }

    default void batchCommitted(int blocks, long rows) {
    }

    default void writerQueueDepth(String name, int depth) {
    }

    default void recoveryTask(String result) {
    }

    default void notifyPublished(String result) {
    }
}
