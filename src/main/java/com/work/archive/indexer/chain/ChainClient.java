package com.work.archive.indexer.chain;

import com.work.archive.core.exception.BlockExecutionException;
import com.work.archive.core.exception.BlockNotFoundException;
import com.work.archive.core.exception.ChainClientException;

import java.util.List;

/**
 * 链交互最小端口：取块、重放、查询高度与 runtime 元数据。
 *
 * 实现方需保证线程安全（解码池与恢复 worker 会并发调用）。
 */
public interface ChainClient {

    /**
     * 当前 canonical 高度（实现可选用 finalized head，以规避分叉回滚）。
     */
    long canonicalHeight() throws ChainClientException;

    /**
     * 按高度获取原始区块。
     *
     * @throws BlockNotFoundException 该高度尚不存在
     */
    RawBlock fetchBlock(long height) throws ChainClientException;

    /**
     * 在链的执行环境中重放区块，返回其 storage 变更集（value 为 null 表示删除）。
     */
    List<StorageChange> executeBlock(long height) throws BlockExecutionException;

    /**
     * 该高度生效的 runtime spec 版本。
     */
    int runtimeVersionAt(long height) throws ChainClientException;

    /**
     * 该高度生效的 metadata blob（codec 的 schema 输入）。
     */
    byte[] fetchMetadata(long height) throws ChainClientException;

    /**
     * 可选：该高度的全量 storage 快照（is_full=true 索引）。
     *
     * @throws BlockExecutionException 链实现不支持该能力或快照失败
     */
    default List<StorageChange> fullStorage(long height) throws BlockExecutionException {
        throw new BlockExecutionException("full storage snapshot not supported by chain client, height=" + height);
    }
}
