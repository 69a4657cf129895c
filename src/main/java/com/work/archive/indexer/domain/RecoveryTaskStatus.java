package com.work.archive.indexer.domain;

/**
 * recovery_tasks.status 状态机：
 *
 * PENDING -> RUNNING -> DONE
 *                    -> FAILED(next_run_at 非空，可重试) -> PENDING
 *                    -> FAILED(next_run_at 为空，永久失败，仅人工 retry)
 *
 * 进程崩溃遗留的 RUNNING 在启动时回到 PENDING。
 */
public enum RecoveryTaskStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}
