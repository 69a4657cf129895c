package com.work.archive.indexer.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * recovery_tasks.payload 的任务描述（JSON，按 kind 区分变体）。
 *
 * 忽略未知字段：升级后新增的字段不影响旧进程消费队列中已存在的任务。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RecoveryJob.ExecuteBlock.class, name = "execute_block"),
        @JsonSubTypes.Type(value = RecoveryJob.FullStorage.class, name = "full_storage")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class RecoveryJob {

    public static final int CURRENT_VERSION = 1;

    private int v = CURRENT_VERSION;

    public static RecoveryJob executeBlock() {
        return new ExecuteBlock();
    }

    public static RecoveryJob fullStorage() {
        return new FullStorage();
    }

    public int getV() {
        return v;
    }

    public void setV(int v) {
        this.v = v;
    }

    /**
     * 恢复结果是否为全量快照（写入 storage.is_full）。
     */
    @JsonIgnore
    public abstract boolean isFull();

    /**
     * 重放区块，取其 storage 变更集。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExecuteBlock extends RecoveryJob {

        @Override
        public boolean isFull() {
            return false;
        }
    }

    /**
     * 取该高度的全量 storage 快照。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FullStorage extends RecoveryJob {

        @Override
        public boolean isFull() {
            return true;
        }
    }
}
