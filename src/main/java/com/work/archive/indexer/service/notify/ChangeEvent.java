package com.work.archive.indexer.service.notify;

/**
 * 已提交数据的变更通知：表名 + 动作 + 主键（blocks/storage 为高度，metadata 为版本）。
 */
public class ChangeEvent {

    public static final String INSERT = "INSERT";

    private final String table;
    private final String action;
    private final long key;

    public ChangeEvent(String table, String action, long key) {
        this.table = table;
        this.action = action;
        this.key = key;
    }

    public static ChangeEvent inserted(String table, long key) {
        return new ChangeEvent(table, INSERT, key);
    }

    public String getTable() {
        return table;
    }

    public String getAction() {
        return action;
    }

    public long getKey() {
        return key;
    }

    @Override
    public String toString() {
        return table + ":" + action + ":" + key;
    }
}
