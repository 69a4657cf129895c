package com.work.archive.core.exception;

/**
 * 高度早于任何已知 runtime 版本：没有 schema 就无法解码，属于致命错误，索引必须停止。
 */
public class SchemaNotFoundException extends ArchiveException {

    private final long height;

    public SchemaNotFoundException(long height) {
        super("no schema version known at height=" + height);
        this.height = height;
    }

    public long getHeight() {
        return height;
    }
}
