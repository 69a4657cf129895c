package com.work.archive.core.version;

/**
 * 从 height 起（含）生效的 schema 版本。
 */
public final class VersionBreakpoint {

    private final long height;
    private final int version;

    public VersionBreakpoint(long height, int version) {
        this.height = height;
        this.version = version;
    }

    public long getHeight() {
        return height;
    }

    public int getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "(" + height + "," + version + ")";
    }
}
