package com.work.archive.indexer.domain;

import java.util.Collections;
import java.util.List;

/**
 * 一次缺口扫描的结果。三个列表均按高度升序。
 *
 * failedStorage 为永久失败的恢复高度，单独列出，不参与 storageGaps。
 */
public class GapReport {

    private final long canonicalHeight;
    private final List<Long> blockGaps;
    private final List<Long> storageGaps;
    private final List<Long> failedStorage;

    public GapReport(long canonicalHeight, List<Long> blockGaps, List<Long> storageGaps, List<Long> failedStorage) {
        this.canonicalHeight = canonicalHeight;
        this.blockGaps = blockGaps == null ? Collections.emptyList() : Collections.unmodifiableList(blockGaps);
        this.storageGaps = storageGaps == null ? Collections.emptyList() : Collections.unmodifiableList(storageGaps);
        this.failedStorage = failedStorage == null ? Collections.emptyList() : Collections.unmodifiableList(failedStorage);
    }

    public long getCanonicalHeight() {
        return canonicalHeight;
    }

    public List<Long> getBlockGaps() {
        return blockGaps;
    }

    public List<Long> getStorageGaps() {
        return storageGaps;
    }

    public List<Long> getFailedStorage() {
        return failedStorage;
    }

    public boolean isEmpty() {
        return blockGaps.isEmpty() && storageGaps.isEmpty();
    }

    @Override
    public String toString() {
        return "GapReport{canonical=" + canonicalHeight
                + ", blockGaps=" + blockGaps.size()
                + ", storageGaps=" + storageGaps.size()
                + ", failedStorage=" + failedStorage.size() + '}';
    }
}
