package com.work.archive.indexer.web.dto;

import com.work.archive.indexer.domain.RecoveryTaskStatus;

import java.util.List;
import java.util.Map;

public class ArchiveStatusView {
    private Long canonicalHeight;
    private Long maxIndexedHeight;
    private long indexedBlocks;
    private Integer pendingBlockGaps;
    private Integer pendingStorageGaps;
    private List<Long> failedStorage;
    private long decodeErrors;
    private Map<RecoveryTaskStatus, Long> recoveryTasks;
    private Integer latestSpecVersion;
    private int versionBreakpoints;

    public Long getCanonicalHeight() {
        return canonicalHeight;
    }

    public void setCanonicalHeight(Long canonicalHeight) {
        this.canonicalHeight = canonicalHeight;
    }

    public Long getMaxIndexedHeight() {
        return maxIndexedHeight;
    }

    public void setMaxIndexedHeight(Long maxIndexedHeight) {
        this.maxIndexedHeight = maxIndexedHeight;
    }

    public long getIndexedBlocks() {
        return indexedBlocks;
    }

    public void setIndexedBlocks(long indexedBlocks) {
        this.indexedBlocks = indexedBlocks;
    }

    public Integer getPendingBlockGaps() {
        return pendingBlockGaps;
    }

    public void setPendingBlockGaps(Integer pendingBlockGaps) {
        this.pendingBlockGaps = pendingBlockGaps;
    }

    public Integer getPendingStorageGaps() {
        return pendingStorageGaps;
    }

    public void setPendingStorageGaps(Integer pendingStorageGaps) {
        this.pendingStorageGaps = pendingStorageGaps;
    }

    public List<Long> getFailedStorage() {
        return failedStorage;
    }

    public void setFailedStorage(List<Long> failedStorage) {
        this.failedStorage = failedStorage;
    }

    public long getDecodeErrors() {
        return decodeErrors;
    }

    public void setDecodeErrors(long decodeErrors) {
        this.decodeErrors = decodeErrors;
    }

    public Map<RecoveryTaskStatus, Long> getRecoveryTasks() {
        return recoveryTasks;
    }

    public void setRecoveryTasks(Map<RecoveryTaskStatus, Long> recoveryTasks) {
        this.recoveryTasks = recoveryTasks;
    }

    public Integer getLatestSpecVersion() {
        return latestSpecVersion;
    }

    public void setLatestSpecVersion(Integer latestSpecVersion) {
        this.latestSpecVersion = latestSpecVersion;
    }

    public int getVersionBreakpoints() {
        return versionBreakpoints;
    }

    public void setVersionBreakpoints(int versionBreakpoints) {
        this.versionBreakpoints = versionBreakpoints;
    }
}
