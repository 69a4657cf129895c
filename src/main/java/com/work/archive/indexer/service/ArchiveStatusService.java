package com.work.archive.indexer.service;

import com.work.archive.core.version.VersionBreakpoint;
import com.work.archive.indexer.domain.GapReport;
import com.work.archive.indexer.domain.RecoveryTaskStatus;
import com.work.archive.indexer.repository.entity.DecodeErrorEntity;
import com.work.archive.indexer.repository.mapper.BlockMapper;
import com.work.archive.indexer.repository.mapper.DecodeErrorMapper;
import com.work.archive.indexer.service.recovery.StorageRecoveryQueue;
import com.work.archive.indexer.service.version.RuntimeVersionService;
import com.work.archive.indexer.web.dto.ArchiveStatusView;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 运维查询（只读聚合）。
 */
@Service
public class ArchiveStatusService {

    private final BlockMapper blockMapper;
    private final DecodeErrorMapper decodeErrorMapper;
    private final StorageRecoveryQueue recoveryQueue;
    private final RuntimeVersionService versions;
    private final IndexerScheduler scheduler;

    public ArchiveStatusService(BlockMapper blockMapper,
                                DecodeErrorMapper decodeErrorMapper,
                                StorageRecoveryQueue recoveryQueue,
                                RuntimeVersionService versions,
                                IndexerScheduler scheduler) {
        this.blockMapper = blockMapper;
        this.decodeErrorMapper = decodeErrorMapper;
        this.recoveryQueue = recoveryQueue;
        this.versions = versions;
        this.scheduler = scheduler;
    }

    public ArchiveStatusView status() {
        ArchiveStatusView v = new ArchiveStatusView();
        v.setMaxIndexedHeight(blockMapper.selectMaxHeight());
        v.setIndexedBlocks(blockMapper.countBlocks());
        v.setDecodeErrors(decodeErrorMapper.countAll());
        Map<RecoveryTaskStatus, Long> tasks = new EnumMap<>(RecoveryTaskStatus.class);
        for (RecoveryTaskStatus s : RecoveryTaskStatus.values()) {
            tasks.put(s, recoveryQueue.count(s));
        }
        v.setRecoveryTasks(tasks);
        versions.latest().map(VersionBreakpoint::getVersion).ifPresent(v::setLatestSpecVersion);
        v.setVersionBreakpoints(versions.breakpoints().size());
        GapReport last = scheduler.getLastReport();
        if (last != null) {
            v.setCanonicalHeight(last.getCanonicalHeight());
            v.setPendingBlockGaps(last.getBlockGaps().size());
            v.setPendingStorageGaps(last.getStorageGaps().size());
            v.setFailedStorage(last.getFailedStorage());
        }
        return v;
    }

    public List<DecodeErrorEntity> decodeErrors(int limit) {
        return decodeErrorMapper.listRecent(Math.max(1, Math.min(limit, 1000)));
    }
}
