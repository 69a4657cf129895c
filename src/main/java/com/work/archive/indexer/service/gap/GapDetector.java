package com.work.archive.indexer.service.gap;

import com.work.archive.indexer.config.ArchiveProperties;
import com.work.archive.indexer.domain.GapReport;
import com.work.archive.indexer.repository.mapper.BlockMapper;
import com.work.archive.indexer.service.recovery.StorageRecoveryQueue;
import com.work.archive.indexer.support.metrics.ArchiveMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 只读的缺口扫描：
 *
 * - blockGaps：[下界, canonical] 内没有 blocks 行的高度，升序，最多 limit 个
 * - storageGaps：已有块但缺 storage 且无 DONE / 永久失败任务的高度
 * - failedStorage：永久失败的恢复高度，单独列出
 *
 * 下界 = max(最低未索引高度, start-height, canonical - backfill-depth)。
 * 已索引高度按 scan-window 分窗读取，差集在内存中计算，单次查询的结果集有界。
 */
@Service
public class GapDetector {

    private static final Logger log = LoggerFactory.getLogger(GapDetector.class);

    private final ArchiveProperties props;
    private final BlockMapper blockMapper;
    private final StorageRecoveryQueue recoveryQueue;
    private final ArchiveMetrics metrics;

    public GapDetector(ArchiveProperties props,
                       BlockMapper blockMapper,
                       StorageRecoveryQueue recoveryQueue,
                       ArchiveMetrics metrics) {
        this.props = props;
        this.blockMapper = blockMapper;
        this.recoveryQueue = recoveryQueue;
        this.metrics = metrics;
    }

    public GapReport detect(long canonicalHeight, int limit) {
        if (limit <= 0 || canonicalHeight < 0) {
            return new GapReport(canonicalHeight, null, null, null);
        }
        List<Long> blockGaps = blockGaps(canonicalHeight, limit);
        List<Long> storageGaps = Collections.emptyList();
        List<Long> failed = Collections.emptyList();
        if (props.isStorageIndexing()) {
            storageGaps = blockMapper.selectHeightsMissingStorage(props.getStartHeight(), limit);
            failed = recoveryQueue.failedHeights(limit);
        }
        GapReport report = new GapReport(canonicalHeight, blockGaps, storageGaps, failed);
        metrics.gapScan(report.getBlockGaps().size(), report.getStorageGaps().size());
        if (!report.isEmpty()) {
            log.debug("gap scan done. {}", report);
        }
        return report;
    }

    List<Long> blockGaps(long canonicalHeight, int limit) {
        long floor = props.getStartHeight();
        if (props.getBackfillDepth() > 0) {
            floor = Math.max(floor, canonicalHeight - props.getBackfillDepth());
        }
        Long lowest = blockMapper.selectLowestUnindexed(floor);
        long from = lowest == null ? floor : Math.max(floor, lowest);
        if (from > canonicalHeight) {
            return Collections.emptyList();
        }
        int window = Math.max(1, props.getScanWindow());
        List<Long> gaps = new ArrayList<>(Math.min(limit, 1024));
        for (long lo = from; lo <= canonicalHeight && gaps.size() < limit; lo += window) {
            long hi = Math.min(canonicalHeight, lo + window - 1);
            List<Long> indexed = blockMapper.selectHeightsInRange(lo, hi);
            Set<Long> present = indexed == null ? Collections.emptySet() : new HashSet<>(indexed);
            for (long h = lo; h <= hi && gaps.size() < limit; h++) {
                if (!present.contains(h)) {
                    gaps.add(h);
                }
            }
        }
        return gaps;
    }
}
