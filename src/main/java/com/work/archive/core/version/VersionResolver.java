package com.work.archive.core.version;

import com.work.archive.core.exception.SchemaNotFoundException;
import com.work.archive.core.support.ValidationUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 高度 -> schema 版本解析器。
 *
 * 维护按高度严格递增的断点列表，查询时二分查找“高度 <= h 的最大断点”。
 * 读多写少：读锁并发，写锁只覆盖一次追加。
 */
public class VersionResolver {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<VersionBreakpoint> breakpoints = new ArrayList<>();

    /**
     * @throws SchemaNotFoundException 高度为负或早于第一个断点
     */
    public int resolve(long height) {
        if (height < 0) {
            throw new SchemaNotFoundException(height);
        }
        lock.readLock().lock();
        try {
            int lo = 0;
            int hi = breakpoints.size() - 1;
            int found = -1;
            while (lo <= hi) {
                int mid = (lo + hi) >>> 1;
                if (breakpoints.get(mid).getHeight() <= height) {
                    found = mid;
                    lo = mid + 1;
                } else {
                    hi = mid - 1;
                }
            }
            if (found < 0) {
                throw new SchemaNotFoundException(height);
            }
            return breakpoints.get(found).getVersion();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 追加断点。只允许在尾部追加：
     * - 与已有断点同高度：no-op
     * - 与尾部版本相同：no-op（版本没有变化）
     * - 高度低于尾部：拒绝
     *
     * @return true 表示断点被追加
     */
    public boolean insert(long height, int version) {
        ValidationUtils.requireNonNegative(height, "height");
        ValidationUtils.requireNonNegative(version, "version");
        lock.writeLock().lock();
        try {
            if (breakpoints.isEmpty()) {
                breakpoints.add(new VersionBreakpoint(height, version));
                return true;
            }
            VersionBreakpoint tail = breakpoints.get(breakpoints.size() - 1);
            if (height <= tail.getHeight() || tail.getVersion() == version) {
                return false;
            }
            breakpoints.add(new VersionBreakpoint(height, version));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 用持久化的断点重建（启动时）。输入不要求有序，重复高度保留第一个。
     */
    public void reload(List<VersionBreakpoint> loaded) {
        List<VersionBreakpoint> sorted = new ArrayList<>(loaded);
        sorted.sort((a, b) -> Long.compare(a.getHeight(), b.getHeight()));
        lock.writeLock().lock();
        try {
            breakpoints.clear();
            for (VersionBreakpoint bp : sorted) {
                if (!breakpoints.isEmpty() && breakpoints.get(breakpoints.size() - 1).getHeight() == bp.getHeight()) {
                    continue;
                }
                breakpoints.add(bp);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<VersionBreakpoint> latest() {
        lock.readLock().lock();
        try {
            return breakpoints.isEmpty() ? Optional.empty() : Optional.of(breakpoints.get(breakpoints.size() - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean knowsVersion(int version) {
        lock.readLock().lock();
        try {
            for (VersionBreakpoint bp : breakpoints) {
                if (bp.getVersion() == version) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<VersionBreakpoint> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(breakpoints));
        } finally {
            lock.readLock().unlock();
        }
    }
}
