package com.work.archive.indexer.service.recovery;

import com.work.archive.indexer.repository.entity.RecoveryTaskEntity;
import com.work.archive.indexer.repository.mapper.RecoveryTaskMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 用 Mockito answer 在内存中模拟 recovery_tasks 表的状态流转。
 */
final class InMemoryRecoveryTasks {

    private final Map<Long, RecoveryTaskEntity> byHeight = new TreeMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final RecoveryTaskMapper mapper = mock(RecoveryTaskMapper.class);

    @SuppressWarnings("unchecked")
    InMemoryRecoveryTasks() {
        when(mapper.enqueue(anyList(), any(), any())).thenAnswer(inv -> {
            List<Long> heights = inv.getArgument(0);
            String payload = inv.getArgument(1);
            Instant now = inv.getArgument(2);
            int inserted = 0;
            for (Long h : heights) {
                if (!byHeight.containsKey(h)) {
                    RecoveryTaskEntity t = new RecoveryTaskEntity();
                    t.setId(ids.incrementAndGet());
                    t.setTargetHeight(h);
                    t.setStatus("PENDING");
                    t.setAttemptCount(0);
                    t.setPayload(payload);
                    t.setNextRunAt(now);
                    t.setCreatedAt(now);
                    t.setUpdatedAt(now);
                    byHeight.put(h, t);
                    inserted++;
                }
            }
            return inserted;
        });
        when(mapper.claim(anyInt(), any())).thenAnswer(inv -> {
            int limit = inv.getArgument(0);
            Instant now = inv.getArgument(1);
            List<RecoveryTaskEntity> out = new ArrayList<>();
            for (RecoveryTaskEntity t : byHeight.values()) {
                if (out.size() >= limit) {
                    break;
                }
                if ("PENDING".equals(t.getStatus()) && (t.getNextRunAt() == null || !t.getNextRunAt().isAfter(now))) {
                    t.setStatus("RUNNING");
                    t.setAttemptCount(t.getAttemptCount() + 1);
                    t.setLastRunAt(now);
                    out.add(copy(t));
                }
            }
            return out;
        });
        when(mapper.markDone(anyLong(), any())).thenAnswer(inv -> {
            RecoveryTaskEntity t = byId(inv.getArgument(0));
            if (t == null || !"RUNNING".equals(t.getStatus())) {
                return 0;
            }
            t.setStatus("DONE");
            t.setLastError(null);
            t.setNextRunAt(null);
            return 1;
        });
        when(mapper.markFailed(anyLong(), any(), any(), any())).thenAnswer(inv -> {
            RecoveryTaskEntity t = byId(inv.getArgument(0));
            if (t == null || !"RUNNING".equals(t.getStatus())) {
                return 0;
            }
            t.setStatus("FAILED");
            t.setLastError(inv.getArgument(1));
            t.setNextRunAt(inv.getArgument(2));
            return 1;
        });
        when(mapper.requeueDueFailures(any())).thenAnswer(inv -> {
            Instant now = inv.getArgument(0);
            int n = 0;
            for (RecoveryTaskEntity t : byHeight.values()) {
                if ("FAILED".equals(t.getStatus()) && t.getNextRunAt() != null && !t.getNextRunAt().isAfter(now)) {
                    t.setStatus("PENDING");
                    n++;
                }
            }
            return n;
        });
        when(mapper.resetOrphans(any())).thenAnswer(inv -> {
            Instant now = inv.getArgument(0);
            int n = 0;
            for (RecoveryTaskEntity t : byHeight.values()) {
                if ("RUNNING".equals(t.getStatus())) {
                    t.setStatus("PENDING");
                    t.setNextRunAt(now);
                    n++;
                }
            }
            return n;
        });
        when(mapper.retry(anyLong(), any())).thenAnswer(inv -> {
            RecoveryTaskEntity t = byId(inv.getArgument(0));
            if (t == null || !"FAILED".equals(t.getStatus())) {
                return 0;
            }
            t.setStatus("PENDING");
            t.setAttemptCount(0);
            t.setNextRunAt(inv.getArgument(1));
            return 1;
        });
        when(mapper.selectPermanentlyFailedHeights(anyInt())).thenAnswer(inv -> {
            List<Long> out = new ArrayList<>();
            for (RecoveryTaskEntity t : byHeight.values()) {
                if ("FAILED".equals(t.getStatus()) && t.getNextRunAt() == null) {
                    out.add(t.getTargetHeight());
                }
            }
            return out;
        });
        when(mapper.countByStatus(anyString())).thenAnswer(inv -> byHeight.values().stream()
                .filter(t -> t.getStatus().equals(inv.getArgument(0)))
                .count());
    }

    RecoveryTaskMapper mapper() {
        return mapper;
    }

    RecoveryTaskEntity at(long height) {
        return byHeight.get(height);
    }

    int size() {
        return byHeight.size();
    }

    private RecoveryTaskEntity byId(Long id) {
        for (RecoveryTaskEntity t : byHeight.values()) {
            if (t.getId().equals(id)) {
                return t;
            }
        }
        return null;
    }

    private static RecoveryTaskEntity copy(RecoveryTaskEntity t) {
        RecoveryTaskEntity c = new RecoveryTaskEntity();
        c.setId(t.getId());
        c.setTargetHeight(t.getTargetHeight());
        c.setStatus(t.getStatus());
        c.setAttemptCount(t.getAttemptCount());
        c.setPayload(t.getPayload());
        c.setLastRunAt(t.getLastRunAt());
        c.setNextRunAt(t.getNextRunAt());
        return c;
    }
}
