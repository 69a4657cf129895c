package com.work.archive.indexer.web;

import com.work.archive.indexer.repository.entity.RecoveryTaskEntity;
import com.work.archive.indexer.service.recovery.StorageRecoveryQueue;
import com.work.archive.indexer.web.dto.RecoveryTaskView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * storage 恢复任务的运维入口：查询与重试永久失败的任务，按高度请求全量快照。
 */
@RestController
@RequestMapping("/api/v1/archive/recovery-tasks")
public class RecoveryTaskController {

    private final StorageRecoveryQueue recoveryQueue;

    public RecoveryTaskController(StorageRecoveryQueue recoveryQueue) {
        this.recoveryQueue = recoveryQueue;
    }

    @GetMapping("/failed")
    public ResponseEntity<List<RecoveryTaskView>> failed(@RequestParam(value = "limit", required = false) Integer limit) {
        int l = limit == null ? 100 : Math.min(limit, 1000);
        List<RecoveryTaskEntity> rows = recoveryQueue.listFailed(l);
        List<RecoveryTaskView> out = new ArrayList<>(rows.size());
        for (RecoveryTaskEntity r : rows) {
            out.add(toView(r));
        }
        return ResponseEntity.ok(out);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<String> retry(@PathVariable("id") long id) {
        if (!recoveryQueue.retry(id)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("task " + id + " not found or not FAILED");
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/full-storage/{height}")
    public ResponseEntity<String> requestFullStorage(@PathVariable("height") long height) {
        if (height < 0) {
            return ResponseEntity.badRequest().body("height must be >= 0");
        }
        if (!recoveryQueue.requestFullStorage(height)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("height " + height + " already has a recovery task");
        }
        return ResponseEntity.accepted().build();
    }

    private RecoveryTaskView toView(RecoveryTaskEntity e) {
        RecoveryTaskView v = new RecoveryTaskView();
        v.setId(e.getId());
        v.setTargetHeight(e.getTargetHeight());
        v.setStatus(e.getStatus());
        v.setAttemptCount(e.getAttemptCount());
        v.setLastError(e.getLastError());
        v.setLastRunAt(e.getLastRunAt());
        v.setUpdatedAt(e.getUpdatedAt());
        return v;
    }
}
