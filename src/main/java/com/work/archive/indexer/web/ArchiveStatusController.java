package com.work.archive.indexer.web;

import com.work.archive.indexer.repository.entity.DecodeErrorEntity;
import com.work.archive.indexer.service.ArchiveStatusService;
import com.work.archive.indexer.web.dto.ArchiveStatusView;
import com.work.archive.indexer.web.dto.DecodeErrorView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 运维只读视图：索引进度、缺口与解码失败记录。
 */
@RestController
@RequestMapping("/api/v1/archive")
public class ArchiveStatusController {

    private final ArchiveStatusService statusService;

    public ArchiveStatusController(ArchiveStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/status")
    public ResponseEntity<ArchiveStatusView> status() {
        return ResponseEntity.ok(statusService.status());
    }

    @GetMapping("/decode-errors")
    public ResponseEntity<List<DecodeErrorView>> decodeErrors(@RequestParam(value = "limit", required = false) Integer limit) {
        int l = limit == null ? 100 : limit;
        List<DecodeErrorEntity> rows = statusService.decodeErrors(l);
        List<DecodeErrorView> out = new ArrayList<>(rows.size());
        for (DecodeErrorEntity r : rows) {
            DecodeErrorView v = new DecodeErrorView();
            v.setHeight(r.getBlockNum());
            v.setSpecVersion(r.getSpec());
            v.setError(r.getError());
            v.setAttempts(r.getAttempts());
            v.setUpdatedAt(r.getUpdatedAt());
            out.add(v);
        }
        return ResponseEntity.ok(out);
    }
}
