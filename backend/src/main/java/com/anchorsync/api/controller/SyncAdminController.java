package com.anchorsync.api.controller;

import com.anchorsync.admin.ModelAdminService;
import com.anchorsync.api.dto.AcceptedResponse;
import com.anchorsync.api.dto.RebuildRequest;
import com.anchorsync.sync.status.SyncStatusSnapshot;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /admin/sync/status, POST /admin/sync/rebuild.
 */
@RestController
@RequestMapping("/api/v1/admin/sync")
@RequiredArgsConstructor
public class SyncAdminController {

    private final ModelAdminService modelAdminService;

    @GetMapping("/status")
    public SyncStatusSnapshot status() {
        return modelAdminService.status();
    }

    @PostMapping("/rebuild")
    public ResponseEntity<AcceptedResponse> rebuild(@Valid @RequestBody RebuildRequest request) {
        String jobId = modelAdminService.rebuild(request.models(), request.fromBlock(), request.toBlock());
        return ResponseEntity.accepted().body(new AcceptedResponse("Rebuild queued", jobId));
    }
}
