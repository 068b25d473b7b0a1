package com.anchorsync.api.controller;

import com.anchorsync.admin.ModelAdminService;
import com.anchorsync.api.dto.AcceptedResponse;
import com.anchorsync.api.dto.IndexedModelResponse;
import com.anchorsync.api.dto.ModelsRequest;
import com.anchorsync.api.dto.QueryableResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * GET/POST/DELETE /admin/models, GET /admin/models/{model}/queryable.
 */
@RestController
@RequestMapping("/api/v1/admin/models")
@RequiredArgsConstructor
public class ModelAdminController {

    private final ModelAdminService modelAdminService;

    @GetMapping
    public List<IndexedModelResponse> listModels() {
        return modelAdminService.listModels().stream()
                .map(s -> new IndexedModelResponse(s.model(), s.syncComplete(), s.outstandingHistoricalSyncs()))
                .toList();
    }

    @PostMapping
    public ResponseEntity<AcceptedResponse> startIndexing(@Valid @RequestBody ModelsRequest request) {
        modelAdminService.startIndexingModels(request.models());
        return ResponseEntity.accepted().body(AcceptedResponse.of("Indexing started"));
    }

    @DeleteMapping
    public ResponseEntity<AcceptedResponse> stopIndexing(@Valid @RequestBody ModelsRequest request) {
        modelAdminService.stopIndexingModels(request.models());
        return ResponseEntity.accepted().body(AcceptedResponse.of("Indexing stopped"));
    }

    @GetMapping("/{model}/queryable")
    public QueryableResponse queryable(@PathVariable String model) {
        modelAdminService.assertQueryable(model);
        return new QueryableResponse(model, true);
    }
}
