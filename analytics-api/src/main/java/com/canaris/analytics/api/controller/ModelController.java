package com.canaris.analytics.api.controller;

import com.canaris.analytics.api.services.ModelCatalogService;
import com.canaris.analytics.model.ModelInfo;
import com.canaris.analytics.store.ModelVersion;
import com.canaris.analytics.store.StorageStats;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelController {
    private final ModelCatalogService catalogService;

    @GetMapping
    public List<ModelVersion> listModels() {
        return catalogService.listModels();
    }

    @GetMapping("/stats")
    public StorageStats stats() {
        return catalogService.stats();
    }

    @GetMapping("/{name}")
    public ModelVersion latest(
            @Parameter(description = "Logical model name", required = true, example = "default")
            @PathVariable(name = "name") String name) {
        return catalogService.latest(name);
    }

    @GetMapping("/{name}/info")
    public ModelInfo info(
            @Parameter(description = "Logical model name", required = true, example = "default")
            @PathVariable(name = "name") String name) {
        return catalogService.info(name);
    }

    @GetMapping("/{name}/versions")
    public List<ModelVersion> versions(
            @Parameter(description = "Logical model name", required = true, example = "default")
            @PathVariable(name = "name") String name) {
        return catalogService.versions(name);
    }

    @DeleteMapping("/{name}/versions/{version}")
    public ResponseEntity<Void> deleteVersion(
            @Parameter(description = "Logical model name", required = true, example = "default")
            @PathVariable(name = "name") String name,
            @Parameter(description = "Version id, e.g. 20240105_103000_000", required = true)
            @PathVariable(name = "version") String version) {
        catalogService.deleteVersion(name, version);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{name}/reload")
    public ModelVersion reload(
            @Parameter(description = "Logical model name", required = true, example = "default")
            @PathVariable(name = "name") String name) {
        return catalogService.reload(name);
    }
}
