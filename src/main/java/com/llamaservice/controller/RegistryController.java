package com.llamaservice.controller;

import com.llamaservice.model.CatalogEntry;
import com.llamaservice.service.ModelCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the model catalog.
 *
 * GET /api/v1/registry/models: every entry, most popular first
 * GET /api/v1/registry/search?q=&tag=: text search, else tag filter, else verified entries
 */
@RestController
@RequestMapping("/api/v1/registry")
public class RegistryController {

    private final ModelCatalog catalog;

    public RegistryController(ModelCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/models")
    public ResponseEntity<Map<String, Object>> models() {
        return ApiResponses.ok(catalog.all());
    }

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(
            @RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "tag", required = false) String tag) {
        List<CatalogEntry> results;
        if (query != null && !query.isBlank()) {
            results = catalog.search(query.trim());
        } else if (tag != null && !tag.isBlank()) {
            results = catalog.byTag(tag.trim());
        } else {
            results = catalog.verifiedOnly();
        }
        return ApiResponses.ok(results);
    }
}
