package com.llamaservice.controller;

import com.llamaservice.dto.GenerationResult;
import com.llamaservice.model.GenerationRequest;
import com.llamaservice.service.ModelLifecycleService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * POST /api/v1/generate: generate text with the active model.
 */
@RestController
@RequestMapping("/api/v1")
public class GenerationController {

    private final ModelLifecycleService lifecycleService;

    public GenerationController(ModelLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @PostMapping("/generate")
    public ResponseEntity<Map<String, Object>> generate(@Valid @RequestBody GenerationRequest request) {
        GenerationResult result = lifecycleService.generate(request);
        if (!result.success()) {
            return ApiResponses.failure(result.failure(), result.error());
        }
        return ApiResponses.ok(result.response());
    }
}
