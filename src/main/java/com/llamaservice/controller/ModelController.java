package com.llamaservice.controller;

import com.llamaservice.dto.DeleteResult;
import com.llamaservice.dto.ModelRecordDto;
import com.llamaservice.dto.SetupRequest;
import com.llamaservice.dto.SetupResult;
import com.llamaservice.service.ModelLifecycleService;
import com.llamaservice.service.ModelProgressEvent;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * REST controller for the model lifecycle and SSE progress streaming.
 *
 * Endpoints:
 * GET /api/v1/models/status: active model
 * GET /api/v1/models: stored model records
 * POST /api/v1/models/setup: download and load, waits for completion
 * POST /api/v1/models/setup/async: same, on the setup executor
 * GET /api/v1/models/progress: SSE stream of setup progress
 * POST /api/v1/models/unload: release the active model
 * DELETE /api/v1/models/{name}: delete a model and its artifacts
 */
@RestController
@RequestMapping("/api/v1/models")
public class ModelController {

    private static final Logger log = LoggerFactory.getLogger(ModelController.class);

    private final ModelLifecycleService lifecycleService;
    private final Executor setupExecutor;

    // Active SSE clients subscribed to progress events
    private final List<SseEmitter> sseClients = new CopyOnWriteArrayList<>();

    public ModelController(ModelLifecycleService lifecycleService,
            @Qualifier("setupExecutor") Executor setupExecutor) {
        this.lifecycleService = lifecycleService;
        this.setupExecutor = setupExecutor;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        return ApiResponses.ok(lifecycleService.status());
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listModels() {
        List<ModelRecordDto> models = lifecycleService.listModels().stream().map(ModelRecordDto::from).toList();
        return ApiResponses.ok(models);
    }

    @PostMapping("/setup")
    public ResponseEntity<Map<String, Object>> setup(@Valid @RequestBody SetupRequest request) {
        SetupResult result = lifecycleService.setup(request.modelName());
        if (!result.success()) {
            return ApiResponses.failure(result.failure(), result.error());
        }
        return ApiResponses.ok(result);
    }

    /**
     * Queues the setup and returns immediately. Subscribe to
     * /api/v1/models/progress for updates.
     */
    @PostMapping("/setup/async")
    public ResponseEntity<Map<String, Object>> setupAsync(@Valid @RequestBody SetupRequest request) {
        String name = request.modelName();
        try {
            setupExecutor.execute(() -> {
                SetupResult result = lifecycleService.setup(name);
                if (!result.success()) {
                    log.warn("Background setup of {} failed: {}", name, result.error());
                }
            });
        } catch (TaskRejectedException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Setup queue is full, try again later");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ApiResponses.status(HttpStatus.ACCEPTED, Map.of(
                "model", name,
                "status", "STARTED",
                "message", "Model setup started. Subscribe to /api/v1/models/progress for updates."));
    }

    /**
     * SSE endpoint for streaming setup progress.
     */
    @GetMapping(value = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamProgress() {
        SseEmitter emitter = new SseEmitter(600_000L); // 10-minute timeout
        sseClients.add(emitter);

        emitter.onCompletion(() -> sseClients.remove(emitter));
        emitter.onTimeout(() -> sseClients.remove(emitter));
        emitter.onError(e -> sseClients.remove(emitter));

        // Send the active model immediately on connect
        try {
            emitter.send(SseEmitter.event().name("status").data(lifecycleService.status()));
        } catch (IOException e) {
            sseClients.remove(emitter);
        }
        return emitter;
    }

    @PostMapping("/unload")
    public ResponseEntity<Map<String, Object>> unload() {
        if (!lifecycleService.unloadActive()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Failed to unload the active model");
            return ResponseEntity.internalServerError().body(body);
        }
        return ApiResponses.ok(lifecycleService.status());
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String name) {
        DeleteResult result = lifecycleService.deleteModel(name);
        if (!result.success()) {
            return ApiResponses.failure(result.failure(), result.error());
        }
        return ApiResponses.ok(result);
    }

    /**
     * Broadcasts setup progress to all connected SSE clients.
     */
    @EventListener
    public void onSetupProgress(ModelProgressEvent event) {
        if (sseClients.isEmpty())
            return;

        Map<String, Object> data = Map.of(
                "model", event.getModelName(),
                "percent", event.getPercent(),
                "stage", event.getStage());

        List<SseEmitter> dead = new ArrayList<>();
        for (SseEmitter emitter : sseClients) {
            try {
                emitter.send(SseEmitter.event().name("progress").data(data));
                if (event.isTerminal()) {
                    emitter.complete();
                    dead.add(emitter);
                }
            } catch (IOException e) {
                dead.add(emitter);
            }
        }
        sseClients.removeAll(dead);
    }
}
