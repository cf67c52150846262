package com.llamaservice.service;

import com.llamaservice.config.AppConfig;
import com.llamaservice.dto.ActiveModelStatus;
import com.llamaservice.dto.DeleteResult;
import com.llamaservice.dto.GenerationResult;
import com.llamaservice.dto.SetupResult;
import com.llamaservice.model.FailureKind;
import com.llamaservice.model.GenerationRequest;
import com.llamaservice.model.GenerationResponse;
import com.llamaservice.model.ModelRecord;
import com.llamaservice.model.ModelState;
import com.llamaservice.repository.ModelRecordStore;
import com.llamaservice.repository.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives a model from the catalog to a loaded, generation-ready state and
 * owns the single active model slot.
 *
 * Setup pipeline for one model:
 * 1. initializing (0%) - resolve the record through the store
 * 2. downloading (10-70%) - only when artifacts are missing
 * 3. loading (70%) - release the previous active model, then load
 * 4. ready (100%)
 *
 * Every state change is persisted before the next step starts. Setups of the
 * same model are serialized; the active slot is swapped under a service-wide
 * lock. Public methods never throw; failures come back as results carrying a
 * {@link FailureKind}.
 */
@Service
public class ModelLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ModelLifecycleService.class);

    public static final String STAGE_INITIALIZING = "initializing";
    public static final String STAGE_DOWNLOADING = "downloading";
    public static final String STAGE_LOADING = "loading";
    public static final String STAGE_READY = "ready";
    public static final String STAGE_FAILED = "failed";

    private static final double DOWNLOAD_START = 10.0;
    private static final double DOWNLOAD_SPAN = 60.0;
    private static final double LOAD_START = 70.0;

    private final ModelRecordStore store;
    private final ModelAcquirer acquirer;
    private final ModelActivator activator;
    private final HealthReporter healthReporter;
    private final ApplicationEventPublisher eventPublisher;
    private final AppConfig appConfig;

    private final ConcurrentHashMap<String, ReentrantLock> setupLocks = new ConcurrentHashMap<>();
    private final ReentrantLock activeLock = new ReentrantLock();
    private volatile ModelRecord active;

    public ModelLifecycleService(ModelRecordStore store,
            ModelAcquirer acquirer,
            ModelActivator activator,
            HealthReporter healthReporter,
            ApplicationEventPublisher eventPublisher,
            AppConfig appConfig) {
        this.store = store;
        this.acquirer = acquirer;
        this.activator = activator;
        this.healthReporter = healthReporter;
        this.eventPublisher = eventPublisher;
        this.appConfig = appConfig;
    }

    public SetupResult setup(String name) {
        return setup(name, null);
    }

    /**
     * Downloads (when needed) and loads the named model, then makes it the
     * active one.
     *
     * @param listener receives non-decreasing percentages with a stage label;
     *                 may be null
     */
    public SetupResult setup(String name, SetupProgressListener listener) {
        if (name == null || name.isBlank()) {
            return SetupResult.failure(name, null, FailureKind.INVALID_REQUEST, "Model name is required");
        }
        ProgressTracker progress = new ProgressTracker(name, listener);
        ReentrantLock lock = setupLocks.computeIfAbsent(name, k -> new ReentrantLock());
        lock.lock();
        try {
            SetupResult result = runSetup(name, progress);
            if (!result.success()) {
                progress.fail();
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private SetupResult runSetup(String name, ProgressTracker progress) {
        progress.emit(0.0, STAGE_INITIALIZING);
        log.info("Setting up model {}", name);

        ModelRecord record;
        try {
            Optional<ModelRecord> found = store.get(name);
            if (found.isEmpty()) {
                log.warn("Setup requested for unknown model {}", name);
                return SetupResult.failure(name, null, FailureKind.NOT_FOUND, "Model not found: " + name);
            }
            record = found.get();
        } catch (PersistenceException e) {
            return persistenceFailure(name, null, e);
        }

        FailureKind phase = FailureKind.ACTIVATION_FAILED;
        try {
            if (record.getState() == ModelState.LOADED && activateIfHeld(record)) {
                log.info("Model {} already loaded", name);
                return finish(record, progress);
            }

            if (record.getState() == ModelState.DOWNLOADING || record.getState() == ModelState.LOADING) {
                log.warn("Model {} was left in state {} by an earlier run, marking it interrupted", name,
                        record.getState().wireValue());
                record.markError("Setup interrupted while " + record.getState().wireValue());
                store.save(record);
            }

            if (needsDownload(record)) {
                phase = FailureKind.ACQUISITION_FAILED;
                Optional<SetupResult> failed = download(record, progress);
                if (failed.isPresent()) {
                    return failed.get();
                }
                phase = FailureKind.ACTIVATION_FAILED;
            } else if (record.getState() == ModelState.LOADED) {
                log.info("Model {} is recorded as loaded but has no in-memory handle, reloading", name);
            }

            Optional<SetupResult> failed = load(record, progress);
            if (failed.isPresent()) {
                return failed.get();
            }
            return finish(record, progress);
        } catch (PersistenceException e) {
            return persistenceFailure(name, record.getState(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error while setting up {}", name, e);
            healthReporter.recordError(name + ": " + e.getMessage());
            return SetupResult.failure(name, record.getState(), phase, "Unexpected error: " + e.getMessage());
        }
    }

    private boolean needsDownload(ModelRecord record) {
        if (record.getState() == ModelState.NOT_DOWNLOADED) {
            return true;
        }
        if (record.getState() != ModelState.ERROR) {
            return false;
        }
        try {
            return !acquirer.isDownloaded(record.getDescriptor());
        } catch (RuntimeException e) {
            log.warn("Cannot check artifacts of {}, downloading again: {}", record.getName(), e.getMessage());
            return true;
        }
    }

    private Optional<SetupResult> download(ModelRecord record, ProgressTracker progress) {
        String name = record.getName();
        progress.emit(DOWNLOAD_START, STAGE_DOWNLOADING);
        record.markDownloading();
        store.save(record);

        boolean downloaded;
        String reason = null;
        try {
            downloaded = acquirer.download(record.getDescriptor(),
                    percent -> progress.emit(DOWNLOAD_START + clamp(percent) * DOWNLOAD_SPAN / 100.0,
                            STAGE_DOWNLOADING));
        } catch (RuntimeException e) {
            log.error("Download of {} threw: {}", name, e.getMessage());
            downloaded = false;
            reason = e.getMessage();
        }

        if (!downloaded) {
            String message = "Failed to download model " + name + (reason != null ? ": " + reason : "");
            record.markError(message);
            store.save(record);
            healthReporter.recordError(message);
            log.warn("Setup of {} failed: {}", name, message);
            return Optional.of(SetupResult.failure(name, record.getState(), FailureKind.ACQUISITION_FAILED,
                    message));
        }

        record.markDownloaded();
        store.save(record);
        log.info("Model {} downloaded", name);
        return Optional.empty();
    }

    private Optional<SetupResult> load(ModelRecord record, ProgressTracker progress) {
        String name = record.getName();
        progress.emit(LOAD_START, STAGE_LOADING);

        activeLock.lock();
        try {
            ModelRecord previous = active;
            if (previous != null && !previous.getName().equals(name)) {
                if (!release(previous.getName())) {
                    String message = "Could not unload active model " + previous.getName();
                    healthReporter.recordError(message);
                    log.warn("Setup of {} failed: {}", name, message);
                    return Optional.of(SetupResult.failure(name, record.getState(), FailureKind.ACTIVATION_FAILED,
                            message));
                }
                active = null;
                log.info("Released previous model {}", previous.getName());
            }

            record.markLoading();
            store.save(record);

            boolean loaded;
            String reason = null;
            try {
                loaded = activator.load(record);
            } catch (RuntimeException e) {
                log.error("Loading {} threw: {}", name, e.getMessage());
                loaded = false;
                reason = e.getMessage();
            }

            if (!loaded) {
                String message = "Failed to load model " + name + (reason != null ? ": " + reason : "");
                record.markError(message);
                store.save(record);
                healthReporter.recordError(message);
                log.warn("Setup of {} failed: {}", name, message);
                return Optional.of(SetupResult.failure(name, record.getState(), FailureKind.ACTIVATION_FAILED,
                        message));
            }

            record.markLoaded();
            store.save(record);
            active = record;
            return Optional.empty();
        } finally {
            activeLock.unlock();
        }
    }

    private SetupResult finish(ModelRecord record, ProgressTracker progress) {
        progress.emit(100.0, STAGE_READY);
        healthReporter.clearError();
        log.info("Model {} is ready", record.getName());
        return SetupResult.success(record);
    }

    /**
     * Makes the record active if the activator still holds it. The check and
     * the assignment share the lock that a switch to another model takes, so a
     * concurrent switch cannot release the handle in between.
     */
    private boolean activateIfHeld(ModelRecord record) {
        activeLock.lock();
        try {
            if (!activator.isLoaded(record.getName())) {
                return false;
            }
            active = record;
            return true;
        } finally {
            activeLock.unlock();
        }
    }

    private boolean release(String name) {
        try {
            return activator.unload(name);
        } catch (RuntimeException e) {
            log.error("Unloading {} threw: {}", name, e.getMessage());
            return false;
        }
    }

    private SetupResult persistenceFailure(String name, ModelState state, PersistenceException e) {
        log.error("Model registry failure during setup of {}: {}", name, e.getMessage(), e);
        healthReporter.recordError("Registry failure: " + e.getMessage());
        return SetupResult.failure(name, state, FailureKind.PERSISTENCE_FAILED, e.getMessage());
    }

    /**
     * Validates the request, fills in configured defaults and runs it against
     * the active model.
     */
    public GenerationResult generate(GenerationRequest request) {
        Optional<String> invalid = validate(request);
        if (invalid.isPresent()) {
            return GenerationResult.failure(FailureKind.INVALID_REQUEST, invalid.get());
        }

        ModelRecord current = active;
        if (current == null || current.getState() != ModelState.LOADED) {
            return GenerationResult.failure(FailureKind.NO_ACTIVE_MODEL,
                    "No model is loaded. Run setup first.");
        }

        try {
            GenerationResponse response = activator.generate(withDefaults(request));
            log.debug("Generated {} tokens with {} in {}ms", response.tokensUsed(), response.model(),
                    response.processingTimeMs());
            return GenerationResult.success(response);
        } catch (RuntimeException e) {
            log.error("Generation with {} failed: {}", current.getName(), e.getMessage());
            healthReporter.recordError("Generation failed: " + e.getMessage());
            return GenerationResult.failure(FailureKind.GENERATION_FAILED, "Generation failed: " + e.getMessage());
        }
    }

    private Optional<String> validate(GenerationRequest request) {
        AppConfig.Generation limits = appConfig.getGeneration();
        if (request == null || request.getPrompt() == null || request.getPrompt().isBlank()) {
            return Optional.of("Prompt is required");
        }
        if (request.getPrompt().length() > limits.getMaxPromptLength()) {
            return Optional.of("Prompt is longer than " + limits.getMaxPromptLength() + " characters");
        }
        Integer maxTokens = request.getMaxTokens();
        if (maxTokens != null && (maxTokens < 1 || maxTokens > limits.getMaxTokensLimit())) {
            return Optional.of("maxTokens must be between 1 and " + limits.getMaxTokensLimit());
        }
        return Optional.empty();
    }

    private GenerationRequest withDefaults(GenerationRequest request) {
        AppConfig.Generation defaults = appConfig.getGeneration();
        GenerationRequest resolved = new GenerationRequest(request.getPrompt());
        resolved.setMaxTokens(request.getMaxTokens() != null ? request.getMaxTokens()
                : defaults.getDefaultMaxTokens());
        resolved.setTemperature(request.getTemperature() != null ? request.getTemperature()
                : defaults.getDefaultTemperature());
        resolved.setTopP(request.getTopP() != null ? request.getTopP() : defaults.getDefaultTopP());
        resolved.setTopK(request.getTopK() != null ? request.getTopK() : defaults.getDefaultTopK());
        resolved.setRepetitionPenalty(request.getRepetitionPenalty() != null ? request.getRepetitionPenalty()
                : defaults.getDefaultRepetitionPenalty());
        resolved.setDoSample(request.getDoSample() != null ? request.getDoSample()
                : defaults.isDefaultDoSample());
        return resolved;
    }

    public ActiveModelStatus status() {
        return ActiveModelStatus.of(active);
    }

    /**
     * Releases the active model. Succeeds when nothing is active.
     */
    public boolean unloadActive() {
        activeLock.lock();
        try {
            ModelRecord current = active;
            if (current == null) {
                return true;
            }
            if (!release(current.getName())) {
                log.warn("Active model {} could not be unloaded", current.getName());
                return false;
            }
            active = null;
            log.info("Model {} unloaded", current.getName());
            return true;
        } finally {
            activeLock.unlock();
        }
    }

    public List<ModelRecord> listModels() {
        return store.all();
    }

    /**
     * Removes a stored model and its artifacts, unloading it first when it is
     * the active model.
     */
    public DeleteResult deleteModel(String name) {
        if (name == null || name.isBlank()) {
            return DeleteResult.failure(name, FailureKind.INVALID_REQUEST, "Model name is required");
        }
        ReentrantLock lock = setupLocks.computeIfAbsent(name, k -> new ReentrantLock());
        lock.lock();
        try {
            activeLock.lock();
            try {
                ModelRecord current = active;
                if (current != null && current.getName().equals(name)) {
                    if (!release(name)) {
                        return DeleteResult.failure(name, FailureKind.ACTIVATION_FAILED,
                                "Could not unload model " + name + " before deleting it");
                    }
                    active = null;
                }
            } finally {
                activeLock.unlock();
            }

            if (!store.delete(name)) {
                return DeleteResult.failure(name, FailureKind.NOT_FOUND, "Model not found: " + name);
            }
            return DeleteResult.success(name);
        } catch (PersistenceException e) {
            log.error("Model registry failure while deleting {}: {}", name, e.getMessage(), e);
            return DeleteResult.failure(name, FailureKind.PERSISTENCE_FAILED, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private static double clamp(double percent) {
        return Math.max(0.0, Math.min(100.0, percent));
    }

    /**
     * Forwards progress to the caller's listener and to application event
     * listeners, never letting the reported percentage go backwards.
     */
    private final class ProgressTracker {

        private final String modelName;
        private final SetupProgressListener listener;
        private double last = 0.0;

        ProgressTracker(String modelName, SetupProgressListener listener) {
            this.modelName = modelName;
            this.listener = listener;
        }

        void emit(double percent, String stage) {
            last = Math.max(last, clamp(percent));
            if (listener != null) {
                try {
                    listener.onProgress(last, stage);
                } catch (RuntimeException e) {
                    log.warn("Progress listener for {} failed: {}", modelName, e.getMessage());
                }
            }
            publish(last, stage);
        }

        void fail() {
            publish(last, STAGE_FAILED);
        }

        private void publish(double percent, String stage) {
            try {
                eventPublisher.publishEvent(new ModelProgressEvent(ModelLifecycleService.this, modelName, percent,
                        stage));
            } catch (RuntimeException e) {
                log.warn("Progress event for {} could not be delivered: {}", modelName, e.getMessage());
            }
        }
    }
}
