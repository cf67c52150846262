package com.llamaservice.model;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable lifecycle wrapper around a {@link ModelDescriptor}.
 *
 * Transitions:
 * NOT_DOWNLOADED → DOWNLOADING → DOWNLOADED → LOADING → LOADED
 * DOWNLOADING / DOWNLOADED / LOADING → ERROR
 * ERROR → DOWNLOADING or LOADING (retry), LOADED → LOADING (reload)
 *
 * The error message is present only in ERROR; the activation timestamp is set
 * on entering LOADED and cleared when the record moves back to an earlier step.
 * Not thread-safe: callers serialize access per model.
 */
public class ModelRecord {

    private static final Set<ModelState> DOWNLOADING_FROM = EnumSet.of(ModelState.NOT_DOWNLOADED, ModelState.ERROR);
    private static final Set<ModelState> DOWNLOADED_FROM = EnumSet.of(ModelState.DOWNLOADING);
    private static final Set<ModelState> LOADING_FROM = EnumSet.of(ModelState.DOWNLOADED, ModelState.ERROR,
            ModelState.LOADED);
    private static final Set<ModelState> LOADED_FROM = EnumSet.of(ModelState.LOADING);
    private static final Set<ModelState> ERROR_FROM = EnumSet.complementOf(EnumSet.of(ModelState.LOADED));

    private final ModelDescriptor descriptor;
    private final Clock clock;

    private ModelState state;
    private String errorMessage;
    private Instant activatedAt;

    public ModelRecord(ModelDescriptor descriptor) {
        this(descriptor, Clock.systemUTC());
    }

    public ModelRecord(ModelDescriptor descriptor, Clock clock) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.state = ModelState.NOT_DOWNLOADED;
    }

    /**
     * Rebuilds a record from its persisted form without replaying transitions.
     */
    public static ModelRecord restore(ModelDescriptor descriptor, ModelState state, String errorMessage,
            Instant activatedAt) {
        ModelRecord record = new ModelRecord(descriptor);
        record.state = state == null ? ModelState.NOT_DOWNLOADED : state;
        if (record.state == ModelState.ERROR) {
            record.errorMessage = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        }
        record.activatedAt = record.state == ModelState.LOADED || record.state == ModelState.ERROR
                ? activatedAt
                : null;
        return record;
    }

    public void markDownloading() {
        transition(DOWNLOADING_FROM, ModelState.DOWNLOADING);
        activatedAt = null;
    }

    public void markDownloaded() {
        transition(DOWNLOADED_FROM, ModelState.DOWNLOADED);
        activatedAt = null;
    }

    public void markLoading() {
        transition(LOADING_FROM, ModelState.LOADING);
        activatedAt = null;
    }

    public void markLoaded() {
        transition(LOADED_FROM, ModelState.LOADED);
        activatedAt = clock.instant();
    }

    public void markError(String message) {
        if (!ERROR_FROM.contains(state)) {
            throw new IllegalStateTransitionException(getName(), state, ModelState.ERROR);
        }
        state = ModelState.ERROR;
        errorMessage = message == null || message.isBlank() ? "Unknown error" : message;
    }

    private void transition(Set<ModelState> allowedFrom, ModelState target) {
        if (!allowedFrom.contains(state)) {
            throw new IllegalStateTransitionException(getName(), state, target);
        }
        state = target;
        errorMessage = null;
    }

    public boolean isReady() {
        return state == ModelState.LOADED;
    }

    public String getName() {
        return descriptor.name();
    }

    public ModelDescriptor getDescriptor() {
        return descriptor;
    }

    public ModelState getState() {
        return state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getActivatedAt() {
        return activatedAt;
    }

    @Override
    public String toString() {
        return "ModelRecord{" + getName() + ", " + state.wireValue()
                + (errorMessage != null ? ", error=" + errorMessage : "") + "}";
    }
}
