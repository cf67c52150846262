package com.llamaservice.service;

import com.llamaservice.model.GenerationRequest;
import com.llamaservice.model.GenerationResponse;
import com.llamaservice.model.ModelRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory activator that echoes the prompt back. Safe to share between
 * setup threads.
 */
class FakeActivator implements ModelActivator {

    final List<String> loads = new CopyOnWriteArrayList<>();
    final List<String> unloads = new CopyOnWriteArrayList<>();
    final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();
    final Set<String> loaded = Collections.synchronizedSet(new LinkedHashSet<>());
    volatile boolean loadSucceeds = true;
    volatile boolean unloadSucceeds = true;
    volatile RuntimeException generationFailure;
    /** Runs after isLoaded has read its answer and before it returns it. */
    volatile Consumer<String> afterLoadedCheck;

    @Override
    public boolean load(ModelRecord record) {
        loads.add(record.getName());
        if (loadSucceeds) {
            loaded.add(record.getName());
        }
        return loadSucceeds;
    }

    @Override
    public boolean unload(String name) {
        unloads.add(name);
        if (unloadSucceeds) {
            loaded.remove(name);
        }
        return unloadSucceeds;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        requests.add(request);
        if (generationFailure != null) {
            throw generationFailure;
        }
        String model = loadedNames().stream().findFirst()
                .orElseThrow(() -> new GenerationException("No model loaded"));
        return new GenerationResponse("echo: " + request.getPrompt(), 3, 5, model, Instant.now());
    }

    @Override
    public boolean isLoaded(String name) {
        boolean held = loaded.contains(name);
        Consumer<String> hook = afterLoadedCheck;
        if (hook != null) {
            hook.accept(name);
        }
        return held;
    }

    @Override
    public Set<String> loadedNames() {
        synchronized (loaded) {
            return new LinkedHashSet<>(loaded);
        }
    }
}
