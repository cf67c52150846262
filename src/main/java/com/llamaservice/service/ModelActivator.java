package com.llamaservice.service;

import com.llamaservice.model.GenerationRequest;
import com.llamaservice.model.GenerationResponse;
import com.llamaservice.model.ModelRecord;

import java.util.Set;

/**
 * Turns downloaded artifacts into an in-memory handle and runs generation
 * against it.
 */
public interface ModelActivator {

    /**
     * @return false when the model could not be loaded
     */
    boolean load(ModelRecord record);

    /**
     * Releases the handle for the model. Unloading a model that is not loaded
     * succeeds.
     */
    boolean unload(String name);

    /**
     * @throws GenerationException when nothing is loaded or the model fails
     */
    GenerationResponse generate(GenerationRequest request);

    boolean isLoaded(String name);

    Set<String> loadedNames();
}
