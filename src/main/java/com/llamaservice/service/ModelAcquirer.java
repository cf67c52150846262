package com.llamaservice.service;

import com.llamaservice.model.ModelDescriptor;

import java.util.function.DoubleConsumer;

/**
 * Fetches model artifacts into the descriptor's local path.
 */
public interface ModelAcquirer {

    /**
     * Downloads the required artifacts.
     *
     * @param onProgress receives the completed fraction in [0, 100]; may be null
     * @return whether at least the minimum artifact set is now present
     */
    boolean download(ModelDescriptor descriptor, DoubleConsumer onProgress);

    /**
     * True when every required artifact is present locally. No side effects.
     */
    boolean isDownloaded(ModelDescriptor descriptor);

    /**
     * Share of required artifacts present locally, in [0, 100]. No side effects.
     */
    double progress(ModelDescriptor descriptor);
}
