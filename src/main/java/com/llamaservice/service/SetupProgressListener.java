package com.llamaservice.service;

/**
 * Receives setup progress. Percentages reported during one setup call never
 * decrease.
 */
@FunctionalInterface
public interface SetupProgressListener {

    void onProgress(double percent, String stage);
}
