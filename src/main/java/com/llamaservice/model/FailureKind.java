package com.llamaservice.model;

/**
 * Reasons an orchestrator operation can fail.
 */
public enum FailureKind {
    /** Name unknown to both the record store and the catalog. */
    NOT_FOUND,
    ACQUISITION_FAILED,
    ACTIVATION_FAILED,
    /** Generation requested with nothing loaded. */
    NO_ACTIVE_MODEL,
    GENERATION_FAILED,
    PERSISTENCE_FAILED,
    INVALID_REQUEST
}
