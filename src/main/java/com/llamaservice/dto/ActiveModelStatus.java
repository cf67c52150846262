package com.llamaservice.dto;

import com.llamaservice.model.ModelRecord;
import com.llamaservice.model.ModelState;

/**
 * Snapshot of the active slot. {@code model} and {@code state} are null when
 * nothing is active.
 */
public record ActiveModelStatus(String model, ModelState state, boolean ready) {

    public static ActiveModelStatus of(ModelRecord active) {
        if (active == null) {
            return new ActiveModelStatus(null, null, false);
        }
        return new ActiveModelStatus(active.getName(), active.getState(), active.isReady());
    }
}
