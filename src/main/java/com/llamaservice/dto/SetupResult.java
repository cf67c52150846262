package com.llamaservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llamaservice.model.FailureKind;
import com.llamaservice.model.ModelRecord;
import com.llamaservice.model.ModelState;

/**
 * Outcome of a setup call. On failure {@code error} and {@code failure} are
 * set; {@code state} is the record's state when the attempt stopped, if known.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetupResult(boolean success, String model, ModelState state, String error, FailureKind failure) {

    public static SetupResult success(ModelRecord record) {
        return new SetupResult(true, record.getName(), record.getState(), null, null);
    }

    public static SetupResult failure(String model, ModelState state, FailureKind failure, String error) {
        return new SetupResult(false, model, state, error, failure);
    }
}
