package com.llamaservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llamaservice.model.FailureKind;
import com.llamaservice.model.GenerationResponse;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationResult(boolean success, GenerationResponse response, String error, FailureKind failure) {

    public static GenerationResult success(GenerationResponse response) {
        return new GenerationResult(true, response, null, null);
    }

    public static GenerationResult failure(FailureKind failure, String error) {
        return new GenerationResult(false, null, error, failure);
    }
}
