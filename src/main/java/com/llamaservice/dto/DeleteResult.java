package com.llamaservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llamaservice.model.FailureKind;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeleteResult(boolean success, String model, String error, FailureKind failure) {

    public static DeleteResult success(String model) {
        return new DeleteResult(true, model, null, null);
    }

    public static DeleteResult failure(String model, FailureKind failure, String error) {
        return new DeleteResult(false, model, error, failure);
    }
}
