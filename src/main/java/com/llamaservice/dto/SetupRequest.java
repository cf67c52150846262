package com.llamaservice.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of the setup endpoints: { "modelName": "gpt2-small" }
 */
public record SetupRequest(@NotBlank String modelName) {
}
