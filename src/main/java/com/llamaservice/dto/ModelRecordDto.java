package com.llamaservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llamaservice.model.GenerationKind;
import com.llamaservice.model.ModelRecord;
import com.llamaservice.model.ModelState;

import java.time.Instant;

/**
 * Flat JSON view of a stored model record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelRecordDto(
        String name,
        String acquisitionId,
        String version,
        String description,
        GenerationKind kind,
        Double sizeGb,
        ModelState state,
        boolean ready,
        String errorMessage,
        Instant activatedAt,
        String localPath) {

    public static ModelRecordDto from(ModelRecord record) {
        return new ModelRecordDto(
                record.getName(),
                record.getDescriptor().acquisitionId(),
                record.getDescriptor().version(),
                record.getDescriptor().description(),
                record.getDescriptor().kind(),
                record.getDescriptor().sizeGb(),
                record.getState(),
                record.isReady(),
                record.getErrorMessage(),
                record.getActivatedAt(),
                record.getDescriptor().localPath());
    }
}
