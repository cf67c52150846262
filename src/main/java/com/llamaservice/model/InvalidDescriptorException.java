package com.llamaservice.model;

import java.util.List;

/**
 * Thrown when a {@link ModelDescriptor} is built with required fields missing.
 */
public class InvalidDescriptorException extends IllegalArgumentException {

    private final List<String> missingFields;

    public InvalidDescriptorException(List<String> missingFields) {
        super("Missing required descriptor fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
