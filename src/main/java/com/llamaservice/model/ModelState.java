package com.llamaservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a {@link ModelRecord}.
 */
public enum ModelState {
    NOT_DOWNLOADED, DOWNLOADING, DOWNLOADED, LOADING, LOADED, ERROR;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ModelState fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
