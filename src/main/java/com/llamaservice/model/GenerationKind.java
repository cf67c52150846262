package com.llamaservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline kind a model is served with. The wire value matches the Hugging Face
 * pipeline tag.
 */
public enum GenerationKind {

    TEXT_GENERATION("text-generation"),
    TEXT_TO_TEXT_GENERATION("text2text-generation"),
    FEATURE_EXTRACTION("feature-extraction");

    private final String tag;

    GenerationKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static GenerationKind fromTag(String tag) {
        for (GenerationKind kind : values()) {
            if (kind.tag.equalsIgnoreCase(tag) || kind.name().equalsIgnoreCase(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown generation kind: " + tag);
    }
}
