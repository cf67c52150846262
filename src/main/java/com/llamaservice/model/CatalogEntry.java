package com.llamaservice.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the model catalog.
 *
 * @param descriptor model metadata
 * @param tags       free-form tags, kept in declaration order
 * @param popularity display ordering score, higher first
 * @param verified   whether the entry has been checked to work end to end
 */
public record CatalogEntry(ModelDescriptor descriptor, Set<String> tags, int popularity, boolean verified) {

    public CatalogEntry {
        Objects.requireNonNull(descriptor, "descriptor");
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public String name() {
        return descriptor.name();
    }
}
