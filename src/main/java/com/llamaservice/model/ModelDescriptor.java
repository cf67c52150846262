package com.llamaservice.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable metadata identifying a model and where its artifacts are fetched
 * from and stored.
 *
 * All required fields are checked in the canonical constructor, so a
 * descriptor read back from the registry document goes through the same
 * validation as one built with {@link #builder()}.
 *
 * @param name              unique model name, also the registry key
 * @param acquisitionId     Hugging Face repository id
 * @param version           descriptor version
 * @param description       human readable description, may be empty
 * @param localPath         directory holding the downloaded artifacts
 * @param kind              pipeline kind
 * @param sizeGb            declared size, null when unknown
 * @param requiredArtifacts artifact paths relative to the repository root
 */
public record ModelDescriptor(
        String name,
        String acquisitionId,
        String version,
        String description,
        String localPath,
        GenerationKind kind,
        Double sizeGb,
        List<String> requiredArtifacts) {

    public ModelDescriptor {
        List<String> missing = new ArrayList<>();
        if (isBlank(name))
            missing.add("name");
        if (isBlank(acquisitionId))
            missing.add("acquisitionId");
        if (isBlank(version))
            missing.add("version");
        if (isBlank(localPath))
            missing.add("localPath");
        if (kind == null)
            missing.add("kind");
        if (requiredArtifacts == null || requiredArtifacts.isEmpty()
                || requiredArtifacts.stream().anyMatch(ModelDescriptor::isBlank)) {
            missing.add("requiredArtifacts");
        }
        if (!missing.isEmpty()) {
            throw new InvalidDescriptorException(missing);
        }
        description = description == null ? "" : description;
        requiredArtifacts = List.copyOf(requiredArtifacts);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this descriptor's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .acquisitionId(acquisitionId)
                .version(version)
                .description(description)
                .localPath(localPath)
                .kind(kind)
                .sizeGb(sizeGb)
                .requiredArtifacts(requiredArtifacts);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static final class Builder {
        private String name;
        private String acquisitionId;
        private String version;
        private String description;
        private String localPath;
        private GenerationKind kind;
        private Double sizeGb;
        private List<String> requiredArtifacts;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder acquisitionId(String acquisitionId) {
            this.acquisitionId = acquisitionId;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder localPath(String localPath) {
            this.localPath = localPath;
            return this;
        }

        public Builder kind(GenerationKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder sizeGb(Double sizeGb) {
            this.sizeGb = sizeGb;
            return this;
        }

        public Builder requiredArtifacts(List<String> requiredArtifacts) {
            this.requiredArtifacts = requiredArtifacts;
            return this;
        }

        /**
         * @throws InvalidDescriptorException naming every missing required field
         */
        public ModelDescriptor build() {
            return new ModelDescriptor(name, acquisitionId, version, description, localPath, kind, sizeGb,
                    requiredArtifacts);
        }
    }
}
