package com.llamaservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    /** Directory holding one sub-directory of artifacts per model */
    private String modelDir = "./models";

    /** Registry document path; defaults to registry.json inside modelDir */
    private String registryFile;

    /** Hugging Face file resolve base URL */
    private String hfBaseUrl = "https://huggingface.co";

    /** Fallback Hugging Face token when none is stored through the API */
    private String hfToken;

    private final Download download = new Download();
    private final Generation generation = new Generation();
    private final Health health = new Health();
    private final Setup setup = new Setup();

    /** Extra catalog entries registered at startup */
    private List<CustomModel> customModels = new ArrayList<>();

    // ───────────── getters / setters ─────────────

    public String getModelDir() {
        return modelDir;
    }

    public void setModelDir(String modelDir) {
        this.modelDir = modelDir;
    }

    public String getRegistryFile() {
        return registryFile;
    }

    public void setRegistryFile(String registryFile) {
        this.registryFile = registryFile;
    }

    /** Returns the registry document path, resolved against modelDir when unset */
    public Path getRegistryPath() {
        if (registryFile != null && !registryFile.isBlank()) {
            return Paths.get(registryFile);
        }
        return Paths.get(modelDir, "registry.json");
    }

    public String getHfBaseUrl() {
        return hfBaseUrl;
    }

    public void setHfBaseUrl(String hfBaseUrl) {
        this.hfBaseUrl = hfBaseUrl;
    }

    public String getHfToken() {
        return hfToken;
    }

    public void setHfToken(String hfToken) {
        this.hfToken = hfToken;
    }

    public Download getDownload() {
        return download;
    }

    public Generation getGeneration() {
        return generation;
    }

    public Health getHealth() {
        return health;
    }

    public Setup getSetup() {
        return setup;
    }

    public List<CustomModel> getCustomModels() {
        return customModels;
    }

    public void setCustomModels(List<CustomModel> customModels) {
        this.customModels = customModels;
    }

    public static class Download {

        private int maxRetries = 3;
        private long initialBackoffMs = 2000;
        private int connectTimeoutMs = 30_000;
        private int readTimeoutMs = 120_000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    public static class Generation {

        private int defaultMaxTokens = 100;
        private double defaultTemperature = 0.7;
        private double defaultTopP = 0.9;
        private int defaultTopK = 50;
        private double defaultRepetitionPenalty = 1.1;
        private boolean defaultDoSample = true;
        private int maxPromptLength = 2048;
        private int maxTokensLimit = 1024;

        public int getDefaultMaxTokens() {
            return defaultMaxTokens;
        }

        public void setDefaultMaxTokens(int defaultMaxTokens) {
            this.defaultMaxTokens = defaultMaxTokens;
        }

        public double getDefaultTemperature() {
            return defaultTemperature;
        }

        public void setDefaultTemperature(double defaultTemperature) {
            this.defaultTemperature = defaultTemperature;
        }

        public double getDefaultTopP() {
            return defaultTopP;
        }

        public void setDefaultTopP(double defaultTopP) {
            this.defaultTopP = defaultTopP;
        }

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public double getDefaultRepetitionPenalty() {
            return defaultRepetitionPenalty;
        }

        public void setDefaultRepetitionPenalty(double defaultRepetitionPenalty) {
            this.defaultRepetitionPenalty = defaultRepetitionPenalty;
        }

        public boolean isDefaultDoSample() {
            return defaultDoSample;
        }

        public void setDefaultDoSample(boolean defaultDoSample) {
            this.defaultDoSample = defaultDoSample;
        }

        public int getMaxPromptLength() {
            return maxPromptLength;
        }

        public void setMaxPromptLength(int maxPromptLength) {
            this.maxPromptLength = maxPromptLength;
        }

        public int getMaxTokensLimit() {
            return maxTokensLimit;
        }

        public void setMaxTokensLimit(int maxTokensLimit) {
            this.maxTokensLimit = maxTokensLimit;
        }
    }

    public static class Health {

        /** Heap used/committed ratio above which the service reports degraded */
        private double heapDegradedThreshold = 0.90;

        public double getHeapDegradedThreshold() {
            return heapDegradedThreshold;
        }

        public void setHeapDegradedThreshold(double heapDegradedThreshold) {
            this.heapDegradedThreshold = heapDegradedThreshold;
        }
    }

    public static class Setup {

        /** Background setups waiting behind the running one before new requests are refused */
        private int queueCapacity = 10;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    /**
     * Catalog entry declared in configuration, e.g.
     * app.custom-models[0].name=tiny-gpt2
     */
    public static class CustomModel {

        private String name;
        private String acquisitionId;
        private String description = "";
        private String version = "1.0.0";
        private String kind = "text-generation";
        private Double sizeGb;
        private List<String> tags = new ArrayList<>();
        private int popularity;
        private boolean verified;
        private List<String> requiredArtifacts = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getAcquisitionId() {
            return acquisitionId;
        }

        public void setAcquisitionId(String acquisitionId) {
            this.acquisitionId = acquisitionId;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public Double getSizeGb() {
            return sizeGb;
        }

        public void setSizeGb(Double sizeGb) {
            this.sizeGb = sizeGb;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public int getPopularity() {
            return popularity;
        }

        public void setPopularity(int popularity) {
            this.popularity = popularity;
        }

        public boolean isVerified() {
            return verified;
        }

        public void setVerified(boolean verified) {
            this.verified = verified;
        }

        public List<String> getRequiredArtifacts() {
            return requiredArtifacts;
        }

        public void setRequiredArtifacts(List<String> requiredArtifacts) {
            this.requiredArtifacts = requiredArtifacts;
        }
    }
}
