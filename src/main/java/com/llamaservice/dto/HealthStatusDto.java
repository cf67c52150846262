package com.llamaservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Detailed health report with heap and model figures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthStatusDto {

    public enum Status {
        HEALTHY, DEGRADED, UNHEALTHY
    }

    private Status status;
    private Instant timestamp;
    private long uptimeMs;
    private MemoryInfo memory;
    private ModelsInfo models;
    private String lastError;

    public static class MemoryInfo {
        private long used;
        private long total;
        private double percentage;

        public MemoryInfo() {
        }

        public MemoryInfo(long used, long total, double percentage) {
            this.used = used;
            this.total = total;
            this.percentage = percentage;
        }

        public long getUsed() {
            return used;
        }

        public void setUsed(long used) {
            this.used = used;
        }

        public long getTotal() {
            return total;
        }

        public void setTotal(long total) {
            this.total = total;
        }

        public double getPercentage() {
            return percentage;
        }

        public void setPercentage(double percentage) {
            this.percentage = percentage;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ModelsInfo {
        private int loaded;
        private int total;
        private String current;

        public ModelsInfo() {
        }

        public ModelsInfo(int loaded, int total, String current) {
            this.loaded = loaded;
            this.total = total;
            this.current = current;
        }

        public int getLoaded() {
            return loaded;
        }

        public void setLoaded(int loaded) {
            this.loaded = loaded;
        }

        public int getTotal() {
            return total;
        }

        public void setTotal(int total) {
            this.total = total;
        }

        public String getCurrent() {
            return current;
        }

        public void setCurrent(String current) {
            this.current = current;
        }
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public long getUptimeMs() {
        return uptimeMs;
    }

    public void setUptimeMs(long uptimeMs) {
        this.uptimeMs = uptimeMs;
    }

    public MemoryInfo getMemory() {
        return memory;
    }

    public void setMemory(MemoryInfo memory) {
        this.memory = memory;
    }

    public ModelsInfo getModels() {
        return models;
    }

    public void setModels(ModelsInfo models) {
        this.models = models;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }
}
