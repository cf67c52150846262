package com.llamaservice.service;

import com.llamaservice.config.AppConfig;
import com.llamaservice.dto.HealthStatusDto;
import com.llamaservice.dto.HealthStatusDto.MemoryInfo;
import com.llamaservice.dto.HealthStatusDto.ModelsInfo;
import com.llamaservice.dto.HealthStatusDto.Status;
import com.llamaservice.model.ModelRecord;
import com.llamaservice.repository.ModelRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Summarizes service health from heap usage, stored model records and the
 * last recorded error.
 *
 * UNHEALTHY while an error is recorded; DEGRADED when heap use crosses the
 * configured threshold or no model is both LOADED and held in memory;
 * HEALTHY otherwise.
 */
@Service
public class HealthReporter {

    private static final Logger log = LoggerFactory.getLogger(HealthReporter.class);

    private final ModelRecordStore store;
    private final ModelActivator activator;
    private final MemoryMXBean memoryBean;
    private final double heapDegradedThreshold;
    private final Clock clock;
    private final Instant startedAt;

    private volatile String lastError;

    @Autowired
    public HealthReporter(ModelRecordStore store, ModelActivator activator, AppConfig appConfig) {
        this(store, activator, ManagementFactory.getMemoryMXBean(),
                appConfig.getHealth().getHeapDegradedThreshold(), Clock.systemUTC());
    }

    HealthReporter(ModelRecordStore store, ModelActivator activator, MemoryMXBean memoryBean,
            double heapDegradedThreshold, Clock clock) {
        this.store = store;
        this.activator = activator;
        this.memoryBean = memoryBean;
        this.heapDegradedThreshold = heapDegradedThreshold;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public HealthStatusDto report() {
        HealthStatusDto dto = new HealthStatusDto();
        Instant now = clock.instant();
        dto.setTimestamp(now);
        dto.setUptimeMs(Math.max(0, now.toEpochMilli() - startedAt.toEpochMilli()));

        List<ModelRecord> records;
        try {
            records = store.all();
        } catch (RuntimeException e) {
            log.error("Health check could not read model records: {}", e.getMessage());
            recordError("Cannot read model records: " + e.getMessage());
            dto.setStatus(Status.UNHEALTHY);
            dto.setMemory(new MemoryInfo(0, 0, 0.0));
            dto.setModels(new ModelsInfo(0, 0, null));
            dto.setLastError(lastError);
            return dto;
        }

        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long used = heap.getUsed();
        long total = heap.getCommitted();
        double ratio = total > 0 ? (double) used / total : 0.0;
        dto.setMemory(new MemoryInfo(used, total, Math.round(ratio * 10000.0) / 100.0));

        // A record stays LOADED after its handle is released, so only count models the activator still holds
        Set<String> held = activator.loadedNames();
        int ready = (int) records.stream()
                .filter(r -> r.isReady() && held.contains(r.getName()))
                .count();
        String current = held.stream().findFirst().orElse(null);
        dto.setModels(new ModelsInfo(ready, records.size(), current));

        String error = lastError;
        dto.setLastError(error);
        if (error != null) {
            dto.setStatus(Status.UNHEALTHY);
        } else if (ratio > heapDegradedThreshold || ready == 0) {
            dto.setStatus(Status.DEGRADED);
        } else {
            dto.setStatus(Status.HEALTHY);
        }
        return dto;
    }

    public void recordError(String message) {
        lastError = message == null || message.isBlank() ? "Unknown error" : message;
    }

    public void clearError() {
        lastError = null;
    }

    public String getLastError() {
        return lastError;
    }
}
