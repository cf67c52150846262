package com.llamaservice.repository;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.llamaservice.config.AppConfig;
import com.llamaservice.model.ModelDescriptor;
import com.llamaservice.model.ModelRecord;
import com.llamaservice.model.ModelState;
import com.llamaservice.service.ModelCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Stores every model record in one JSON document:
 *
 * <pre>
 * {
 *   "gpt2-small": {
 *     "descriptor": { "name": "gpt2-small", "acquisitionId": "Xenova/gpt2", ... },
 *     "state": "loaded",
 *     "activatedAt": "2024-05-01T10:15:30Z",
 *     "ready": true
 *   }
 * }
 * </pre>
 *
 * Each mutation reads the whole document, changes one key and writes the whole
 * document back through a temp file and an atomic rename. A single lock
 * serializes all document access in this process; separate processes sharing
 * the file are not coordinated.
 */
@Repository
public class JsonFileModelRecordStore implements ModelRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileModelRecordStore.class);
    private static final TypeReference<LinkedHashMap<String, JsonNode>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final Path registryPath;
    private final ModelCatalog catalog;
    private final ObjectMapper mapper;
    private final ReentrantLock documentLock = new ReentrantLock();

    public JsonFileModelRecordStore(AppConfig appConfig, ModelCatalog catalog) {
        this.registryPath = appConfig.getRegistryPath();
        this.catalog = catalog;
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    @Override
    public Optional<ModelRecord> get(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        documentLock.lock();
        try {
            Map<String, JsonNode> document = readDocument();
            JsonNode node = document.get(name);
            if (node != null) {
                return Optional.of(toRecord(name, node));
            }

            Optional<ModelRecord> fresh = catalog.lookup(name).map(entry -> new ModelRecord(entry.descriptor()));
            if (fresh.isEmpty()) {
                log.warn("Model {} is neither persisted nor in the catalog", name);
                return Optional.empty();
            }
            log.info("Creating record for {} from catalog ({})", name, fresh.get().getDescriptor().acquisitionId());
            document.put(name, toNode(fresh.get()));
            writeDocument(document);
            return fresh;
        } finally {
            documentLock.unlock();
        }
    }

    @Override
    public void save(ModelRecord record) {
        documentLock.lock();
        try {
            Map<String, JsonNode> document = readDocument();
            document.put(record.getName(), toNode(record));
            writeDocument(document);
            log.debug("Saved {} as {}", record.getName(), record.getState().wireValue());
        } finally {
            documentLock.unlock();
        }
    }

    @Override
    public List<ModelRecord> all() {
        documentLock.lock();
        try {
            List<ModelRecord> records = new ArrayList<>();
            for (Map.Entry<String, JsonNode> entry : readDocument().entrySet()) {
                try {
                    records.add(toRecord(entry.getKey(), entry.getValue()));
                } catch (PersistenceException e) {
                    log.warn("Skipping unreadable registry entry {}: {}", entry.getKey(), e.getMessage());
                }
            }
            return records;
        } finally {
            documentLock.unlock();
        }
    }

    @Override
    public boolean delete(String name) {
        Path artifactDir;
        documentLock.lock();
        try {
            Map<String, JsonNode> document = readDocument();
            JsonNode removed = document.remove(name);
            if (removed == null) {
                log.info("Nothing to delete for {}", name);
                return false;
            }
            writeDocument(document);
            String localPath = removed.path("descriptor").path("localPath").asText(null);
            artifactDir = localPath != null ? Paths.get(localPath) : registryPath.resolveSibling(name);
        } finally {
            documentLock.unlock();
        }

        try {
            deleteRecursively(artifactDir);
        } catch (IOException e) {
            log.warn("Record {} deleted but artifacts at {} could not be removed: {}", name, artifactDir,
                    e.getMessage());
        }
        log.info("Model {} deleted", name);
        return true;
    }

    public Path getRegistryPath() {
        return registryPath;
    }

    private ModelRecord toRecord(String name, JsonNode node) {
        try {
            StoredModel stored = mapper.treeToValue(node, StoredModel.class);
            if (stored.descriptor() == null) {
                throw new IOException("entry has no descriptor");
            }
            return ModelRecord.restore(stored.descriptor(), stored.state(), stored.errorMessage(),
                    stored.activatedAt());
        } catch (IOException | IllegalArgumentException e) {
            throw new PersistenceException("Registry entry for " + name + " is invalid: " + e.getMessage(), e);
        }
    }

    private JsonNode toNode(ModelRecord record) {
        StoredModel stored = new StoredModel(record.getDescriptor(), record.getState(), record.getErrorMessage(),
                record.getActivatedAt(), record.isReady());
        return mapper.valueToTree(stored);
    }

    private Map<String, JsonNode> readDocument() {
        if (!Files.exists(registryPath)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, JsonNode> document = mapper.readValue(registryPath.toFile(), DOCUMENT_TYPE);
            return document != null ? document : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new PersistenceException("Cannot read model registry " + registryPath, e);
        }
    }

    private void writeDocument(Map<String, JsonNode> document) {
        Path tempFile = registryPath.resolveSibling(registryPath.getFileName() + ".tmp");
        try {
            Path parent = registryPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(tempFile.toFile(), document);
            try {
                Files.move(tempFile, registryPath, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, registryPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new PersistenceException("Cannot write model registry " + registryPath, e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path p : ordered) {
                Files.deleteIfExists(p);
            }
        }
    }

    /**
     * Persisted form of one record.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StoredModel(ModelDescriptor descriptor, ModelState state, String errorMessage, Instant activatedAt,
            boolean ready) {
    }
}
