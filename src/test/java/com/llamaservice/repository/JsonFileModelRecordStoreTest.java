package com.llamaservice.repository;

import com.llamaservice.config.AppConfig;
import com.llamaservice.model.ModelRecord;
import com.llamaservice.model.ModelState;
import com.llamaservice.service.ModelCatalog;
import com.llamaservice.testsupport.TestModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileModelRecordStoreTest {

    @TempDir
    Path tempDir;

    private JsonFileModelRecordStore store;

    @BeforeEach
    void setUp() {
        AppConfig config = new AppConfig();
        config.setModelDir(tempDir.toString());
        store = new JsonFileModelRecordStore(config, new ModelCatalog(config));
    }

    @Test
    @DisplayName("get of a catalog name on an empty document returns a fresh record and persists it")
    void getMaterializesCatalogEntries() throws Exception {
        ModelRecord record = store.get("llama-7b-chat").orElseThrow();

        assertThat(record.getState()).isEqualTo(ModelState.NOT_DOWNLOADED);
        assertThat(record.getDescriptor().acquisitionId()).isEqualTo("Xenova/DialoGPT-large");
        assertThat(Files.readString(store.getRegistryPath())).contains("\"llama-7b-chat\"");
        assertThat(store.all()).extracting(ModelRecord::getName).containsExactly("llama-7b-chat");
    }

    @Test
    void getOfUnknownNameIsEmptyAndWritesNothing() {
        assertThat(store.get("unknown-model")).isEmpty();
        assertThat(store.get(" ")).isEmpty();
        assertThat(Files.exists(store.getRegistryPath())).isFalse();
    }

    @Test
    @DisplayName("Every state survives a save and reload")
    void roundTripsEveryState() {
        Instant activatedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        for (ModelState state : EnumSet.allOf(ModelState.class)) {
            String name = "model-" + state.wireValue();
            String error = state == ModelState.ERROR ? "disk full" : null;
            store.save(ModelRecord.restore(TestModels.descriptor(name, tempDir), state, error, activatedAt));
        }

        for (ModelState state : EnumSet.allOf(ModelState.class)) {
            ModelRecord loaded = store.get("model-" + state.wireValue()).orElseThrow();
            assertThat(loaded.getState()).isEqualTo(state);
            assertThat(loaded.getDescriptor()).isEqualTo(TestModels.descriptor(loaded.getName(), tempDir));
            if (state == ModelState.ERROR) {
                assertThat(loaded.getErrorMessage()).isEqualTo("disk full");
            }
            if (state == ModelState.LOADED) {
                assertThat(loaded.getActivatedAt()).isEqualTo(activatedAt);
                assertThat(loaded.isReady()).isTrue();
            }
        }
    }

    @Test
    void saveUpsertsByName() {
        ModelRecord record = new ModelRecord(TestModels.descriptor("a", tempDir));
        store.save(record);
        record.markDownloading();
        store.save(record);

        assertThat(store.all()).hasSize(1);
        assertThat(store.get("a").orElseThrow().getState()).isEqualTo(ModelState.DOWNLOADING);
    }

    @Test
    void allPreservesDocumentOrder() {
        store.save(new ModelRecord(TestModels.descriptor("b", tempDir)));
        store.save(new ModelRecord(TestModels.descriptor("a", tempDir)));
        store.save(new ModelRecord(TestModels.descriptor("c", tempDir)));

        assertThat(store.all()).extracting(ModelRecord::getName).containsExactly("b", "a", "c");
    }

    @Test
    void deleteRemovesRecordAndArtifacts() throws Exception {
        ModelRecord record = new ModelRecord(TestModels.descriptor("a", tempDir));
        store.save(record);
        Path artifactDir = Path.of(record.getDescriptor().localPath());
        Files.createDirectories(artifactDir.resolve("onnx"));
        Files.writeString(artifactDir.resolve("onnx/decoder_model.onnx"), "weights");

        assertThat(store.delete("a")).isTrue();

        assertThat(store.all()).isEmpty();
        assertThat(Files.exists(artifactDir)).isFalse();
        assertThat(store.delete("a")).isFalse();
    }

    @Test
    void unreadableEntryIsSkippedByAllButFailsGet() throws Exception {
        store.save(new ModelRecord(TestModels.descriptor("good", tempDir)));
        String document = Files.readString(store.getRegistryPath());
        Files.writeString(store.getRegistryPath(),
                document.replaceFirst("\\{", "{ \"bad\": { \"state\": \"loaded\" },"));

        assertThat(store.all()).extracting(ModelRecord::getName).containsExactly("good");
        assertThatThrownBy(() -> store.get("bad")).isInstanceOf(PersistenceException.class);
    }

    @Test
    void corruptDocumentRaisesPersistenceException() throws Exception {
        Files.createDirectories(store.getRegistryPath().getParent());
        Files.writeString(store.getRegistryPath(), "{ not json");

        assertThatThrownBy(() -> store.all()).isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.save(new ModelRecord(TestModels.descriptor("a", tempDir))))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("Concurrent saves of different records all survive")
    void concurrentSavesDoNotLoseUpdates() throws Exception {
        int writers = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String name = "model-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    ModelRecord record = new ModelRecord(TestModels.descriptor(name, tempDir));
                    store.save(record);
                    record.markDownloading();
                    store.save(record);
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                return store.get("gpt2-small");
            }));
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<ModelRecord> all = store.all();
        assertThat(all).hasSize(writers + 1);
        assertThat(all).filteredOn(r -> r.getName().startsWith("model-"))
                .allSatisfy(r -> assertThat(r.getState()).isEqualTo(ModelState.DOWNLOADING));
        assertThat(store.get("gpt2-small")).isPresent();
    }
}
