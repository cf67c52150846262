package com.llamaservice.service;

import com.llamaservice.config.AppConfig;
import com.llamaservice.model.ModelDescriptor;
import com.llamaservice.testsupport.TestModels;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs the acquirer against a local HTTP server standing in for the Hub.
 */
class HuggingFaceAcquirerTest {

    @TempDir
    Path tempDir;

    private HttpServer server;
    private final Map<String, String> files = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failuresLeft = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();

    private final CredentialService credentials = mock(CredentialService.class);
    private AppConfig config;
    private HuggingFaceAcquirer acquirer;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();

        config = new AppConfig();
        config.setModelDir(tempDir.toString());
        config.setHfBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        config.getDownload().setMaxRetries(2);
        config.getDownload().setInitialBackoffMs(1);
        when(credentials.resolveToken()).thenReturn(Optional.empty());
        acquirer = new HuggingFaceAcquirer(config, credentials);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        requests.add(path);
        String auth = exchange.getRequestHeaders().getFirst("Authorization");
        if (auth != null) {
            authHeaders.add(auth);
        }
        AtomicInteger failures = failuresLeft.get(path);
        if (failures != null && failures.getAndDecrement() > 0) {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
            return;
        }
        String body = files.get(path);
        if (body == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private void serve(String repo, String artifact, String content) {
        files.put("/" + repo + "/resolve/main/" + artifact, content);
    }

    private ModelDescriptor descriptor() {
        return TestModels.descriptor("tiny", tempDir);
    }

    @Test
    @DisplayName("Downloads every artifact and reports progress up to 100")
    void downloadsAllArtifacts() throws Exception {
        serve("test/tiny", "config.json", "{\"model_type\":\"gpt2\"}");
        serve("test/tiny", "tokenizer.json", "{}");
        List<Double> progress = new ArrayList<>();

        boolean ok = acquirer.download(descriptor(), progress::add);

        assertThat(ok).isTrue();
        assertThat(acquirer.isDownloaded(descriptor())).isTrue();
        assertThat(acquirer.progress(descriptor())).isEqualTo(100.0);
        assertThat(Files.readString(tempDir.resolve("tiny/config.json"))).contains("gpt2");
        assertThat(progress).isSorted().last().isEqualTo(100.0);
        assertThat(tempDir.resolve("tiny/config.json.tmp")).doesNotExist();
    }

    @Test
    void existingFilesAreNotFetchedAgain() throws Exception {
        serve("test/tiny", "config.json", "{}");
        serve("test/tiny", "tokenizer.json", "{}");
        Files.createDirectories(tempDir.resolve("tiny"));
        Files.writeString(tempDir.resolve("tiny/config.json"), "{\"cached\":true}");

        acquirer.download(descriptor(), null);

        assertThat(requests).containsExactly("/test/tiny/resolve/main/tokenizer.json");
        assertThat(Files.readString(tempDir.resolve("tiny/config.json"))).contains("cached");
    }

    @Test
    void missingOptionalArtifactStillCountsAsUsable() {
        serve("test/tiny", "config.json", "{}");

        boolean ok = acquirer.download(descriptor(), null);

        assertThat(ok).isTrue();
        assertThat(acquirer.isDownloaded(descriptor())).isFalse();
        assertThat(acquirer.progress(descriptor())).isEqualTo(50.0);
    }

    @Test
    void missingConfigFailsTheDownload() {
        serve("test/tiny", "tokenizer.json", "{}");

        assertThat(acquirer.download(descriptor(), null)).isFalse();
    }

    @Test
    void transientServerErrorsAreRetried() {
        serve("test/tiny", "config.json", "{}");
        serve("test/tiny", "tokenizer.json", "{}");
        failuresLeft.put("/test/tiny/resolve/main/config.json", new AtomicInteger(1));

        assertThat(acquirer.download(descriptor(), null)).isTrue();
        assertThat(requests).filteredOn(p -> p.endsWith("config.json")).hasSize(2);
    }

    @Test
    void resolvedTokenIsSentAsBearer() {
        serve("test/tiny", "config.json", "{}");
        serve("test/tiny", "tokenizer.json", "{}");
        when(credentials.resolveToken()).thenReturn(Optional.of("hf_resolved_token"));

        acquirer.download(descriptor(), null);

        assertThat(authHeaders).isNotEmpty().allMatch("Bearer hf_resolved_token"::equals);
    }

    @Test
    void noTokenMeansNoAuthorizationHeader() {
        serve("test/tiny", "config.json", "{}");
        serve("test/tiny", "tokenizer.json", "{}");

        acquirer.download(descriptor(), null);

        assertThat(requests).isNotEmpty();
        assertThat(authHeaders).isEmpty();
    }
}
