package com.llamaservice.service;

import com.llamaservice.config.AppConfig;
import com.llamaservice.model.ModelDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.function.DoubleConsumer;

/**
 * Downloads model artifacts from Hugging Face.
 *
 * Each required artifact {file} of repo {id} is fetched from
 * {hf-base-url}/{id}/resolve/main/{file} into {localPath}/{file}.
 *
 * - Authorization: Bearer header when a token is stored or configured
 * - Atomic write: download to .tmp file, then rename
 * - Files already present and non-empty are skipped
 * - Retry with exponential back-off per file
 * - A failed file is logged and the remaining files are still attempted
 */
@Service
public class HuggingFaceAcquirer implements ModelAcquirer {

    private static final Logger log = LoggerFactory.getLogger(HuggingFaceAcquirer.class);

    private static final String RESOLVE_PATH = "%s/%s/resolve/main/%s";

    // Buffer size for streaming download: 512 KB
    private static final int BUFFER_SIZE = 512 * 1024;
    private static final long REPORT_EVERY_BYTES = 5L * 1024 * 1024;
    private static final long MAX_BACKOFF_MS = 30_000;

    /** Artifact that must exist for a download to count as usable */
    static final String MINIMUM_ARTIFACT = "config.json";

    private final AppConfig appConfig;
    private final CredentialService credentials;

    public HuggingFaceAcquirer(AppConfig appConfig, CredentialService credentials) {
        this.appConfig = appConfig;
        this.credentials = credentials;
    }

    @Override
    public boolean download(ModelDescriptor descriptor, DoubleConsumer onProgress) {
        Path modelDir = Paths.get(descriptor.localPath());
        List<String> artifacts = descriptor.requiredArtifacts();
        String token = credentials.resolveToken().orElse(null);

        log.info("Downloading {} ({} artifacts) from {} into {}", descriptor.name(), artifacts.size(),
                descriptor.acquisitionId(), modelDir);
        try {
            Files.createDirectories(modelDir);
        } catch (IOException e) {
            log.error("Cannot create model directory {}: {}", modelDir, e.getMessage());
            return false;
        }

        int completed = 0;
        for (String artifact : artifacts) {
            final int done = completed;
            DoubleConsumer fileProgress = fraction -> report(onProgress,
                    (done + fraction) / artifacts.size() * 100.0);
            try {
                downloadFileWithRetry(descriptor.acquisitionId(), artifact, modelDir.resolve(artifact), token,
                        fileProgress);
            } catch (IOException e) {
                log.warn("Failed to download {} for {}: {}", artifact, descriptor.name(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Download of {} interrupted", descriptor.name());
                return false;
            }
            completed++;
            report(onProgress, (double) completed / artifacts.size() * 100.0);
        }

        boolean usable = hasMinimumArtifacts(descriptor);
        if (usable) {
            log.info("Download of {} finished ({}% of artifacts present)", descriptor.name(),
                    Math.round(progress(descriptor)));
        } else {
            log.warn("Download of {} did not produce the minimum artifact set", descriptor.name());
        }
        return usable;
    }

    @Override
    public boolean isDownloaded(ModelDescriptor descriptor) {
        Path modelDir = Paths.get(descriptor.localPath());
        return descriptor.requiredArtifacts().stream().allMatch(a -> isPresent(modelDir.resolve(a)));
    }

    @Override
    public double progress(ModelDescriptor descriptor) {
        Path modelDir = Paths.get(descriptor.localPath());
        long present = descriptor.requiredArtifacts().stream().filter(a -> isPresent(modelDir.resolve(a))).count();
        return (double) present / descriptor.requiredArtifacts().size() * 100.0;
    }

    private boolean hasMinimumArtifacts(ModelDescriptor descriptor) {
        Path modelDir = Paths.get(descriptor.localPath());
        if (descriptor.requiredArtifacts().contains(MINIMUM_ARTIFACT)) {
            return isPresent(modelDir.resolve(MINIMUM_ARTIFACT));
        }
        return isDownloaded(descriptor);
    }

    private static boolean isPresent(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Downloads a single file with exponential backoff retry.
     */
    private void downloadFileWithRetry(String repo, String artifact, Path localPath, String token,
            DoubleConsumer fileProgress) throws IOException, InterruptedException {
        int maxRetries = Math.max(1, appConfig.getDownload().getMaxRetries());
        long delayMs = appConfig.getDownload().getInitialBackoffMs();
        IOException lastException = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                downloadFile(repo, artifact, localPath, token, fileProgress);
                return;
            } catch (IOException e) {
                lastException = e;
                if (attempt < maxRetries) {
                    log.warn("Download attempt {}/{} failed for {}: {}. Retrying in {}ms...",
                            attempt, maxRetries, artifact, e.getMessage(), delayMs);
                    Thread.sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                }
            }
        }
        throw new IOException("Failed to download " + artifact + " after " + maxRetries + " attempts",
                lastException);
    }

    /**
     * Streams one file to a temp file next to its destination, then renames it.
     */
    private void downloadFile(String repo, String artifact, Path localPath, String token,
            DoubleConsumer fileProgress) throws IOException {
        if (isPresent(localPath)) {
            log.info("Already downloaded, skipping: {}", localPath);
            return;
        }

        String urlStr = String.format(RESOLVE_PATH, stripTrailingSlash(appConfig.getHfBaseUrl()), repo, artifact);
        log.info("Downloading {} → {}", urlStr, localPath);

        HttpURLConnection conn = (HttpURLConnection) new URL(urlStr).openConnection();
        try {
            conn.setRequestMethod("GET");
            if (token != null) {
                conn.setRequestProperty("Authorization", "Bearer " + token);
            }
            conn.setRequestProperty("User-Agent", "llama-model-service/1.0 (Java)");
            conn.setConnectTimeout(appConfig.getDownload().getConnectTimeoutMs());
            conn.setReadTimeout(appConfig.getDownload().getReadTimeoutMs());
            conn.setInstanceFollowRedirects(true);

            int responseCode = conn.getResponseCode();
            if (responseCode == HttpURLConnection.HTTP_UNAUTHORIZED) {
                throw new IOException("Authentication failed (401). Check the Hugging Face token.");
            }
            if (responseCode == HttpURLConnection.HTTP_NOT_FOUND) {
                throw new IOException("File not found on Hugging Face (404): " + artifact);
            }
            if (responseCode != HttpURLConnection.HTTP_OK) {
                throw new IOException("Unexpected HTTP response " + responseCode + " for: " + artifact);
            }

            Files.createDirectories(localPath.toAbsolutePath().getParent());
            long totalBytes = conn.getContentLengthLong();
            Path tempFile = localPath.resolveSibling(localPath.getFileName() + ".tmp");
            MessageDigest sha256 = newSha256();

            try (InputStream in = new BufferedInputStream(conn.getInputStream(), BUFFER_SIZE);
                    OutputStream out = Files.newOutputStream(tempFile,
                            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {

                byte[] buffer = new byte[BUFFER_SIZE];
                long bytesRead = 0;
                long lastReportedBytes = 0;
                int read;

                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    sha256.update(buffer, 0, read);
                    bytesRead += read;

                    if (totalBytes > 0 && bytesRead - lastReportedBytes >= REPORT_EVERY_BYTES) {
                        fileProgress.accept(Math.min(1.0, (double) bytesRead / totalBytes));
                        lastReportedBytes = bytesRead;
                    }
                }

                if (totalBytes > 0 && bytesRead != totalBytes) {
                    throw new IOException("Download incomplete: expected " + totalBytes + " bytes but got "
                            + bytesRead);
                }
            } catch (IOException e) {
                Files.deleteIfExists(tempFile);
                throw e;
            }

            Files.move(tempFile, localPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            log.info("Downloaded {} ({} bytes, SHA-256: {})", artifact, Files.size(localPath),
                    HexFormat.of().formatHex(sha256.digest()));
        } finally {
            conn.disconnect();
        }
    }

    private static MessageDigest newSha256() throws IOException {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("SHA-256 not available", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static void report(DoubleConsumer onProgress, double percent) {
        if (onProgress != null) {
            onProgress.accept(Math.max(0.0, Math.min(100.0, percent)));
        }
    }
}
