package com.llamaservice;

import com.llamaservice.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableAsync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@SpringBootApplication
@EnableAsync
public class LlamaServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(LlamaServiceApplication.class);

    /** Parent of the SQLite file in spring.datasource.url */
    static final Path DATA_DIR = Paths.get("data");

    public static void main(String[] args) {
        prepareDataDirectory();
        SpringApplication.run(LlamaServiceApplication.class, args);
    }

    /**
     * SQLite does not create missing parent directories, so this has to run
     * before the context opens the datasource.
     */
    public static void prepareDataDirectory() {
        try {
            Files.createDirectories(DATA_DIR);
        } catch (IOException e) {
            log.warn("Could not create {}: {}", DATA_DIR.toAbsolutePath(), e.getMessage());
        }
    }

    @Bean
    ApplicationListener<ApplicationReadyEvent> readyAnnouncer(AppConfig appConfig) {
        return event -> {
            String port = event.getApplicationContext().getEnvironment().getProperty("local.server.port");
            if (port == null) {
                // CLI run, no web server
                return;
            }
            log.info("llama-model-service listening on port {}, models under {}", port,
                    Paths.get(appConfig.getModelDir()).toAbsolutePath());
            log.info("POST /api/v1/models/setup to load a model, then POST /api/v1/generate");
        };
    }
}
