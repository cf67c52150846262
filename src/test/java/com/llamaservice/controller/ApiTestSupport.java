package com.llamaservice.controller;

import com.llamaservice.config.AppConfig;
import com.llamaservice.model.GenerationResponse;
import com.llamaservice.service.HealthReporter;
import com.llamaservice.service.ModelAcquirer;
import com.llamaservice.service.ModelActivator;
import com.llamaservice.service.ModelLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Shared context for the REST tests: real lifecycle, store and catalog with
 * mocked download and inference.
 */
@SpringBootTest
@AutoConfigureMockMvc
abstract class ApiTestSupport {

    @Autowired MockMvc mvc;
    @Autowired AppConfig appConfig;
    @Autowired ModelLifecycleService lifecycleService;
    @Autowired HealthReporter healthReporter;

    @MockBean ModelAcquirer acquirer;
    @MockBean ModelActivator activator;

    @BeforeEach
    void resetState() throws Exception {
        when(activator.unload(anyString())).thenReturn(true);
        lifecycleService.unloadActive();
        Files.deleteIfExists(appConfig.getRegistryPath());
        healthReporter.clearError();

        when(acquirer.download(any(), any())).thenReturn(true);
        when(activator.load(any())).thenReturn(true);
        when(activator.generate(any())).thenAnswer(inv -> new GenerationResponse(
                "generated text", 2, 15, "gpt2-small", Instant.now()));
    }
}
