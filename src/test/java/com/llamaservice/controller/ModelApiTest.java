package com.llamaservice.controller;

import com.llamaservice.testsupport.Polling;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.http.MediaType.APPLICATION_JSON;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ModelApiTest extends ApiTestSupport {

    private void setup(String model) throws Exception {
        mvc.perform(post("/api/v1/models/setup")
                        .contentType(APPLICATION_JSON)
                        .content("{\"modelName\":\"" + model + "\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void statusWithNothingActiveIsNotReady() throws Exception {
        mvc.perform(get("/api/v1/models/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ready").value(false))
                .andExpect(jsonPath("$.data.model").doesNotExist());
    }

    @Test
    void setupLoadsTheModelAndMakesItActive() throws Exception {
        mvc.perform(post("/api/v1/models/setup")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"modelName":"gpt2-small"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.state").value("loaded"));

        mvc.perform(get("/api/v1/models/status"))
                .andExpect(jsonPath("$.data.model").value("gpt2-small"))
                .andExpect(jsonPath("$.data.ready").value(true));
    }

    @Test
    void setupOfUnknownModelReturns404() throws Exception {
        mvc.perform(post("/api/v1/models/setup")
                        .contentType(APPLICATION_JSON)
                        .content("{\"modelName\":\"no-such-model\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.failure").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void setupWithoutModelNameReturns400ProblemDetail() throws Exception {
        mvc.perform(post("/api/v1/models/setup")
                        .contentType(APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("validation_failed"))
                .andExpect(jsonPath("$.fields.modelName").exists());
    }

    @Test
    void failedDownloadReturns500WithFailureKind() throws Exception {
        when(acquirer.download(any(), any())).thenReturn(false);

        mvc.perform(post("/api/v1/models/setup")
                        .contentType(APPLICATION_JSON)
                        .content("{\"modelName\":\"gpt2-small\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.failure").value("ACQUISITION_FAILED"));

        mvc.perform(get("/api/v1/models"))
                .andExpect(jsonPath("$.data[0].name").value("gpt2-small"))
                .andExpect(jsonPath("$.data[0].state").value("error"))
                .andExpect(jsonPath("$.data[0].errorMessage").exists());
    }

    @Test
    void listShowsStoredRecords() throws Exception {
        setup("distilgpt2");

        mvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].acquisitionId").value("Xenova/distilgpt2"))
                .andExpect(jsonPath("$.data[0].ready").value(true));
    }

    @Test
    void asyncSetupReturns202AndCompletesInTheBackground() throws Exception {
        mvc.perform(post("/api/v1/models/setup/async")
                        .contentType(APPLICATION_JSON)
                        .content("{\"modelName\":\"gpt2-small\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.status").value("STARTED"));

        Polling.waitUntil(Duration.ofSeconds(5), Duration.ofMillis(20),
                () -> "gpt2-small".equals(lifecycleService.status().model()));
    }

    @Test
    void progressStreamOpensAnSseConnection() throws Exception {
        mvc.perform(get("/api/v1/models/progress"))
                .andExpect(request().asyncStarted());
    }

    @Test
    void unloadClearsTheActiveModel() throws Exception {
        setup("gpt2-small");

        mvc.perform(post("/api/v1/models/unload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ready").value(false));
    }

    @Test
    void deleteRemovesTheModel() throws Exception {
        setup("gpt2-small");

        mvc.perform(delete("/api/v1/models/gpt2-small"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true));

        mvc.perform(delete("/api/v1/models/gpt2-small"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.failure").value("NOT_FOUND"));
    }
}
