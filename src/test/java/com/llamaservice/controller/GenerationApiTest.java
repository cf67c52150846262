package com.llamaservice.controller;

import org.junit.jupiter.api.Test;

import static org.springframework.http.MediaType.APPLICATION_JSON;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GenerationApiTest extends ApiTestSupport {

    @Test
    void generateWithoutActiveModelReturns409() throws Exception {
        mvc.perform(post("/api/v1/generate")
                        .contentType(APPLICATION_JSON)
                        .content("{\"prompt\":\"Hello\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.failure").value("NO_ACTIVE_MODEL"));
    }

    @Test
    void generateReturnsTheModelOutput() throws Exception {
        mvc.perform(post("/api/v1/models/setup")
                        .contentType(APPLICATION_JSON)
                        .content("{\"modelName\":\"gpt2-small\"}"))
                .andExpect(status().isOk());

        mvc.perform(post("/api/v1/generate")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"prompt":"Once upon a time","maxTokens":20,"temperature":0.5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.text").value("generated text"))
                .andExpect(jsonPath("$.data.tokensUsed").value(2))
                .andExpect(jsonPath("$.data.model").value("gpt2-small"));
    }

    @Test
    void blankPromptReturns400ProblemDetail() throws Exception {
        mvc.perform(post("/api/v1/generate")
                        .contentType(APPLICATION_JSON)
                        .content("{\"prompt\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("validation_failed"))
                .andExpect(jsonPath("$.fields.prompt").exists());
    }

    @Test
    void maxTokensAboveTheLimitIsInvalid() throws Exception {
        mvc.perform(post("/api/v1/generate")
                        .contentType(APPLICATION_JSON)
                        .content("{\"prompt\":\"Hello\",\"maxTokens\":100000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.failure").value("INVALID_REQUEST"));
    }

    @Test
    void malformedJsonReturns400ProblemDetail() throws Exception {
        mvc.perform(post("/api/v1/generate")
                        .contentType(APPLICATION_JSON)
                        .content("{\"prompt\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("malformed_json"));
    }
}
