package com.llamaservice.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Text generation parameters. Every field except the prompt is optional;
 * missing values fall back to the configured generation defaults.
 */
public class GenerationRequest {

    @NotBlank
    private String prompt;

    @Min(1)
    private Integer maxTokens;

    @DecimalMin("0.0")
    @DecimalMax("5.0")
    private Double temperature;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double topP;

    @Min(0)
    private Integer topK;

    @DecimalMin("0.0")
    private Double repetitionPenalty;

    private Boolean doSample;

    public GenerationRequest() {
    }

    public GenerationRequest(String prompt) {
        this.prompt = prompt;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
        this.maxTokens = maxTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public Double getTopP() {
        return topP;
    }

    public void setTopP(Double topP) {
        this.topP = topP;
    }

    public Integer getTopK() {
        return topK;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }

    public Double getRepetitionPenalty() {
        return repetitionPenalty;
    }

    public void setRepetitionPenalty(Double repetitionPenalty) {
        this.repetitionPenalty = repetitionPenalty;
    }

    public Boolean getDoSample() {
        return doSample;
    }

    public void setDoSample(Boolean doSample) {
        this.doSample = doSample;
    }
}
