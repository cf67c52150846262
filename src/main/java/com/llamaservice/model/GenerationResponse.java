package com.llamaservice.model;

import java.time.Instant;

/**
 * Output of one generation call.
 *
 * @param text             generated continuation
 * @param tokensUsed       number of tokens produced
 * @param processingTimeMs wall time spent in the model
 * @param model            name of the model that served the request
 * @param timestamp        completion time
 */
public record GenerationResponse(String text, int tokensUsed, long processingTimeMs, String model,
        Instant timestamp) {
}
