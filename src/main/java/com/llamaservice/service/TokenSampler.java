package com.llamaservice.service;

import java.util.Arrays;
import java.util.Random;

/**
 * Picks the next token id from a row of logits.
 *
 * Order: repetition penalty, then greedy argmax when sampling is off;
 * otherwise temperature, top-k, top-p (nucleus) and a weighted draw.
 */
class TokenSampler {

    private final double temperature;
    private final int topK;
    private final double topP;
    private final double repetitionPenalty;
    private final boolean doSample;
    private final Random random;

    TokenSampler(double temperature, int topK, double topP, double repetitionPenalty, boolean doSample,
            Random random) {
        this.temperature = temperature;
        this.topK = topK;
        this.topP = topP;
        this.repetitionPenalty = repetitionPenalty;
        this.doSample = doSample;
        this.random = random;
    }

    int next(float[] logits, long[] previousIds) {
        float[] scores = Arrays.copyOf(logits, logits.length);
        applyRepetitionPenalty(scores, previousIds);

        if (!doSample || temperature <= 0.0) {
            return argmax(scores);
        }

        double[] probs = softmax(scores, temperature);
        Integer[] order = new Integer[probs.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(probs[b], probs[a]));

        int limit = topK > 0 ? Math.min(topK, order.length) : order.length;
        double cumulative = 0.0;
        int keep = 0;
        while (keep < limit) {
            cumulative += probs[order[keep]];
            keep++;
            if (topP > 0.0 && topP < 1.0 && cumulative >= topP) {
                break;
            }
        }

        double draw = random.nextDouble() * cumulative;
        double running = 0.0;
        for (int i = 0; i < keep; i++) {
            running += probs[order[i]];
            if (draw < running) {
                return order[i];
            }
        }
        return order[keep - 1];
    }

    private void applyRepetitionPenalty(float[] scores, long[] previousIds) {
        if (repetitionPenalty <= 0.0 || repetitionPenalty == 1.0) {
            return;
        }
        boolean[] seen = new boolean[scores.length];
        for (long id : previousIds) {
            int i = (int) id;
            if (i >= 0 && i < scores.length && !seen[i]) {
                seen[i] = true;
                scores[i] = scores[i] > 0
                        ? (float) (scores[i] / repetitionPenalty)
                        : (float) (scores[i] * repetitionPenalty);
            }
        }
    }

    static int argmax(float[] scores) {
        int best = 0;
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] > scores[best]) {
                best = i;
            }
        }
        return best;
    }

    private static double[] softmax(float[] scores, double temperature) {
        double max = Double.NEGATIVE_INFINITY;
        for (float s : scores) {
            max = Math.max(max, s / temperature);
        }
        double[] probs = new double[scores.length];
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            probs[i] = Math.exp(scores[i] / temperature - max);
            sum += probs[i];
        }
        for (int i = 0; i < probs.length; i++) {
            probs[i] /= sum;
        }
        return probs;
    }
}
