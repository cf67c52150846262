package com.llamaservice.service;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.llamaservice.model.GenerationKind;
import com.llamaservice.model.GenerationRequest;
import com.llamaservice.model.GenerationResponse;
import com.llamaservice.model.ModelRecord;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.LongBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * ONNX Runtime activator for decoder-only text generation models.
 *
 * Expects the Hugging Face ONNX export layout used by the Xenova repositories:
 * onnx/decoder_model.onnx plus tokenizer.json next to config.json.
 *
 * decoder_model.onnx I/O:
 * input: input_ids [1, n] int64, attention_mask [1, n] int64,
 * position_ids [1, n] int64 (only when the export declares it)
 * output: logits [1, n, vocab] float32
 *
 * Generation re-runs the full sequence each step (no KV cache).
 */
@Service
public class OnnxModelActivator implements ModelActivator {

    private static final Logger log = LoggerFactory.getLogger(OnnxModelActivator.class);

    static final String DECODER_ARTIFACT = "onnx/decoder_model.onnx";
    static final String TOKENIZER_ARTIFACT = "tokenizer.json";

    private static final int DEFAULT_MAX_TOKENS = 100;

    private final Map<String, LoadedModel> loaded = new LinkedHashMap<>();
    private final Random random = new Random();

    @Override
    public synchronized boolean load(ModelRecord record) {
        String name = record.getName();
        if (record.getDescriptor().kind() != GenerationKind.TEXT_GENERATION) {
            log.warn("Cannot load {}: generation kind {} is not supported by the ONNX activator", name,
                    record.getDescriptor().kind().getTag());
            return false;
        }

        Path modelDir = Paths.get(record.getDescriptor().localPath());
        Path decoderPath = modelDir.resolve(DECODER_ARTIFACT);
        Path tokenizerPath = modelDir.resolve(TOKENIZER_ARTIFACT);
        if (!Files.exists(decoderPath) || !Files.exists(tokenizerPath)) {
            log.warn("Cannot load {}: {} or {} missing under {}", name, DECODER_ARTIFACT, TOKENIZER_ARTIFACT,
                    modelDir);
            return false;
        }

        closeQuietly(loaded.remove(name));
        log.info("Loading ONNX model {} from {}", name, decoderPath);
        try {
            OrtEnvironment env = OrtEnvironment.getEnvironment();
            OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            opts.setIntraOpNumThreads(Math.max(1, Runtime.getRuntime().availableProcessors() / 2));
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            OrtSession session = env.createSession(decoderPath.toString(), opts);
            Gpt2Tokenizer tokenizer;
            try {
                tokenizer = Gpt2Tokenizer.load(tokenizerPath);
            } catch (IOException e) {
                session.close();
                throw e;
            }
            loaded.put(name, new LoadedModel(name, env, session, tokenizer));
            log.info("Model {} loaded (inputs: {})", name, session.getInputNames());
            return true;
        } catch (OrtException | IOException e) {
            log.error("Failed to load model {}: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized boolean unload(String name) {
        LoadedModel model = loaded.remove(name);
        if (model == null) {
            return true;
        }
        try {
            model.session().close();
            log.info("Model {} unloaded", name);
            return true;
        } catch (OrtException e) {
            log.error("Failed to release model {}: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        LoadedModel model;
        synchronized (this) {
            model = loaded.values().stream().findFirst()
                    .orElseThrow(() -> new GenerationException("No model loaded"));
        }

        long start = System.currentTimeMillis();
        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS;
        TokenSampler sampler = new TokenSampler(
                valueOr(request.getTemperature(), 0.7),
                request.getTopK() != null ? request.getTopK() : 0,
                valueOr(request.getTopP(), 1.0),
                valueOr(request.getRepetitionPenalty(), 1.0),
                !Boolean.FALSE.equals(request.getDoSample()),
                random);

        long[] ids = model.tokenizer().encode(request.getPrompt());
        if (ids.length == 0) {
            if (model.tokenizer().getEndOfTextId() < 0) {
                throw new GenerationException("Prompt produced no tokens");
            }
            ids = new long[] { model.tokenizer().getEndOfTextId() };
        }
        int promptLength = ids.length;

        try {
            for (int step = 0; step < maxTokens; step++) {
                float[] logits = lastLogits(model, ids);
                int next = sampler.next(logits, ids);
                if (next == model.tokenizer().getEndOfTextId()) {
                    break;
                }
                ids = Arrays.copyOf(ids, ids.length + 1);
                ids[ids.length - 1] = next;
            }
        } catch (OrtException e) {
            throw new GenerationException("Generation failed: " + e.getMessage(), e);
        }

        long[] generated = Arrays.copyOfRange(ids, promptLength, ids.length);
        String text = model.tokenizer().decode(generated);
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Generated {} tokens with {} in {}ms", generated.length, model.name(), elapsed);
        return new GenerationResponse(text, generated.length, elapsed, model.name(), Instant.now());
    }

    /**
     * Runs the decoder over the whole sequence and returns the logits of the
     * last position.
     */
    private float[] lastLogits(LoadedModel model, long[] ids) throws OrtException {
        long[] shape = { 1, ids.length };
        long[] mask = new long[ids.length];
        long[] positions = new long[ids.length];
        for (int i = 0; i < ids.length; i++) {
            mask[i] = 1;
            positions[i] = i;
        }

        Map<String, OnnxTensor> inputs = new HashMap<>();
        try {
            for (String inputName : model.session().getInputNames()) {
                long[] data = switch (inputName) {
                    case "input_ids" -> ids;
                    case "attention_mask" -> mask;
                    case "position_ids" -> positions;
                    default -> throw new GenerationException(
                            "Model " + model.name() + " requires unsupported input " + inputName);
                };
                inputs.put(inputName, OnnxTensor.createTensor(model.env(), LongBuffer.wrap(data), shape));
            }
            try (OrtSession.Result result = model.session().run(inputs)) {
                OnnxValue output = result.get("logits").orElse(result.get(0));
                float[][][] logits = (float[][][]) output.getValue();
                return logits[0][logits[0].length - 1];
            }
        } finally {
            inputs.values().forEach(OnnxTensor::close);
        }
    }

    @Override
    public synchronized boolean isLoaded(String name) {
        return loaded.containsKey(name);
    }

    @Override
    public synchronized Set<String> loadedNames() {
        return new LinkedHashSet<>(loaded.keySet());
    }

    @PreDestroy
    public synchronized void shutdown() {
        log.info("Shutting down ONNX sessions...");
        loaded.values().forEach(this::closeQuietly);
        loaded.clear();
    }

    private void closeQuietly(LoadedModel model) {
        if (model == null) {
            return;
        }
        try {
            model.session().close();
        } catch (OrtException e) {
            log.warn("Error closing session for {}: {}", model.name(), e.getMessage());
        }
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private record LoadedModel(String name, OrtEnvironment env, OrtSession session, Gpt2Tokenizer tokenizer) {
    }
}
