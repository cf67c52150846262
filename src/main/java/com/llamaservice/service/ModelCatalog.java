package com.llamaservice.service;

import com.llamaservice.config.AppConfig;
import com.llamaservice.model.CatalogEntry;
import com.llamaservice.model.GenerationKind;
import com.llamaservice.model.ModelDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of models available for first-time setup.
 *
 * Built once from the fixed list below plus any app.custom-models entries.
 * Lookups are pure: nothing here touches disk or network.
 */
@Service
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    static final String DEFAULT_VERSION = "1.0.0";

    static final List<String> DECODER_ARTIFACTS = List.of(
            "config.json", "tokenizer.json", "tokenizer_config.json", "onnx/decoder_model.onnx");

    static final List<String> ENCODER_DECODER_ARTIFACTS = List.of(
            "config.json", "tokenizer.json", "tokenizer_config.json",
            "onnx/encoder_model.onnx", "onnx/decoder_model.onnx");

    /**
     * Built-in rows: [name, hf-id, description, size-gb, popularity, tags...]
     */
    private static final Object[][] BUILT_IN = {
            { "gpt2-small", "Xenova/gpt2",
                    "GPT-2 Small - Fast and lightweight text generation model", 0.5, 95,
                    "text-generation", "fast", "lightweight" },
            { "gpt2-medium", "Xenova/gpt2-medium",
                    "GPT-2 Medium - Balanced performance and quality", 1.5, 85,
                    "text-generation", "balanced" },
            { "distilgpt2", "Xenova/distilgpt2",
                    "DistilGPT-2 - Distilled version of GPT-2, faster inference", 0.3, 75,
                    "text-generation", "distilled", "fast" },
            { "dialogpt-medium", "Xenova/DialoGPT-medium",
                    "DialoGPT Medium - Conversational AI model", 1.2, 70,
                    "conversation", "dialog", "chat" },
            { "t5-small", "Xenova/t5-small",
                    "T5 Small - Text-to-text transfer transformer", 0.2, 80,
                    "text2text-generation", "summarization", "translation" },
            { "flan-t5-small", "Xenova/flan-t5-small",
                    "FLAN-T5 Small - Instruction-tuned T5 model", 0.3, 85,
                    "text2text-generation", "instruction-following", "flan" },
            { "llama-7b-chat", "Xenova/DialoGPT-large",
                    "Llama 7B Chat - Large language model optimized for conversation", 7.0, 90,
                    "text-generation", "large", "chat", "llama" }
    };

    private final String modelDir;
    private final Map<String, CatalogEntry> entries = new LinkedHashMap<>();

    public ModelCatalog(AppConfig appConfig) {
        this.modelDir = appConfig.getModelDir();
        for (Object[] row : BUILT_IN) {
            register(builtIn(row));
        }
        for (AppConfig.CustomModel custom : appConfig.getCustomModels()) {
            try {
                register(fromConfig(custom));
            } catch (IllegalArgumentException e) { // includes InvalidDescriptorException
                log.warn("Skipping custom model '{}': {}", custom.getName(), e.getMessage());
            }
        }
        log.info("Model catalog initialized with {} entries", entries.size());
    }

    /**
     * Adds or replaces an entry. Intended for startup wiring only.
     */
    public synchronized void register(CatalogEntry entry) {
        entries.put(entry.name(), entry);
    }

    public synchronized Optional<CatalogEntry> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * All entries, most popular first. Ties keep registration order.
     */
    public synchronized List<CatalogEntry> all() {
        List<CatalogEntry> sorted = new ArrayList<>(entries.values());
        sorted.sort(Comparator.comparingInt(CatalogEntry::popularity).reversed());
        return sorted;
    }

    /**
     * Entries whose name, description or any tag contains the query, ignoring
     * case.
     */
    public List<CatalogEntry> search(String query) {
        if (query == null || query.isBlank()) {
            return all();
        }
        String q = query.trim().toLowerCase(Locale.ROOT);
        return all().stream()
                .filter(e -> e.name().toLowerCase(Locale.ROOT).contains(q)
                        || e.descriptor().description().toLowerCase(Locale.ROOT).contains(q)
                        || e.tags().stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).contains(q)))
                .toList();
    }

    public List<CatalogEntry> byTag(String tag) {
        return all().stream()
                .filter(e -> e.tags().contains(tag))
                .toList();
    }

    public List<CatalogEntry> verifiedOnly() {
        return all().stream()
                .filter(CatalogEntry::verified)
                .toList();
    }

    private CatalogEntry builtIn(Object[] row) {
        String name = (String) row[0];
        List<String> tags = new ArrayList<>();
        for (int i = 5; i < row.length; i++) {
            tags.add((String) row[i]);
        }
        boolean textToText = tags.contains(GenerationKind.TEXT_TO_TEXT_GENERATION.getTag());

        ModelDescriptor descriptor = ModelDescriptor.builder()
                .name(name)
                .acquisitionId((String) row[1])
                .version(DEFAULT_VERSION)
                .description((String) row[2])
                .localPath(localPathFor(name))
                .kind(textToText ? GenerationKind.TEXT_TO_TEXT_GENERATION : GenerationKind.TEXT_GENERATION)
                .sizeGb((Double) row[3])
                .requiredArtifacts(textToText ? ENCODER_DECODER_ARTIFACTS : DECODER_ARTIFACTS)
                .build();
        return new CatalogEntry(descriptor, new LinkedHashSet<>(tags), (Integer) row[4], true);
    }

    private CatalogEntry fromConfig(AppConfig.CustomModel custom) {
        GenerationKind kind = GenerationKind.fromTag(custom.getKind());
        List<String> artifacts = custom.getRequiredArtifacts() == null || custom.getRequiredArtifacts().isEmpty()
                ? (kind == GenerationKind.TEXT_TO_TEXT_GENERATION ? ENCODER_DECODER_ARTIFACTS : DECODER_ARTIFACTS)
                : custom.getRequiredArtifacts();

        ModelDescriptor descriptor = ModelDescriptor.builder()
                .name(custom.getName())
                .acquisitionId(custom.getAcquisitionId())
                .version(custom.getVersion())
                .description(custom.getDescription())
                .localPath(custom.getName() == null ? null : localPathFor(custom.getName()))
                .kind(kind)
                .sizeGb(custom.getSizeGb())
                .requiredArtifacts(artifacts)
                .build();
        return new CatalogEntry(descriptor, new LinkedHashSet<>(custom.getTags()),
                custom.getPopularity(), custom.isVerified());
    }

    private String localPathFor(String name) {
        return Paths.get(modelDir, name).toString();
    }
}
