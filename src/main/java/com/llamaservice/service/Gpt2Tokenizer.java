package com.llamaservice.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure-Java GPT-2 byte-level BPE tokenizer.
 *
 * Reads the vocabulary and merge rules from a Hugging Face tokenizer.json.
 * Encoding splits text with the GPT-2 pre-tokenizer regex (a leading space
 * stays attached to the following word), maps every UTF-8 byte to its
 * printable stand-in and applies the merges. Decoding reverses the byte
 * mapping, so any id sequence decodes to valid text.
 */
public class Gpt2Tokenizer {

    private static final Logger log = LoggerFactory.getLogger(Gpt2Tokenizer.class);

    public static final String END_OF_TEXT = "<|endoftext|>";

    private static final Pattern SPLIT_PATTERN = Pattern.compile(
            "'s|'t|'re|'ve|'m|'ll|'d| ?\\p{L}+| ?\\p{N}+| ?[^\\s\\p{L}\\p{N}]+|\\s+(?!\\S)|\\s+");

    // Bytes to unicode mapping used in the GPT-2 tokenizer
    private static final Map<Integer, Character> BYTE_ENCODER = buildByteEncoder();
    private static final Map<Character, Integer> BYTE_DECODER = buildByteDecoder();

    private final Map<String, Integer> vocab;
    private final Map<Integer, String> idToToken;
    // BPE merge priority map: pair -> rank (lower rank = higher priority)
    private final Map<String, Integer> bpeMerges;
    private final int endOfTextId;

    private Gpt2Tokenizer(Map<String, Integer> vocab, Map<String, Integer> bpeMerges) {
        this.vocab = vocab;
        this.bpeMerges = bpeMerges;
        this.idToToken = new HashMap<>();
        vocab.forEach((token, id) -> idToToken.put(id, token));
        this.endOfTextId = vocab.getOrDefault(END_OF_TEXT, -1);
    }

    /**
     * Loads the tokenizer from a Hugging Face tokenizer.json file.
     */
    public static Gpt2Tokenizer load(Path tokenizerJsonPath) throws IOException {
        log.info("Loading GPT-2 tokenizer from {}", tokenizerJsonPath);
        JsonNode root = new ObjectMapper().readTree(tokenizerJsonPath.toFile());
        return fromJson(root);
    }

    public static Gpt2Tokenizer fromJson(JsonNode root) throws IOException {
        JsonNode vocabNode = root.path("model").path("vocab");
        if (!vocabNode.isObject() || vocabNode.isEmpty()) {
            throw new IOException("tokenizer.json has no model.vocab");
        }

        Map<String, Integer> vocab = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> vocabIter = vocabNode.fields();
        while (vocabIter.hasNext()) {
            Map.Entry<String, JsonNode> entry = vocabIter.next();
            vocab.put(entry.getKey(), entry.getValue().intValue());
        }
        for (JsonNode added : root.path("added_tokens")) {
            vocab.putIfAbsent(added.path("content").asText(), added.path("id").intValue());
        }

        // Merges are "a b" strings in older files and ["a", "b"] pairs in newer ones
        Map<String, Integer> merges = new HashMap<>();
        JsonNode mergesNode = root.path("model").path("merges");
        for (int i = 0; i < mergesNode.size(); i++) {
            JsonNode merge = mergesNode.get(i);
            String pair = merge.isArray() ? merge.get(0).asText() + " " + merge.get(1).asText() : merge.asText();
            merges.putIfAbsent(pair, i);
        }

        log.info("GPT-2 tokenizer loaded: {} vocab entries, {} merge rules", vocab.size(), merges.size());
        return new Gpt2Tokenizer(vocab, merges);
    }

    public long[] encode(String text) {
        List<Integer> tokenIds = new ArrayList<>();
        Matcher matcher = SPLIT_PATTERN.matcher(text);
        while (matcher.find()) {
            List<String> symbols = new ArrayList<>();
            for (byte b : matcher.group().getBytes(StandardCharsets.UTF_8)) {
                symbols.add(String.valueOf(BYTE_ENCODER.get(Byte.toUnsignedInt(b))));
            }
            for (String token : applyBpe(symbols)) {
                Integer id = vocab.get(token);
                if (id != null) {
                    tokenIds.add(id);
                } else {
                    log.debug("Dropping token outside the vocabulary: {}", token);
                }
            }
        }
        return tokenIds.stream().mapToLong(Integer::longValue).toArray();
    }

    public String decode(long[] ids) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (long id : ids) {
            String token = idToToken.get((int) id);
            if (token == null || (int) id == endOfTextId) {
                continue;
            }
            for (char c : token.toCharArray()) {
                Integer b = BYTE_DECODER.get(c);
                if (b != null) {
                    bytes.write(b);
                }
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    /**
     * Id of the end-of-text token, or -1 when the vocabulary has none.
     */
    public int getEndOfTextId() {
        return endOfTextId;
    }

    public int vocabSize() {
        return vocab.size();
    }

    /**
     * Applies BPE merge rules until no more merges can be applied.
     */
    private List<String> applyBpe(List<String> tokens) {
        if (tokens.size() <= 1)
            return tokens;

        while (true) {
            int bestRank = Integer.MAX_VALUE;
            int bestIdx = -1;
            for (int i = 0; i < tokens.size() - 1; i++) {
                Integer rank = bpeMerges.get(tokens.get(i) + " " + tokens.get(i + 1));
                if (rank != null && rank < bestRank) {
                    bestRank = rank;
                    bestIdx = i;
                }
            }
            if (bestIdx == -1)
                break;

            tokens.set(bestIdx, tokens.get(bestIdx) + tokens.get(bestIdx + 1));
            tokens.remove(bestIdx + 1);
        }
        return tokens;
    }

    /**
     * Maps byte values 0-255 to printable Unicode characters. Printable Latin-1
     * bytes map to themselves, the rest are shifted above 255.
     */
    private static Map<Integer, Character> buildByteEncoder() {
        Map<Integer, Character> be = new LinkedHashMap<>();
        for (int b = 0; b < 256; b++) {
            if ((b >= '!' && b <= '~') || (b >= 161 && b <= 172) || (b >= 174 && b <= 255)) {
                be.put(b, (char) b);
            }
        }
        int n = 0;
        for (int b = 0; b < 256; b++) {
            if (!be.containsKey(b)) {
                be.put(b, (char) (256 + n));
                n++;
            }
        }
        return be;
    }

    private static Map<Character, Integer> buildByteDecoder() {
        Map<Character, Integer> bd = new HashMap<>();
        for (Map.Entry<Integer, Character> entry : BYTE_ENCODER.entrySet()) {
            bd.put(entry.getValue(), entry.getKey());
        }
        return bd;
    }
}
