package com.wikigen.embedding;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic local embedding model for markdown. Each line contributes its words,
 * adjacent word pairs and boundary-padded character trigrams through signed feature
 * hashing. Header lines count double, lines inside fenced code count half. The
 * result is L2-normalized. Needs no model download, so it is the default provider.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    private static final String MODEL = "hashing-v1";
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "do", "for", "from", "how", "i", "if", "in",
            "is", "it", "of", "on", "or", "so", "that", "the", "this", "to", "was", "what", "when", "with", "you");

    private static final float HEADER_WEIGHT = 2.0f;
    private static final float PROSE_WEIGHT = 1.0f;
    private static final float CODE_WEIGHT = 0.5f;
    private static final float PAIR_FACTOR = 0.5f;
    private static final float TRIGRAM_FACTOR = 0.25f;

    private static final int FNV_OFFSET = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        boolean inFence = false;
        for (String line : LINE_BREAK.split(text)) {
            String trimmed = line.strip();
            if (trimmed.startsWith("```")) {
                inFence = !inFence;
                continue;
            }
            float weight;
            if (inFence) {
                weight = CODE_WEIGHT;
            } else if (trimmed.startsWith("#")) {
                weight = HEADER_WEIGHT;
            } else {
                weight = PROSE_WEIGHT;
            }
            addLine(vector, trimmed.toLowerCase(Locale.ROOT), weight);
        }

        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return MODEL;
    }

    private static void addLine(float[] vector, String line, float weight) {
        String previous = null;
        for (String word : NON_WORD.split(line)) {
            if (word.isEmpty() || STOP_WORDS.contains(word)) {
                continue;
            }
            addFeature(vector, "w:" + word, weight);
            if (previous != null) {
                addFeature(vector, "p:" + previous + ' ' + word, weight * PAIR_FACTOR);
            }
            String padded = '<' + word + '>';
            for (int i = 0; i + 3 <= padded.length(); i++) {
                addFeature(vector, "c:" + padded.substring(i, i + 3), weight * TRIGRAM_FACTOR);
            }
            previous = word;
        }
    }

    // The top hash bit picks the sign so bucket collisions tend to cancel out.
    private static void addFeature(float[] vector, String feature, float weight) {
        int hash = fnv1a(feature);
        int bucket = Math.floorMod(hash, vector.length);
        vector[bucket] += hash < 0 ? -weight : weight;
    }

    private static int fnv1a(String feature) {
        int hash = FNV_OFFSET;
        for (byte b : feature.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xFF;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static void normalize(float[] vector) {
        double sumOfSquares = 0;
        for (float value : vector) {
            sumOfSquares += (double) value * value;
        }
        if (sumOfSquares == 0) {
            return;
        }
        float scale = (float) (1.0 / Math.sqrt(sumOfSquares));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }
}
