package com.knowledgecore.embedding;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic feature-hashing model over word tokens and character trigrams. Needs no model files, so
 * it serves offline setups and tests. Shared vocabulary produces high cosine similarity; semantics beyond
 * lexical overlap are not captured.
 *
 * <p>Each word contributes a {@code tok:} feature at full weight and one {@code tri:} feature per
 * character trigram at 0.35 weight. Features land in a bucket chosen by their string hash, so
 * the vectors are stable across JVMs and releases for a fixed dimension.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private static final String VERSION = "hashing-trigram-v1";
    private static final Pattern WORD_BOUNDARY = Pattern.compile("\\W+");
    private static final int TRIGRAM = 3;
    private static final float TOKEN_WEIGHT = 1.0f;
    private static final float TRIGRAM_WEIGHT = 0.35f;

    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String word : WORD_BOUNDARY.split(text.toLowerCase(Locale.ROOT))) {
            if (!word.isEmpty()) {
                accumulateWord(vector, word);
            }
        }
        return EmbeddingGenerator.normalize(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION;
    }

    private void accumulateWord(float[] vector, String word) {
        vector[bucket("tok:" + word)] += TOKEN_WEIGHT;
        for (int end = TRIGRAM; end <= word.length(); end++) {
            vector[bucket("tri:" + word.substring(end - TRIGRAM, end))] += TRIGRAM_WEIGHT;
        }
    }

    private int bucket(String feature) {
        return Math.floorMod(feature.hashCode(), dimension);
    }
}
