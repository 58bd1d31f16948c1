package com.netcourier.docqa.service.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Local feature-hashing model: each lower-cased word token is hashed into one of
 * {@code dimensions} buckets and the resulting count vector is L2-normalised.
 */
public class HashingEmbeddingsClient implements EmbeddingsClient {

    public static final String MODEL = "feature-hashing";

    private final int dimensions;

    public HashingEmbeddingsClient(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            vector[Math.floorMod(token.hashCode(), dimensions)] += 1f;
        }
        double norm = 0d;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0d) {
            float scale = (float) (1d / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    @Override
    public List<float[]> embedMany(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String model() {
        return MODEL;
    }
}
