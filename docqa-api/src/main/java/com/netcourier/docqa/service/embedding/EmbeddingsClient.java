package com.netcourier.docqa.service.embedding;

import java.util.List;

/**
 * Maps text to fixed-dimension vectors. Identical text and model always give the same vector.
 */
public interface EmbeddingsClient {

    float[] embed(String text);

    /**
     * Embeds a batch, preserving input order.
     */
    List<float[]> embedMany(List<String> texts);

    int dimensions();

    String model();
}
