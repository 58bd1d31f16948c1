package com.netcourier.docqa.service.embedding;

import com.netcourier.docqa.service.error.EmbeddingUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for a sentence-transformers style {@code POST /embed} service. Every call is bounded by
 * {@code timeout} and retried once with backoff before surfacing {@link EmbeddingUnavailableException}.
 */
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;
    private final String model;
    private final int dimensions;
    private final Duration timeout;
    private final Duration retryBackoff;

    public WebClientEmbeddingsClient(WebClient embeddingsWebClient,
                                     String model,
                                     int dimensions,
                                     Duration timeout,
                                     Duration retryBackoff) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.model = model;
        this.dimensions = dimensions;
        this.timeout = timeout;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public float[] embed(String text) {
        return embedMany(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedMany(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        EmbedResponse response;
        try {
            response = embeddingsWebClient.post()
                    .uri("/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbedRequest(texts, model))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(timeout)
                    .retryWhen(Retry.backoff(1, retryBackoff))
                    .onErrorResume(throwable -> {
                        log.warn("Embeddings service call failed: {}", throwable.getMessage());
                        return Mono.error(new EmbeddingUnavailableException("Failed to compute embeddings", throwable));
                    })
                    .block();
        } catch (EmbeddingUnavailableException ex) {
            throw ex;
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Failed to compute embeddings", e);
        }
        if (response == null || response.vectors() == null || response.vectors().size() != texts.size()) {
            throw new EmbeddingUnavailableException("Embeddings service returned an unexpected number of vectors");
        }
        List<float[]> vectors = new ArrayList<>(response.vectors().size());
        for (List<Double> values : response.vectors()) {
            if (values.size() != dimensions) {
                throw new EmbeddingUnavailableException("Embeddings service returned " + values.size()
                        + " dimensions, expected " + dimensions);
            }
            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String model() {
        return model;
    }

    private record EmbedRequest(List<String> texts, String model) {}

    private record EmbedResponse(List<List<Double>> vectors, String model, int dimensions) {}
}
