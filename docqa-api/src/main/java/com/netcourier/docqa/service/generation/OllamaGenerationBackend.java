package com.netcourier.docqa.service.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcourier.docqa.model.BackendsResponse.BackendDescriptor;
import com.netcourier.docqa.service.error.GenerationBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local model served by Ollama's {@code /api/generate}. Streaming reads the newline-delimited JSON
 * frames Ollama emits; {@code timeout} bounds the whole call for {@link #generate} and every gap
 * between frames for {@link #stream}.
 */
public class OllamaGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaGenerationBackend.class);

    public static final String NAME = "ollama";

    private final WebClient ollamaWebClient;
    private final String model;
    private final Duration timeout;
    private final GenerationOptions defaults;

    public OllamaGenerationBackend(WebClient ollamaWebClient, String model, Duration timeout, GenerationOptions defaults) {
        this.ollamaWebClient = ollamaWebClient;
        this.model = model;
        this.timeout = timeout;
        this.defaults = defaults;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(GenerationRequest request) {
        if (request.context().isEmpty()) {
            return PromptBuilder.NO_INFORMATION;
        }
        try {
            GenerateResponse response = ollamaWebClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(request, false))
                    .retrieve()
                    .bodyToMono(GenerateResponse.class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.response() == null) {
                throw new GenerationBackendException("Ollama returned no response field");
            }
            return response.response().strip();
        } catch (GenerationBackendException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw wrap(ex);
        }
    }

    @Override
    public Flux<String> stream(GenerationRequest request) {
        if (request.context().isEmpty()) {
            return Flux.just(PromptBuilder.NO_INFORMATION);
        }
        return ollamaWebClient.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_NDJSON)
                .bodyValue(payload(request, true))
                .retrieve()
                .bodyToFlux(GenerateResponse.class)
                .timeout(timeout)
                .takeUntil(GenerateResponse::done)
                .map(frame -> {
                    if (frame.error() != null) {
                        throw new GenerationBackendException("Ollama reported: " + frame.error());
                    }
                    return frame.response() == null ? "" : frame.response();
                })
                .filter(fragment -> !fragment.isEmpty())
                .onErrorMap(ex -> ex instanceof GenerationBackendException ? ex : wrap(ex));
    }

    @Override
    public BackendDescriptor describe() {
        return new BackendDescriptor(NAME, "local", model, true);
    }

    private Map<String, Object> payload(GenerationRequest request, boolean stream) {
        GenerationOptions options = request.overrides().applyTo(defaults);
        Map<String, Object> sampling = new LinkedHashMap<>();
        sampling.put("temperature", options.temperature());
        sampling.put("top_p", options.topP());
        sampling.put("num_predict", options.maxOutputTokens());
        sampling.put("stop", PromptBuilder.STOP_SEQUENCES);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", PromptBuilder.completionPrompt(request));
        payload.put("stream", stream);
        payload.put("options", sampling);
        return payload;
    }

    private GenerationBackendException wrap(Throwable ex) {
        if (ex instanceof WebClientResponseException response) {
            log.warn("Ollama returned {}: {}", response.getStatusCode(), response.getResponseBodyAsString());
            return new GenerationBackendException("Ollama returned " + response.getStatusCode().value(), ex);
        }
        log.warn("Ollama call failed: {}", ex.toString());
        return new GenerationBackendException("Ollama call failed", ex);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(String model,
                            String response,
                            boolean done,
                            String error,
                            @JsonProperty("eval_count") Integer evalCount,
                            List<Integer> context) {}
}
