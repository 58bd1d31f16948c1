package com.netcourier.docqa.service.generation.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal client for OpenAI-compatible {@code /v1/chat/completions}, blocking and SSE streaming.
 */
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private static final String DONE = "[DONE]";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public OpenAiChatClient(WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    public ChatCompletionResponse complete(Request request) {
        try {
            ChatCompletionResponse response = webClient.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(request, false))
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.firstChoice() == null || response.firstChoice().message() == null) {
                throw new OpenAiChatException("Chat completion returned no choices");
            }
            return response;
        } catch (OpenAiChatException ex) {
            throw ex;
        } catch (WebClientResponseException ex) {
            throw logAndWrap(ex);
        } catch (RuntimeException ex) {
            log.warn("Chat completion failed: {}", ex.toString());
            throw new OpenAiChatException("Failed to invoke chat completion", ex);
        }
    }

    /**
     * Streams content deltas. Empty deltas (role announcements, finish frames) are dropped.
     */
    public Flux<String> stream(Request request) {
        return webClient.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload(request, true))
                .retrieve()
                .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .timeout(timeout)
                .map(ServerSentEvent::data)
                .filter(data -> data != null && !data.isBlank())
                .map(String::trim)
                .takeWhile(data -> !DONE.equals(data))
                .map(this::deltaContent)
                .filter(content -> !content.isEmpty())
                .onErrorMap(WebClientResponseException.class, this::logAndWrap)
                .onErrorMap(ex -> ex instanceof OpenAiChatException ? ex : new OpenAiChatException("Failed to stream chat completion", ex));
    }

    private String deltaContent(String data) {
        StreamResponse response;
        try {
            response = objectMapper.readValue(data, StreamResponse.class);
        } catch (JsonProcessingException e) {
            throw new OpenAiChatException("Malformed streaming frame", e);
        }
        if (response.choices() == null || response.choices().isEmpty()) {
            return "";
        }
        StreamDelta delta = response.choices().get(0).delta();
        return delta == null || delta.content() == null ? "" : delta.content();
    }

    private Map<String, Object> payload(Request request, boolean stream) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", stream);
        payload.put("temperature", request.temperature());
        payload.put("top_p", request.topP());
        payload.put("max_tokens", request.maxTokens());
        if (request.stop() != null && !request.stop().isEmpty()) {
            payload.put("stop", request.stop());
        }
        return payload;
    }

    private OpenAiChatException logAndWrap(WebClientResponseException exception) {
        HttpStatusCode status = exception.getStatusCode();
        log.warn("Chat completion returned {}: {}", status, exception.getResponseBodyAsString());
        return new OpenAiChatException("Chat completion returned " + status.value(), exception);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(String model,
                          List<Message> messages,
                          double temperature,
                          double topP,
                          int maxTokens,
                          List<String> stop) {
    }

    public record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatCompletionResponse(List<Choice> choices) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamResponse(List<StreamChoice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamChoice(StreamDelta delta, @JsonProperty("finish_reason") String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamDelta(String role, String content) {
    }
}
