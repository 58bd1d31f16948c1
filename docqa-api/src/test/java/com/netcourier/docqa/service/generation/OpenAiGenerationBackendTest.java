package com.netcourier.docqa.service.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.docqa.service.error.GenerationBackendException;
import com.netcourier.docqa.service.generation.openai.OpenAiChatClient;
import com.netcourier.docqa.service.generation.openai.OpenAiChatException;
import com.netcourier.docqa.service.retrieval.ContextBundle;
import com.netcourier.docqa.service.retrieval.ContextChunk;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiGenerationBackendTest {

    private static final GenerationOptions DEFAULTS = new GenerationOptions(0.3, 1.0, 500);

    private final GenerationRequest request = new GenerationRequest("How long do refunds take?",
            new ContextBundle("How long do refunds take?",
                    List.of(new ContextChunk("1-0", 1, 0, "Refunds take five days.", 0.8)), 23));

    @Test
    void completesWithSystemAndUserMessages() {
        StubExchange exchange = StubExchange.respondingWith(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Five days.\"},\"finish_reason\":\"stop\"}]}");

        assertThat(backend(exchange, true).generate(request)).isEqualTo("Five days.");
        assertThat(exchange.bodies().get(0)).contains("\"role\":\"system\"", "\"role\":\"user\"",
                "\"model\":\"gpt-3.5-turbo\"", "\"max_tokens\":500");
    }

    @Test
    void streamsContentDeltasUntilDone() {
        String events = "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"Five\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\" days.\"}}]}\n\n"
                + "data: [DONE]\n\n";
        StubExchange exchange = StubExchange.respondingWith(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM_VALUE, events);

        StepVerifier.create(backend(exchange, true).stream(request))
                .expectNext("Five", " days.")
                .verifyComplete();
    }

    @Test
    void missingApiKeyFailsWithoutCalling() {
        StubExchange exchange = StubExchange.hanging();
        OpenAiGenerationBackend backend = backend(exchange, false);

        assertThatThrownBy(() -> backend.generate(request)).isInstanceOf(OpenAiChatException.class);
        StepVerifier.create(backend.stream(request)).expectError(GenerationBackendException.class).verify();
        assertThat(exchange.bodies()).isEmpty();
        assertThat(backend.describe().configured()).isFalse();
    }

    @Test
    void rejectedRequestBecomesBackendFailure() {
        StubExchange exchange = StubExchange.respondingWith(HttpStatus.UNAUTHORIZED, MediaType.APPLICATION_JSON_VALUE,
                "{\"error\":{\"message\":\"bad key\"}}");

        assertThatThrownBy(() -> backend(exchange, true).generate(request))
                .isInstanceOf(OpenAiChatException.class)
                .hasMessage("Chat completion returned 401");
    }

    private static OpenAiGenerationBackend backend(StubExchange exchange, boolean configured) {
        OpenAiChatClient client = new OpenAiChatClient(exchange.webClient(), new ObjectMapper(), Duration.ofSeconds(2));
        return new OpenAiGenerationBackend(client, "gpt-3.5-turbo", configured, DEFAULTS);
    }
}
