package com.netcourier.docqa.service.vector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for a remote vector store, plugged into a {@link WebClient} as its exchange function.
 */
abstract class FakeStoreExchange implements ExchangeFunction {

    final ObjectMapper objectMapper = new ObjectMapper();
    final List<String> requests = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger failuresToInject = new AtomicInteger();

    WebClient webClient() {
        return WebClient.builder()
                .baseUrl("http://store.test")
                .exchangeFunction(this)
                .build();
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        HttpMethod method = request.method();
        String path = request.url().getPath();
        requests.add(method.name() + " " + path);
        if (failuresToInject.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
            return Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
        }
        return readBody(request).map(body -> handle(method, path, body));
    }

    abstract ClientResponse handle(HttpMethod method, String path, JsonNode body);

    ClientResponse json(Object body) {
        try {
            return ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(objectMapper.writeValueAsString(body))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    static ClientResponse status(HttpStatus status) {
        return ClientResponse.create(status).build();
    }

    static double cosine(JsonNode a, JsonNode b) {
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i).asDouble();
            double y = b.get(i).asDouble();
            dot += x * y;
            aNorm += x * x;
            bNorm += y * y;
        }
        return aNorm == 0d || bNorm == 0d ? 0d : dot / Math.sqrt(aNorm * bNorm);
    }

    private Mono<JsonNode> readBody(ClientRequest request) {
        MockClientHttpRequest captured = new MockClientHttpRequest(request.method(), request.url());
        return request.writeTo(captured, ExchangeStrategies.withDefaults())
                .then(Mono.defer(() -> captured.getBodyAsString()))
                .defaultIfEmpty("")
                .map(this::parse);
    }

    private JsonNode parse(String body) {
        if (body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Request body is not JSON: " + body, e);
        }
    }
}
