package com.netcourier.docqa.service.generation;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Answers every request with a canned response and keeps the request bodies it saw.
 */
public class StubExchange implements ExchangeFunction {

    private final Supplier<Mono<ClientResponse>> response;
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    private StubExchange(Supplier<Mono<ClientResponse>> response) {
        this.response = response;
    }

    public static StubExchange respondingWith(HttpStatus status, String contentType, String body) {
        return new StubExchange(() -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(body)
                .build()));
    }

    public static StubExchange hanging() {
        return new StubExchange(Mono::never);
    }

    public WebClient webClient() {
        return WebClient.builder()
                .baseUrl("http://backend.test")
                .exchangeFunction(this)
                .build();
    }

    public List<String> bodies() {
        return bodies;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        MockClientHttpRequest captured = new MockClientHttpRequest(request.method(), request.url());
        return request.writeTo(captured, ExchangeStrategies.withDefaults())
                .then(Mono.defer(captured::getBodyAsString))
                .defaultIfEmpty("")
                .doOnNext(bodies::add)
                .then(Mono.defer(response));
    }
}
