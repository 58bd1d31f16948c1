package com.netcourier.docqa.service.vector;

import com.netcourier.docqa.service.error.IndexUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Blocking bridge for vector store calls: bounded by a timeout, retried once with backoff unless
 * the store rejected the request outright, then surfaced as {@link IndexUnavailableException}.
 */
final class RemoteIndexCalls {

    private static final Logger log = LoggerFactory.getLogger(RemoteIndexCalls.class);

    private final String store;
    private final Duration timeout;
    private final Duration retryBackoff;

    RemoteIndexCalls(String store, Duration timeout, Duration retryBackoff) {
        this.store = store;
        this.timeout = timeout;
        this.retryBackoff = retryBackoff;
    }

    <T> T await(Mono<T> call, String action) {
        try {
            return call.timeout(timeout)
                    .retryWhen(Retry.backoff(1, retryBackoff).filter(RemoteIndexCalls::isTransient))
                    .onErrorResume(throwable -> {
                        log.warn("{} {} failed: {}", store, action, throwable.getMessage());
                        return Mono.error(new IndexUnavailableException(store + " " + action + " failed", throwable));
                    })
                    .block();
        } catch (IndexUnavailableException ex) {
            throw ex;
        } catch (RuntimeException e) {
            throw new IndexUnavailableException(store + " " + action + " failed", e);
        }
    }

    private static boolean isTransient(Throwable throwable) {
        return !(throwable instanceof WebClientResponseException response) || response.getStatusCode().is5xxServerError();
    }
}
