package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.model.BackendsResponse.BackendDescriptor;
import reactor.core.publisher.Flux;

/**
 * Produces an answer for a question and its retrieved context. Failures of any kind are reported
 * as {@link com.netcourier.docqa.service.error.GenerationBackendException}; an empty answer is a
 * valid result.
 */
public interface GenerationBackend {

    String name();

    String generate(GenerationRequest request);

    /**
     * Finite, single-use fragment stream. Cancelling the subscription aborts the underlying call.
     */
    Flux<String> stream(GenerationRequest request);

    BackendDescriptor describe();
}
