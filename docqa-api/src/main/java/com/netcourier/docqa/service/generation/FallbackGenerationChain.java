package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.model.BackendsResponse.BackendDescriptor;
import com.netcourier.docqa.service.error.GenerationBackendException;
import com.netcourier.docqa.service.error.InvalidParametersException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered list of backends tried one after another. A failing backend hands the request to the
 * next one and leaves one fallback record behind. When streaming, a hop is only possible before the
 * first fragment went out; a failure after that ends the stream.
 */
public class FallbackGenerationChain {

    private static final Logger log = LoggerFactory.getLogger(FallbackGenerationChain.class);

    private final List<GenerationBackend> backends;
    private final MeterRegistry meterRegistry;

    public FallbackGenerationChain(List<GenerationBackend> backends, MeterRegistry meterRegistry) {
        if (backends == null || backends.isEmpty()) {
            throw new IllegalArgumentException("At least one generation backend is required");
        }
        this.backends = List.copyOf(backends);
        this.meterRegistry = meterRegistry;
    }

    public GenerationResult generate(GenerationRequest request) {
        List<String> fallbacks = new ArrayList<>();
        RuntimeException lastFailure = null;
        for (int position = 0; position < backends.size(); position++) {
            GenerationBackend backend = backends.get(position);
            try {
                String text = backend.generate(request);
                return new GenerationResult(text == null ? "" : text, backend.name(), fallbacks);
            } catch (InvalidParametersException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                lastFailure = ex;
                if (position + 1 < backends.size()) {
                    fallbacks.add(recordFallback(backend, backends.get(position + 1), ex).hop());
                }
            }
        }
        throw exhausted(lastFailure);
    }

    public Flux<GenerationSignal> stream(GenerationRequest request) {
        return streamFrom(0, request);
    }

    public List<BackendDescriptor> backends() {
        return backends.stream().map(GenerationBackend::describe).toList();
    }

    private Flux<GenerationSignal> streamFrom(int position, GenerationRequest request) {
        GenerationBackend backend = backends.get(position);
        return Flux.defer(() -> {
            AtomicBoolean delivered = new AtomicBoolean();
            return Flux.defer(() -> backend.stream(request))
                    .map(fragment -> {
                        delivered.set(true);
                        return GenerationSignal.fragment(backend.name(), fragment);
                    })
                    .concatWith(Mono.fromSupplier(() -> GenerationSignal.completed(backend.name())))
                    .onErrorResume(ex -> {
                        if (ex instanceof InvalidParametersException) {
                            return Flux.error(ex);
                        }
                        if (delivered.get()) {
                            log.warn("Backend {} failed mid-stream: {}", backend.name(), ex.toString());
                            return Flux.error(new GenerationBackendException(
                                    "Backend " + backend.name() + " failed after partial output", ex));
                        }
                        if (position + 1 >= backends.size()) {
                            return Flux.error(exhausted(ex));
                        }
                        GenerationSignal hop = recordFallback(backend, backends.get(position + 1), ex);
                        return Flux.concat(Mono.just(hop), streamFrom(position + 1, request));
                    });
        });
    }

    private GenerationSignal recordFallback(GenerationBackend from, GenerationBackend to, Throwable cause) {
        log.warn("Generation backend {} failed, falling back to {}: {}", from.name(), to.name(), cause.getMessage());
        meterRegistry.counter("rag.generation.fallbacks", "from", from.name(), "to", to.name()).increment();
        return GenerationSignal.fallback(from.name(), to.name());
    }

    private GenerationBackendException exhausted(Throwable lastFailure) {
        log.error("All {} generation backends failed", backends.size());
        return new GenerationBackendException("All generation backends failed", lastFailure);
    }
}
