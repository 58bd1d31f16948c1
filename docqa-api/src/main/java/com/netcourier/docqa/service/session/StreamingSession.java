package com.netcourier.docqa.service.session;

import com.netcourier.docqa.model.StreamEvent;
import com.netcourier.docqa.persistence.entity.DeliveryMode;
import com.netcourier.docqa.service.error.ErrorKind;
import com.netcourier.docqa.service.error.RagException;
import com.netcourier.docqa.service.generation.FallbackGenerationChain;
import com.netcourier.docqa.service.generation.GenerationOverrides;
import com.netcourier.docqa.service.generation.GenerationRequest;
import com.netcourier.docqa.service.generation.GenerationSignal;
import com.netcourier.docqa.service.qa.QueryHistoryService;
import com.netcourier.docqa.service.retrieval.ContextBundle;
import com.netcourier.docqa.service.retrieval.RetrievalOptions;
import com.netcourier.docqa.service.retrieval.RetrievalService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One streamed answer: retrieval, then generation through the fallback chain, surfaced as an ordered
 * {@link StreamEvent} sequence. The session is single use. Every state change goes through
 * {@link SessionTransitions} with a compare-and-set, so exactly one terminal state is ever reached.
 * The answer is logged to history only after the session has moved to {@link SessionState#COMPLETED};
 * a failed write then surfaces as an error event in place of the completion.
 */
public class StreamingSession {

    private static final Logger log = LoggerFactory.getLogger(StreamingSession.class);

    private final String ownerId;
    private final String question;
    private final RetrievalOptions retrievalOptions;
    private final GenerationOverrides overrides;
    private final RetrievalService retrievalService;
    private final FallbackGenerationChain generationChain;
    private final QueryHistoryService historyService;
    private final MeterRegistry meterRegistry;
    private final int bufferSize;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.INIT);
    private final Sinks.Empty<Void> cancelled = Sinks.empty();

    public StreamingSession(String ownerId,
                            String question,
                            RetrievalOptions retrievalOptions,
                            GenerationOverrides overrides,
                            RetrievalService retrievalService,
                            FallbackGenerationChain generationChain,
                            QueryHistoryService historyService,
                            MeterRegistry meterRegistry,
                            int bufferSize) {
        this.ownerId = ownerId;
        this.question = question;
        this.retrievalOptions = retrievalOptions;
        this.overrides = overrides;
        this.retrievalService = retrievalService;
        this.generationChain = generationChain;
        this.historyService = historyService;
        this.meterRegistry = meterRegistry;
        this.bufferSize = bufferSize;
    }

    public SessionState state() {
        return state.get();
    }

    /**
     * Stops the session. No event follows and no collaborator is called afterwards; an in-flight
     * generation is cancelled at its next fragment boundary.
     */
    public void cancel() {
        if (transition(SessionEvent.CANCEL)) {
            log.debug("Session for owner {} cancelled", ownerId);
            cancelled.tryEmitEmpty();
        }
    }

    public Flux<StreamEvent> events() {
        return Flux.defer(() -> {
            if (!transition(SessionEvent.START)) {
                if (state.get() == SessionState.CANCELLED) {
                    return Flux.empty();
                }
                return Flux.error(new IllegalStateException("Session already started"));
            }
            long startedAt = System.nanoTime();
            Flux<StreamEvent> pipeline = Flux.concat(
                    Mono.just(StreamEvent.status("searching")),
                    retrieve().flatMapMany(bundle -> generate(bundle, startedAt)));
            return pipeline
                    .onErrorResume(this::failed)
                    .takeUntilOther(cancelled.asMono())
                    .doOnCancel(this::cancel);
        });
    }

    private Mono<ContextBundle> retrieve() {
        return Mono.fromCallable(() -> retrievalService.retrieve(ownerId, question, retrievalOptions))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Flux<StreamEvent> generate(ContextBundle bundle, long startedAt) {
        if (!transition(SessionEvent.CONTEXT_READY)) {
            return Flux.empty();
        }
        StringBuilder answer = new StringBuilder();
        AtomicReference<String> answeredBy = new AtomicReference<>();
        Flux<StreamEvent> fragments = generationChain.stream(new GenerationRequest(question, bundle, overrides))
                .limitRate(bufferSize)
                .handle((GenerationSignal signal, SynchronousSink<StreamEvent> sink) -> {
                    switch (signal.type()) {
                        case FRAGMENT -> {
                            answer.append(signal.content());
                            sink.next(StreamEvent.chunk(signal.content()));
                        }
                        case FALLBACK -> sink.next(StreamEvent.status("fallback: " + signal.hop()));
                        case COMPLETED -> answeredBy.set(signal.backend());
                    }
                });
        Mono<StreamEvent> completion = Mono.fromCallable(() -> complete(bundle, answer.toString(), answeredBy.get(), startedAt))
                .subscribeOn(Schedulers.boundedElastic());
        return Flux.concat(Mono.just(StreamEvent.status("generating")), fragments, completion);
    }

    private StreamEvent complete(ContextBundle bundle, String answer, String backend, long startedAt) {
        if (!transition(SessionEvent.FINISH)) {
            return null;
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        try {
            historyService.record(ownerId, question, answer, elapsedMillis, bundle.chunkIds(), backend, DeliveryMode.STREAM);
        } catch (RuntimeException e) {
            return errorEvent(e);
        }
        meterRegistry.timer("rag.qa.duration", "mode", "stream").record(Duration.ofMillis(elapsedMillis));
        log.info("Streamed answer for owner {} from {} in {} ms using {} chunks",
                ownerId, backend, elapsedMillis, bundle.chunks().size());
        return StreamEvent.complete(elapsedMillis, bundle.chunks().size(), backend);
    }

    private Mono<StreamEvent> failed(Throwable error) {
        if (!transition(SessionEvent.FAIL)) {
            return Mono.empty();
        }
        return Mono.just(errorEvent(error));
    }

    private StreamEvent errorEvent(Throwable error) {
        if (error instanceof RagException ragException) {
            log.warn("Session for owner {} failed with {}: {}", ownerId, ragException.kind(), error.getMessage());
            return StreamEvent.error(ragException.kind().name(), error.getMessage());
        }
        log.error("Session for owner {} failed unexpectedly", ownerId, error);
        return StreamEvent.error(ErrorKind.INTERNAL.name(), "Unexpected error while answering");
    }

    private boolean transition(SessionEvent event) {
        while (true) {
            SessionState current = state.get();
            SessionState next = SessionTransitions.next(current, event).orElse(null);
            if (next == null) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                if (next.isTerminal()) {
                    meterRegistry.counter("rag.session.outcomes", "state", next.name().toLowerCase(Locale.ROOT)).increment();
                }
                return true;
            }
        }
    }
}
