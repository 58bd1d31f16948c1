package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.model.BackendsResponse.BackendDescriptor;
import com.netcourier.docqa.service.error.GenerationBackendException;
import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.retrieval.ContextBundle;
import com.netcourier.docqa.service.retrieval.ContextChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FallbackGenerationChainTest {

    private final GenerationRequest request = new GenerationRequest("What is the refund window?",
            new ContextBundle("What is the refund window?",
                    List.of(new ContextChunk("1-0", 1, 0, "Refunds are accepted for 30 days.", 0.9)), 33));

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void firstHealthyBackendAnswers() {
        ScriptedBackend primary = ScriptedBackend.answering("ollama", "30 days.");
        ScriptedBackend secondary = ScriptedBackend.answering("extractive", "unused");
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(primary, secondary), meterRegistry);

        GenerationResult result = chain.generate(request);

        assertThat(result.text()).isEqualTo("30 days.");
        assertThat(result.backend()).isEqualTo("ollama");
        assertThat(result.fallbacks()).isEmpty();
        assertThat(secondary.generateCalls.get()).isZero();
    }

    @Test
    void failingBackendHandsOverToTheNext() {
        ScriptedBackend primary = ScriptedBackend.failing("ollama", new GenerationBackendException("Ollama call failed"));
        ScriptedBackend openai = ScriptedBackend.failing("openai", new GenerationBackendException("No API key"));
        ScriptedBackend extractive = ScriptedBackend.answering("extractive", "Refunds are accepted for 30 days.");
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(primary, openai, extractive), meterRegistry);

        GenerationResult result = chain.generate(request);

        assertThat(result.backend()).isEqualTo("extractive");
        assertThat(result.fallbacks()).containsExactly("ollama -> openai", "openai -> extractive");
        assertThat(meterRegistry.counter("rag.generation.fallbacks", "from", "ollama", "to", "openai").count())
                .isEqualTo(1.0);
    }

    @Test
    void exhaustedChainReportsBackendFailure() {
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(
                ScriptedBackend.failing("ollama", new GenerationBackendException("down")),
                ScriptedBackend.failing("openai", new IllegalStateException("boom"))), meterRegistry);

        assertThatThrownBy(() -> chain.generate(request))
                .isInstanceOf(GenerationBackendException.class)
                .hasMessage("All generation backends failed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyCompletionIsAnAnswerNotAFailure() {
        ScriptedBackend primary = ScriptedBackend.answering("ollama", "");
        ScriptedBackend secondary = ScriptedBackend.answering("extractive", "unused");
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(primary, secondary), meterRegistry);

        GenerationResult result = chain.generate(request);

        assertThat(result.text()).isEmpty();
        assertThat(result.backend()).isEqualTo("ollama");
        assertThat(result.fallbacks()).isEmpty();
        assertThat(secondary.generateCalls.get()).isZero();
    }

    @Test
    void emptyStreamCompletesOnThePrimary() {
        ScriptedBackend primary = new ScriptedBackend("ollama", () -> "", Flux::empty);
        ScriptedBackend secondary = ScriptedBackend.answering("extractive", "unused");
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(primary, secondary), meterRegistry);

        StepVerifier.create(chain.stream(request))
                .assertNext(signal -> {
                    assertThat(signal.type()).isEqualTo(GenerationSignal.Type.COMPLETED);
                    assertThat(signal.backend()).isEqualTo("ollama");
                })
                .verifyComplete();
        assertThat(secondary.streamSubscriptions.get()).isZero();
    }

    @Test
    void invalidParametersAreNotRetriedOnAnotherBackend() {
        ScriptedBackend secondary = ScriptedBackend.answering("extractive", "unused");
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(
                ScriptedBackend.failing("ollama", new InvalidParametersException("topP must be in (0, 1]")),
                secondary), meterRegistry);

        assertThatThrownBy(() -> chain.generate(request)).isInstanceOf(InvalidParametersException.class);
        assertThat(secondary.generateCalls.get()).isZero();
    }

    @Test
    void streamFallsBackWhenPrimaryTimesOutBeforeFirstFragment() {
        ScriptedBackend primary = new ScriptedBackend("ollama", () -> "unused",
                () -> Flux.<String>never().timeout(Duration.ofMillis(50)));
        ScriptedBackend fallback = ScriptedBackend.answering("extractive", "Refunds ", "take 30 days.");
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(primary, fallback), meterRegistry);

        StepVerifier.create(chain.stream(request))
                .assertNext(signal -> {
                    assertThat(signal.type()).isEqualTo(GenerationSignal.Type.FALLBACK);
                    assertThat(signal.hop()).isEqualTo("ollama -> extractive");
                })
                .assertNext(signal -> assertThat(signal.content()).isEqualTo("Refunds "))
                .assertNext(signal -> assertThat(signal.content()).isEqualTo("take 30 days."))
                .assertNext(signal -> {
                    assertThat(signal.type()).isEqualTo(GenerationSignal.Type.COMPLETED);
                    assertThat(signal.backend()).isEqualTo("extractive");
                })
                .verifyComplete();
    }

    @Test
    void streamFailureAfterPartialOutputEndsWithoutFallback() {
        ScriptedBackend primary = new ScriptedBackend("ollama", () -> "unused",
                () -> Flux.just("Refunds ").concatWith(Flux.error(new GenerationBackendException("connection reset"))));
        ScriptedBackend fallback = ScriptedBackend.answering("extractive", "unused");
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(primary, fallback), meterRegistry);

        StepVerifier.create(chain.stream(request))
                .assertNext(signal -> assertThat(signal.type()).isEqualTo(GenerationSignal.Type.FRAGMENT))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(GenerationBackendException.class)
                        .hasMessageContaining("after partial output"))
                .verify();
        assertThat(fallback.streamSubscriptions.get()).isZero();
    }

    @Test
    void streamOfExhaustedChainErrors() {
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(
                ScriptedBackend.failing("ollama", new GenerationBackendException("down"))), meterRegistry);

        StepVerifier.create(chain.stream(request))
                .expectError(GenerationBackendException.class)
                .verify();
    }

    @Test
    void describesBackendsInChainOrder() {
        FallbackGenerationChain chain = new FallbackGenerationChain(List.of(
                ScriptedBackend.answering("ollama", "a"), ScriptedBackend.answering("extractive", "b")), meterRegistry);

        assertThat(chain.backends()).extracting(BackendDescriptor::name).containsExactly("ollama", "extractive");
    }

    @Test
    void requiresAtLeastOneBackend() {
        assertThatThrownBy(() -> new FallbackGenerationChain(List.of(), meterRegistry))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
