package com.netcourier.docqa.service.generation;

import com.netcourier.docqa.service.retrieval.ContextBundle;
import com.netcourier.docqa.service.retrieval.ContextChunk;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractiveGenerationBackendTest {

    private final ExtractiveGenerationBackend backend = new ExtractiveGenerationBackend(1, 3);

    @Test
    void answersWithTheSentenceSharingMostWords() {
        GenerationRequest request = request("Where is the office located?",
                "Parking is free on weekends. The office is located in Lisbon. Refunds take five days.");

        assertThat(backend.generate(request))
                .isEqualTo(ExtractiveGenerationBackend.PREFIX + " The office is located in Lisbon.");
    }

    @Test
    void keepsDocumentOrderForSeveralSentences() {
        ExtractiveGenerationBackend twoSentences = new ExtractiveGenerationBackend(2, 3);
        GenerationRequest request = request("office parking",
                "The office is in Lisbon. Lunch is at noon. Parking is behind the building.");

        assertThat(twoSentences.generate(request)).isEqualTo(ExtractiveGenerationBackend.PREFIX
                + " The office is in Lisbon. Parking is behind the building.");
    }

    @Test
    void emptyContextAnswersWithNoInformationMessage() {
        GenerationRequest request = new GenerationRequest("Anything?", ContextBundle.empty("Anything?"));

        assertThat(backend.generate(request)).isEqualTo(PromptBuilder.NO_INFORMATION);
    }

    @Test
    void streamedFragmentsConcatenateToTheWholeAnswer() {
        GenerationRequest request = request("Where is the office located?", "The office is located in Lisbon.");
        String whole = backend.generate(request);

        List<String> fragments = backend.stream(request).collectList().block();

        assertThat(fragments).isNotNull().hasSizeGreaterThan(1);
        assertThat(String.join("", fragments)).isEqualTo(whole);
        assertThat(fragments.get(0)).isEqualTo("Based on the ");
    }

    @Test
    void streamCanBeConsumedOneFragmentAtATime() {
        GenerationRequest request = request("office", "The office is located in Lisbon.");

        StepVerifier.create(backend.stream(request), 1)
                .expectNext("Based on the ")
                .thenRequest(1)
                .expectNext("relevant information I ")
                .thenCancel()
                .verify();
    }

    private static GenerationRequest request(String question, String text) {
        return new GenerationRequest(question, new ContextBundle(question,
                List.of(new ContextChunk("1-0", 1, 0, text, 0.8)), text.length()));
    }
}
