package com.netcourier.docqa.service.retrieval;

import com.netcourier.docqa.persistence.entity.DocumentChunkEntity;
import com.netcourier.docqa.persistence.repository.DocumentChunkRepository;
import com.netcourier.docqa.service.embedding.EmbeddingsClient;
import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.vector.InMemoryVectorIndex;
import com.netcourier.docqa.service.vector.SearchFilters;
import com.netcourier.docqa.service.vector.VectorMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultRetrievalServiceTest {

    private static final float[] QUERY = {1f, 0f, 0f, 0f};

    @Mock
    private EmbeddingsClient embeddingsClient;

    @Mock
    private DocumentChunkRepository chunkRepository;

    private final Map<String, DocumentChunkEntity> chunkTexts = new ConcurrentHashMap<>();

    private InMemoryVectorIndex vectorIndex;
    private DefaultRetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        vectorIndex = new InMemoryVectorIndex(4);
        retrievalService = new DefaultRetrievalService(embeddingsClient, vectorIndex, chunkRepository);
        lenient().when(embeddingsClient.embed(anyString())).thenReturn(QUERY);
        lenient().when(chunkRepository.findByOwnerIdAndChunkIdIn(anyString(), anyCollection())).thenAnswer(invocation -> {
            String owner = invocation.getArgument(0);
            Collection<String> ids = invocation.getArgument(1);
            return chunkTexts.values().stream()
                    .filter(chunk -> chunk.getOwnerId().equals(owner) && ids.contains(chunk.getChunkId()))
                    .toList();
        });
    }

    @Test
    void returnsClosestChunksMostSimilarFirst() {
        store("alice", 1, 1, 0.4, "Chunk one text.");
        store("alice", 1, 2, 0.9, "Chunk two text.");
        store("alice", 1, 3, 0.3, "Chunk three text.");

        ContextBundle bundle = retrievalService.retrieve("alice", "question?", new RetrievalOptions(2, 4000));

        assertThat(bundle.chunks()).extracting(ContextChunk::chunkIndex).containsExactly(2, 1);
        assertThat(bundle.chunkIds()).containsExactly("1-2", "1-1");
        assertThat(bundle.chunks().get(0).text()).isEqualTo("Chunk two text.");
        assertThat(bundle.totalLength()).isEqualTo("Chunk two text.".length() + "Chunk one text.".length());
    }

    @Test
    void emptyIndexYieldsEmptyBundle() {
        ContextBundle bundle = retrievalService.retrieve("alice", "anything?", RetrievalOptions.defaults());

        assertThat(bundle.isEmpty()).isTrue();
        assertThat(bundle.question()).isEqualTo("anything?");
        assertThat(bundle.totalLength()).isZero();
    }

    @Test
    void neverReturnsAnotherOwnersChunks() {
        store("bob", 7, 0, 0.99, "Bob's secret.");

        assertThat(retrievalService.retrieve("alice", "secret?", RetrievalOptions.defaults()).isEmpty()).isTrue();
    }

    @Test
    void stopsAtFirstChunkThatExceedsBudget() {
        store("alice", 1, 0, 0.9, "x".repeat(30));
        store("alice", 1, 1, 0.8, "y".repeat(30));
        store("alice", 1, 2, 0.7, "z".repeat(5));

        ContextBundle bundle = retrievalService.retrieve("alice", "q", new RetrievalOptions(5, 40));

        assertThat(bundle.chunkIds()).containsExactly("1-0");
        assertThat(bundle.totalLength()).isEqualTo(30);
    }

    @Test
    void skipsMatchesWithoutStoredText() {
        store("alice", 1, 0, 0.9, "Kept.");
        vectorIndex.add("alice", "9-0", withCosine(0.95), new VectorMetadata(9, 0));

        ContextBundle bundle = retrievalService.retrieve("alice", "q", RetrievalOptions.defaults());

        assertThat(bundle.chunkIds()).containsExactly("1-0");
    }

    @Test
    void restrictsToRequestedDocuments() {
        store("alice", 1, 0, 0.9, "From document one.");
        store("alice", 2, 0, 0.5, "From document two.");

        ContextBundle bundle = retrievalService.retrieve("alice", "q",
                new RetrievalOptions(5, 4000, SearchFilters.documents(List.of(2L))));

        assertThat(bundle.chunkIds()).containsExactly("2-0");
    }

    @Test
    void rejectsBlankQuestionAndInvalidOptions() {
        assertThatThrownBy(() -> retrievalService.retrieve("alice", " ", RetrievalOptions.defaults()))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> new RetrievalOptions(0, 100))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> new RetrievalOptions(3, 0))
                .isInstanceOf(InvalidParametersException.class);
        verifyNoInteractions(embeddingsClient);
    }

    @Test
    void budgetKeepsOrderAndCountsCharacters() {
        ContextBundle bundle = new ContextBudget(10).assemble("q", List.of(
                new ContextChunk("1-0", 1, 0, "abcd", 0.9),
                new ContextChunk("1-1", 1, 1, "efgh", 0.8),
                new ContextChunk("1-2", 1, 2, "ijk", 0.7)));

        assertThat(bundle.chunkIds()).containsExactly("1-0", "1-1");
        assertThat(bundle.totalLength()).isEqualTo(8);
    }

    private void store(String owner, long documentId, int chunkIndex, double cosine, String text) {
        String chunkId = documentId + "-" + chunkIndex;
        vectorIndex.add(owner, chunkId, withCosine(cosine), new VectorMetadata(documentId, chunkIndex));
        chunkTexts.put(owner + "/" + chunkId, new DocumentChunkEntity(chunkId, documentId, owner, chunkIndex, text,
                "hash", 0, text.length(), 500, 50));
    }

    private static float[] withCosine(double cosine) {
        return new float[]{(float) cosine, (float) Math.sqrt(1d - cosine * cosine), 0f, 0f};
    }
}
