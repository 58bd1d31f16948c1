package com.netcourier.docqa.service.retrieval;

import com.netcourier.docqa.persistence.entity.DocumentChunkEntity;
import com.netcourier.docqa.persistence.repository.DocumentChunkRepository;
import com.netcourier.docqa.service.embedding.EmbeddingsClient;
import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.vector.VectorIndex;
import com.netcourier.docqa.service.vector.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class DefaultRetrievalService implements RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(DefaultRetrievalService.class);

    private final EmbeddingsClient embeddingsClient;
    private final VectorIndex vectorIndex;
    private final DocumentChunkRepository chunkRepository;

    public DefaultRetrievalService(EmbeddingsClient embeddingsClient,
                                   VectorIndex vectorIndex,
                                   DocumentChunkRepository chunkRepository) {
        this.embeddingsClient = embeddingsClient;
        this.vectorIndex = vectorIndex;
        this.chunkRepository = chunkRepository;
    }

    @Override
    public ContextBundle retrieve(String ownerId, String question, RetrievalOptions options) {
        if (question == null || question.isBlank()) {
            throw new InvalidParametersException("Question must not be empty");
        }
        float[] queryVector = embeddingsClient.embed(question);
        List<VectorMatch> matches = vectorIndex.search(ownerId, queryVector, options.k(), options.filters());
        if (matches.isEmpty()) {
            return ContextBundle.empty(question);
        }
        Map<String, DocumentChunkEntity> texts = chunkRepository
                .findByOwnerIdAndChunkIdIn(ownerId, matches.stream().map(VectorMatch::chunkId).toList())
                .stream()
                .collect(Collectors.toMap(DocumentChunkEntity::getChunkId, Function.identity()));

        List<ContextChunk> ranked = new ArrayList<>(matches.size());
        for (VectorMatch match : matches.stream().sorted(VectorMatch.RANKING).toList()) {
            DocumentChunkEntity chunk = texts.get(match.chunkId());
            if (chunk == null) {
                log.debug("Skipping chunk {} of owner {}: no stored text", match.chunkId(), ownerId);
                continue;
            }
            ranked.add(new ContextChunk(match.chunkId(), match.documentId(), match.chunkIndex(), chunk.getContent(), match.score()));
        }
        ContextBundle bundle = new ContextBudget(options.maxContextLength()).assemble(question, ranked);
        log.debug("Retrieved {} of {} candidate chunks ({} chars) for owner {}",
                bundle.chunks().size(), matches.size(), bundle.totalLength(), ownerId);
        return bundle;
    }
}
