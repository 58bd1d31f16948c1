package com.netcourier.docqa.service.qa;

import com.netcourier.docqa.config.RagProperties;
import com.netcourier.docqa.model.AnswerResponse;
import com.netcourier.docqa.model.AskRequest;
import com.netcourier.docqa.model.BackendsResponse;
import com.netcourier.docqa.persistence.entity.DeliveryMode;
import com.netcourier.docqa.service.embedding.EmbeddingsClient;
import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.generation.FallbackGenerationChain;
import com.netcourier.docqa.service.generation.GenerationOverrides;
import com.netcourier.docqa.service.generation.GenerationRequest;
import com.netcourier.docqa.service.generation.GenerationResult;
import com.netcourier.docqa.service.retrieval.ContextBundle;
import com.netcourier.docqa.service.retrieval.RetrievalOptions;
import com.netcourier.docqa.service.retrieval.RetrievalService;
import com.netcourier.docqa.service.session.StreamingSession;
import com.netcourier.docqa.service.vector.SearchFilters;
import com.netcourier.docqa.service.vector.VectorIndex;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Service
public class DefaultQuestionAnsweringService implements QuestionAnsweringService {

    private static final Logger log = LoggerFactory.getLogger(DefaultQuestionAnsweringService.class);

    private final RetrievalService retrievalService;
    private final FallbackGenerationChain generationChain;
    private final QueryHistoryService historyService;
    private final QueryQuotaGuard quotaGuard;
    private final VectorIndex vectorIndex;
    private final EmbeddingsClient embeddingsClient;
    private final RagProperties properties;
    private final MeterRegistry meterRegistry;

    public DefaultQuestionAnsweringService(RetrievalService retrievalService,
                                           FallbackGenerationChain generationChain,
                                           QueryHistoryService historyService,
                                           QueryQuotaGuard quotaGuard,
                                           VectorIndex vectorIndex,
                                           EmbeddingsClient embeddingsClient,
                                           RagProperties properties,
                                           MeterRegistry meterRegistry) {
        this.retrievalService = retrievalService;
        this.generationChain = generationChain;
        this.historyService = historyService;
        this.quotaGuard = quotaGuard;
        this.vectorIndex = vectorIndex;
        this.embeddingsClient = embeddingsClient;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public AnswerResponse ask(String ownerId, AskRequest request) {
        requireQuestion(request);
        quotaGuard.check(ownerId);
        Timer.Sample sample = Timer.start(meterRegistry);
        long startedAt = System.nanoTime();
        ContextBundle bundle = retrievalService.retrieve(ownerId, request.question(), retrievalOptions(request));
        GenerationResult result = generationChain.generate(new GenerationRequest(request.question(), bundle, overrides(request)));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        historyService.record(ownerId, request.question(), result.text(), elapsedMillis, bundle.chunkIds(),
                result.backend(), DeliveryMode.WHOLE);
        sample.stop(meterRegistry.timer("rag.qa.duration", "mode", DeliveryMode.WHOLE.name().toLowerCase(Locale.ROOT)));
        log.info("Answered question for owner {} from {} in {} ms using {} chunks",
                ownerId, result.backend(), elapsedMillis, bundle.chunks().size());
        return new AnswerResponse(result.text(), elapsedMillis, bundle.chunkIds(), result.backend(), result.fallbacks());
    }

    @Override
    public StreamingSession openSession(String ownerId, AskRequest request) {
        requireQuestion(request);
        quotaGuard.check(ownerId);
        return new StreamingSession(ownerId, request.question(), retrievalOptions(request), overrides(request),
                retrievalService, generationChain, historyService, meterRegistry,
                properties.getSession().getBufferSize());
    }

    @Override
    public BackendsResponse backends() {
        return new BackendsResponse(generationChain.backends(),
                vectorIndex.variant().name().toLowerCase(Locale.ROOT),
                embeddingsClient.model());
    }

    private RetrievalOptions retrievalOptions(AskRequest request) {
        RagProperties.Retrieval defaults = properties.getRetrieval();
        SearchFilters filters = request.documentIds() == null || request.documentIds().isEmpty()
                ? SearchFilters.none()
                : SearchFilters.documents(request.documentIds());
        return new RetrievalOptions(
                request.topK() == null ? defaults.getTopK() : request.topK(),
                request.maxContextLength() == null ? defaults.getMaxContextLength() : request.maxContextLength(),
                filters);
    }

    private static GenerationOverrides overrides(AskRequest request) {
        return new GenerationOverrides(request.temperature(), request.topP(), request.maxOutputTokens());
    }

    private static void requireQuestion(AskRequest request) {
        if (request == null || request.question() == null || request.question().isBlank()) {
            throw new InvalidParametersException("Question must not be empty");
        }
    }
}
