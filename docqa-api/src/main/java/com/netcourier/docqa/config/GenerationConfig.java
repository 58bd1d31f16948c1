package com.netcourier.docqa.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.docqa.service.generation.ExtractiveGenerationBackend;
import com.netcourier.docqa.service.generation.FallbackGenerationChain;
import com.netcourier.docqa.service.generation.GenerationBackend;
import com.netcourier.docqa.service.generation.GenerationOptions;
import com.netcourier.docqa.service.generation.OllamaGenerationBackend;
import com.netcourier.docqa.service.generation.OpenAiGenerationBackend;
import com.netcourier.docqa.service.generation.openai.OpenAiChatClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the generation chain in the order listed by {@code rag.generation.order}.
 */
@Configuration
public class GenerationConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationConfig.class);

    @Bean
    public FallbackGenerationChain generationChain(RagProperties properties,
                                                   ObjectMapper objectMapper,
                                                   MeterRegistry meterRegistry,
                                                   @Qualifier("ollamaWebClient") WebClient ollamaWebClient,
                                                   @Qualifier("openAiWebClient") WebClient openAiWebClient) {
        RagProperties.Generation generation = properties.getGeneration();
        List<String> order = generation.getOrder();
        if (order == null || order.isEmpty()
                || !ExtractiveGenerationBackend.NAME.equals(order.get(order.size() - 1).trim().toLowerCase(Locale.ROOT))) {
            throw new IllegalStateException("rag.generation.order must end with '" + ExtractiveGenerationBackend.NAME
                    + "' but was " + order);
        }
        List<GenerationBackend> backends = new ArrayList<>();
        for (String name : order) {
            backends.add(switch (name.trim().toLowerCase(Locale.ROOT)) {
                case OllamaGenerationBackend.NAME -> {
                    RagProperties.Backend ollama = generation.getOllama();
                    yield new OllamaGenerationBackend(ollamaWebClient, ollama.getModel(), ollama.getTimeout(), options(ollama));
                }
                case OpenAiGenerationBackend.NAME -> {
                    RagProperties.Backend openai = generation.getOpenai();
                    OpenAiChatClient chatClient = new OpenAiChatClient(openAiWebClient, objectMapper, openai.getTimeout());
                    yield new OpenAiGenerationBackend(chatClient, openai.getModel(), openai.hasApiKey(), options(openai));
                }
                case ExtractiveGenerationBackend.NAME -> new ExtractiveGenerationBackend(
                        generation.getExtractive().getMaxSentences(), generation.getExtractive().getWordsPerFragment());
                default -> throw new IllegalStateException("Unknown generation backend '" + name + "' in rag.generation.order");
            });
        }
        log.info("Generation chain: {}", backends.stream().map(GenerationBackend::name).toList());
        return new FallbackGenerationChain(backends, meterRegistry);
    }

    private static GenerationOptions options(RagProperties.Backend backend) {
        return new GenerationOptions(backend.getTemperature(), backend.getTopP(), backend.getMaxOutputTokens());
    }
}
