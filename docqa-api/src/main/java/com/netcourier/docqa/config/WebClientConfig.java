package com.netcourier.docqa.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient embeddingsWebClient(RagProperties properties) {
        return baseClient(properties.getEmbeddings().getBaseUrl(), null, properties.getEmbeddings().getTimeout());
    }

    @Bean
    public WebClient qdrantWebClient(RagProperties properties) {
        RagProperties.Qdrant qdrant = properties.getVector().getQdrant();
        WebClient.Builder builder = builder(qdrant.getBaseUrl(), properties.getVector().getTimeout());
        if (qdrant.getApiKey() != null && !qdrant.getApiKey().isBlank()) {
            builder.defaultHeader("api-key", qdrant.getApiKey());
        }
        return builder.build();
    }

    @Bean
    public WebClient openSearchWebClient(RagProperties properties) {
        return baseClient(properties.getVector().getOpensearch().getBaseUrl(), null, properties.getVector().getTimeout());
    }

    @Bean
    public WebClient ollamaWebClient(RagProperties properties) {
        RagProperties.Backend ollama = properties.getGeneration().getOllama();
        return baseClient(ollama.getBaseUrl(), null, ollama.getTimeout());
    }

    @Bean
    public WebClient openAiWebClient(RagProperties properties) {
        RagProperties.Backend openai = properties.getGeneration().getOpenai();
        return baseClient(openai.getBaseUrl(), openai.hasApiKey() ? openai.getApiKey() : null, openai.getTimeout());
    }

    private WebClient baseClient(String baseUrl, String bearerToken, Duration responseTimeout) {
        WebClient.Builder builder = builder(baseUrl, responseTimeout);
        if (bearerToken != null) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken);
        }
        return builder.build();
    }

    private WebClient.Builder builder(String baseUrl, Duration responseTimeout) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (responseTimeout != null && !responseTimeout.isZero()) {
            HttpClient httpClient = HttpClient.create().responseTimeout(responseTimeout);
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        return builder;
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
