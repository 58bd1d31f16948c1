package com.netcourier.docqa.config;

import com.netcourier.docqa.service.embedding.EmbeddingsClient;
import com.netcourier.docqa.service.embedding.HashingEmbeddingsClient;
import com.netcourier.docqa.service.embedding.WebClientEmbeddingsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(RagProperties.class)
public class EmbeddingsConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingsConfig.class);

    @Bean
    public EmbeddingsClient embeddingsClient(RagProperties properties,
                                             @Qualifier("embeddingsWebClient") WebClient embeddingsWebClient) {
        RagProperties.Embeddings embeddings = properties.getEmbeddings();
        EmbeddingsClient client = switch (embeddings.getType()) {
            case HASHING -> new HashingEmbeddingsClient(embeddings.getDimensions());
            case REMOTE -> new WebClientEmbeddingsClient(embeddingsWebClient, embeddings.getModel(),
                    embeddings.getDimensions(), embeddings.getTimeout(), embeddings.getRetryBackoff());
        };
        log.info("Using {} embeddings ({} dimensions)", client.model(), client.dimensions());
        return client;
    }
}
