package com.netcourier.docqa.config;

import com.netcourier.docqa.service.vector.VectorIndexVariant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide configuration for the retrieval and generation pipeline. Bound once at startup from
 * the {@code rag.*} tree and handed to constructors; nothing mutates it afterwards.
 */
@Validated
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    @Valid
    private final Chunking chunking = new Chunking();

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Embeddings embeddings = new Embeddings();

    @Valid
    private final Vector vector = new Vector();

    @Valid
    private final Generation generation = new Generation();

    @Valid
    private final Session session = new Session();

    @Valid
    private final Limits limits = new Limits();

    public Chunking getChunking() {
        return chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Embeddings getEmbeddings() {
        return embeddings;
    }

    public Vector getVector() {
        return vector;
    }

    public Generation getGeneration() {
        return generation;
    }

    public Session getSession() {
        return session;
    }

    public Limits getLimits() {
        return limits;
    }

    public static class Chunking {

        @Min(1)
        private int size = 1000;

        @Min(0)
        private int overlap = 200;

        /**
         * How far back from a hard cut the chunker may move to land on a sentence or line break.
         */
        @Min(0)
        private int lookBack = 100;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        public int getLookBack() {
            return lookBack;
        }

        public void setLookBack(int lookBack) {
            this.lookBack = lookBack;
        }
    }

    public static class Retrieval {

        @Min(1)
        private int topK = 5;

        @Min(1)
        private int maxContextLength = 4000;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getMaxContextLength() {
            return maxContextLength;
        }

        public void setMaxContextLength(int maxContextLength) {
            this.maxContextLength = maxContextLength;
        }
    }

    public static class Embeddings {

        private EmbeddingsType type = EmbeddingsType.HASHING;

        private String baseUrl = "http://localhost:9000";

        private String model = "sentence-transformers/all-MiniLM-L6-v2";

        @Min(1)
        private int dimensions = 384;

        private Duration timeout = Duration.ofSeconds(30);

        private Duration retryBackoff = Duration.ofMillis(500);

        public EmbeddingsType getType() {
            return type;
        }

        public void setType(EmbeddingsType type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }
    }

    public enum EmbeddingsType {
        HASHING,
        REMOTE
    }

    public static class Vector {

        private VectorIndexVariant type = VectorIndexVariant.IN_MEMORY;

        private Duration timeout = Duration.ofSeconds(10);

        private Duration retryBackoff = Duration.ofMillis(500);

        private final InMemory inMemory = new InMemory();

        private final Qdrant qdrant = new Qdrant();

        private final OpenSearch opensearch = new OpenSearch();

        public VectorIndexVariant getType() {
            return type;
        }

        public void setType(VectorIndexVariant type) {
            this.type = type;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public InMemory getInMemory() {
            return inMemory;
        }

        public Qdrant getQdrant() {
            return qdrant;
        }

        public OpenSearch getOpensearch() {
            return opensearch;
        }
    }

    public static class InMemory {

        /**
         * Optional JSON snapshot file. Empty keeps the index purely in memory.
         */
        private String snapshotPath = "";

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }

    public static class Qdrant {

        private String baseUrl = "http://localhost:6333";

        private String apiKey = "";

        private String collection = "qa_documents";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }
    }

    public static class OpenSearch {

        private String baseUrl = "http://localhost:9200";

        private String index = "qa_documents";

        @Min(1)
        private int numCandidates = 100;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getIndex() {
            return index;
        }

        public void setIndex(String index) {
            this.index = index;
        }

        public int getNumCandidates() {
            return numCandidates;
        }

        public void setNumCandidates(int numCandidates) {
            this.numCandidates = numCandidates;
        }
    }

    public static class Generation {

        /**
         * Preference order of the fallback chain. Must end with the extractive backend.
         */
        @NotEmpty
        private List<String> order = new ArrayList<>(List.of("ollama", "openai", "extractive"));

        private final Backend ollama = new Backend("http://localhost:11434", "qwen3:1.7b", 0.3, 0.9, 500);

        private final Backend openai = new Backend("https://api.openai.com", "gpt-3.5-turbo", 0.3, 1.0, 500);

        private final Extractive extractive = new Extractive();

        public List<String> getOrder() {
            return order;
        }

        public void setOrder(List<String> order) {
            this.order = order;
        }

        public Backend getOllama() {
            return ollama;
        }

        public Backend getOpenai() {
            return openai;
        }

        public Extractive getExtractive() {
            return extractive;
        }
    }

    public static class Backend {

        private String baseUrl;

        private String apiKey = "";

        private String model;

        private Duration timeout = Duration.ofSeconds(60);

        private double temperature;

        private double topP;

        @Min(1)
        private int maxOutputTokens;

        public Backend() {
        }

        Backend(String baseUrl, String model, double temperature, double topP, int maxOutputTokens) {
            this.baseUrl = baseUrl;
            this.model = model;
            this.temperature = temperature;
            this.topP = topP;
            this.maxOutputTokens = maxOutputTokens;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public double getTopP() {
            return topP;
        }

        public void setTopP(double topP) {
            this.topP = topP;
        }

        public int getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }
    }

    public static class Extractive {

        @Min(1)
        private int maxSentences = 3;

        @Min(1)
        private int wordsPerFragment = 3;

        public int getMaxSentences() {
            return maxSentences;
        }

        public void setMaxSentences(int maxSentences) {
            this.maxSentences = maxSentences;
        }

        public int getWordsPerFragment() {
            return wordsPerFragment;
        }

        public void setWordsPerFragment(int wordsPerFragment) {
            this.wordsPerFragment = wordsPerFragment;
        }
    }

    public static class Session {

        /**
         * Fragments requested ahead of the consumer while streaming.
         */
        @Min(1)
        private int bufferSize = 16;

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }
    }

    public static class Limits {

        @Min(1)
        private int maxDocumentsPerUser = 100;

        @Min(1)
        private int maxChunksPerDocument = 1000;

        @Min(1)
        private int maxQueriesPerHour = 100;

        public int getMaxDocumentsPerUser() {
            return maxDocumentsPerUser;
        }

        public void setMaxDocumentsPerUser(int maxDocumentsPerUser) {
            this.maxDocumentsPerUser = maxDocumentsPerUser;
        }

        public int getMaxChunksPerDocument() {
            return maxChunksPerDocument;
        }

        public void setMaxChunksPerDocument(int maxChunksPerDocument) {
            this.maxChunksPerDocument = maxChunksPerDocument;
        }

        public int getMaxQueriesPerHour() {
            return maxQueriesPerHour;
        }

        public void setMaxQueriesPerHour(int maxQueriesPerHour) {
            this.maxQueriesPerHour = maxQueriesPerHour;
        }
    }
}
