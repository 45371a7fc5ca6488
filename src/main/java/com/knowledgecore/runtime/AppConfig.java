package com.knowledgecore.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private VectorStoreConfig vectorStore = new VectorStoreConfig();
    private RegistryConfig registry = new RegistryConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private RetryConfig retry = new RetryConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();

    public static AppConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(path.toFile(), AppConfig.class);
        return config == null ? new AppConfig() : config;
    }

    /**
     * Applies connection overrides from the environment on top of file settings. Credentials are usually
     * supplied this way rather than committed to YAML.
     */
    public AppConfig withEnvironment(Map<String, String> environment) {
        String qdrantUrl = environment.get("KNOWLEDGE_QDRANT_URL");
        if (qdrantUrl != null && !qdrantUrl.isBlank()) {
            vectorStore.setUrl(qdrantUrl);
        }
        String qdrantKey = environment.get("KNOWLEDGE_QDRANT_API_KEY");
        if (qdrantKey != null && !qdrantKey.isBlank()) {
            vectorStore.setApiKey(qdrantKey);
        }
        String supabaseUrl = environment.get("KNOWLEDGE_SUPABASE_URL");
        if (supabaseUrl != null && !supabaseUrl.isBlank()) {
            registry.setUrl(supabaseUrl);
            registry.setEnabled(true);
        }
        String supabaseKey = environment.get("KNOWLEDGE_SUPABASE_KEY");
        if (supabaseKey != null && !supabaseKey.isBlank()) {
            registry.setApiKey(supabaseKey);
        }
        return this;
    }

    public VectorStoreConfig getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(VectorStoreConfig vectorStore) {
        this.vectorStore = vectorStore == null ? new VectorStoreConfig() : vectorStore;
    }

    public RegistryConfig getRegistry() {
        return registry;
    }

    public void setRegistry(RegistryConfig registry) {
        this.registry = registry == null ? new RegistryConfig() : registry;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry == null ? new RetryConfig() : retry;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorStoreConfig {
        private String url = "http://localhost:6333";
        private String apiKey;
        private String collectionName = "open-claude-knowledge";
        private int scrollPageSize = 100;
        private int deleteBatchSize = 100;
        private int upsertBatchSize = 100;
        private int timeoutMs = 30000;
        private long scanTimeoutMs = 300000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCollectionName() {
            return collectionName;
        }

        public void setCollectionName(String collectionName) {
            this.collectionName = collectionName;
        }

        public int getScrollPageSize() {
            return scrollPageSize;
        }

        public void setScrollPageSize(int scrollPageSize) {
            this.scrollPageSize = scrollPageSize;
        }

        public int getDeleteBatchSize() {
            return deleteBatchSize;
        }

        public void setDeleteBatchSize(int deleteBatchSize) {
            this.deleteBatchSize = deleteBatchSize;
        }

        public int getUpsertBatchSize() {
            return upsertBatchSize;
        }

        public void setUpsertBatchSize(int upsertBatchSize) {
            this.upsertBatchSize = upsertBatchSize;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getScanTimeoutMs() {
            return scanTimeoutMs;
        }

        public void setScanTimeoutMs(long scanTimeoutMs) {
            this.scanTimeoutMs = scanTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegistryConfig {
        private boolean enabled = false;
        private String url;
        private String apiKey;
        private String table = "knowledge_documents";
        private int timeoutMs = 10000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "minilm";
        private int dimension = 384;
        private int loadAttempts = 3;
        private long loadBackoffMs = 1000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getLoadAttempts() {
            return loadAttempts;
        }

        public void setLoadAttempts(int loadAttempts) {
            this.loadAttempts = loadAttempts;
        }

        public long getLoadBackoffMs() {
            return loadBackoffMs;
        }

        public void setLoadBackoffMs(long loadBackoffMs) {
            this.loadBackoffMs = loadBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 4000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int chunkSize = 2000;
        private int overlap = 200;
        private int minChunkSize = 50;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        public int getMinChunkSize() {
            return minChunkSize;
        }

        public void setMinChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int defaultLimit = 5;
        private int ingestThreads = 2;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getIngestThreads() {
            return ingestThreads;
        }

        public void setIngestThreads(int ingestThreads) {
            this.ingestThreads = ingestThreads;
        }
    }
}
