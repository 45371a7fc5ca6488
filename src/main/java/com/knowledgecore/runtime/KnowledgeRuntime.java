package com.knowledgecore.runtime;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgecore.embedding.EmbeddingGenerator;
import com.knowledgecore.embedding.HashingEmbeddingService;
import com.knowledgecore.embedding.MiniLmEmbeddingService;
import com.knowledgecore.embedding.ModelLoader;
import com.knowledgecore.ingest.Chunker;
import com.knowledgecore.ingest.IngestionCoordinator;
import com.knowledgecore.registry.MetadataRegistry;
import com.knowledgecore.registry.SupabaseMetadataRegistry;
import com.knowledgecore.retrieval.RetrievalService;
import com.knowledgecore.vector.QdrantVectorStore;
import com.knowledgecore.vector.VectorStore;

import okhttp3.OkHttpClient;

/**
 * Wires the pipeline from one {@link AppConfig}. Every component is owned by this instance; new settings
 * mean a new runtime, never a mutated one.
 */
public final class KnowledgeRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeRuntime.class);

    private final OkHttpClient httpClient;
    private final ExecutorService executor;
    private final VectorStore vectorStore;
    private final MetadataRegistry registry;
    private final EmbeddingGenerator embeddingGenerator;
    private final IngestionCoordinator coordinator;
    private final RetrievalService retrievalService;

    private KnowledgeRuntime(AppConfig config) {
        AppConfig.VectorStoreConfig storeConfig = config.getVectorStore();
        AppConfig.RegistryConfig registryConfig = config.getRegistry();
        AppConfig.EmbeddingConfig embeddingConfig = config.getEmbedding();
        AppConfig.RetryConfig retryConfig = config.getRetry();
        AppConfig.ChunkingConfig chunkingConfig = config.getChunking();

        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(storeConfig.getTimeoutMs()))
                .readTimeout(Duration.ofMillis(storeConfig.getTimeoutMs()))
                .build();
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.getRetrieval().getIngestThreads()), workerFactory());

        RetryPolicy storePolicy = RetryPolicy.exponential(
                retryConfig.getMaxAttempts(),
                retryConfig.getInitialBackoffMs(),
                retryConfig.getMaxBackoffMs(),
                Sleeper.SYSTEM);
        RetryPolicy loadPolicy = RetryPolicy.linear(
                embeddingConfig.getLoadAttempts(),
                embeddingConfig.getLoadBackoffMs(),
                Sleeper.SYSTEM);

        int dimension = embeddingConfig.getDimension();
        this.embeddingGenerator = new EmbeddingGenerator(modelLoader(embeddingConfig), loadPolicy, dimension);
        this.vectorStore = QdrantVectorStore.fromConfig(httpClient, storeConfig, dimension, storePolicy);
        this.registry = registryConfig.isEnabled()
                ? SupabaseMetadataRegistry.fromConfig(
                        httpClient.newBuilder().callTimeout(Duration.ofMillis(registryConfig.getTimeoutMs())).build(),
                        registryConfig,
                        storePolicy)
                : null;

        Chunker chunker = new Chunker(chunkingConfig.getChunkSize(), chunkingConfig.getOverlap(), chunkingConfig.getMinChunkSize());
        this.coordinator = new IngestionCoordinator(vectorStore, registry, embeddingGenerator, chunker,
                storeConfig.getCollectionName(), executor, Clock.systemUTC());
        this.retrievalService = new RetrievalService(embeddingGenerator, vectorStore,
                storeConfig.getCollectionName(), config.getRetrieval().getDefaultLimit());

        log.info("runtime.start qdrant={} collection={} registry={} provider={} dimension={}",
                storeConfig.getUrl(),
                storeConfig.getCollectionName(),
                registry == null ? "disabled" : registryConfig.getUrl(),
                embeddingConfig.getProvider(),
                dimension);
    }

    public static KnowledgeRuntime start(AppConfig config) {
        return new KnowledgeRuntime(config);
    }

    static ModelLoader modelLoader(AppConfig.EmbeddingConfig config) {
        String provider = config.getProvider() == null ? "" : config.getProvider().toLowerCase(Locale.ROOT);
        if ("hashing".equals(provider)) {
            int dimension = config.getDimension();
            return () -> new HashingEmbeddingService(dimension);
        }
        if (!"minilm".equals(provider)) {
            throw new IllegalArgumentException("Unknown embedding provider: " + config.getProvider());
        }
        return MiniLmEmbeddingService.loader();
    }

    public IngestionCoordinator coordinator() {
        return coordinator;
    }

    public RetrievalService retrieval() {
        return retrievalService;
    }

    public VectorStore vectorStore() {
        return vectorStore;
    }

    /** {@code null} when the registry is disabled. */
    public MetadataRegistry registry() {
        return registry;
    }

    public EmbeddingGenerator embeddingGenerator() {
        return embeddingGenerator;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("runtime.close pending tasks abandoned");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        log.info("runtime.stop");
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "knowledge-ingest-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
