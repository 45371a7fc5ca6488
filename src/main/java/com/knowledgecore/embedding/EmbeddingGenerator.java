package com.knowledgecore.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgecore.runtime.RetryPolicy;
import com.knowledgecore.vector.SchemaMismatchException;

/**
 * Lazily loads the embedding model on first use and produces L2-normalized vectors of a fixed dimension.
 *
 * <p>Loading is single-flight: concurrent first callers wait on the same load instead of starting their
 * own. A load that exhausts its retries leaves the generator {@link State#UNINITIALIZED} so a later call
 * starts over. Once {@link State#READY}, the model is kept for the life of the instance.
 */
public class EmbeddingGenerator {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGenerator.class);

    public enum State {
        UNINITIALIZED,
        LOADING,
        READY
    }

    private final ModelLoader loader;
    private final RetryPolicy loadPolicy;
    private final int dimension;
    private final Object lock = new Object();

    private volatile EmbeddingService model;
    private CompletableFuture<EmbeddingService> inFlight;
    private State state = State.UNINITIALIZED;

    public EmbeddingGenerator(ModelLoader loader, RetryPolicy loadPolicy, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.loader = loader;
        this.loadPolicy = loadPolicy.retryingOn(e -> !(e instanceof SchemaMismatchException));
        this.dimension = dimension;
    }

    public float[] embed(String text) {
        float[] vector = ready().embed(text);
        return checked(vector);
    }

    /** Embeds every text; the i-th vector belongs to the i-th input. */
    public List<float[]> embedMany(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<float[]> raw = ready().embedAll(texts);
        if (raw.size() != texts.size()) {
            throw new IllegalStateException("Model returned " + raw.size() + " vectors for " + texts.size() + " inputs");
        }
        List<float[]> vectors = new ArrayList<>(raw.size());
        for (float[] vector : raw) {
            vectors.add(checked(vector));
        }
        return vectors;
    }

    public int dimension() {
        return dimension;
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    /** Model version once loaded, empty before that. */
    public String modelVersion() {
        EmbeddingService loaded = model;
        return loaded == null ? "" : loaded.version();
    }

    private EmbeddingService ready() {
        EmbeddingService loaded = model;
        if (loaded != null) {
            return loaded;
        }

        CompletableFuture<EmbeddingService> future;
        boolean owner = false;
        synchronized (lock) {
            if (model != null) {
                return model;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                state = State.LOADING;
                owner = true;
            }
            future = inFlight;
        }

        if (owner) {
            load(future);
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ModelUnavailableException unavailable) {
                throw unavailable;
            }
            if (e.getCause() instanceof SchemaMismatchException mismatch) {
                throw mismatch;
            }
            throw new ModelUnavailableException("Embedding model failed to load", 1, e.getCause());
        }
    }

    private void load(CompletableFuture<EmbeddingService> future) {
        int[] attempts = {0};
        try {
            EmbeddingService loaded = loadPolicy.execute("load embedding model", () -> {
                attempts[0]++;
                log.info("embedding.load attempt={}/{}", attempts[0], loadPolicy.maxAttempts());
                EmbeddingService candidate = loader.load();
                if (candidate.dimension() != dimension) {
                    throw new SchemaMismatchException("Embedding model " + candidate.version() + " dimension",
                            dimension, candidate.dimension());
                }
                return candidate;
            });
            synchronized (lock) {
                model = loaded;
                state = State.READY;
                inFlight = null;
            }
            log.info("embedding.ready model={} dimension={} attempts={}", loaded.version(), dimension, attempts[0]);
            future.complete(loaded);
        } catch (SchemaMismatchException e) {
            reset();
            future.completeExceptionally(e);
        } catch (Exception e) {
            reset();
            log.error("embedding.load failed attempts={}", attempts[0], e);
            future.completeExceptionally(new ModelUnavailableException(
                    "Embedding model unavailable after " + attempts[0] + " attempts", attempts[0], e));
        } catch (Error e) {
            // Linkage and initializer errors from the model runtime are not retried but must release waiters.
            reset();
            log.error("embedding.load aborted attempts={}", attempts[0], e);
            future.completeExceptionally(new ModelUnavailableException(
                    "Embedding model runtime failed to initialize", attempts[0], e));
        }
    }

    private void reset() {
        synchronized (lock) {
            state = State.UNINITIALIZED;
            inFlight = null;
        }
    }

    private float[] checked(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new SchemaMismatchException("Embedding dimension", dimension, vector == null ? 0 : vector.length);
        }
        return normalize(vector);
    }

    /** Scales the vector to unit length in place. Zero vectors are returned unchanged. */
    static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm <= 0.0) {
            return vector;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return vector;
    }
}
